package org.tpch;

/**
 * Root of the unchecked failures raised by the benchmark engine.
 *
 * <p>None of these are retried. A failure inside a timed region terminates the
 * execution unit that raised it.
 */
public class BenchmarkException extends RuntimeException {

    public BenchmarkException(String message) {
        super(message);
    }

    public BenchmarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
