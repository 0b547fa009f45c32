package org.tpch;

/**
 * An execution unit terminated without delivering its timing sample.
 *
 * <p>Carries the name of the unit ({@code power}, {@code throughput-2},
 * {@code refresh}) so the operator can tell which stream broke the phase.
 */
public class StreamFailureException extends BenchmarkException {
    private final String unit;

    public StreamFailureException(String unit, Throwable cause) {
        super("stream '" + unit + "' failed: " + cause.getMessage(), cause);
        this.unit = unit;
    }

    protected StreamFailureException(String unit, String message) {
        super(message);
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
