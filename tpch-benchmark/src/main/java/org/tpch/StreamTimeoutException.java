package org.tpch;

import java.time.Duration;

public class StreamTimeoutException extends StreamFailureException {

    public StreamTimeoutException(String unit, Duration timeout) {
        super(unit, "stream '" + unit + "' did not finish within " + timeout.toMillis() + "ms");
    }
}
