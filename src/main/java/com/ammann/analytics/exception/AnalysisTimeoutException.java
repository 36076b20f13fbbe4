package com.ammann.analytics.exception;

import java.time.Duration;

/**
 * Exception indicating that a computation exceeded its deadline and was abandoned.
 *
 * <p>Raised by the isolation forest, whose cost grows with the number of trees
 * and the size of the series.
 */
public class AnalysisTimeoutException extends AnalyticsException {
    private final transient Duration timeout;

    public AnalysisTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(String.format("%s did not finish within %d ms", operation, timeout.toMillis()), cause);
        this.timeout = timeout;
    }

    public AnalysisTimeoutException(String operation, Duration timeout) {
        this(operation, timeout, null);
    }

    public Duration getTimeout() {
        return timeout;
    }
}
