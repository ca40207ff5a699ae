package com.flagship.crypto_settlement.matcher;

import lombok.Value;

/**
 * Final state of a monitor run.
 */
@Value
public class MonitorResult {

    public enum Status {
        FOUND,
        /** Max attempts or the overall timeout reached without a match. */
        EXHAUSTED,
        /** The monitoring thread was interrupted between attempts. */
        INTERRUPTED
    }

    Status status;
    MatchResult lastResult;
    int attempts;

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
