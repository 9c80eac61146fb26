package org.netpreserve.scriptorium;

public enum Outcome {
    SUCCESS,
    FAILURE,
    /** Already archived in an earlier run. */
    SKIPPED,
    /** Refused by the trust policy, no request made. */
    REJECTED,
    CANCELLED
}
