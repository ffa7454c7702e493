package com.dexarb.domain;

public enum ExecutionStatus {
    SUCCESS,
    FAILED,
    /**
     * Submitted but neither confirmed nor failed before the receipt wait ran out. Reconcile out-of-band.
     */
    UNCONFIRMED,
    /**
     * Watch-only run: nothing was signed.
     */
    SKIPPED
}
