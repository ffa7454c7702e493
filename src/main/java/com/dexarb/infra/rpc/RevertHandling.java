package com.dexarb.infra.rpc;

/**
 * How a call site treats a revert or undecodable result.
 */
public enum RevertHandling {
    /** A revert is a definitive answer (for example "no such pool"). */
    FAIL_FAST,
    /** Retry once after backoff; some nodes intermittently mis-serve reverts. */
    RETRY_ONCE
}
