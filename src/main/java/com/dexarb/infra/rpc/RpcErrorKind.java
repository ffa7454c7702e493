package com.dexarb.infra.rpc;

public enum RpcErrorKind {
    /** Remote signalled throughput exhaustion (HTTP 429, JSON-RPC limit codes). */
    RATE_LIMITED,
    /** Connection reset, timeout, 5xx, node not ready. */
    NETWORK,
    /** eth_call reverted with revert data. */
    REVERTED,
    /** Revert without data, or a result that cannot be decoded. */
    MALFORMED,
    /** Revert whose reason is an insufficient-liquidity error. */
    INSUFFICIENT_LIQUIDITY,
    /** Any other JSON-RPC error object. */
    RPC_ERROR;

    public boolean isTransient() {
        return this == RATE_LIMITED || this == NETWORK;
    }
}
