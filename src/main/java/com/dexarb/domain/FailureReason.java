package com.dexarb.domain;

import com.dexarb.infra.rpc.RpcErrorKind;

/**
 * Why a quote, verdict or trade attempt did not succeed. Every rejection is logged with one of these.
 */
public enum FailureReason {
    RATE_LIMITED,
    NETWORK_TRANSIENT,
    NO_POOL_FOUND,
    POOL_UNINITIALIZED,
    INSUFFICIENT_LIQUIDITY,
    UNPRICEABLE,
    INSUFFICIENT_BALANCE,
    ALLOWANCE_FAILED,
    EXECUTION_REVERTED,
    EXECUTION_UNCONFIRMED,
    PENDING_TRANSACTION,
    NO_QUOTE,
    UNPROFITABLE,
    RPC_ERROR;

    public static FailureReason fromRpc(RpcErrorKind kind) {
        return switch (kind) {
            case RATE_LIMITED -> RATE_LIMITED;
            case NETWORK -> NETWORK_TRANSIENT;
            case INSUFFICIENT_LIQUIDITY -> INSUFFICIENT_LIQUIDITY;
            case REVERTED, MALFORMED, RPC_ERROR -> RPC_ERROR;
        };
    }
}
