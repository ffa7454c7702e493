package com.dexarb.core.execution;

import com.dexarb.domain.FailureReason;
import lombok.Getter;

@Getter
public class ExecutionFailure extends RuntimeException {

    private final FailureReason reason;
    private final String txHash;

    public ExecutionFailure(FailureReason reason, String message, String txHash) {
        super(message);
        this.reason = reason;
        this.txHash = txHash;
    }
}
