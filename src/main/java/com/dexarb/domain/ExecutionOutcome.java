package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder(toBuilder = true)
public class ExecutionOutcome {
    ExecutionStatus status;
    ExecutionState finalState;
    FailureReason reason;
    String txHash;
    String approvalTxHash;
    BigInteger gasUsed;
    BigInteger minBuyAmount;
    int attempts;
    int slippageBps;
    String detail;

    public static ExecutionOutcome failed(ExecutionState state, FailureReason reason, String detail) {
        return ExecutionOutcome.builder()
                .status(ExecutionStatus.FAILED)
                .finalState(ExecutionState.FAILED)
                .reason(reason)
                .detail(state + ": " + detail)
                .build();
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
