package com.dexarb.domain;

/**
 * Lifecycle of one trade. Steps run strictly in declaration order; APPROVE is skipped when allowance suffices.
 */
public enum ExecutionState {
    SIZE,
    QUOTE,
    GUARD,
    BALANCE_CHECK,
    ALLOWANCE_CHECK,
    APPROVE,
    SUBMIT,
    CONFIRM,
    SUCCESS,
    FAILED
}
