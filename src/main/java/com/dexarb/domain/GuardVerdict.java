package com.dexarb.domain;

import java.math.BigDecimal;

/**
 * Outcome of the profitability check. USD figures are for display and thresholds only, never for amounts.
 */
public record GuardVerdict(
    boolean ok,
    BigDecimal netUsd,
    BigDecimal grossUsd,
    BigDecimal gasUsd,
    BigDecimal sellUsd,
    BigDecimal buyUsd,
    FailureReason reason
) {

    public static GuardVerdict unpriceable(BigDecimal gasUsd, BigDecimal sellUsd, BigDecimal buyUsd) {
        return new GuardVerdict(false, null, null, gasUsd, sellUsd, buyUsd, FailureReason.UNPRICEABLE);
    }
}
