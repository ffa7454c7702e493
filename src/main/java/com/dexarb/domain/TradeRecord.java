package com.dexarb.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Flat trade row handed to the trade logger.
 */
public record TradeRecord(
    Instant timestamp,
    String router,
    String pair,
    String sellToken,
    BigInteger sellAmount,
    String buyToken,
    BigInteger buyAmount,
    BigDecimal sellUsd,
    BigDecimal buyUsd,
    BigDecimal gasUsd,
    BigDecimal netUsd,
    String txHash,
    ExecutionStatus status,
    FailureReason reason
) {

    public static TradeRecord of(ArbitrageOpportunity opp, ExecutionOutcome outcome, Instant now) {
        Quote q = opp.getQuote();
        GuardVerdict v = opp.getVerdict();
        return new TradeRecord(
            now,
            q.getRouterId(),
            opp.getPair().label(),
            q.getSellToken().address(),
            q.getSellAmount(),
            q.getBuyToken().address(),
            q.getBuyAmount(),
            v.sellUsd(),
            v.buyUsd(),
            v.gasUsd(),
            v.netUsd(),
            outcome.getTxHash(),
            outcome.getStatus(),
            outcome.getReason()
        );
    }
}
