package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A quote that passed the profitability guard and is ready for execution.
 */
@Value
@Builder
public class ArbitrageOpportunity {
    String id;
    TradePair pair;
    Quote quote;
    GuardVerdict verdict;
    Instant detectedAt;

    public Token getSellToken() {
        return quote.getSellToken();
    }

    public Token getBuyToken() {
        return quote.getBuyToken();
    }

    public BigInteger getSellAmount() {
        return quote.getSellAmount();
    }
}
