package com.dexarb.core.quote;

import com.dexarb.domain.FailureReason;
import com.dexarb.domain.Quote;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Quotes ranked by buy amount (best first) plus the reason each failing router gave.
 */
public record FanOutResult(List<Quote> ranked, Map<String, FailureReason> failures) {

    public Optional<Quote> best() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    public boolean isEmpty() {
        return ranked.isEmpty();
    }
}
