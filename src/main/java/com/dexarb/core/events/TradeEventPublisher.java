package com.dexarb.core.events;

import java.time.Instant;

/**
 * Synchronous hand-off of trade records and counters to downstream collectors. Best effort: a publisher
 * must not throw into the trading loop.
 */
public interface TradeEventPublisher {

    boolean isEnabled();

    void publish(Instant ts, String type, String key, Object data);

    default void publish(String type, Object data) {
        publish(null, type, null, data);
    }

    default void publish(String type, String key, Object data) {
        publish(null, type, key, data);
    }
}
