package com.dexarb.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each event as one JSON line to the {@code dexarb.events} logger; route that logger to a file or
 * collector in the logging configuration.
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingTradeEventPublisher implements TradeEventPublisher {

    private static final Logger EVENTS = LoggerFactory.getLogger("dexarb.events");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public boolean isEnabled() {
        return EVENTS.isInfoEnabled();
    }

    @Override
    public void publish(Instant ts, String type, String key, Object data) {
        if (!isEnabled()) {
            return;
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("ts", (ts != null ? ts : clock.instant()).toString());
        envelope.put("type", type);
        if (key != null) {
            envelope.put("key", key);
        }
        envelope.put("data", data);
        try {
            EVENTS.info(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable {} event: {}", type, e.getOriginalMessage());
        }
    }
}
