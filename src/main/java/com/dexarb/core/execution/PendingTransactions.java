package com.dexarb.core.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transactions submitted but not yet seen mined. Swaps are keyed by sell token, approvals by
 * {@link #approvalKey}. While an entry exists nothing new is sent under that key.
 */
@Slf4j
@Component
public class PendingTransactions {

    public record Pending(String txHash, String routerId, String pair, Instant submittedAt) {
    }

    private final ConcurrentHashMap<String, Pending> byToken = new ConcurrentHashMap<>();

    public static String approvalKey(String token, String spender) {
        return "approve:" + token.toLowerCase(Locale.ROOT) + ":" + spender.toLowerCase(Locale.ROOT);
    }

    public void register(String sellToken, Pending pending) {
        Pending previous = byToken.put(sellToken, pending);
        if (previous != null && !previous.txHash().equals(pending.txHash())) {
            log.warn("[PENDING] {} replaced pending {} with {}", sellToken, previous.txHash(), pending.txHash());
        }
    }

    public Optional<Pending> get(String sellToken) {
        return Optional.ofNullable(byToken.get(sellToken));
    }

    /**
     * Removes the entry only if it still refers to {@code txHash}.
     */
    public boolean clear(String sellToken, String txHash) {
        Pending current = byToken.get(sellToken);
        return current != null && current.txHash().equals(txHash) && byToken.remove(sellToken, current);
    }

    public Map<String, Pending> snapshot() {
        return Map.copyOf(byToken);
    }
}
