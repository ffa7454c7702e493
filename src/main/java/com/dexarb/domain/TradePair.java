package com.dexarb.domain;

import java.util.Locale;

/**
 * A configured "SELL/BUY" pair label, not yet resolved to token addresses.
 */
public record TradePair(String sell, String buy) {

    public static TradePair parse(String label) {
        String[] parts = label == null ? new String[0] : label.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Bad pair label: " + label);
        }
        return new TradePair(parts[0].trim(), parts[1].trim());
    }

    public boolean matchesEitherWay(TradePair other) {
        return (eq(sell, other.sell) && eq(buy, other.buy)) || (eq(sell, other.buy) && eq(buy, other.sell));
    }

    private static boolean eq(String a, String b) {
        return a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }

    public String label() {
        return sell + "/" + buy;
    }

    @Override
    public String toString() {
        return label();
    }
}
