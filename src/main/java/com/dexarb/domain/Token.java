package com.dexarb.domain;

import java.util.Locale;

/**
 * ERC-20 style token. The address is always held in canonical lower-case form.
 */
public record Token(String address, int decimals, String symbol) {

    public Token {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("token address is required");
        }
        address = canonical(address);
        if (decimals < 0 || decimals > 77) {
            throw new IllegalArgumentException("decimals out of range: " + decimals);
        }
    }

    public static String canonical(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public boolean sameAddress(String other) {
        return other != null && address.equals(canonical(other));
    }

    @Override
    public String toString() {
        return symbol + "(" + address + ")";
    }
}
