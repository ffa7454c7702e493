package com.dexarb.core.resolver;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.Token;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves token decimals and symbols once per process. Decimals fall back from the override table to
 * {@code decimals()}, then to 6 for USD-named tokens, then to 18. A transient RPC failure is not a
 * fallback trigger: it propagates so a guessed value is never cached.
 */
@Slf4j
@Service
public class TokenMetadataResolver {

    static final int STABLE_FALLBACK_DECIMALS = 6;
    static final int DEFAULT_DECIMALS = 18;

    private final EvmClient evm;
    private final Map<String, Integer> decimalOverrides = new HashMap<>();
    private final Map<String, String> addressBySymbol = new HashMap<>();
    private final Map<String, String> symbolByAddress = new HashMap<>();
    private final ConcurrentHashMap<String, Token> tokens = new ConcurrentHashMap<>();

    public TokenMetadataResolver(EvmClient evm, ArbProperties properties) {
        this.evm = evm;
        ArbProperties.Tokens config = properties.tokens();
        config.decimals().forEach((address, decimals) -> decimalOverrides.put(Token.canonical(address), decimals));
        config.symbols().forEach((symbol, address) -> {
            addressBySymbol.put(symbol.toUpperCase(Locale.ROOT), Token.canonical(address));
            symbolByAddress.put(Token.canonical(address), symbol);
        });
    }

    public Token resolve(String address) {
        String key = Token.canonical(address);
        Token cached = tokens.get(key);
        if (cached != null) {
            return cached;
        }
        String symbol = resolveSymbol(key);
        int decimals = resolveDecimals(key, symbol);
        Token token = new Token(key, decimals, symbol);
        Token raced = tokens.putIfAbsent(key, token);
        if (raced == null) {
            log.debug("Resolved token {} decimals={}", token, decimals);
        }
        return raced != null ? raced : token;
    }

    /**
     * Accepts a configured symbol (case-insensitive) or a 0x address.
     */
    public Token resolveLabel(String label) {
        String trimmed = label.trim();
        if (isAddress(trimmed)) {
            return resolve(trimmed);
        }
        String address = addressBySymbol.get(trimmed.toUpperCase(Locale.ROOT));
        if (address == null) {
            throw new IllegalArgumentException("Unknown token symbol: " + label);
        }
        return resolve(address);
    }

    private int resolveDecimals(String address, String symbol) {
        Integer override = decimalOverrides.get(address);
        if (override != null) {
            return override;
        }
        try {
            return evm.decimals(address);
        } catch (RpcException e) {
            if (e.getKind().isTransient()) {
                throw e;
            }
            log.warn("decimals() failed for {} ({}), falling back by symbol {}", address, e.getKind(), symbol);
        } catch (ArithmeticException e) {
            log.warn("decimals() out of range for {}, falling back by symbol {}", address, symbol);
        }
        if (symbol != null && symbol.toUpperCase(Locale.ROOT).contains("USD")) {
            return STABLE_FALLBACK_DECIMALS;
        }
        return DEFAULT_DECIMALS;
    }

    private String resolveSymbol(String address) {
        String known = symbolByAddress.get(address);
        if (known != null) {
            return known;
        }
        try {
            String symbol = evm.symbol(address);
            if (symbol != null && !symbol.isBlank()) {
                return symbol.trim();
            }
        } catch (RpcException e) {
            if (e.getKind().isTransient()) {
                throw e;
            }
            log.debug("symbol() failed for {}: {}", address, e.getKind());
        }
        return "TOKEN_" + address.substring(2, 8);
    }

    static boolean isAddress(String value) {
        return value.length() == 42 && value.startsWith("0x");
    }
}
