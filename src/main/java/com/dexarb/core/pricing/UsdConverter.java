package com.dexarb.core.pricing;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.cache.NegativeCache;
import com.dexarb.core.resolver.TokenMetadataResolver;
import com.dexarb.domain.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Optional;

/**
 * Values token amounts in USD. Stable assets count at par; other tokens are priced against a stable asset
 * directly, else through the base asset. Tokens with no route are remembered in the negative cache.
 */
@Slf4j
@Service
public class UsdConverter {

    private static final MathContext MC = MathContext.DECIMAL128;

    private final SpotPriceReader spot;
    private final BaseAssetPriceOracle baseOracle;
    private final TokenMetadataResolver tokens;
    private final NegativeCache cache;
    private final ArbProperties.Tokens config;

    public UsdConverter(SpotPriceReader spot, BaseAssetPriceOracle baseOracle, TokenMetadataResolver tokens,
            NegativeCache cache, ArbProperties properties) {
        this.spot = spot;
        this.baseOracle = baseOracle;
        this.tokens = tokens;
        this.cache = cache;
        this.config = properties.tokens();
    }

    public Optional<BigDecimal> toUsd(Token token, BigInteger amount) {
        return unitPriceUsd(token).map(p -> p.multiply(new BigDecimal(amount).movePointLeft(token.decimals()), MC));
    }

    /**
     * USD value of one whole token.
     */
    public Optional<BigDecimal> unitPriceUsd(Token token) {
        if (isStable(token)) {
            return Optional.of(BigDecimal.ONE);
        }
        if (token.sameAddress(config.baseAsset())) {
            return Optional.of(baseOracle.usdPrice());
        }
        String key = NegativeCache.usdRouteKey(token.address());
        if (cache.isNegative(key)) {
            return Optional.empty();
        }
        for (String stableAddress : config.stableAssets()) {
            Token stable = tokens.resolve(stableAddress);
            Optional<BigDecimal> direct = spot.price(token, stable);
            if (direct.isPresent()) {
                return direct;
            }
        }
        Token base = tokens.resolve(config.baseAsset());
        Optional<BigDecimal> viaBase = spot.price(token, base).map(p -> p.multiply(baseOracle.usdPrice(), MC));
        if (viaBase.isEmpty()) {
            log.warn("[PRICE] no USD route for {}", token);
            cache.markMissing(key);
        }
        return viaBase;
    }

    public boolean isStable(Token token) {
        return config.stableAssets().stream().anyMatch(token::sameAddress);
    }
}
