package com.dexarb.core.pricing;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.resolver.TokenMetadataResolver;
import com.dexarb.domain.Token;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.rpc.RevertHandling;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint80;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * USD price of the base asset (gas denomination and routing intermediary). Sources in order: price feed,
 * reference pool against the first stable asset, configured fallback. Never answers zero.
 */
@Slf4j
@Service
public class BaseAssetPriceOracle {

    public enum Source {
        FEED,
        POOL,
        FALLBACK
    }

    public record BasePrice(BigDecimal usd, Source source, Instant fetchedAt) {
    }

    private final EvmClient evm;
    private final SpotPriceReader spot;
    private final TokenMetadataResolver tokens;
    private final ArbProperties.Guard guard;
    private final ArbProperties.Tokens tokenConfig;
    private final Clock clock;

    private volatile BasePrice cached;

    public BaseAssetPriceOracle(EvmClient evm, SpotPriceReader spot, TokenMetadataResolver tokens,
            ArbProperties properties, Clock clock) {
        this.evm = evm;
        this.spot = spot;
        this.tokens = tokens;
        this.guard = properties.guard();
        this.tokenConfig = properties.tokens();
        this.clock = clock;
    }

    public BigDecimal usdPrice() {
        return current().usd();
    }

    public synchronized BasePrice current() {
        Instant now = clock.instant();
        BasePrice snapshot = cached;
        if (snapshot != null && Duration.between(snapshot.fetchedAt(), now).compareTo(guard.oracleTtl()) < 0) {
            return snapshot;
        }
        BasePrice fresh = fetch(now);
        if (snapshot == null || snapshot.source() != fresh.source()) {
            log.info("[PRICE] base asset = {} USD from {}", fresh.usd().toPlainString(), fresh.source());
        }
        cached = fresh;
        return fresh;
    }

    private BasePrice fetch(Instant now) {
        Optional<BigDecimal> feed = fromFeed();
        if (feed.isPresent()) {
            return new BasePrice(feed.get(), Source.FEED, now);
        }
        Optional<BigDecimal> pool = fromPool();
        if (pool.isPresent()) {
            return new BasePrice(pool.get(), Source.POOL, now);
        }
        log.warn("[PRICE] feed and reference pool unavailable, using fallback {} USD", guard.fallbackBaseUsd());
        return new BasePrice(guard.fallbackBaseUsd(), Source.FALLBACK, now);
    }

    private Optional<BigDecimal> fromFeed() {
        String feed = guard.baseUsdFeed();
        if (feed == null || feed.isBlank()) {
            return Optional.empty();
        }
        try {
            Function latestRoundData = new Function("latestRoundData", List.of(), List.of(
                    new TypeReference<Uint80>() {
                    },
                    new TypeReference<Int256>() {
                    },
                    new TypeReference<Uint256>() {
                    },
                    new TypeReference<Uint256>() {
                    },
                    new TypeReference<Uint80>() {
                    }));
            List<Type> round = evm.call(feed, latestRoundData, RevertHandling.FAIL_FAST);
            BigInteger answer = (BigInteger) round.get(1).getValue();
            int decimals = evm.decimals(feed);
            BigDecimal usd = new BigDecimal(answer).movePointLeft(decimals);
            return sane(usd, "feed");
        } catch (RpcException e) {
            log.warn("[PRICE] feed {} unreadable: {}", feed, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> fromPool() {
        try {
            Token base = tokens.resolve(tokenConfig.baseAsset());
            Token stable = tokens.resolve(tokenConfig.stableAssets().get(0));
            return spot.price(base, stable).flatMap(p -> sane(p, "reference pool"));
        } catch (RpcException e) {
            log.warn("[PRICE] reference pool unreadable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> sane(BigDecimal usd, String source) {
        if (usd.compareTo(guard.baseUsdSanityMin()) < 0 || usd.compareTo(guard.baseUsdSanityMax()) > 0) {
            log.warn("[PRICE] {} price {} outside sanity range [{}, {}]", source, usd.toPlainString(),
                    guard.baseUsdSanityMin(), guard.baseUsdSanityMax());
            return Optional.empty();
        }
        return Optional.of(usd);
    }
}
