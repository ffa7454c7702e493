package com.dexarb.core.pricing;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.quote.RouterAdapter;
import com.dexarb.core.quote.RouterRegistry;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.GuardVerdict;
import com.dexarb.domain.Quote;
import com.dexarb.infra.EvmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Optional;

/**
 * Accepts a quote only when buy value minus sell value minus gas cost reaches the configured USD minimum.
 */
@Slf4j
@Service
public class ProfitabilityGuard {

    private static final int NATIVE_DECIMALS = 18;
    private static final MathContext MC = MathContext.DECIMAL128;

    private final UsdConverter converter;
    private final BaseAssetPriceOracle baseOracle;
    private final EvmClient evm;
    private final RouterRegistry registry;
    private final BigDecimal minProfitUsd;

    public ProfitabilityGuard(UsdConverter converter, BaseAssetPriceOracle baseOracle, EvmClient evm,
            RouterRegistry registry, ArbProperties properties) {
        this.converter = converter;
        this.baseOracle = baseOracle;
        this.evm = evm;
        this.registry = registry;
        this.minProfitUsd = properties.guard().minProfitUsd();
    }

    public GuardVerdict evaluate(Quote quote) {
        long gasUnits = registry.byId(quote.getRouterId())
                .map(RouterAdapter::gasUnits)
                .orElseThrow(() -> new IllegalArgumentException("Unknown router " + quote.getRouterId()));
        BigDecimal gasUsd = gasUsd(gasUnits, evm.gasPrice());

        Optional<BigDecimal> sellUsd = converter.toUsd(quote.getSellToken(), quote.getSellAmount());
        Optional<BigDecimal> buyUsd = converter.toUsd(quote.getBuyToken(), quote.getBuyAmount());
        if (sellUsd.isEmpty() || buyUsd.isEmpty()) {
            log.warn("[GUARD] {} {}->{} rejected: {} (sellUsd={}, buyUsd={})", quote.getRouterId(),
                    quote.getSellToken().symbol(), quote.getBuyToken().symbol(), FailureReason.UNPRICEABLE,
                    sellUsd.orElse(null), buyUsd.orElse(null));
            return GuardVerdict.unpriceable(gasUsd, sellUsd.orElse(null), buyUsd.orElse(null));
        }

        GuardVerdict verdict = decide(sellUsd.get(), buyUsd.get(), gasUsd);
        if (verdict.ok()) {
            log.info("[GUARD] {} {}->{} approved: net={} gross={} gas={}", quote.getRouterId(),
                    quote.getSellToken().symbol(), quote.getBuyToken().symbol(),
                    verdict.netUsd().toPlainString(), verdict.grossUsd().toPlainString(), gasUsd.toPlainString());
        } else {
            log.info("[GUARD] {} {}->{} rejected: {} net={} < min {}", quote.getRouterId(),
                    quote.getSellToken().symbol(), quote.getBuyToken().symbol(), verdict.reason(),
                    verdict.netUsd().toPlainString(), minProfitUsd);
        }
        return verdict;
    }

    public GuardVerdict decide(BigDecimal sellUsd, BigDecimal buyUsd, BigDecimal gasUsd) {
        BigDecimal gross = buyUsd.subtract(sellUsd);
        BigDecimal net = gross.subtract(gasUsd);
        boolean ok = net.compareTo(minProfitUsd) >= 0;
        return new GuardVerdict(ok, net, gross, gasUsd, sellUsd, buyUsd, ok ? null : FailureReason.UNPROFITABLE);
    }

    BigDecimal gasUsd(long gasUnits, BigInteger gasPriceWei) {
        BigDecimal costNative = new BigDecimal(gasPriceWei.multiply(BigInteger.valueOf(gasUnits)))
                .movePointLeft(NATIVE_DECIMALS);
        return costNative.multiply(baseOracle.usdPrice(), MC);
    }
}
