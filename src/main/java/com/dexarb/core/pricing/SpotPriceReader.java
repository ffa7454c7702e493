package com.dexarb.core.pricing;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.amm.ConcentratedLiquidityMath;
import com.dexarb.core.resolver.PoolResolver;
import com.dexarb.domain.ConcentratedPoolState;
import com.dexarb.domain.ReservePoolState;
import com.dexarb.domain.RouterFamily;
import com.dexarb.domain.Token;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;

/**
 * Mid price of one token in another, read from the first live pool found: concentrated venues over their
 * fee tiers first, then constant-product pairs. Used for valuation only, never for trade amounts.
 */
@Slf4j
@Component
public class SpotPriceReader {

    static final MathContext MC = MathContext.DECIMAL128;

    private final PoolResolver pools;
    private final List<ArbProperties.Router> concentrated;
    private final List<ArbProperties.Router> constantProduct;

    public SpotPriceReader(ArbProperties properties, PoolResolver pools) {
        this.pools = pools;
        List<ArbProperties.Router> enabled = properties.routers().stream()
                .filter(r -> Boolean.TRUE.equals(r.enabled()))
                .toList();
        this.concentrated = enabled.stream().filter(r -> r.family() == RouterFamily.CONCENTRATED_LIQUIDITY).toList();
        this.constantProduct = enabled.stream().filter(r -> r.family() == RouterFamily.CONSTANT_PRODUCT).toList();
    }

    /**
     * Units of {@code quote} per one unit of {@code base}, in human units.
     *
     * @throws RpcException when a read fails transiently, so callers do not mistake it for "no route"
     */
    public Optional<BigDecimal> price(Token base, Token quote) {
        for (ArbProperties.Router router : concentrated) {
            for (int fee : router.feeTiers()) {
                Optional<BigDecimal> p = concentratedPrice(router, fee, base, quote);
                if (p.isPresent()) {
                    return p;
                }
            }
        }
        for (ArbProperties.Router router : constantProduct) {
            Optional<BigDecimal> p = reservePrice(router, base, quote);
            if (p.isPresent()) {
                return p;
            }
        }
        return Optional.empty();
    }

    private Optional<BigDecimal> concentratedPrice(ArbProperties.Router router, int fee, Token base, Token quote) {
        try {
            Optional<String> pool = pools.concentratedPool(router.name(), router.factory(),
                    base.address(), quote.address(), fee);
            if (pool.isEmpty()) {
                return Optional.empty();
            }
            ConcentratedPoolState state = pools.concentratedState(pool.get(), fee);
            if (state.sqrtPriceX96().signum() == 0 || state.liquidity().signum() == 0) {
                return Optional.empty();
            }
            boolean baseIsToken0 = base.sameAddress(state.token0());
            Token t0 = baseIsToken0 ? base : quote;
            Token t1 = baseIsToken0 ? quote : base;
            BigDecimal oneInTwo = ConcentratedLiquidityMath.price(state.sqrtPriceX96(), t0.decimals(), t1.decimals(), MC);
            if (oneInTwo.signum() == 0) {
                return Optional.empty();
            }
            return Optional.of(baseIsToken0 ? oneInTwo : BigDecimal.ONE.divide(oneInTwo, MC));
        } catch (RpcException e) {
            if (e.getKind().isTransient()) {
                throw e;
            }
            log.debug("[PRICE] {} fee={} unreadable for {}/{}: {}", router.name(), fee, base.symbol(), quote.symbol(),
                    e.getKind());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> reservePrice(ArbProperties.Router router, Token base, Token quote) {
        try {
            Optional<String> pair = pools.constantProductPair(router.name(), router.factory(),
                    base.address(), quote.address());
            if (pair.isEmpty()) {
                return Optional.empty();
            }
            ReservePoolState state = pools.reserves(pair.get());
            boolean baseIsToken0 = base.sameAddress(state.token0());
            BigDecimal reserveBase = new BigDecimal(baseIsToken0 ? state.reserve0() : state.reserve1())
                    .movePointLeft(base.decimals());
            BigDecimal reserveQuote = new BigDecimal(baseIsToken0 ? state.reserve1() : state.reserve0())
                    .movePointLeft(quote.decimals());
            if (reserveBase.signum() == 0 || reserveQuote.signum() == 0) {
                return Optional.empty();
            }
            return Optional.of(reserveQuote.divide(reserveBase, MC));
        } catch (RpcException e) {
            if (e.getKind().isTransient()) {
                throw e;
            }
            log.debug("[PRICE] {} unreadable for {}/{}: {}", router.name(), base.symbol(), quote.symbol(), e.getKind());
            return Optional.empty();
        }
    }
}
