package com.dexarb.core.quote;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.amm.ConstantProductMath;
import com.dexarb.core.cache.NegativeCache;
import com.dexarb.core.resolver.PoolResolver;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.Quote;
import com.dexarb.domain.QuoteException;
import com.dexarb.domain.ReservePoolState;
import com.dexarb.domain.RouterFamily;
import com.dexarb.domain.Token;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Uniswap V2 style venue (BaseSwap and forks): one pair per token pair, fee in basis points.
 */
@Slf4j
public final class ConstantProductAdapter implements RouterAdapter {

    private final String id;
    private final String factory;
    private final String router;
    private final int feeBps;
    private final long gasUnits;
    private final LiquidityFloor floor;
    private final PoolResolver pools;

    public ConstantProductAdapter(ArbProperties.Router config, LiquidityFloor floor, PoolResolver pools) {
        this.id = config.name();
        this.factory = config.factory().toLowerCase(Locale.ROOT);
        this.router = config.router().toLowerCase(Locale.ROOT);
        this.feeBps = config.feeBps();
        this.gasUnits = config.gasUnits();
        this.floor = floor;
        this.pools = pools;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public RouterFamily family() {
        return RouterFamily.CONSTANT_PRODUCT;
    }

    @Override
    public long gasUnits() {
        return gasUnits;
    }

    @Override
    public String spender() {
        return router;
    }

    @Override
    public Quote quote(Token sell, Token buy, BigInteger amountIn) {
        String key = NegativeCache.poolKey(id, sell.address(), buy.address(), null);
        if (pools.isLowLiquidity(key)) {
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY, id + " pair recently too shallow");
        }
        String pair = pools.constantProductPair(id, factory, sell.address(), buy.address())
                .orElseThrow(() -> new QuoteException(FailureReason.NO_POOL_FOUND,
                        id + " has no pair for " + sell.symbol() + "/" + buy.symbol()));

        ReservePoolState state = pools.reserves(pair);
        boolean sellIsToken0 = sell.sameAddress(state.token0());
        BigInteger reserveIn = sellIsToken0 ? state.reserve0() : state.reserve1();
        BigInteger reserveOut = sellIsToken0 ? state.reserve1() : state.reserve0();
        if (reserveIn.signum() == 0 || reserveOut.signum() == 0
                || floor.isShallow(sell, reserveIn, buy, reserveOut)) {
            pools.markLowLiquidity(key);
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY,
                    id + " pair " + pair + " below " + floor.minBaseReserve() + " base asset");
        }
        BigInteger out = ConstantProductMath.quote(amountIn, reserveIn, reserveOut, feeBps);
        log.debug("[QUOTE] {} pair={} {} -> {}", id, pair, amountIn, out);

        return Quote.builder()
                .routerId(id)
                .family(RouterFamily.CONSTANT_PRODUCT)
                .sellToken(sell)
                .buyToken(buy)
                .sellAmount(amountIn)
                .buyAmount(out)
                .feePpm(feeBps * 100)
                .path(List.of(sell.address(), buy.address()))
                .poolAddress(pair)
                .build();
    }

    @Override
    public String encodeSwap(Quote quote, BigInteger minOut, String recipient, long deadlineEpochSeconds) {
        List<Address> path = quote.getPath().stream().map(Address::new).toList();
        Function swap = new Function("swapExactTokensForTokens",
                List.of(new Uint256(quote.getSellAmount()),
                        new Uint256(minOut),
                        new DynamicArray<>(Address.class, path),
                        new Address(recipient),
                        new Uint256(BigInteger.valueOf(deadlineEpochSeconds))),
                List.of());
        return FunctionEncoder.encode(swap);
    }
}
