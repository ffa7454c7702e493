package com.dexarb.core.quote;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.amm.ConcentratedLiquidityMath;
import com.dexarb.core.cache.NegativeCache;
import com.dexarb.core.resolver.PoolResolver;
import com.dexarb.domain.ConcentratedPoolState;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.Quote;
import com.dexarb.domain.QuoteException;
import com.dexarb.domain.RouterFamily;
import com.dexarb.domain.Token;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Uniswap V3 style venue: quotes every configured fee tier and keeps the best single-slot estimate.
 * Swaps go through SwapRouter02 {@code multicall(deadline, [exactInputSingle])}.
 */
@Slf4j
public final class ConcentratedLiquidityAdapter implements RouterAdapter {

    static final String EXACT_INPUT_SINGLE =
            "exactInputSingle((address,address,uint24,address,uint256,uint256,uint160))";

    private final String id;
    private final String factory;
    private final String router;
    private final List<Integer> feeTiers;
    private final long gasUnits;
    private final int maxImpactBps;
    private final LiquidityFloor floor;
    private final PoolResolver pools;

    public ConcentratedLiquidityAdapter(ArbProperties.Router config, int maxImpactBps, LiquidityFloor floor,
            PoolResolver pools) {
        this.id = config.name();
        this.factory = config.factory().toLowerCase(Locale.ROOT);
        this.router = config.router().toLowerCase(Locale.ROOT);
        this.feeTiers = List.copyOf(config.feeTiers());
        this.gasUnits = config.gasUnits();
        this.maxImpactBps = maxImpactBps;
        this.floor = floor;
        this.pools = pools;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public RouterFamily family() {
        return RouterFamily.CONCENTRATED_LIQUIDITY;
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
        Quote best = null;
        FailureReason lastReason = FailureReason.NO_POOL_FOUND;
        String lastDetail = "no pool on any fee tier";

        for (int fee : feeTiers) {
            String key = NegativeCache.poolKey(id, sell.address(), buy.address(), fee);
            if (pools.isLowLiquidity(key)) {
                lastReason = FailureReason.INSUFFICIENT_LIQUIDITY;
                lastDetail = "fee " + fee + ": recently too shallow";
                continue;
            }
            try {
                String pool = pools.concentratedPool(id, factory, sell.address(), buy.address(), fee).orElse(null);
                if (pool == null) {
                    continue;
                }
                ConcentratedPoolState state = pools.concentratedState(pool, fee);
                boolean zeroForOne = sell.sameAddress(state.token0());
                if (tooShallow(sell, buy, state, zeroForOne)) {
                    pools.markLowLiquidity(key);
                    throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY,
                            "pool " + pool + " below " + floor.minBaseReserve() + " base asset");
                }
                if (state.sqrtPriceX96().signum() > 0 && !ConcentratedLiquidityMath.withinDepth(amountIn,
                        state.liquidity(), state.sqrtPriceX96(), zeroForOne, maxImpactBps)) {
                    pools.markLowLiquidity(key);
                    throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY,
                            "input " + amountIn + " exceeds " + maxImpactBps + " bps of pool " + pool);
                }
                BigInteger out = ConcentratedLiquidityMath.quote(amountIn, state.sqrtPriceX96(), state.liquidity(),
                        fee, zeroForOne, maxImpactBps);
                log.debug("[QUOTE] {} fee={} pool={} {} -> {}", id, fee, pool, amountIn, out);
                if (best == null || out.compareTo(best.getBuyAmount()) > 0) {
                    best = Quote.builder()
                            .routerId(id)
                            .family(RouterFamily.CONCENTRATED_LIQUIDITY)
                            .sellToken(sell)
                            .buyToken(buy)
                            .sellAmount(amountIn)
                            .buyAmount(out)
                            .feePpm(fee)
                            .path(List.of(sell.address(), buy.address()))
                            .poolAddress(pool)
                            .build();
                }
            } catch (QuoteException e) {
                lastReason = e.getReason();
                lastDetail = "fee " + fee + ": " + e.getMessage();
            } catch (RpcException e) {
                lastReason = FailureReason.fromRpc(e.getKind());
                lastDetail = "fee " + fee + ": " + e.getMessage();
            }
        }
        if (best == null) {
            throw new QuoteException(lastReason, id + " " + sell.symbol() + "->" + buy.symbol() + ": " + lastDetail);
        }
        return best;
    }

    private boolean tooShallow(Token sell, Token buy, ConcentratedPoolState state, boolean zeroForOne) {
        if (state.liquidity().signum() == 0) {
            return true;
        }
        if (state.sqrtPriceX96().signum() == 0) {
            // left to the math, which reports it as uninitialised
            return false;
        }
        BigInteger sellReserve = ConcentratedLiquidityMath.virtualReserveIn(state.liquidity(), state.sqrtPriceX96(), zeroForOne);
        BigInteger buyReserve = ConcentratedLiquidityMath.virtualReserveIn(state.liquidity(), state.sqrtPriceX96(), !zeroForOne);
        return floor.isShallow(sell, sellReserve, buy, buyReserve);
    }

    @Override
    public String encodeSwap(Quote quote, BigInteger minOut, String recipient, long deadlineEpochSeconds) {
        List<Type> params = List.of(
                new Address(quote.getSellToken().address()),
                new Address(quote.getBuyToken().address()),
                new Uint24(quote.getFeePpm()),
                new Address(recipient),
                new Uint256(quote.getSellAmount()),
                new Uint256(minOut),
                new Uint160(BigInteger.ZERO));
        // the params tuple is fully static, so its encoding is the plain concatenation of its fields
        String exactInputSingle = Hash.sha3String(EXACT_INPUT_SINGLE).substring(0, 10)
                + Numeric.cleanHexPrefix(FunctionEncoder.encodeConstructor(params));

        Function multicall = new Function("multicall",
                List.of(new Uint256(BigInteger.valueOf(deadlineEpochSeconds)),
                        new DynamicArray<>(DynamicBytes.class,
                                List.of(new DynamicBytes(Numeric.hexStringToByteArray(exactInputSingle))))),
                List.of());
        return FunctionEncoder.encode(multicall);
    }
}
