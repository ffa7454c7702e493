package com.dexarb.core.amm;

import com.dexarb.domain.FailureReason;
import com.dexarb.domain.QuoteException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Single-slot pricing for concentrated-liquidity pools from {@code sqrtPriceX96}. No tick traversal: the
 * estimate is only accepted while the input stays small against the virtual reserve at the current price.
 *
 * <p>Amounts are raw integer units. The human price of token0 in token1 is
 * {@code (S / 2^96)^2 * 10^(d0 - d1)}; converting a raw input to a raw output multiplies by
 * {@code 10^(dOut - dIn)}, which cancels that adjustment, so raw swaps use {@code S^2 / 2^192} directly.
 */
public final class ConcentratedLiquidityMath {

    public static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);
    public static final BigInteger Q192 = BigInteger.ONE.shiftLeft(192);
    public static final int FEE_DENOMINATOR = 1_000_000;

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private ConcentratedLiquidityMath() {
    }

    /**
     * Human-unit price of token0 expressed in token1.
     */
    public static BigDecimal price(BigInteger sqrtPriceX96, int decimals0, int decimals1, MathContext mc) {
        BigDecimal raw = new BigDecimal(sqrtPriceX96.multiply(sqrtPriceX96)).divide(new BigDecimal(Q192), mc);
        return raw.scaleByPowerOfTen(decimals0 - decimals1).round(mc);
    }

    /**
     * Input amount after the pool fee ({@code feePpm} parts per million) is taken.
     */
    public static BigInteger afterFee(BigInteger amountIn, int feePpm) {
        return amountIn.multiply(BigInteger.valueOf(FEE_DENOMINATOR - feePpm))
                .divide(BigInteger.valueOf(FEE_DENOMINATOR));
    }

    /**
     * Raw output for a raw input at the current slot price, rounded down.
     *
     * @param zeroForOne true when selling token0 for token1
     */
    public static BigInteger amountOut(BigInteger amountIn, BigInteger sqrtPriceX96, int feePpm, boolean zeroForOne) {
        if (amountIn.signum() <= 0 || sqrtPriceX96.signum() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger net = afterFee(amountIn, feePpm);
        BigInteger priceX192 = sqrtPriceX96.multiply(sqrtPriceX96);
        return zeroForOne
                ? net.multiply(priceX192).divide(Q192)
                : net.multiply(Q192).divide(priceX192);
    }

    /**
     * Virtual reserve of the input token at the current price: {@code L * 2^96 / S} for token0,
     * {@code L * S / 2^96} for token1.
     */
    public static BigInteger virtualReserveIn(BigInteger liquidity, BigInteger sqrtPriceX96, boolean zeroForOne) {
        return zeroForOne
                ? liquidity.multiply(Q96).divide(sqrtPriceX96)
                : liquidity.multiply(sqrtPriceX96).divide(Q96);
    }

    public static boolean withinDepth(BigInteger amountIn, BigInteger liquidity, BigInteger sqrtPriceX96,
            boolean zeroForOne, int maxImpactBps) {
        BigInteger reserve = virtualReserveIn(liquidity, sqrtPriceX96, zeroForOne);
        return amountIn.multiply(BPS).compareTo(reserve.multiply(BigInteger.valueOf(maxImpactBps))) <= 0;
    }

    /**
     * Checked quote: rejects uninitialised pools, empty liquidity, inputs beyond the depth bound and
     * non-positive outputs.
     */
    public static BigInteger quote(BigInteger amountIn, BigInteger sqrtPriceX96, BigInteger liquidity, int feePpm,
            boolean zeroForOne, int maxImpactBps) {
        if (sqrtPriceX96 == null || sqrtPriceX96.signum() <= 0) {
            throw new QuoteException(FailureReason.POOL_UNINITIALIZED, "sqrtPriceX96 is zero");
        }
        if (liquidity == null || liquidity.signum() <= 0) {
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY, "pool liquidity is zero");
        }
        if (!withinDepth(amountIn, liquidity, sqrtPriceX96, zeroForOne, maxImpactBps)) {
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY,
                    "input " + amountIn + " exceeds " + maxImpactBps + " bps of virtual reserve "
                            + virtualReserveIn(liquidity, sqrtPriceX96, zeroForOne));
        }
        BigInteger out = amountOut(amountIn, sqrtPriceX96, feePpm, zeroForOne);
        if (out.signum() <= 0) {
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY, "output rounds to zero");
        }
        return out;
    }
}
