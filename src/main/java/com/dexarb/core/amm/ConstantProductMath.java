package com.dexarb.core.amm;

import com.dexarb.domain.FailureReason;
import com.dexarb.domain.QuoteException;

import java.math.BigInteger;

/**
 * x * y = k output with the fee taken on input, matching the on-chain {@code getAmountOut}.
 */
public final class ConstantProductMath {

    public static final int BPS = 10_000;

    private ConstantProductMath() {
    }

    /**
     * {@code floor(a*(10000-f)*Rout / (Rin*10000 + a*(10000-f)))}; zero for non-positive input or empty reserves.
     */
    public static BigInteger amountOut(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        if (amountIn.signum() <= 0 || reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger inWithFee = amountIn.multiply(BigInteger.valueOf(BPS - feeBps));
        BigInteger numerator = inWithFee.multiply(reserveOut);
        BigInteger denominator = reserveIn.multiply(BigInteger.valueOf(BPS)).add(inWithFee);
        return numerator.divide(denominator);
    }

    public static BigInteger quote(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        if (reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY, "pair has empty reserves");
        }
        BigInteger out = amountOut(amountIn, reserveIn, reserveOut, feeBps);
        if (out.signum() <= 0) {
            throw new QuoteException(FailureReason.INSUFFICIENT_LIQUIDITY, "output rounds to zero");
        }
        return out;
    }
}
