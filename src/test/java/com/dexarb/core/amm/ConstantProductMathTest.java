package com.dexarb.core.amm;

import com.dexarb.domain.FailureReason;
import com.dexarb.domain.QuoteException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConstantProductMathTest {

    private static final BigInteger R_IN = BigInteger.valueOf(5_000_000_000L);
    private static final BigInteger R_OUT = new BigInteger("2000000000000000000000");

    @Test
    void zeroInputGivesZeroOutput() {
        assertEquals(BigInteger.ZERO, ConstantProductMath.amountOut(BigInteger.ZERO, R_IN, R_OUT, 30));
    }

    @Test
    void matchesTheOnChainFormula() {
        BigInteger million = BigInteger.valueOf(1_000_000);
        assertEquals(BigInteger.valueOf(996),
                ConstantProductMath.amountOut(BigInteger.valueOf(1000), million, million, 30));
    }

    @Test
    void outputGrowsWithInputButNeverDrainsTheReserve() {
        BigInteger previous = BigInteger.ZERO;
        for (long a = 1; a <= 1_000_000_000_000L; a *= 10) {
            BigInteger out = ConstantProductMath.amountOut(BigInteger.valueOf(a), R_IN, R_OUT, 30);
            assertTrue(out.compareTo(previous) >= 0, "non-monotonic at " + a);
            assertTrue(out.compareTo(R_OUT) < 0);
            previous = out;
        }
    }

    @Test
    void emptyReservesGiveNoQuote() {
        QuoteException e = assertThrows(QuoteException.class,
                () -> ConstantProductMath.quote(BigInteger.TEN, BigInteger.ZERO, R_OUT, 30));
        assertEquals(FailureReason.INSUFFICIENT_LIQUIDITY, e.getReason());
    }

    @Test
    void dustThatRoundsToZeroGivesNoQuote() {
        QuoteException e = assertThrows(QuoteException.class,
                () -> ConstantProductMath.quote(BigInteger.ONE, R_OUT, R_IN, 30));
        assertEquals(FailureReason.INSUFFICIENT_LIQUIDITY, e.getReason());
    }
}
