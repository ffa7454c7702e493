package com.dexarb.core.pricing;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.QuoteException;
import com.dexarb.domain.Token;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TradeSizerTest {

    private static final Token WETH = new Token(ArbProperties.WETH, 18, "WETH");
    private static final Token USDC = new Token(ArbProperties.USDC, 6, "USDC");

    private final UsdConverter converter = mock(UsdConverter.class);
    private final TradeSizer sizer = new TradeSizer(converter);

    @Test
    void notionalIsConvertedAtTheUnitPrice() {
        when(converter.unitPriceUsd(WETH)).thenReturn(Optional.of(new BigDecimal("3200")));
        when(converter.unitPriceUsd(USDC)).thenReturn(Optional.of(BigDecimal.ONE));

        assertEquals(new BigInteger("6250000000000000"), sizer.size(WETH, new BigDecimal("20")));
        assertEquals(BigInteger.valueOf(20_000_000L), sizer.size(USDC, new BigDecimal("20")));
    }

    @Test
    void unpricedTokenCannotBeSized() {
        when(converter.unitPriceUsd(WETH)).thenReturn(Optional.empty());

        QuoteException e = assertThrows(QuoteException.class, () -> sizer.size(WETH, new BigDecimal("20")));
        assertEquals(FailureReason.UNPRICEABLE, e.getReason());
    }

    @Test
    void dustNotionalRoundingToZeroIsRejected() {
        when(converter.unitPriceUsd(USDC)).thenReturn(Optional.of(BigDecimal.ONE));

        assertThrows(QuoteException.class, () -> sizer.size(USDC, new BigDecimal("0.0000001")));
    }
}
