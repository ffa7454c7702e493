package com.dexarb.core.pricing;

import com.dexarb.domain.FailureReason;
import com.dexarb.domain.QuoteException;
import com.dexarb.domain.Token;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Turns a USD notional into a sell amount in the token's smallest unit.
 */
@Service
@RequiredArgsConstructor
public class TradeSizer {

    private final UsdConverter converter;

    public BigInteger size(Token sell, BigDecimal notionalUsd) {
        BigDecimal unitUsd = converter.unitPriceUsd(sell)
                .filter(p -> p.signum() > 0)
                .orElseThrow(() -> new QuoteException(FailureReason.UNPRICEABLE, "cannot price " + sell + " in USD"));
        BigInteger amount = notionalUsd.divide(unitUsd, MathContext.DECIMAL128)
                .movePointRight(sell.decimals())
                .setScale(0, RoundingMode.DOWN)
                .toBigIntegerExact();
        if (amount.signum() <= 0) {
            throw new QuoteException(FailureReason.UNPRICEABLE, notionalUsd + " USD rounds to zero " + sell.symbol());
        }
        return amount;
    }
}
