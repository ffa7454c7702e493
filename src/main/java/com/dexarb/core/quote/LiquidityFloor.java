package com.dexarb.core.quote;

import com.dexarb.domain.Token;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Minimum base-asset depth a pool must hold to be quoted. Pools without the base asset are not judged.
 *
 * @param baseAsset      base asset address
 * @param minBaseReserve minimum reserve in whole base-asset units
 */
public record LiquidityFloor(String baseAsset, BigDecimal minBaseReserve) {

    public boolean isShallow(Token sell, BigInteger sellReserve, Token buy, BigInteger buyReserve) {
        return below(sell, sellReserve) || below(buy, buyReserve);
    }

    private boolean below(Token token, BigInteger reserve) {
        if (!token.sameAddress(baseAsset) || minBaseReserve.signum() <= 0) {
            return false;
        }
        return new BigDecimal(reserve).movePointLeft(token.decimals()).compareTo(minBaseReserve) < 0;
    }
}
