package com.dexarb.domain;

import java.math.BigInteger;

public record ConcentratedPoolState(
    String address,
    String token0,
    String token1,
    int feePpm,
    BigInteger sqrtPriceX96,
    int tick,
    BigInteger liquidity
) {
}
