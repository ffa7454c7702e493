package com.dexarb.domain;

import java.math.BigInteger;

public record ReservePoolState(
    String address,
    String token0,
    String token1,
    BigInteger reserve0,
    BigInteger reserve1
) {
}
