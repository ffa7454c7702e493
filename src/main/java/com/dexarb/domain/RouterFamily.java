package com.dexarb.domain;

public enum RouterFamily {
    CONCENTRATED_LIQUIDITY, // sqrt-price slot, fee tiers in ppm
    CONSTANT_PRODUCT // x * y = k reserves
}
