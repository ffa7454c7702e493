package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * One router's answer for selling {@code sellAmount} of {@code sellToken}. Amounts are in smallest units.
 */
@Value
@Builder
public class Quote {
    String routerId;
    RouterFamily family;
    Token sellToken;
    Token buyToken;
    BigInteger sellAmount;
    BigInteger buyAmount;
    int feePpm;
    List<String> path;
    String poolAddress;
}
