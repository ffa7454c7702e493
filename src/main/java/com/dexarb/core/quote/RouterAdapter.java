package com.dexarb.core.quote;

import com.dexarb.domain.Quote;
import com.dexarb.domain.RouterFamily;
import com.dexarb.domain.Token;

import java.math.BigInteger;

/**
 * One configured venue. Quotes are computed locally from pool state; no quoter contract is called.
 */
public sealed interface RouterAdapter permits ConcentratedLiquidityAdapter, ConstantProductAdapter {

    String id();

    RouterFamily family();

    long gasUnits();

    /**
     * Contract that pulls the sell token; the approval target.
     */
    String spender();

    /**
     * @throws com.dexarb.domain.QuoteException when this venue cannot price the trade
     * @throws com.dexarb.infra.rpc.RpcException when reading pool state fails
     */
    Quote quote(Token sell, Token buy, BigInteger amountIn);

    /**
     * Calldata for swapping {@code quote.sellAmount} with at least {@code minOut} delivered to {@code recipient}.
     */
    String encodeSwap(Quote quote, BigInteger minOut, String recipient, long deadlineEpochSeconds);
}
