package com.dexarb.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TradePairTest {

    @Test
    void parsesAndTrimsLabels() {
        TradePair pair = TradePair.parse(" WETH / USDbC ");

        assertEquals("WETH", pair.sell());
        assertEquals("USDbC", pair.buy());
        assertEquals("WETH/USDbC", pair.label());
    }

    @Test
    void rejectsMalformedLabels() {
        assertThrows(IllegalArgumentException.class, () -> TradePair.parse("WETH"));
        assertThrows(IllegalArgumentException.class, () -> TradePair.parse("WETH/USDC/DAI"));
        assertThrows(IllegalArgumentException.class, () -> TradePair.parse("/USDC"));
        assertThrows(IllegalArgumentException.class, () -> TradePair.parse(null));
    }

    @Test
    void matchingIgnoresDirectionAndCase() {
        TradePair pair = TradePair.parse("WETH/USDC");

        assertTrue(pair.matchesEitherWay(TradePair.parse("usdc/weth")));
        assertTrue(pair.matchesEitherWay(TradePair.parse("WETH/USDC")));
        assertFalse(pair.matchesEitherWay(TradePair.parse("WETH/USDbC")));
    }
}
