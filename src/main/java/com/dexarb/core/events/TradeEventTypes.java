package com.dexarb.core.events;

public final class TradeEventTypes {

    private TradeEventTypes() {
    }

    public static final String TRADE_RECORD = "trade.record";
    public static final String TRADE_RECONCILED = "trade.reconciled";

    public static final String SESSION_STATS = "session.stats";
}
