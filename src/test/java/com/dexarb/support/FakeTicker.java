package com.dexarb.support;

import com.dexarb.infra.rpc.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Time only moves when somebody sleeps.
 */
public class FakeTicker implements Ticker {

    private long now;
    private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());

    @Override
    public synchronized long nanoTime() {
        return now;
    }

    @Override
    public void sleepNanos(long nanos) {
        sleeps.add(nanos);
        synchronized (this) {
            now += nanos;
        }
    }

    public List<Long> sleeps() {
        return sleeps;
    }
}
