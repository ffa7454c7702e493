package com.dexarb.support;

import com.dexarb.config.ArbProperties;

public final class TestProperties {

    private TestProperties() {
    }

    public static ArbProperties defaults() {
        return new ArbProperties(null, null, null, null, null, null, null, null);
    }

    public static ArbProperties withGuard(ArbProperties.Guard guard) {
        return new ArbProperties(null, null, null, null, guard, null, null, null);
    }

    public static ArbProperties withDriver(ArbProperties.Driver driver) {
        return new ArbProperties(null, null, null, null, null, null, null, driver);
    }
}
