package com.dexarb.core.quote;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.resolver.PoolResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one adapter per enabled router entry at startup, keyed by its configured name.
 */
@Slf4j
@Component
public class RouterRegistry {

    private final Map<String, RouterAdapter> adapters;

    public RouterRegistry(ArbProperties properties, PoolResolver pools) {
        LiquidityFloor floor = new LiquidityFloor(properties.tokens().baseAsset(), properties.guard().minBaseReserve());
        Map<String, RouterAdapter> byName = new LinkedHashMap<>();
        for (ArbProperties.Router router : properties.routers()) {
            if (!Boolean.TRUE.equals(router.enabled())) {
                log.info("Router {} disabled", router.name());
                continue;
            }
            requireText(router.name(), "router name");
            requireText(router.factory(), router.name() + ".factory");
            requireText(router.router(), router.name() + ".router");
            RouterAdapter adapter = switch (router.family()) {
                case CONCENTRATED_LIQUIDITY ->
                        new ConcentratedLiquidityAdapter(router, properties.guard().maxImpactBps(), floor, pools);
                case CONSTANT_PRODUCT -> new ConstantProductAdapter(router, floor, pools);
            };
            if (byName.put(router.name(), adapter) != null) {
                throw new IllegalStateException("Duplicate router name: " + router.name());
            }
        }
        if (byName.isEmpty()) {
            throw new IllegalStateException("No router enabled");
        }
        this.adapters = Collections.unmodifiableMap(byName);
        log.info("Routers enabled: {}", adapters.keySet());
    }

    public List<RouterAdapter> enabled() {
        return new ArrayList<>(adapters.values());
    }

    public Optional<RouterAdapter> byId(String id) {
        return Optional.ofNullable(adapters.get(id));
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(what + " is required");
        }
    }
}
