package com.dexarb.core.resolver;

import com.dexarb.core.cache.NegativeCache;
import com.dexarb.domain.ConcentratedPoolState;
import com.dexarb.domain.ReservePoolState;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.rpc.RevertHandling;
import com.dexarb.infra.rpc.RpcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int24;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint16;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds pools through venue registries and reads their live state. Only existence is cached; prices and
 * reserves are read fresh for every quote.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolResolver {

    static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final EvmClient evm;
    private final NegativeCache cache;
    private final ConcurrentHashMap<String, String[]> tokenOrder = new ConcurrentHashMap<>();

    public Optional<String> concentratedPool(String venue, String factory, String tokenA, String tokenB, int feePpm) {
        String key = NegativeCache.poolKey(venue, tokenA, tokenB, feePpm);
        Function getPool = new Function("getPool",
                List.of(new Address(tokenA), new Address(tokenB), new Uint24(feePpm)),
                List.of(new TypeReference<Address>() {
                }));
        return lookup(key, factory, getPool);
    }

    public Optional<String> constantProductPair(String venue, String factory, String tokenA, String tokenB) {
        String key = NegativeCache.poolKey(venue, tokenA, tokenB, null);
        Function getPair = new Function("getPair",
                List.of(new Address(tokenA), new Address(tokenB)),
                List.of(new TypeReference<Address>() {
                }));
        return lookup(key, factory, getPair);
    }

    public boolean isNegative(String key) {
        return cache.isNegative(key);
    }

    public boolean isLowLiquidity(String key) {
        return cache.lookup(key).map(e -> e.kind() == NegativeCache.Kind.LOW_LIQUIDITY).orElse(false);
    }

    public void markLowLiquidity(String key) {
        log.info("[RESOLVER] {} marked low-liquidity", key);
        cache.markLowLiquidity(key);
    }

    public ConcentratedPoolState concentratedState(String pool, int feePpm) {
        Function slot0 = new Function("slot0", List.of(), List.of(
                new TypeReference<Uint160>() {
                },
                new TypeReference<Int24>() {
                },
                new TypeReference<Uint16>() {
                },
                new TypeReference<Uint16>() {
                },
                new TypeReference<Uint16>() {
                },
                new TypeReference<Uint8>() {
                },
                new TypeReference<Bool>() {
                }));
        // nodes occasionally mis-serve reverts on slot0
        List<Type> s = evm.call(pool, slot0, RevertHandling.RETRY_ONCE);
        Function liquidityFn = new Function("liquidity", List.of(), List.of(new TypeReference<Uint128>() {
        }));
        BigInteger liquidity = (BigInteger) evm.call(pool, liquidityFn, RevertHandling.RETRY_ONCE).get(0).getValue();
        String[] order = tokenOrder(pool);
        return new ConcentratedPoolState(pool, order[0], order[1], feePpm,
                (BigInteger) s.get(0).getValue(),
                ((BigInteger) s.get(1).getValue()).intValue(),
                liquidity);
    }

    public ReservePoolState reserves(String pair) {
        Function getReserves = new Function("getReserves", List.of(), List.of(
                new TypeReference<Uint112>() {
                },
                new TypeReference<Uint112>() {
                },
                new TypeReference<Uint32>() {
                }));
        List<Type> r = evm.call(pair, getReserves, RevertHandling.RETRY_ONCE);
        String[] order = tokenOrder(pair);
        return new ReservePoolState(pair, order[0], order[1],
                (BigInteger) r.get(0).getValue(),
                (BigInteger) r.get(1).getValue());
    }

    private Optional<String> lookup(String key, String factory, Function registryCall) {
        Optional<NegativeCache.Entry> cached = cache.lookup(key);
        if (cached.isPresent()) {
            NegativeCache.Entry entry = cached.get();
            return entry.kind() == NegativeCache.Kind.FOUND ? Optional.of(entry.payload()) : Optional.empty();
        }
        String address;
        try {
            address = ((Address) evm.call(factory, registryCall, RevertHandling.FAIL_FAST).get(0)).getValue();
        } catch (RpcException e) {
            if (e.getKind().isTransient()) {
                throw e;
            }
            log.debug("[RESOLVER] {} on {} reverted for {}: {}", registryCall.getName(), factory, key, e.getKind());
            cache.markMissing(key);
            return Optional.empty();
        }
        address = address.toLowerCase(Locale.ROOT);
        if (ZERO_ADDRESS.equals(address)) {
            log.debug("[RESOLVER] no pool for {}", key);
            cache.markMissing(key);
            return Optional.empty();
        }
        cache.markFound(key, address);
        return Optional.of(address);
    }

    private String[] tokenOrder(String pool) {
        String[] known = tokenOrder.get(pool);
        if (known != null) {
            return known;
        }
        String[] order = new String[]{readAddress(pool, "token0"), readAddress(pool, "token1")};
        tokenOrder.put(pool, order);
        return order;
    }

    private String readAddress(String pool, String getter) {
        Function fn = new Function(getter, List.of(), List.of(new TypeReference<Address>() {
        }));
        return ((Address) evm.call(pool, fn, RevertHandling.RETRY_ONCE).get(0)).getValue().toLowerCase(Locale.ROOT);
    }
}
