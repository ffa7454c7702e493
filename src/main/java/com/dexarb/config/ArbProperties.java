package com.dexarb.config;

import com.dexarb.domain.RouterFamily;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration of the arbitrage client. Defaults target Base mainnet.
 */
@Validated
@ConfigurationProperties(prefix = "arb")
public record ArbProperties(
    @Valid Rpc rpc,
    @Valid Wallet wallet,
    @Valid Tokens tokens,
    @Valid List<Router> routers,
    @Valid Guard guard,
    @Valid Execution execution,
    @Valid Cache cache,
    @Valid Driver driver
) {

    public static final String WETH = "0x4200000000000000000000000000000000000006";
    public static final String USDC = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
    public static final String USDBC = "0xd9aaec86b65d86f6a7b5b1b0c42ffa531710b6ca";

    public ArbProperties {
        if (rpc == null) {
            rpc = new Rpc(null, null, null, null, null, null, null);
        }
        if (wallet == null) {
            wallet = new Wallet(null, null);
        }
        if (tokens == null) {
            tokens = new Tokens(null, null, null, null);
        }
        if (routers == null || routers.isEmpty()) {
            routers = defaultRouters();
        }
        if (guard == null) {
            guard = new Guard(null, null, null, null, null, null, null, null);
        }
        if (execution == null) {
            execution = new Execution(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
        if (cache == null) {
            cache = new Cache(null, null, null);
        }
        if (driver == null) {
            driver = new Driver(null, null, null, null, null, null, null, null, null, null);
        }
    }

    private static List<Router> defaultRouters() {
        return List.of(
            new Router("univ3", RouterFamily.CONCENTRATED_LIQUIDITY,
                "0x33128a8fc17869897dce68ed026d694621f6fdfd",
                "0x2626664c2603336e57b271c5c0b26f421741e481",
                List.of(500, 3000, 10000), null, 300_000L, true),
            new Router("baseswap", RouterFamily.CONSTANT_PRODUCT,
                "0xfda619b6d20975be80a10332cd39b9a4b0faa8bb",
                "0x327df1e6de05895d2ab08513aadd9313fe505d86",
                null, 30, 220_000L, true)
        );
    }

    private static List<String> sanitizeStringList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public record Rpc(
        /**
         * Chain id every call and signature is pinned to. No eth_chainId handshake is made.
         */
        @NotNull @Min(1) Long chainId,
        List<Endpoint> endpoints,
        @NotNull @Min(100) Long callTimeoutMillis,
        /**
         * Attempts per gateway call, first try included.
         */
        @NotNull @Min(1) Integer maxAttempts,
        @NotNull @Min(0) Long baseBackoffMillis,
        @NotNull @Min(0) Long maxBackoffMillis,
        @NotNull @Min(0) Long jitterMillis
    ) {
        public Rpc {
            if (chainId == null) {
                chainId = 8453L;
            }
            if (endpoints == null || endpoints.isEmpty()) {
                endpoints = List.of(new Endpoint("https://mainnet.base.org", null, null));
            }
            if (callTimeoutMillis == null) {
                callTimeoutMillis = 10_000L;
            }
            if (maxAttempts == null) {
                maxAttempts = 5;
            }
            if (baseBackoffMillis == null) {
                baseBackoffMillis = 500L;
            }
            if (maxBackoffMillis == null) {
                maxBackoffMillis = 5_000L;
            }
            if (jitterMillis == null) {
                jitterMillis = 250L;
            }
        }
    }

    public record Endpoint(
        String url,
        @Min(1) Integer requestsPerSecond,
        @Min(1) Integer maxConcurrent
    ) {
        public Endpoint {
            if (requestsPerSecond == null) {
                requestsPerSecond = 20;
            }
            if (maxConcurrent == null) {
                maxConcurrent = 12;
            }
        }
    }

    public record Wallet(
        /**
         * Hex private key. Empty means watch-only: nothing is signed or submitted.
         */
        String privateKey,
        /**
         * Address used for balance/allowance reads when running watch-only.
         */
        String address
    ) {
        @Override
        public String toString() {
            return "Wallet[privateKey=" + (privateKey == null || privateKey.isBlank() ? "<none>" : "****")
                + ", address=" + address + "]";
        }
    }

    public record Tokens(
        /**
         * Wrapped native asset used as pricing intermediary and gas denomination.
         */
        String baseAsset,
        List<String> stableAssets,
        /**
         * Symbol -> address, used to resolve pair labels and to name known tokens.
         */
        Map<String, String> symbols,
        /**
         * Address -> decimals, consulted before any remote call.
         */
        Map<String, Integer> decimals
    ) {
        public Tokens {
            baseAsset = baseAsset == null || baseAsset.isBlank() ? WETH : baseAsset.trim().toLowerCase(Locale.ROOT);
            stableAssets = sanitizeStringList(stableAssets).stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
            if (stableAssets.isEmpty()) {
                stableAssets = List.of(USDC, USDBC);
            }
            if (symbols == null || symbols.isEmpty()) {
                Map<String, String> defaults = new LinkedHashMap<>();
                defaults.put("WETH", WETH);
                defaults.put("USDC", USDC);
                defaults.put("USDbC", USDBC);
                symbols = defaults;
            }
            if (decimals == null || decimals.isEmpty()) {
                Map<String, Integer> defaults = new LinkedHashMap<>();
                defaults.put(WETH, 18);
                defaults.put(USDC, 6);
                defaults.put(USDBC, 6);
                decimals = defaults;
            }
        }
    }

    public record Router(
        String name,
        @NotNull RouterFamily family,
        /**
         * Registry contract: getPool(a,b,fee) for concentrated venues, getPair(a,b) for constant-product ones.
         */
        String factory,
        /**
         * Swap router; also the spender approved for the sell token.
         */
        String router,
        /**
         * Fee tiers (ppm) quoted on concentrated venues.
         */
        List<Integer> feeTiers,
        /**
         * Pool fee (bps) on constant-product venues.
         */
        @Min(0) @Max(10_000) Integer feeBps,
        @Min(21_000) Long gasUnits,
        Boolean enabled
    ) {
        public Router {
            if (feeTiers == null || feeTiers.isEmpty()) {
                feeTiers = List.of(500, 3000, 10000);
            }
            if (feeBps == null) {
                feeBps = 30;
            }
            if (gasUnits == null) {
                gasUnits = family == RouterFamily.CONCENTRATED_LIQUIDITY ? 300_000L : 220_000L;
            }
            if (enabled == null) {
                enabled = true;
            }
        }
    }

    public record Guard(
        @NotNull BigDecimal minProfitUsd,
        /**
         * Base-asset USD price used when neither the feed nor a reference pool answers.
         */
        @NotNull @DecimalMin("0.0") BigDecimal fallbackBaseUsd,
        /**
         * Optional Chainlink-style aggregator for the base asset.
         */
        String baseUsdFeed,
        @NotNull BigDecimal baseUsdSanityMin,
        @NotNull BigDecimal baseUsdSanityMax,
        @NotNull Duration oracleTtl,
        /**
         * Largest input accepted by the single-slot estimate, as bps of the pool's virtual input reserve.
         */
        @NotNull @Min(1) @Max(10_000) Integer maxImpactBps,
        /**
         * Pools holding less of the base asset than this, in whole units, are skipped and remembered as shallow.
         */
        @NotNull @DecimalMin("0.0") BigDecimal minBaseReserve
    ) {
        public Guard {
            if (minProfitUsd == null) {
                minProfitUsd = BigDecimal.ONE;
            }
            if (fallbackBaseUsd == null) {
                fallbackBaseUsd = new BigDecimal("3200");
            }
            if (baseUsdSanityMin == null) {
                baseUsdSanityMin = new BigDecimal("100");
            }
            if (baseUsdSanityMax == null) {
                baseUsdSanityMax = new BigDecimal("10000");
            }
            if (oracleTtl == null) {
                oracleTtl = Duration.ofSeconds(15);
            }
            if (maxImpactBps == null) {
                maxImpactBps = 200;
            }
            if (minBaseReserve == null) {
                minBaseReserve = new BigDecimal("2");
            }
        }
    }

    public record Execution(
        @NotNull @Min(0) Integer defaultSlippageBps,
        @NotNull @Min(0) Integer maxSlippageBps,
        @NotNull @Min(1) Integer slippageStepBps,
        @NotNull @Min(1) Integer maxSwapAttempts,
        @NotNull @Min(1) Integer approvalAttempts,
        @NotNull @Min(0) Long approvalBackoffMillis,
        @NotNull @Min(100) Long receiptPollIntervalMillis,
        @NotNull @Min(1) Integer receiptPollAttempts,
        @NotNull @DecimalMin("1.0") Double gasLimitMultiplier,
        @NotNull @DecimalMin("0.0") Double gasPriceMultiplier,
        @NotNull @Min(21_000) Long fallbackGasLimit,
        @NotNull @Min(1) Long deadlineSeconds,
        @NotNull Boolean verifyApprovals,
        /**
         * Native balance (wei) below which a warning is logged before submitting.
         */
        @NotNull Long minNativeBalanceWei,
        /**
         * A pending transaction with no receipt that the node no longer knows is dropped after this long.
         */
        @NotNull Duration dropUnseenAfter
    ) {
        public Execution {
            if (defaultSlippageBps == null) {
                defaultSlippageBps = 50;
            }
            if (maxSlippageBps == null) {
                maxSlippageBps = 300;
            }
            if (slippageStepBps == null) {
                slippageStepBps = 50;
            }
            if (maxSwapAttempts == null) {
                maxSwapAttempts = 3;
            }
            if (approvalAttempts == null) {
                approvalAttempts = 3;
            }
            if (approvalBackoffMillis == null) {
                approvalBackoffMillis = 2_000L;
            }
            if (receiptPollIntervalMillis == null) {
                receiptPollIntervalMillis = 1_000L;
            }
            if (receiptPollAttempts == null) {
                receiptPollAttempts = 60;
            }
            if (gasLimitMultiplier == null) {
                gasLimitMultiplier = 1.25;
            }
            if (gasPriceMultiplier == null) {
                gasPriceMultiplier = 1.10;
            }
            if (fallbackGasLimit == null) {
                fallbackGasLimit = 350_000L;
            }
            if (deadlineSeconds == null) {
                deadlineSeconds = 120L;
            }
            if (verifyApprovals == null) {
                verifyApprovals = false;
            }
            if (minNativeBalanceWei == null) {
                minNativeBalanceWei = 200_000_000_000_000L;
            }
            if (dropUnseenAfter == null) {
                dropUnseenAfter = Duration.ofMinutes(5);
            }
        }
    }

    public record Cache(
        Duration missingTtl,
        Duration lowLiquidityTtl,
        Duration foundTtl
    ) {
        public Cache {
            if (missingTtl == null) {
                missingTtl = Duration.ofHours(3);
            }
            if (lowLiquidityTtl == null) {
                lowLiquidityTtl = Duration.ofMinutes(10);
            }
            if (foundTtl == null) {
                foundTtl = Duration.ofMinutes(30);
            }
        }
    }

    public record Driver(
        Boolean enabled,
        /**
         * Pair labels "SELL/BUY"; each side is a configured symbol or an address.
         */
        List<String> pairs,
        /**
         * Pairs skipped in both directions.
         */
        List<String> exclude,
        @NotNull @DecimalMin("0.0") BigDecimal tradeUsd,
        @NotNull @Min(100) Long intervalMillis,
        @NotNull @Min(100) Long tickBudgetMillis,
        @NotNull @Min(1) Integer backoffAfterErrors,
        @NotNull @Min(0) Integer maxSkippedTicks,
        @NotNull @Min(1) Integer fanOutThreads,
        @NotNull @Min(1) Integer statsEveryTicks
    ) {
        public Driver {
            if (enabled == null) {
                enabled = true;
            }
            pairs = sanitizeStringList(pairs);
            if (pairs.isEmpty()) {
                pairs = List.of("WETH/USDC");
            }
            exclude = sanitizeStringList(exclude);
            if (tradeUsd == null) {
                tradeUsd = new BigDecimal("15");
            }
            if (intervalMillis == null) {
                intervalMillis = 2_000L;
            }
            if (tickBudgetMillis == null) {
                tickBudgetMillis = 180_000L;
            }
            if (backoffAfterErrors == null) {
                backoffAfterErrors = 5;
            }
            if (maxSkippedTicks == null) {
                maxSkippedTicks = 10;
            }
            if (fanOutThreads == null) {
                fanOutThreads = 4;
            }
            if (statsEveryTicks == null) {
                statsEveryTicks = 20;
            }
        }
    }
}
