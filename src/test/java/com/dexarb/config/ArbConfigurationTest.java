package com.dexarb.config;

import com.dexarb.core.cache.NegativeCache;
import com.dexarb.domain.RouterFamily;
import com.dexarb.infra.TransactionSigner;
import com.dexarb.infra.rpc.RpcGateway;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArbConfigurationTest {

    // well-known hardhat account #0
    private static final String KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(TestConfig.class);

    @Configuration
    @EnableConfigurationProperties(ArbProperties.class)
    @Import(ArbConfiguration.class)
    static class TestConfig {
    }

    @Test
    void emptyConfigurationFallsBackToBaseDefaults() {
        runner.run(context -> {
            ArbProperties properties = context.getBean(ArbProperties.class);

            assertEquals(8453L, properties.rpc().chainId());
            assertEquals(List.of("univ3", "baseswap"),
                    properties.routers().stream().map(ArbProperties.Router::name).toList());
            assertEquals(RouterFamily.CONCENTRATED_LIQUIDITY, properties.routers().get(0).family());
            assertEquals(List.of(ArbProperties.USDC, ArbProperties.USDBC), properties.tokens().stableAssets());
            assertEquals(0, BigDecimal.ONE.compareTo(properties.guard().minProfitUsd()));
            assertEquals(50, properties.execution().defaultSlippageBps());
            assertEquals(0, new BigDecimal("2").compareTo(properties.guard().minBaseReserve()));
            assertEquals(Duration.ofMinutes(5), properties.execution().dropUnseenAfter());
            assertEquals(1, context.getBean(RpcGateway.class).endpoints().size());
        });
    }

    @Test
    void noPrivateKeyMeansNoSigner() {
        runner.withPropertyValues("arb.wallet.private-key=  ")
                .run(context -> assertTrue(context.getBeansOfType(TransactionSigner.class).isEmpty()));
    }

    @Test
    void privateKeyEnablesSigning() {
        runner.withPropertyValues("arb.wallet.private-key=" + KEY)
                .run(context -> assertEquals("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266",
                        context.getBean(TransactionSigner.class).address()));
    }

    @Test
    void overridesAreBound() {
        runner.withPropertyValues(
                        "arb.rpc.endpoints[0].url=https://a.example",
                        "arb.rpc.endpoints[0].requests-per-second=5",
                        "arb.rpc.endpoints[1].url=https://b.example",
                        "arb.guard.min-profit-usd=2.5",
                        "arb.guard.min-base-reserve=0.5",
                        "arb.execution.drop-unseen-after=90s",
                        "arb.driver.pairs=WETH/USDC,USDC/WETH",
                        "arb.driver.exclude=USDbC/WETH",
                        "arb.cache.missing-ttl=1h")
                .run(context -> {
                    ArbProperties properties = context.getBean(ArbProperties.class);

                    assertEquals(2, properties.rpc().endpoints().size());
                    assertEquals(5, properties.rpc().endpoints().get(0).requestsPerSecond());
                    assertEquals(0, new BigDecimal("2.5").compareTo(properties.guard().minProfitUsd()));
                    assertEquals(0, new BigDecimal("0.5").compareTo(properties.guard().minBaseReserve()));
                    assertEquals(Duration.ofSeconds(90), properties.execution().dropUnseenAfter());
                    assertEquals(List.of("WETH/USDC", "USDC/WETH"), properties.driver().pairs());
                    assertEquals(List.of("USDbC/WETH"), properties.driver().exclude());
                    assertEquals(Duration.ofHours(1), properties.cache().missingTtl());
                    assertNotNull(context.getBean(NegativeCache.class));
                    assertEquals(2, context.getBean(RpcGateway.class).endpoints().size());
                });
    }

    @Test
    void invalidValuesFailStartup() {
        runner.withPropertyValues("arb.rpc.max-attempts=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void walletToStringMasksTheKey() {
        ArbProperties.Wallet wallet = new ArbProperties.Wallet(KEY, null);

        assertFalse(wallet.toString().contains("ac0974"));
    }
}
