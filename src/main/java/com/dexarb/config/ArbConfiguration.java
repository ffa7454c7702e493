package com.dexarb.config;

import com.dexarb.core.cache.NegativeCache;
import com.dexarb.core.events.LoggingTradeEventPublisher;
import com.dexarb.core.events.TradeEventPublisher;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.LocalKeySigner;
import com.dexarb.infra.TransactionSigner;
import com.dexarb.infra.rpc.RetryPolicy;
import com.dexarb.infra.rpc.RpcEndpoint;
import com.dexarb.infra.rpc.RpcGateway;
import com.dexarb.infra.rpc.Ticker;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ArbConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Ticker ticker() {
        return Ticker.system();
    }

    @Bean
    public OkHttpClient rpcHttpClient(ArbProperties properties) {
        Duration timeout = Duration.ofMillis(properties.rpc().callTimeoutMillis());
        return new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                // the gateway decides about retries
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public RpcGateway rpcGateway(OkHttpClient rpcHttpClient, ObjectMapper objectMapper, ArbProperties properties,
            Ticker ticker) {
        ArbProperties.Rpc rpc = properties.rpc();
        List<RpcEndpoint> endpoints = rpc.endpoints().stream()
                .map(e -> new RpcEndpoint(e.url(), e.requestsPerSecond(), e.maxConcurrent(), ticker))
                .toList();
        RetryPolicy retryPolicy = new RetryPolicy(rpc.maxAttempts(),
                Duration.ofMillis(rpc.baseBackoffMillis()),
                Duration.ofMillis(rpc.maxBackoffMillis()),
                Duration.ofMillis(rpc.jitterMillis()),
                ticker, new Random());
        return new RpcGateway(rpcHttpClient, objectMapper, endpoints, retryPolicy, rpc.chainId());
    }

    @Bean
    public EvmClient evmClient(RpcGateway rpcGateway) {
        return new EvmClient(rpcGateway);
    }

    @Bean
    @ConditionalOnExpression("!'${arb.wallet.private-key:}'.isBlank()")
    public TransactionSigner transactionSigner(ArbProperties properties) {
        return new LocalKeySigner(properties.wallet().privateKey().trim());
    }

    @Bean
    public NegativeCache negativeCache(ArbProperties properties, Clock clock) {
        ArbProperties.Cache cache = properties.cache();
        return new NegativeCache(
                new NegativeCache.TtlPolicy(cache.missingTtl(), cache.lowLiquidityTtl(), cache.foundTtl()), clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor(ArbProperties properties) {
        return Executors.newFixedThreadPool(properties.driver().fanOutThreads(), named("quote-fanout"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService tickExecutor() {
        return Executors.newSingleThreadExecutor(named("arb-tick"));
    }

    @Bean
    public TradeEventPublisher tradeEventPublisher(ObjectMapper objectMapper, Clock clock) {
        return new LoggingTradeEventPublisher(objectMapper, clock);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
