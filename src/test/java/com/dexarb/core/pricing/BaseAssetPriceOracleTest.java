package com.dexarb.core.pricing;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.resolver.TokenMetadataResolver;
import com.dexarb.domain.Token;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.rpc.RevertHandling;
import com.dexarb.infra.rpc.RpcErrorKind;
import com.dexarb.infra.rpc.RpcException;
import com.dexarb.support.MutableClock;
import com.dexarb.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint80;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BaseAssetPriceOracleTest {

    private static final String FEED = "0x71041dddad3595f9ced3dccfbe3d1f4b0a16bb70";
    private static final Token WETH = new Token(ArbProperties.WETH, 18, "WETH");
    private static final Token USDC = new Token(ArbProperties.USDC, 6, "USDC");

    private EvmClient evm;
    private SpotPriceReader spot;
    private MutableClock clock;
    private BaseAssetPriceOracle oracle;

    @BeforeEach
    void setUp() {
        evm = mock(EvmClient.class);
        spot = mock(SpotPriceReader.class);
        TokenMetadataResolver tokens = mock(TokenMetadataResolver.class);
        when(tokens.resolve(ArbProperties.WETH)).thenReturn(WETH);
        when(tokens.resolve(ArbProperties.USDC)).thenReturn(USDC);
        when(spot.price(WETH, USDC)).thenReturn(Optional.empty());
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ArbProperties properties = TestProperties.withGuard(new ArbProperties.Guard(null, new BigDecimal("3100"),
                FEED, null, null, Duration.ofSeconds(15), null, null));
        oracle = new BaseAssetPriceOracle(evm, spot, tokens, properties, clock);
    }

    @Test
    void feedAnswerIsScaledByFeedDecimals() {
        feedAnswers(new BigInteger("320012345678"));

        BaseAssetPriceOracle.BasePrice price = oracle.current();

        assertEquals(BaseAssetPriceOracle.Source.FEED, price.source());
        assertEquals(0, new BigDecimal("3200.12345678").compareTo(price.usd()));
    }

    @Test
    void insaneFeedFallsThroughToReferencePool() {
        feedAnswers(new BigInteger("1200000000000000"));
        when(spot.price(WETH, USDC)).thenReturn(Optional.of(new BigDecimal("2999.5")));

        BaseAssetPriceOracle.BasePrice price = oracle.current();

        assertEquals(BaseAssetPriceOracle.Source.POOL, price.source());
        assertEquals(0, new BigDecimal("2999.5").compareTo(price.usd()));
    }

    @Test
    void unreadableFeedAndPoolUseFallback() {
        when(evm.call(eq(FEED), any(Function.class), any(RevertHandling.class)))
                .thenThrow(new RpcException(RpcErrorKind.REVERTED, "execution reverted"));
        when(spot.price(WETH, USDC)).thenThrow(new RpcException(RpcErrorKind.NETWORK, "timeout"));

        BaseAssetPriceOracle.BasePrice price = oracle.current();

        assertEquals(BaseAssetPriceOracle.Source.FALLBACK, price.source());
        assertEquals(0, new BigDecimal("3100").compareTo(price.usd()));
    }

    @Test
    void priceIsReusedWithinTtl() {
        feedAnswers(new BigInteger("320000000000"));

        oracle.usdPrice();
        clock.advance(Duration.ofSeconds(14));
        oracle.usdPrice();
        verify(evm, times(1)).call(eq(FEED), any(Function.class), any(RevertHandling.class));

        clock.advance(Duration.ofSeconds(1));
        oracle.usdPrice();
        verify(evm, times(2)).call(eq(FEED), any(Function.class), any(RevertHandling.class));
    }

    private void feedAnswers(BigInteger answer) {
        List<Type> round = List.of(new Uint80(BigInteger.ONE), new Int256(answer), new Uint256(BigInteger.ZERO),
                new Uint256(BigInteger.ZERO), new Uint80(BigInteger.ONE));
        when(evm.call(eq(FEED), any(Function.class), any(RevertHandling.class))).thenReturn(round);
        when(evm.decimals(FEED)).thenReturn(8);
    }
}
