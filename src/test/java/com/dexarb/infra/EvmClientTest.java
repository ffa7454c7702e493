package com.dexarb.infra;

import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.rpc.RetryPolicy;
import com.dexarb.infra.rpc.RpcEndpoint;
import com.dexarb.infra.rpc.RpcErrorKind;
import com.dexarb.infra.rpc.RpcException;
import com.dexarb.infra.rpc.RpcGateway;
import com.dexarb.support.FakeTicker;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint256;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class EvmClientTest {

    private static final String TOKEN = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
    private static final String OWNER = "0x1111111111111111111111111111111111111111";

    private MockWebServer server;
    private EvmClient evm;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        FakeTicker ticker = new FakeTicker();
        RpcGateway gateway = new RpcGateway(new OkHttpClient(), new ObjectMapper(),
                List.of(new RpcEndpoint(server.url("/").toString(), 20, 2, ticker)),
                new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(10), Duration.ZERO, ticker, new Random()),
                8453);
        evm = new EvmClient(gateway);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void respond(String resultJson) {
        server.enqueue(new MockResponse().setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + resultJson + "}"));
    }

    @Test
    void decodesBalanceOf() throws Exception {
        respond("\"0x" + TypeEncoder.encode(new Uint256(BigInteger.valueOf(15_000_000))) + "\"");

        assertEquals(BigInteger.valueOf(15_000_000), evm.balanceOf(TOKEN, OWNER));

        String body = server.takeRequest().getBody().readUtf8();
        assertTrue(body.contains("\"eth_call\""));
        assertTrue(body.contains("0x70a08231"), "balanceOf selector");
    }

    @Test
    void emptyReturnDataIsMalformed() {
        respond("\"0x\"");

        RpcException e = assertThrows(RpcException.class, () -> evm.balanceOf(TOKEN, OWNER));
        assertEquals(RpcErrorKind.MALFORMED, e.getKind());
    }

    @Test
    void quantitiesAreHexDecoded() {
        respond("\"0x3b9aca00\"");
        assertEquals(BigInteger.valueOf(1_000_000_000L), evm.gasPrice());
    }

    @Test
    void missingReceiptIsEmpty() {
        respond("null");
        assertEquals(Optional.empty(), evm.receipt("0xabc"));
    }

    @Test
    void receiptStatusAndGasAreRead() {
        respond("{\"status\":\"0x0\",\"gasUsed\":\"0x5208\",\"blockNumber\":\"0x10\"}");

        TxReceipt r = evm.receipt("0xabc").orElseThrow();
        assertFalse(r.success());
        assertEquals(BigInteger.valueOf(21_000), r.gasUsed());
        assertEquals(BigInteger.valueOf(16), r.blockNumber());
    }

    @Test
    void transactionIsKnownOnlyWhenTheNodeReturnsIt() {
        respond("null");
        respond("{\"hash\":\"0xabc\",\"blockNumber\":null}");

        assertFalse(evm.transactionKnown("0xabc"));
        assertTrue(evm.transactionKnown("0xabc"));
    }
}
