package com.dexarb.infra;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.rpc.RpcErrorKind;
import com.dexarb.infra.rpc.RpcException;
import com.dexarb.support.FakeTicker;
import com.dexarb.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TransactionSenderTest {

    private static final String WALLET = "0x1111111111111111111111111111111111111111";
    private static final String ROUTER = "0x2222222222222222222222222222222222222222";
    private static final String SIGNED = "0xf86b0c8204d4830186a0942222222222222222222222222222222222222222808430783030";
    private static final String HASH = Hash.sha3(SIGNED);

    private EvmClient evm;
    private TransactionSigner signer;
    private FakeTicker ticker;
    private TransactionSender sender;

    @BeforeEach
    void setUp() {
        evm = mock(EvmClient.class);
        signer = mock(TransactionSigner.class);
        ticker = new FakeTicker();
        when(signer.address()).thenReturn(WALLET);
        when(signer.sign(any(), anyLong())).thenReturn(SIGNED);
        when(evm.chainId()).thenReturn(8453L);
        when(evm.pendingNonce(WALLET)).thenReturn(BigInteger.valueOf(12));
        when(evm.gasPrice()).thenReturn(BigInteger.valueOf(1_000));
        when(evm.sendRawTransaction(SIGNED)).thenReturn(HASH);
        sender = new TransactionSender(evm, Optional.of(signer), TestProperties.defaults(), ticker);
    }

    @Test
    void buffersGasPriceAndEstimateBeforeSigning() {
        when(evm.estimateGas(WALLET, ROUTER, "0xdata")).thenReturn(BigInteger.valueOf(100_000));

        assertEquals(HASH, sender.send(ROUTER, "0xdata"));

        ArgumentCaptor<RawTransaction> tx = ArgumentCaptor.forClass(RawTransaction.class);
        verify(signer).sign(tx.capture(), eq(8453L));
        assertEquals(BigInteger.valueOf(12), tx.getValue().getNonce());
        assertEquals(BigInteger.valueOf(1_100), tx.getValue().getGasPrice());
        assertEquals(BigInteger.valueOf(125_000), tx.getValue().getGasLimit());
        assertEquals(ROUTER, tx.getValue().getTo());
    }

    @Test
    void fallsBackToConfiguredGasLimitWhenEstimationIsUnavailable() {
        when(evm.estimateGas(any(), any(), any())).thenThrow(new RpcException(RpcErrorKind.NETWORK, "down"));

        sender.send(ROUTER, "0xdata");

        ArgumentCaptor<RawTransaction> tx = ArgumentCaptor.forClass(RawTransaction.class);
        verify(signer).sign(tx.capture(), anyLong());
        assertEquals(BigInteger.valueOf(350_000), tx.getValue().getGasLimit());
    }

    @Test
    void revertDuringEstimationIsNotSigned() {
        when(evm.estimateGas(any(), any(), any())).thenThrow(new RpcException(RpcErrorKind.REVERTED, "STF"));

        RpcException e = assertThrows(RpcException.class, () -> sender.send(ROUTER, "0xdata"));

        assertEquals(RpcErrorKind.REVERTED, e.getKind());
        verify(signer, never()).sign(any(), anyLong());
        verify(evm, never()).sendRawTransaction(any());
    }

    @Test
    void unansweredBroadcastStillYieldsTheLocalHash() {
        when(evm.estimateGas(any(), any(), any())).thenReturn(BigInteger.valueOf(100_000));
        when(evm.sendRawTransaction(SIGNED)).thenThrow(new RpcException(RpcErrorKind.NETWORK, "read timed out"));

        assertEquals(HASH, sender.send(ROUTER, "0xdata"));
        verify(evm, times(1)).sendRawTransaction(SIGNED);
        verify(signer, times(1)).sign(any(), anyLong());
    }

    @Test
    void alreadyKnownCountsAsSent() {
        when(evm.estimateGas(any(), any(), any())).thenReturn(BigInteger.valueOf(100_000));
        when(evm.sendRawTransaction(SIGNED)).thenThrow(new RpcException(RpcErrorKind.RPC_ERROR,
                "eth_sendRawTransaction on http://b returned -32000 (already known)"));

        assertEquals(HASH, sender.send(ROUTER, "0xdata"));
        verify(evm, never()).transactionKnown(any());
    }

    @Test
    void rejectionIsAcceptedWhenTheNodeHoldsTheTransaction() {
        when(evm.estimateGas(any(), any(), any())).thenReturn(BigInteger.valueOf(100_000));
        when(evm.sendRawTransaction(SIGNED)).thenThrow(new RpcException(RpcErrorKind.RPC_ERROR,
                "eth_sendRawTransaction on http://b returned -32000 (nonce too low)"));
        when(evm.transactionKnown(HASH)).thenReturn(true);

        assertEquals(HASH, sender.send(ROUTER, "0xdata"));
    }

    @Test
    void outrightRejectionPropagates() {
        when(evm.estimateGas(any(), any(), any())).thenReturn(BigInteger.valueOf(100_000));
        when(evm.sendRawTransaction(SIGNED)).thenThrow(new RpcException(RpcErrorKind.RPC_ERROR,
                "eth_sendRawTransaction on http://b returned -32000 (insufficient funds for gas)"));
        when(evm.transactionKnown(HASH)).thenReturn(false);

        RpcException e = assertThrows(RpcException.class, () -> sender.send(ROUTER, "0xdata"));
        assertEquals(RpcErrorKind.RPC_ERROR, e.getKind());
    }

    @Test
    void pollsUntilTheReceiptAppears() {
        TxReceipt mined = new TxReceipt("0xhash", true, BigInteger.valueOf(90_000), BigInteger.TEN);
        when(evm.receipt("0xhash"))
                .thenReturn(Optional.empty())
                .thenThrow(new RpcException(RpcErrorKind.RATE_LIMITED, "429"))
                .thenReturn(Optional.of(mined));

        assertEquals(Optional.of(mined), sender.awaitReceipt("0xhash"));
        assertEquals(2, ticker.sleeps().size());
    }

    @Test
    void givesUpAfterTheConfiguredPolls() {
        when(evm.receipt("0xhash")).thenReturn(Optional.empty());

        assertTrue(sender.awaitReceipt("0xhash").isEmpty());
        verify(evm, times(60)).receipt("0xhash");
    }

    @Test
    void watchOnlyRefusesToSubmit() {
        ArbProperties props = new ArbProperties(null, new ArbProperties.Wallet("", WALLET), null, null, null, null,
                null, null);
        TransactionSender watchOnly = new TransactionSender(evm, Optional.empty(), props, ticker);

        assertTrue(watchOnly.isWatchOnly());
        assertEquals(WALLET, watchOnly.walletAddress());
        assertThrows(IllegalStateException.class, () -> watchOnly.send(ROUTER, "0xdata"));
    }
}
