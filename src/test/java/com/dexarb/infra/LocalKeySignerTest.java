package com.dexarb.infra;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.SignedRawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LocalKeySignerTest {

    @Test
    void signsWithChainIdAndRecoversToTheWalletAddress() throws Exception {
        ECKeyPair keyPair = Keys.createEcKeyPair();
        String privateKey = Numeric.toHexStringWithPrefixZeroPadded(keyPair.getPrivateKey(), 64);
        String expected = Credentials.create(keyPair).getAddress().toLowerCase(Locale.ROOT);

        LocalKeySigner signer = new LocalKeySigner(privateKey);
        assertEquals(expected, signer.address());

        RawTransaction tx = RawTransaction.createTransaction(BigInteger.valueOf(7), BigInteger.valueOf(1_000_000_000L),
                BigInteger.valueOf(250_000), "0x327df1e6de05895d2ab08513aadd9313fe505d86", BigInteger.ZERO, "0x38ed1739");
        String signed = signer.sign(tx, 8453);

        SignedRawTransaction decoded = (SignedRawTransaction) TransactionDecoder.decode(signed);
        assertEquals(expected, decoded.getFrom().toLowerCase(Locale.ROOT));
        assertEquals(Long.valueOf(8453), decoded.getChainId());
        assertEquals(BigInteger.valueOf(7), decoded.getNonce());
        assertEquals("0x327df1e6de05895d2ab08513aadd9313fe505d86", decoded.getTo());
    }
}
