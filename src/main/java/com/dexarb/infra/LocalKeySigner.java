package com.dexarb.infra;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.util.Locale;

/**
 * Signs with an in-process private key (EIP-155 replay protection).
 */
public class LocalKeySigner implements TransactionSigner {

    private final Credentials credentials;

    public LocalKeySigner(String privateKey) {
        this.credentials = Credentials.create(privateKey);
    }

    @Override
    public String address() {
        return credentials.getAddress().toLowerCase(Locale.ROOT);
    }

    @Override
    public String sign(RawTransaction transaction, long chainId) {
        byte[] signed = TransactionEncoder.signMessage(transaction, chainId, credentials);
        return Numeric.toHexString(signed);
    }
}
