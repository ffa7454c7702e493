package com.dexarb.infra;

import org.web3j.crypto.RawTransaction;

/**
 * Signs transactions for the trading wallet. Key custody stays behind this seam.
 */
public interface TransactionSigner {

    String address();

    /**
     * @return the signed, RLP-encoded transaction as 0x-prefixed hex
     */
    String sign(RawTransaction transaction, long chainId);
}
