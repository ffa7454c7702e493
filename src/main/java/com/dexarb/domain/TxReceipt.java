package com.dexarb.domain;

import java.math.BigInteger;

public record TxReceipt(String transactionHash, boolean success, BigInteger gasUsed, BigInteger blockNumber) {
}
