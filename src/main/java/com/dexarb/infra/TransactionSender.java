package com.dexarb.infra;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.rpc.RpcErrorKind;
import com.dexarb.infra.rpc.RpcException;
import com.dexarb.infra.rpc.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Builds, signs and submits transactions for the trading wallet, then polls for receipts. Without a
 * signer the sender is watch-only and refuses to submit.
 */
@Slf4j
@Service
public class TransactionSender {

    private static final BigInteger MIN_GAS_LIMIT = BigInteger.valueOf(21_000L);

    private final EvmClient evm;
    private final TransactionSigner signer;
    private final ArbProperties.Execution execution;
    private final String watchAddress;
    private final Ticker ticker;

    public TransactionSender(EvmClient evm, Optional<TransactionSigner> signer, ArbProperties properties,
            Ticker ticker) {
        this.evm = evm;
        this.signer = signer.orElse(null);
        this.execution = properties.execution();
        String configured = properties.wallet().address();
        this.watchAddress = configured == null || configured.isBlank() ? null : configured.trim().toLowerCase(Locale.ROOT);
        this.ticker = ticker;

        if (this.signer != null) {
            log.info("Wallet loaded: {}", this.signer.address());
        } else {
            log.warn("No private key provided. Execution will be in WATCH-ONLY mode (reads as {}).", watchAddress);
        }
    }

    public boolean isWatchOnly() {
        return signer == null;
    }

    /**
     * Address whose balances and allowances are read; null when watch-only without a configured address.
     */
    public String walletAddress() {
        return signer != null ? signer.address() : watchAddress;
    }

    /**
     * Signs and submits a call to {@code to} with a fresh pending nonce and gas price.
     *
     * @return the locally computed transaction hash
     * @throws RpcException of a revert kind (see {@link #isRevert}) when gas estimation reverts, or when the
     *                      node rejects the broadcast outright
     */
    public String send(String to, String data) {
        if (signer == null) {
            throw new IllegalStateException("watch-only: no signer configured");
        }
        String from = signer.address();
        BigInteger nonce = evm.pendingNonce(from);
        BigInteger gasPrice = scale(evm.gasPrice(), execution.gasPriceMultiplier());
        BigInteger gasLimit = resolveGasLimit(from, to, data);

        RawTransaction tx = RawTransaction.createTransaction(nonce, gasPrice, gasLimit, to, BigInteger.ZERO, data);
        String signed = signer.sign(tx, evm.chainId());
        String hash = Hash.sha3(signed);
        broadcast(signed, hash);
        log.info("[SUBMIT] tx sent hash={} nonce={} gasPrice={} gasLimit={}", hash, nonce, gasPrice, gasLimit);
        return hash;
    }

    /**
     * Once the node may have accepted the transaction its hash is returned rather than an error, so the
     * caller tracks it as pending instead of signing a second one.
     */
    private void broadcast(String signed, String hash) {
        try {
            String reported = evm.sendRawTransaction(signed);
            if (reported != null && !hash.equalsIgnoreCase(reported)) {
                log.warn("[SUBMIT] node reported hash {} for {}", reported, hash);
            }
        } catch (RpcException e) {
            if (e.getKind() == RpcErrorKind.NETWORK) {
                log.warn("[SUBMIT] broadcast of {} unacknowledged ({}), tracking it as sent", hash, e.getMessage());
                return;
            }
            if (e.getKind() == RpcErrorKind.RPC_ERROR && (isAlreadyKnown(e) || knownToNode(hash, e))) {
                log.info("[SUBMIT] node already holds {} ({})", hash, e.getMessage());
                return;
            }
            throw e;
        }
    }

    private boolean knownToNode(String hash, RpcException original) {
        try {
            return evm.transactionKnown(hash);
        } catch (RpcException e) {
            original.addSuppressed(e);
            return false;
        }
    }

    static boolean isAlreadyKnown(RpcException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("already known") || message.contains("known transaction");
    }

    /**
     * Polls for a receipt up to the configured number of attempts.
     */
    public Optional<TxReceipt> awaitReceipt(String txHash) {
        long sleepNanos = TimeUnit.MILLISECONDS.toNanos(execution.receiptPollIntervalMillis());
        for (int i = 0; i < execution.receiptPollAttempts(); i++) {
            Optional<TxReceipt> receipt = pollReceipt(txHash);
            if (receipt.isPresent()) {
                return receipt;
            }
            try {
                ticker.sleepNanos(sleepNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted waiting for " + txHash);
            }
        }
        log.warn("[CONFIRM] no receipt for {} after {} polls", txHash, execution.receiptPollAttempts());
        return Optional.empty();
    }

    /**
     * Single receipt read. Transient RPC failures read as "not yet".
     */
    public Optional<TxReceipt> pollReceipt(String txHash) {
        try {
            return evm.receipt(txHash);
        } catch (RpcException e) {
            if (!e.getKind().isTransient()) {
                throw e;
            }
            log.debug("[CONFIRM] receipt read for {} failed transiently: {}", txHash, e.getMessage());
            return Optional.empty();
        }
    }

    private BigInteger resolveGasLimit(String from, String to, String data) {
        BigInteger fallback = BigInteger.valueOf(execution.fallbackGasLimit());
        try {
            BigInteger estimate = evm.estimateGas(from, to, data);
            return scale(estimate, execution.gasLimitMultiplier()).max(MIN_GAS_LIMIT);
        } catch (RpcException e) {
            if (isRevert(e)) {
                throw e;
            }
            log.warn("[SUBMIT] gas estimation failed ({}: {}), using fallback limit {}",
                    e.getKind(), e.getMessage(), fallback);
            return fallback;
        }
    }

    public static boolean isRevert(RpcException e) {
        return e.getKind() == RpcErrorKind.REVERTED
                || e.getKind() == RpcErrorKind.MALFORMED
                || e.getKind() == RpcErrorKind.INSUFFICIENT_LIQUIDITY;
    }

    private static BigInteger scale(BigInteger value, double multiplier) {
        return new BigDecimal(value)
                .multiply(BigDecimal.valueOf(multiplier))
                .setScale(0, RoundingMode.CEILING)
                .toBigIntegerExact();
    }
}
