package com.dexarb.core.execution;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.Token;
import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.TransactionSender;
import com.dexarb.infra.rpc.RetryPolicy;
import com.dexarb.infra.rpc.RpcException;
import com.dexarb.infra.rpc.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Grants the router an unlimited allowance when the current one is short. Approval has its own retry
 * budget, separate from the gateway's, spent only on failures before the transaction is broadcast. A broadcast approval is registered as pending until its receipt is
 * seen; one that is still unconfirmed is never replaced by a second approval.
 */
@Slf4j
@Service
public class AllowanceManager {

    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private final EvmClient evm;
    private final TransactionSender sender;
    private final PendingTransactions pending;
    private final RetryPolicy retryPolicy;
    private final boolean verify;
    private final Clock clock;

    public AllowanceManager(EvmClient evm, TransactionSender sender, PendingTransactions pending,
            ArbProperties properties, Ticker ticker, Clock clock) {
        this.evm = evm;
        this.sender = sender;
        this.pending = pending;
        this.clock = clock;
        ArbProperties.Execution execution = properties.execution();
        Duration backoff = Duration.ofMillis(execution.approvalBackoffMillis());
        this.retryPolicy = new RetryPolicy(execution.approvalAttempts(), backoff, backoff.multipliedBy(8),
                Duration.ZERO, ticker, new Random());
        this.verify = execution.verifyApprovals();
    }

    public boolean isSufficient(Token token, String owner, String spender, BigInteger required) {
        BigInteger allowance = evm.allowance(token.address(), owner, spender);
        log.debug("[APPROVAL] {} allowance for {} = {} (need {})", token.symbol(), spender, allowance, required);
        return allowance.compareTo(required) >= 0;
    }

    /**
     * Sends {@code approve(spender, 2^256-1)} and waits for it to be mined.
     *
     * @return hash of the confirmed approval
     * @throws ExecutionFailure with EXECUTION_UNCONFIRMED when the approval was sent but not seen mined,
     *                          with ALLOWANCE_FAILED when it reverted or could not be sent within the attempts
     */
    public String approve(Token token, String owner, String spender, BigInteger required) {
        String data = FunctionEncoder.encode(new Function("approve",
                List.of(new Address(spender), new Uint256(MAX_UINT256)), List.of()));
        try {
            return retryPolicy.execute(
                    (error, attempt) -> {
                        log.warn("[APPROVAL] {} attempt {} failed: {}", token.symbol(), attempt, error.getMessage());
                        // once broadcast, an approval is settled by a later tick, never replaced in this one
                        return error instanceof ExecutionFailure
                                ? RetryPolicy.RetryMode.NONE
                                : RetryPolicy.RetryMode.BACKOFF;
                    },
                    attempt -> approveOnce(token, owner, spender, required, data, attempt));
        } catch (ExecutionFailure e) {
            if (isUnconfirmed(e)) {
                throw e;
            }
            throw new ExecutionFailure(FailureReason.ALLOWANCE_FAILED,
                    "approval of " + token.symbol() + " for " + spender + " failed: " + e.getMessage(), e.getTxHash());
        } catch (RpcException e) {
            throw new ExecutionFailure(FailureReason.ALLOWANCE_FAILED,
                    "approval of " + token.symbol() + " for " + spender + " failed: " + e.getMessage(), null);
        }
    }

    private static boolean isUnconfirmed(RuntimeException e) {
        return e instanceof ExecutionFailure f && f.getReason() == FailureReason.EXECUTION_UNCONFIRMED;
    }

    private String approveOnce(Token token, String owner, String spender, BigInteger required, String data,
            int attempt) {
        log.info("[APPROVAL] approving {} for {} (attempt {})", token.symbol(), spender, attempt);
        String hash = sender.send(token.address(), data);
        String key = PendingTransactions.approvalKey(token.address(), spender);
        pending.register(key, new PendingTransactions.Pending(hash, spender, "approve " + token.symbol(),
                clock.instant()));
        Optional<TxReceipt> receipt = sender.awaitReceipt(hash);
        if (receipt.isEmpty()) {
            throw new ExecutionFailure(FailureReason.EXECUTION_UNCONFIRMED, "approval " + hash + " unconfirmed", hash);
        }
        pending.clear(key, hash);
        if (!receipt.get().success()) {
            throw new ExecutionFailure(FailureReason.EXECUTION_REVERTED, "approval " + hash + " reverted", hash);
        }
        if (verify && !isSufficient(token, owner, spender, required)) {
            throw new ExecutionFailure(FailureReason.ALLOWANCE_FAILED,
                    "allowance still short after approval " + hash, hash);
        }
        log.info("[APPROVAL] {} approved for {} in {}", token.symbol(), spender, hash);
        return hash;
    }
}
