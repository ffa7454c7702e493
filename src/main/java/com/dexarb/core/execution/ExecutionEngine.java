package com.dexarb.core.execution;

import com.dexarb.config.ArbProperties;
import com.dexarb.core.quote.RouterAdapter;
import com.dexarb.core.quote.RouterRegistry;
import com.dexarb.domain.ArbitrageOpportunity;
import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.ExecutionState;
import com.dexarb.domain.ExecutionStatus;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.Quote;
import com.dexarb.domain.Token;
import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.TransactionSender;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Runs one approved opportunity through BALANCE_CHECK, ALLOWANCE_CHECK, APPROVE (when needed), SUBMIT and
 * CONFIRM. A reverted swap is rebuilt with wider slippage and a fresh nonce and gas price until the attempt
 * budget runs out. A swap or approval without a receipt is reported UNCONFIRMED and stays registered as
 * pending; nothing new is sent under its key until it settles.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final TransactionSender sender;
    private final EvmClient evm;
    private final AllowanceManager allowances;
    private final PendingTransactions pending;
    private final PendingReconciler reconciler;
    private final RouterRegistry registry;
    private final ArbProperties.Execution config;
    private final Clock clock;

    public ExecutionEngine(TransactionSender sender, EvmClient evm, AllowanceManager allowances,
            PendingTransactions pending, PendingReconciler reconciler, RouterRegistry registry,
            ArbProperties properties, Clock clock) {
        this.sender = sender;
        this.evm = evm;
        this.allowances = allowances;
        this.pending = pending;
        this.reconciler = reconciler;
        this.registry = registry;
        this.config = properties.execution();
        this.clock = clock;
    }

    public ExecutionOutcome execute(ArbitrageOpportunity opp) {
        Quote quote = opp.getQuote();
        Token sell = quote.getSellToken();
        RouterAdapter adapter = registry.byId(quote.getRouterId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown router " + quote.getRouterId()));
        log.info("--- START EXECUTION {} | {} {} {} -> {} {} via {} ---", opp.getId(), quote.getSellAmount(),
                sell.symbol(), opp.getPair(), quote.getBuyAmount(), quote.getBuyToken().symbol(), adapter.id());

        ExecutionState state = ExecutionState.BALANCE_CHECK;
        String approvalTx = null;
        try {
            Optional<PendingTransactions.Pending> inFlight = pending.get(sell.address());
            if (inFlight.isPresent()) {
                return fail(opp, state, FailureReason.PENDING_TRANSACTION,
                        "swap " + inFlight.get().txHash() + " for " + sell.symbol() + " still pending");
            }
            if (minOut(quote.getBuyAmount(), config.maxSlippageBps()).signum() <= 0) {
                return fail(opp, state, FailureReason.INSUFFICIENT_LIQUIDITY,
                        "minimum output of " + quote.getBuyAmount() + " " + quote.getBuyToken().symbol()
                                + " rounds to zero at " + config.maxSlippageBps() + " bps");
            }

            String wallet = sender.walletAddress();
            if (wallet != null) {
                BigInteger balance = evm.balanceOf(sell.address(), wallet);
                log.info("[EXECUTION] State: {} | {} balance {} (need {})", state, sell.symbol(), balance,
                        quote.getSellAmount());
                if (balance.compareTo(quote.getSellAmount()) < 0) {
                    return fail(opp, state, FailureReason.INSUFFICIENT_BALANCE,
                            "balance " + balance + " < " + quote.getSellAmount());
                }
            }

            if (sender.isWatchOnly()) {
                log.info("[WATCH-ONLY] Would swap {} {} for >= {} {} on {} (slippage {} bps)",
                        quote.getSellAmount(), sell.symbol(),
                        minOut(quote.getBuyAmount(), config.defaultSlippageBps()), quote.getBuyToken().symbol(),
                        adapter.id(), config.defaultSlippageBps());
                return ExecutionOutcome.builder()
                        .status(ExecutionStatus.SKIPPED)
                        .finalState(state)
                        .slippageBps(config.defaultSlippageBps())
                        .minBuyAmount(minOut(quote.getBuyAmount(), config.defaultSlippageBps()))
                        .detail("watch-only")
                        .build();
            }

            state = ExecutionState.ALLOWANCE_CHECK;
            PendingReconciler.Resolution earlierApproval =
                    reconciler.reconcile(PendingTransactions.approvalKey(sell.address(), adapter.spender()));
            if (earlierApproval.blocking()) {
                String hash = earlierApproval.entry().txHash();
                return fail(opp, state, FailureReason.PENDING_TRANSACTION,
                        "approval " + hash + " for " + sell.symbol() + " still pending").toBuilder()
                        .approvalTxHash(hash)
                        .build();
            }
            if (!allowances.isSufficient(sell, wallet, adapter.spender(), quote.getSellAmount())) {
                state = ExecutionState.APPROVE;
                log.info("[EXECUTION] State: {} | approving {} for {}", state, sell.symbol(), adapter.spender());
                approvalTx = allowances.approve(sell, wallet, adapter.spender(), quote.getSellAmount());
            }

            warnIfLowOnGas(wallet);
            return submitWithEscalation(opp, adapter, wallet, approvalTx);
        } catch (ExecutionFailure e) {
            if (state == ExecutionState.APPROVE && e.getReason() == FailureReason.EXECUTION_UNCONFIRMED) {
                log.warn("[EXECUTION] {} approval {} - left pending, no swap sent", e.getReason(), e.getTxHash());
                return ExecutionOutcome.builder()
                        .status(ExecutionStatus.UNCONFIRMED)
                        .finalState(ExecutionState.APPROVE)
                        .reason(FailureReason.EXECUTION_UNCONFIRMED)
                        .approvalTxHash(e.getTxHash())
                        .detail(e.getMessage())
                        .build();
            }
            return fail(opp, state, e.getReason(), e.getMessage()).toBuilder().approvalTxHash(approvalTx).build();
        } catch (RpcException e) {
            log.error("[EXECUTION] RPC failure during state {}: {}", state, e.getMessage(), e);
            return fail(opp, state, FailureReason.fromRpc(e.getKind()), e.getMessage()).toBuilder()
                    .approvalTxHash(approvalTx)
                    .build();
        }
    }

    private ExecutionOutcome submitWithEscalation(ArbitrageOpportunity opp, RouterAdapter adapter, String wallet,
            String approvalTx) {
        Quote quote = opp.getQuote();
        String sell = quote.getSellToken().address();
        int slippage = config.defaultSlippageBps();
        String lastDetail = "no attempt made";

        for (int attempt = 1; attempt <= config.maxSwapAttempts(); attempt++) {
            BigInteger minOut = minOut(quote.getBuyAmount(), slippage);
            long deadline = clock.instant().getEpochSecond() + config.deadlineSeconds();
            String data = adapter.encodeSwap(quote, minOut, wallet, deadline);
            log.info("[EXECUTION] State: {} | attempt {}/{} minOut={} slippage={} bps", ExecutionState.SUBMIT,
                    attempt, config.maxSwapAttempts(), minOut, slippage);

            String hash;
            try {
                hash = sender.send(adapter.spender(), data);
            } catch (RpcException e) {
                if (!TransactionSender.isRevert(e)) {
                    throw e;
                }
                lastDetail = "estimate reverted: " + e.getMessage();
                log.warn("[EXECUTION] attempt {} reverted in simulation ({})", attempt, e.getKind());
                slippage = escalate(slippage);
                continue;
            }

            pending.register(sell, new PendingTransactions.Pending(hash, adapter.id(), opp.getPair().label(),
                    clock.instant()));
            log.info("[EXECUTION] State: {} | waiting for {}", ExecutionState.CONFIRM, hash);
            Optional<TxReceipt> receipt = sender.awaitReceipt(hash);
            if (receipt.isEmpty()) {
                log.warn("[EXECUTION] {} {} - left pending for reconciliation", FailureReason.EXECUTION_UNCONFIRMED, hash);
                return ExecutionOutcome.builder()
                        .status(ExecutionStatus.UNCONFIRMED)
                        .finalState(ExecutionState.CONFIRM)
                        .reason(FailureReason.EXECUTION_UNCONFIRMED)
                        .txHash(hash)
                        .approvalTxHash(approvalTx)
                        .minBuyAmount(minOut)
                        .attempts(attempt)
                        .slippageBps(slippage)
                        .build();
            }
            pending.clear(sell, hash);
            if (receipt.get().success()) {
                log.info("--- EXECUTION SUCCESSFUL {} | tx {} gasUsed {} ---", opp.getId(), hash,
                        receipt.get().gasUsed());
                return ExecutionOutcome.builder()
                        .status(ExecutionStatus.SUCCESS)
                        .finalState(ExecutionState.SUCCESS)
                        .txHash(hash)
                        .approvalTxHash(approvalTx)
                        .gasUsed(receipt.get().gasUsed())
                        .minBuyAmount(minOut)
                        .attempts(attempt)
                        .slippageBps(slippage)
                        .build();
            }
            lastDetail = "tx " + hash + " reverted on-chain";
            log.warn("[EXECUTION] attempt {} reverted on-chain: {}", attempt, hash);
            slippage = escalate(slippage);
        }

        return fail(opp, ExecutionState.SUBMIT, FailureReason.EXECUTION_REVERTED,
                config.maxSwapAttempts() + " attempts exhausted, last: " + lastDetail).toBuilder()
                .approvalTxHash(approvalTx)
                .attempts(config.maxSwapAttempts())
                .slippageBps(slippage)
                .build();
    }

    static BigInteger minOut(BigInteger buyAmount, int slippageBps) {
        return buyAmount.multiply(BPS.subtract(BigInteger.valueOf(slippageBps))).divide(BPS);
    }

    private int escalate(int slippage) {
        return Math.min(slippage + config.slippageStepBps(), config.maxSlippageBps());
    }

    private void warnIfLowOnGas(String wallet) {
        BigInteger nativeBalance = evm.nativeBalance(wallet);
        if (nativeBalance.compareTo(BigInteger.valueOf(config.minNativeBalanceWei())) < 0) {
            log.warn("[EXECUTION] native balance {} wei below {} - transactions may fail for gas", nativeBalance,
                    config.minNativeBalanceWei());
        }
    }

    private ExecutionOutcome fail(ArbitrageOpportunity opp, ExecutionState state, FailureReason reason, String detail) {
        log.warn("--- EXECUTION FAILED {} | state {} reason {}: {} ---", opp.getId(), state, reason, detail);
        return ExecutionOutcome.failed(state, reason, detail);
    }
}
