package com.dexarb.core.execution;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.TxReceipt;
import com.dexarb.infra.EvmClient;
import com.dexarb.infra.TransactionSender;
import com.dexarb.infra.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Settles entries of {@link PendingTransactions} against the chain: mined ones are cleared with their receipt,
 * ones the node has forgotten for longer than the configured window are dropped.
 */
@Slf4j
@Component
public class PendingReconciler {

    public enum Status {
        NONE,
        IN_FLIGHT,
        MINED,
        DROPPED
    }

    public record Resolution(Status status, PendingTransactions.Pending entry, TxReceipt receipt) {

        static final Resolution NOTHING = new Resolution(Status.NONE, null, null);

        public boolean blocking() {
            return status == Status.IN_FLIGHT;
        }
    }

    private final PendingTransactions pending;
    private final TransactionSender sender;
    private final EvmClient evm;
    private final Duration dropUnseenAfter;
    private final Clock clock;

    public PendingReconciler(PendingTransactions pending, TransactionSender sender, EvmClient evm,
            ArbProperties properties, Clock clock) {
        this.pending = pending;
        this.sender = sender;
        this.evm = evm;
        this.dropUnseenAfter = properties.execution().dropUnseenAfter();
        this.clock = clock;
    }

    public Resolution reconcile(String key) {
        Optional<PendingTransactions.Pending> inFlight = pending.get(key);
        if (inFlight.isEmpty()) {
            return Resolution.NOTHING;
        }
        PendingTransactions.Pending p = inFlight.get();
        Optional<TxReceipt> receipt = sender.pollReceipt(p.txHash());
        if (receipt.isPresent()) {
            pending.clear(key, p.txHash());
            log.info("[PENDING] {} resolved: {} (gasUsed {})", p.txHash(),
                    receipt.get().success() ? "SUCCESS" : "REVERTED", receipt.get().gasUsed());
            return new Resolution(Status.MINED, p, receipt.get());
        }
        if (Duration.between(p.submittedAt(), clock.instant()).compareTo(dropUnseenAfter) > 0 && !known(p)) {
            pending.clear(key, p.txHash());
            log.warn("[PENDING] {} for {} unseen by the node after {}, dropped", p.txHash(), p.pair(), dropUnseenAfter);
            return new Resolution(Status.DROPPED, p, null);
        }
        log.info("[PENDING] {} still unconfirmed, holding {}", p.txHash(), p.pair());
        return new Resolution(Status.IN_FLIGHT, p, null);
    }

    private boolean known(PendingTransactions.Pending p) {
        try {
            return evm.transactionKnown(p.txHash());
        } catch (RpcException e) {
            if (!e.getKind().isTransient()) {
                throw e;
            }
            log.debug("[PENDING] lookup of {} failed transiently: {}", p.txHash(), e.getMessage());
            return true;
        }
    }
}
