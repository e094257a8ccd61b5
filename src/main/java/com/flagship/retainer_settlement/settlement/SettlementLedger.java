package com.flagship.retainer_settlement.settlement;

import com.flagship.retainer_settlement.deal.DealNotFoundException;
import com.flagship.retainer_settlement.deal.DealStageStore;
import com.flagship.retainer_settlement.observability.CorrelationContext;
import com.flagship.retainer_settlement.observability.SettlementMetrics;
import com.flagship.retainer_settlement.pipeline.PaymentState;
import com.flagship.retainer_settlement.pipeline.PaymentStateDeriver;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.SessionScope;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The settlement working set of one user session.
 *
 * Holds one {@link SettlementEntry} per deal in a settlement stage, in load order, and
 * enforces the safety lock: the BPO is only paid once the inbound payment has been received.
 *
 * Entries are immutable and swapped under the map's monitor, so a reader sees either the old
 * or the new entry, never a half-applied one. Calls to the store happen outside the monitor.
 *
 * Stage changes of one deal never overlap. A deal whose change is still being persisted is
 * claimed, and any other change or inbound mark for it is rejected rather than queued.
 */
@Component
@SessionScope
@Slf4j
public class SettlementLedger {

    private final DealStageStore stageStore;
    private final SettlementMetrics metrics;

    private final Map<UUID, SettlementEntry> entries = new LinkedHashMap<>();
    // guarded by entries
    private final Set<UUID> inFlight = new HashSet<>();

    public SettlementLedger(DealStageStore stageStore, SettlementMetrics metrics) {
        this.stageStore = stageStore;
        this.metrics = metrics;
    }

    /**
     * Replaces the working set with freshly loaded entries.
     *
     * An inbound payment marked received in this session survives the reload as long as the
     * deal is still in the same stage. Anything else is taken as loaded.
     */
    public void load(List<SettlementEntry> loaded) {
        synchronized (entries) {
            Map<UUID, SettlementEntry> previous = new LinkedHashMap<>(entries);
            entries.clear();
            for (SettlementEntry entry : loaded) {
                SettlementEntry before = previous.get(entry.getDealId());
                if (before != null
                        && before.getStage() == entry.getStage()
                        && before.getPaymentState().isInboundReceived()
                        && !entry.getPaymentState().isInboundReceived()) {
                    entry = entry.withPaymentState(entry.getPaymentState().withInboundReceived());
                }
                entries.put(entry.getDealId(), entry);
            }
        }
        log.debug("Loaded {} settlement entries", loaded.size());
    }

    public List<SettlementEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries.values());
        }
    }

    public Optional<SettlementEntry> find(UUID dealId) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(dealId));
        }
    }

    /**
     * @throws DealNotFoundException if the deal is not in this session's working set
     */
    public SettlementEntry get(UUID dealId) {
        return find(dealId).orElseThrow(() -> new DealNotFoundException(dealId));
    }

    public boolean isInFlight(UUID dealId) {
        synchronized (entries) {
            return inFlight.contains(dealId);
        }
    }

    /**
     * Records that the inbound payment for a deal has arrived.
     *
     * @return false when the deal is not eligible: inbound already received, or already paid to the BPO
     * @throws TransitionInProgressException if a stage change of the deal is being persisted
     */
    public boolean markInboundReceived(UUID dealId) {
        synchronized (entries) {
            SettlementEntry entry = get(dealId);
            if (inFlight.contains(dealId)) {
                throw new TransitionInProgressException(dealId);
            }
            if (entry.getPaymentState().isInboundReceived() || entry.getStage().isTerminal()) {
                log.info("Deal {} not eligible for inbound receipt: stage={}, inbound={}",
                        dealId, entry.getStage().getKey(), entry.getPaymentState().getInbound());
                return false;
            }
            entries.put(dealId, entry.withPaymentState(entry.getPaymentState().withInboundReceived()));
        }
        metrics.recordInboundReceived();
        log.info("Inbound payment received for deal {}", dealId);
        return true;
    }

    public boolean canPayOutbound(UUID dealId) {
        return canPayOutbound(get(dealId));
    }

    public boolean canPayOutbound(SettlementEntry entry) {
        return !entry.getStage().isTerminal()
                && !entry.getPaymentState().isOutboundPaid()
                && entry.getPaymentState().isInboundReceived();
    }

    /**
     * Pays the BPO: moves the deal to "Paid to BPO" and marks outbound paid.
     *
     * @throws SafetyLockException if inbound payment has not been received or the BPO is already paid
     * @throws TransitionInProgressException if a stage change of the deal is being persisted
     * @throws StageTransitionFailedException if the store rejects the change; the entry is restored
     */
    public SettlementEntry payOutbound(UUID dealId) {
        MDC.put(CorrelationContext.DEAL_ID_MDC_KEY, dealId.toString());
        try {
            SettlementEntry entry;
            synchronized (entries) {
                entry = get(dealId);
                if (inFlight.contains(dealId)) {
                    throw new TransitionInProgressException(dealId);
                }
                if (!canPayOutbound(entry)) {
                    metrics.recordSafetyLockRejection();
                    throw new SafetyLockException(dealId, lockReason(entry));
                }
                inFlight.add(dealId);
            }
            try {
                long startTime = System.currentTimeMillis();
                new OptimisticStageChange(this, stageStore, entry, PipelineStage.PAID_TO_BPO, PaymentState.SETTLED)
                        .execute();
                metrics.recordPersistenceLatency("pay_outbound", System.currentTimeMillis() - startTime);
            } finally {
                release(dealId);
            }
            log.info("BPO paid for deal {}", dealId);
            return get(dealId);
        } finally {
            MDC.remove(CorrelationContext.DEAL_ID_MDC_KEY);
        }
    }

    /**
     * Moves one entry to {@code target}, with the payment state derived from the target stage.
     *
     * @throws TransitionInProgressException if a stage change of the deal is being persisted
     * @throws StageTransitionFailedException if the store rejects the change; the entry is restored
     */
    void changeStage(SettlementEntry entry, PipelineStage target) {
        UUID dealId = entry.getDealId();
        synchronized (entries) {
            if (!inFlight.add(dealId)) {
                throw new TransitionInProgressException(dealId);
            }
        }
        try {
            new OptimisticStageChange(this, stageStore, entry, target, PaymentStateDeriver.derive(target)).execute();
        } finally {
            release(dealId);
        }
    }

    /**
     * Swaps {@code expected} for {@code replacement} if the deal's entry is still {@code expected}.
     */
    boolean swap(SettlementEntry expected, SettlementEntry replacement) {
        synchronized (entries) {
            if (!expected.equals(entries.get(expected.getDealId()))) {
                return false;
            }
            entries.put(replacement.getDealId(), replacement);
            return true;
        }
    }

    private void release(UUID dealId) {
        synchronized (entries) {
            inFlight.remove(dealId);
        }
    }

    private static String lockReason(SettlementEntry entry) {
        if (entry.getStage().isTerminal() || entry.getPaymentState().isOutboundPaid()) {
            return "BPO already paid";
        }
        return "inbound payment not yet received";
    }
}
