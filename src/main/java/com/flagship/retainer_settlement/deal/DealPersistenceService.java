package com.flagship.retainer_settlement.deal;

import com.flagship.retainer_settlement.deal.event.DealStageChangedEvent;
import com.flagship.retainer_settlement.outbox.OutboxService;
import com.flagship.retainer_settlement.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes deals in the intake deal flow.
 *
 * Bridges {@link DealEntity} and the typed {@link Deal}. Stage changes are written together
 * with a {@link DealStageChangedEvent} in the outbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DealPersistenceService implements DealStageStore {

    private final DealRepository dealRepository;
    private final OutboxService outboxService;

    @Override
    @Transactional
    public void updateStage(UUID dealId, PipelineStage from, PipelineStage to) {
        int updated = dealRepository.updateStatus(dealId, to.getLabel());
        if (updated == 0) {
            throw new DealNotFoundException(dealId);
        }
        outboxService.recordDealEvent(DealStageChangedEvent.of(dealId, from, to));
        log.debug("Persisted stage {} for deal {}", to.getKey(), dealId);
    }

    /**
     * Moves a set of deals to {@code stage}. Deals already there, or no longer present, are
     * left alone; every deal that does move gets an event carrying its previous status.
     *
     * @return number of deals moved
     */
    @Transactional
    public int advanceToStage(Collection<UUID> dealIds, PipelineStage stage) {
        if (dealIds.isEmpty()) {
            return 0;
        }
        Map<UUID, String> previousStatus = new LinkedHashMap<>();
        for (DealEntity deal : dealRepository.lockAllById(dealIds)) {
            if (!stage.getLabel().equals(deal.getStatus())) {
                previousStatus.put(deal.getId(), deal.getStatus());
            }
        }
        if (previousStatus.size() < dealIds.size()) {
            log.info("{} of {} deals already in {} or missing", dealIds.size() - previousStatus.size(),
                    dealIds.size(), stage.getKey());
        }
        if (previousStatus.isEmpty()) {
            return 0;
        }
        int updated = dealRepository.updateStatusForDeals(previousStatus.keySet(), stage.getLabel());
        previousStatus.forEach((dealId, status) ->
                outboxService.recordDealEvent(DealStageChangedEvent.fromStatus(dealId, status, stage)));
        return updated;
    }

    @Transactional(readOnly = true)
    public Optional<Deal> findById(UUID dealId) {
        return dealRepository.findById(dealId).map(DealEntity::toDomain);
    }

    /**
     * Deals whose status is one of {@code labels}, newest first.
     * A non-null {@code attorneyId} restricts the result to deals assigned to that attorney.
     */
    @Transactional(readOnly = true)
    public List<Deal> findByStatuses(Collection<String> labels, UUID attorneyId) {
        List<DealEntity> rows = attorneyId == null
                ? dealRepository.findByStatusInOrderByCreatedAtDesc(labels)
                : dealRepository.findByStatusInAndAssignedAttorneyIdOrderByCreatedAtDesc(labels, attorneyId);
        return rows.stream().map(DealEntity::toDomain).toList();
    }

    /**
     * Deals assigned to a lawyer and created between the two dates, both inclusive.
     */
    @Transactional(readOnly = true)
    public List<Deal> findForAttorney(UUID attorneyId, LocalDate from, LocalDate to) {
        return dealRepository.findForAttorneyCreatedBetween(attorneyId, startOf(from), endOf(to))
                .stream()
                .map(DealEntity::toDomain)
                .toList();
    }

    /**
     * Deals of a lead vendor in {@code stage}. Either date bound may be null (unbounded).
     */
    @Transactional(readOnly = true)
    public List<Deal> findForLeadVendor(String leadVendor, PipelineStage stage, LocalDate from, LocalDate to) {
        Instant lower = from == null ? Instant.EPOCH : startOf(from);
        Instant upper = to == null ? Instant.parse("9999-12-31T00:00:00Z") : endOf(to);
        return dealRepository.findForLeadVendorInStatusCreatedBetween(leadVendor, stage.getLabel(), lower, upper)
                .stream()
                .map(DealEntity::toDomain)
                .toList();
    }

    private static Instant startOf(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Exclusive upper bound covering the whole of {@code date}.
     */
    private static Instant endOf(LocalDate date) {
        return date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
