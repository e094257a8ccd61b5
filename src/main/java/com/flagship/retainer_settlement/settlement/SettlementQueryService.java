package com.flagship.retainer_settlement.settlement;

import com.flagship.retainer_settlement.deal.CounterpartyDirectory;
import com.flagship.retainer_settlement.deal.Deal;
import com.flagship.retainer_settlement.deal.DealPersistenceService;
import com.flagship.retainer_settlement.identity.CallerIdentity;
import com.flagship.retainer_settlement.pipeline.StageRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Loads the settlement working set from the deal store, newest first.
 * Lawyers only get the deals assigned to them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementQueryService {

    private final DealPersistenceService dealPersistenceService;
    private final CounterpartyDirectory counterpartyDirectory;

    public List<SettlementEntry> loadWorkingSet(CallerIdentity caller) {
        UUID attorneyFilter = caller.isLawyer() ? caller.getUserId() : null;
        List<Deal> deals = dealPersistenceService.findByStatuses(StageRegistry.settlementLabels(), attorneyFilter);

        Set<UUID> attorneyIds = deals.stream()
                .map(Deal::getAssignedAttorneyId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<UUID, String> attorneyNames = counterpartyDirectory.attorneyNames(attorneyIds);

        List<SettlementEntry> entries = deals.stream()
                .map(deal -> SettlementEntry.fromDeal(deal, attorneyNames.get(deal.getAssignedAttorneyId())))
                .toList();
        log.debug("Loaded settlement working set: deals={}, lawyerFilter={}", entries.size(), attorneyFilter != null);
        return entries;
    }
}
