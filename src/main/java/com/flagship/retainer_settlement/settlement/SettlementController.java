package com.flagship.retainer_settlement.settlement;

import com.flagship.retainer_settlement.identity.CallerIdentity;
import com.flagship.retainer_settlement.pipeline.StageRegistry;
import com.flagship.retainer_settlement.settlement.dto.InboundReceivedResponse;
import com.flagship.retainer_settlement.settlement.dto.MoveStageRequest;
import com.flagship.retainer_settlement.settlement.dto.SettlementView;
import com.flagship.retainer_settlement.settlement.dto.StageMoveResponse;
import com.flagship.retainer_settlement.settlement.dto.StageView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints of the settlement board.
 *
 * The ledger and transition controller are session scoped; every request of one browser
 * session sees the same working set. {@code GET /api/settlements} (re)loads it.
 */
@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementQueryService queryService;
    private final SettlementLedger ledger;
    private final KanbanTransitionController transitionController;

    @GetMapping("/stages")
    public List<StageView> getStages() {
        return StageRegistry.stages().stream().map(StageView::from).toList();
    }

    @GetMapping
    public List<SettlementView> loadSettlements(
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        CallerIdentity caller = CallerIdentity.of(userId, role);
        ledger.load(queryService.loadWorkingSet(caller));
        return ledger.entries().stream().map(this::toView).toList();
    }

    @GetMapping("/{dealId}")
    public SettlementView getSettlement(
            @PathVariable("dealId") UUID dealId,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        CallerIdentity.of(userId, role);
        return toView(ledger.get(dealId));
    }

    @PostMapping("/{dealId}/stage")
    public ResponseEntity<StageMoveResponse> moveStage(
            @PathVariable("dealId") UUID dealId,
            @Valid @RequestBody MoveStageRequest request,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        CallerIdentity.of(userId, role).requireAnyRole(CallerIdentity.BACK_OFFICE, "move deals between stages");
        log.info("Stage move requested: dealId={}, target={}", dealId, request.getStage());
        TransitionOutcome outcome = transitionController.move(dealId, request.getStage());
        return ResponseEntity.ok(new StageMoveResponse(outcome, toView(ledger.get(dealId))));
    }

    @PostMapping("/{dealId}/inbound-received")
    public InboundReceivedResponse markInboundReceived(
            @PathVariable("dealId") UUID dealId,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        CallerIdentity.of(userId, role).requireAnyRole(CallerIdentity.BACK_OFFICE, "record inbound payments");
        boolean applied = ledger.markInboundReceived(dealId);
        return new InboundReceivedResponse(applied, toView(ledger.get(dealId)));
    }

    @PostMapping("/{dealId}/pay-outbound")
    public SettlementView payOutbound(
            @PathVariable("dealId") UUID dealId,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        CallerIdentity.of(userId, role).requireAnyRole(CallerIdentity.BACK_OFFICE, "pay the BPO");
        return toView(ledger.payOutbound(dealId));
    }

    private SettlementView toView(SettlementEntry entry) {
        return SettlementView.from(entry, ledger.canPayOutbound(entry));
    }
}
