package com.flagship.retainer_settlement.invoice;

import com.flagship.retainer_settlement.identity.CallerIdentity;
import com.flagship.retainer_settlement.invoice.dto.EligibleDealResponse;
import com.flagship.retainer_settlement.invoice.dto.InvoiceRequest;
import com.flagship.retainer_settlement.invoice.dto.InvoiceResponse;
import com.flagship.retainer_settlement.invoice.dto.NextNumberResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for invoice authoring and lifecycle.
 *
 * Creation requires an {@code Idempotency-Key} header: repeating a request with the same key
 * returns the invoice created the first time (200 instead of 201).
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final InvoiceService invoiceService;

    @GetMapping("/next-number")
    public NextNumberResponse previewNextNumber(
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        CallerIdentity.of(userId, role).requireAnyRole(CallerIdentity.BACK_OFFICE, "create invoices");
        return new NextNumberResponse(invoiceService.previewNextNumber());
    }

    @PostMapping
    public ResponseEntity<InvoiceResponse> createInvoice(
            @Valid @RequestBody InvoiceRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        log.info("Received invoice creation request: idempotencyKey={}, type={}, deals={}",
                idempotencyKey, request.getInvoiceType(), request.getDealIds() == null ? 0 : request.getDealIds().size());

        InvoiceCreation creation = invoiceService.createInvoice(
                request.toForm(), CallerIdentity.of(userId, role), idempotencyKey);
        HttpStatus status = creation.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(InvoiceResponse.from(creation.getInvoice()));
    }

    @PutMapping("/{id}")
    public InvoiceResponse updateInvoice(
            @PathVariable("id") UUID id,
            @Valid @RequestBody InvoiceRequest request,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        return InvoiceResponse.from(
                invoiceService.updateInvoice(id, request.toForm(), CallerIdentity.of(userId, role)));
    }

    @GetMapping("/{id}")
    public InvoiceResponse getInvoice(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        return InvoiceResponse.from(invoiceService.getInvoice(id, CallerIdentity.of(userId, role)));
    }

    @GetMapping
    public List<InvoiceResponse> listInvoices(
            @RequestParam(name = "lawyer_id", required = false) UUID lawyerId,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "type", required = false) String type,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        InvoiceFilter filter = InvoiceFilter.builder()
                .lawyerId(lawyerId)
                .status(status == null ? null : InvoiceStatus.fromValue(status))
                .invoiceType(type == null ? null : InvoiceType.fromValue(type))
                .build();
        return invoiceService.listInvoices(filter, CallerIdentity.of(userId, role))
                .stream()
                .map(InvoiceResponse::from)
                .toList();
    }

    @PostMapping("/{id}/paid")
    public InvoiceResponse markPaid(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        return InvoiceResponse.from(invoiceService.markPaid(id, CallerIdentity.of(userId, role)));
    }

    @PostMapping("/{id}/chargeback")
    public InvoiceResponse requestChargeback(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        return InvoiceResponse.from(invoiceService.requestChargeback(id, CallerIdentity.of(userId, role)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteInvoice(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        invoiceService.deleteInvoice(id, CallerIdentity.of(userId, role));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/eligible-deals")
    public List<EligibleDealResponse> listEligibleDeals(
            @RequestParam("type") String type,
            @RequestParam("counterparty_id") UUID counterpartyId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "editing_invoice_id", required = false) UUID editingInvoiceId,
            @RequestHeader(CallerIdentity.USER_ID_HEADER) UUID userId,
            @RequestHeader(CallerIdentity.ROLE_HEADER) String role) {
        return invoiceService.listEligibleDeals(InvoiceType.fromValue(type), counterpartyId, from, to,
                        editingInvoiceId, CallerIdentity.of(userId, role))
                .stream()
                .map(EligibleDealResponse::from)
                .toList();
    }
}
