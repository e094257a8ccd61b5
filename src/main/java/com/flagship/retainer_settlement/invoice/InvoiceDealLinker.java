package com.flagship.retainer_settlement.invoice;

import com.flagship.retainer_settlement.deal.DealRepository;
import com.flagship.retainer_settlement.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Points deals at the invoice that bills them, and back again.
 *
 * A deal already linked to another invoice of the same type is left alone and counted as
 * not linked. Linking nothing is an error; linking only some deals is logged and reported.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceDealLinker {

    private final DealRepository dealRepository;
    private final SettlementMetrics metrics;

    /**
     * @throws DealLinkException if deals were requested but no row was updated
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LinkResult linkDeals(List<UUID> dealIds, UUID invoiceId, InvoiceType invoiceType) {
        if (dealIds == null || dealIds.isEmpty()) {
            return LinkResult.empty();
        }
        Set<UUID> distinct = new LinkedHashSet<>(dealIds);
        int linked = switch (invoiceType) {
            case LAWYER -> dealRepository.linkLawyerInvoice(distinct, invoiceId);
            case PUBLISHER -> dealRepository.linkPublisherInvoice(distinct, invoiceId);
        };
        LinkResult result = new LinkResult(distinct.size(), linked);

        if (linked == 0) {
            metrics.recordDealLink("none");
            log.error("No deals linked to invoice {} via {}: requested={}",
                    invoiceId, invoiceType.getLinkColumn(), distinct.size());
            throw new DealLinkException(invoiceId, distinct.size());
        }
        if (result.isPartial()) {
            metrics.recordDealLink("partial");
            log.warn("Linked only {} of {} deals to invoice {} via {}",
                    linked, distinct.size(), invoiceId, invoiceType.getLinkColumn());
        } else {
            metrics.recordDealLink("complete");
            log.debug("Linked {} deals to invoice {}", linked, invoiceId);
        }
        return result;
    }

    /**
     * Clears the link column on every deal pointing at the invoice.
     *
     * @return number of deals unlinked
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int unlinkDeals(UUID invoiceId, InvoiceType invoiceType) {
        int unlinked = switch (invoiceType) {
            case LAWYER -> dealRepository.unlinkLawyerInvoice(invoiceId);
            case PUBLISHER -> dealRepository.unlinkPublisherInvoice(invoiceId);
        };
        log.debug("Unlinked {} deals from invoice {} via {}", unlinked, invoiceId, invoiceType.getLinkColumn());
        return unlinked;
    }
}
