package com.flagship.retainer_settlement.invoice;

import com.flagship.retainer_settlement.identity.CallerIdentity;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Optional criteria for listing invoices. Null fields do not restrict the result.
 */
@Value
@Builder(toBuilder = true)
public class InvoiceFilter {
    UUID lawyerId;
    InvoiceStatus status;
    InvoiceType invoiceType;

    /**
     * Lawyers only ever see their own invoices, whatever they asked for.
     */
    public InvoiceFilter restrictedTo(CallerIdentity caller) {
        if (!caller.isLawyer()) {
            return this;
        }
        return toBuilder()
                .lawyerId(caller.getUserId())
                .invoiceType(InvoiceType.LAWYER)
                .build();
    }

    Specification<InvoiceEntity> toSpecification() {
        return (root, query, cb) -> {
            var predicate = cb.conjunction();
            if (lawyerId != null) {
                predicate = cb.and(predicate, cb.equal(root.get("lawyerId"), lawyerId));
            }
            if (status != null) {
                predicate = cb.and(predicate, cb.equal(root.get("status"), status));
            }
            if (invoiceType != null) {
                predicate = cb.and(predicate, cb.equal(root.get("invoiceType"), invoiceType));
            }
            return predicate;
        };
    }
}
