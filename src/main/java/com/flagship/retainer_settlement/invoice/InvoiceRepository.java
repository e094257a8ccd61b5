package com.flagship.retainer_settlement.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID>, JpaSpecificationExecutor<InvoiceEntity> {

    /**
     * Used for numbering: the count of invoices already issued under a year prefix.
     */
    long countByInvoiceNumberStartingWith(String prefix);

    Optional<InvoiceEntity> findByIdempotencyKey(String idempotencyKey);
}
