package com.flagship.retainer_settlement.deal;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the intake deal flow.
 *
 * Every write is a bulk update returning the affected row count, so callers can tell
 * "nothing matched" apart from "partially applied".
 */
@Repository
public interface DealRepository extends JpaRepository<DealEntity, UUID> {

    List<DealEntity> findByStatusInOrderByCreatedAtDesc(Collection<String> statuses);

    List<DealEntity> findByStatusInAndAssignedAttorneyIdOrderByCreatedAtDesc(
        Collection<String> statuses, UUID assignedAttorneyId);

    /**
     * Deals assigned to a lawyer created in [from, to).
     */
    @Query("""
        SELECT d FROM DealEntity d
        WHERE d.assignedAttorneyId = :attorneyId
          AND d.createdAt >= :from AND d.createdAt < :to
        ORDER BY d.createdAt DESC
        """)
    List<DealEntity> findForAttorneyCreatedBetween(@Param("attorneyId") UUID attorneyId,
                                                   @Param("from") Instant from,
                                                   @Param("to") Instant to);

    /**
     * Deals of a lead vendor in a given stage created in [from, to).
     */
    @Query("""
        SELECT d FROM DealEntity d
        WHERE d.leadVendor = :leadVendor
          AND d.status = :status
          AND d.createdAt >= :from AND d.createdAt < :to
        ORDER BY d.createdAt DESC
        """)
    List<DealEntity> findForLeadVendorInStatusCreatedBetween(@Param("leadVendor") String leadVendor,
                                                             @Param("status") String status,
                                                             @Param("from") Instant from,
                                                             @Param("to") Instant to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealEntity d SET d.status = :status WHERE d.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") String status);

    /**
     * Locks the given deals until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DealEntity d WHERE d.id IN :ids")
    List<DealEntity> lockAllById(@Param("ids") Collection<UUID> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealEntity d SET d.status = :status WHERE d.id IN :ids")
    int updateStatusForDeals(@Param("ids") Collection<UUID> ids, @Param("status") String status);

    /**
     * Links deals to a lawyer invoice. Deals already linked to a different lawyer invoice are left alone.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE DealEntity d SET d.invoiceId = :invoiceId
        WHERE d.id IN :dealIds AND (d.invoiceId IS NULL OR d.invoiceId = :invoiceId)
        """)
    int linkLawyerInvoice(@Param("dealIds") Collection<UUID> dealIds, @Param("invoiceId") UUID invoiceId);

    /**
     * Links deals to a publisher invoice. Deals already linked to a different publisher invoice are left alone.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE DealEntity d SET d.publisherInvoiceId = :invoiceId
        WHERE d.id IN :dealIds AND (d.publisherInvoiceId IS NULL OR d.publisherInvoiceId = :invoiceId)
        """)
    int linkPublisherInvoice(@Param("dealIds") Collection<UUID> dealIds, @Param("invoiceId") UUID invoiceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealEntity d SET d.invoiceId = NULL WHERE d.invoiceId = :invoiceId")
    int unlinkLawyerInvoice(@Param("invoiceId") UUID invoiceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealEntity d SET d.publisherInvoiceId = NULL WHERE d.publisherInvoiceId = :invoiceId")
    int unlinkPublisherInvoice(@Param("invoiceId") UUID invoiceId);
}
