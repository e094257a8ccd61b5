package com.flagship.retainer_settlement.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Next deliverable events in write order. Rows already locked by another publisher are skipped
     * rather than waited on.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL
          AND retry_count < :maxRetries
        ORDER BY sequence_number
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> lockNextBatch(@Param("limit") int limit, @Param("maxRetries") int maxRetries);

    @Query("""
        SELECT new com.flagship.retainer_settlement.outbox.OutboxBacklog(
            e.aggregateType,
            COUNT(e),
            SUM(CASE WHEN e.retryCount >= :maxRetries THEN 1L ELSE 0L END),
            MIN(e.createdAt))
        FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        GROUP BY e.aggregateType
        """)
    List<OutboxBacklog> summarizeBacklog(@Param("maxRetries") int maxRetries);
}
