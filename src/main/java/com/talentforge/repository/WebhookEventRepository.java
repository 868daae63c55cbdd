package com.talentforge.repository;

import com.talentforge.model.WebhookEvent;
import com.talentforge.model.WebhookEventStatus;
import com.talentforge.model.WebhookProvider;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger persistence. Every status change is a conditional update on the
 * expected source status; a return value of 0 means another worker got there first.
 */
@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, UUID> {

    Optional<WebhookEvent> findByProviderAndEventId(WebhookProvider provider, String eventId);

    long countByStatus(WebhookEventStatus status);

    @Query("SELECT e FROM WebhookEvent e WHERE e.status = com.talentforge.model.WebhookEventStatus.FAILED " +
           "AND e.nextRetryAt <= :now ORDER BY e.nextRetryAt ASC")
    List<WebhookEvent> findDueRetries(@Param("now") Instant now, Pageable pageable);

    @Query("SELECT e FROM WebhookEvent e WHERE e.status IN :statuses " +
           "AND COALESCE(e.lastAttemptAt, e.createdAt) < :cutoff ORDER BY e.createdAt ASC")
    List<WebhookEvent> findExpiredLeases(@Param("statuses") Collection<WebhookEventStatus> statuses,
                                         @Param("cutoff") Instant cutoff,
                                         Pageable pageable);

    @Query("SELECT e FROM WebhookEvent e WHERE e.status = :status " +
           "AND (:provider IS NULL OR e.provider = :provider) " +
           "AND (:eventType IS NULL OR e.eventType = :eventType)")
    Page<WebhookEvent> search(@Param("status") WebhookEventStatus status,
                              @Param("provider") WebhookProvider provider,
                              @Param("eventType") String eventType,
                              Pageable pageable);

    List<WebhookEvent> findAllByStatusOrderByCreatedAtDesc(WebhookEventStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.PROCESSING, " +
           "e.lastAttemptAt = :now WHERE e.id = :id AND e.status IN :from")
    int claim(@Param("id") UUID id,
              @Param("from") Collection<WebhookEventStatus> from,
              @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.COMPLETED, " +
           "e.processedAt = :now, e.nextRetryAt = NULL, e.errorMessage = NULL " +
           "WHERE e.id = :id AND e.status = com.talentforge.model.WebhookEventStatus.PROCESSING")
    int markCompleted(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.FAILED, " +
           "e.attempts = e.attempts + 1, e.nextRetryAt = :nextRetryAt, e.errorMessage = :error, " +
           "e.lastAttemptAt = :now " +
           "WHERE e.id = :id AND e.status = com.talentforge.model.WebhookEventStatus.PROCESSING")
    int markFailed(@Param("id") UUID id,
                   @Param("nextRetryAt") Instant nextRetryAt,
                   @Param("error") String error,
                   @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.DEAD_LETTER, " +
           "e.attempts = e.attempts + 1, e.nextRetryAt = NULL, e.errorMessage = :error, " +
           "e.lastAttemptAt = :now " +
           "WHERE e.id = :id AND e.status = com.talentforge.model.WebhookEventStatus.PROCESSING")
    int markDeadLetter(@Param("id") UUID id,
                       @Param("error") String error,
                       @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.FAILED, " +
           "e.attempts = 0, e.errorMessage = NULL, e.nextRetryAt = :nextRetryAt " +
           "WHERE e.id = :id AND e.status = com.talentforge.model.WebhookEventStatus.DEAD_LETTER")
    int resetDeadLetter(@Param("id") UUID id, @Param("nextRetryAt") Instant nextRetryAt);

    /**
     * Takes an in-flight row away from a worker that never finished. The
     * cutoff is re-checked so a row claimed again in the meantime is left alone.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.FAILED, " +
           "e.attempts = e.attempts + 1, e.nextRetryAt = :nextRetryAt, e.errorMessage = :error, " +
           "e.lastAttemptAt = :now " +
           "WHERE e.id = :id AND e.status IN :from " +
           "AND COALESCE(e.lastAttemptAt, e.createdAt) < :cutoff")
    int expireLeaseToFailed(@Param("id") UUID id,
                            @Param("from") Collection<WebhookEventStatus> from,
                            @Param("cutoff") Instant cutoff,
                            @Param("nextRetryAt") Instant nextRetryAt,
                            @Param("error") String error,
                            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEvent e SET e.status = com.talentforge.model.WebhookEventStatus.DEAD_LETTER, " +
           "e.attempts = e.attempts + 1, e.nextRetryAt = NULL, e.errorMessage = :error, " +
           "e.lastAttemptAt = :now " +
           "WHERE e.id = :id AND e.status IN :from " +
           "AND COALESCE(e.lastAttemptAt, e.createdAt) < :cutoff")
    int expireLeaseToDeadLetter(@Param("id") UUID id,
                                @Param("from") Collection<WebhookEventStatus> from,
                                @Param("cutoff") Instant cutoff,
                                @Param("error") String error,
                                @Param("now") Instant now);
}
