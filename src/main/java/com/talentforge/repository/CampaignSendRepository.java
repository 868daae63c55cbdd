package com.talentforge.repository;

import com.talentforge.model.CampaignSend;
import com.talentforge.model.CampaignSendStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Each engagement write is guarded by its own timestamp being null. The
 * returned row count tells the caller whether it owns the counter increment.
 */
@Repository
public interface CampaignSendRepository extends JpaRepository<CampaignSend, UUID> {

    Optional<CampaignSend> findFirstByProviderMessageId(String providerMessageId);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE CampaignSend s SET s.deliveredAt = :at, s.sentAt = COALESCE(s.sentAt, :at), s.updatedAt = :at " +
           "WHERE s.id = :id AND s.deliveredAt IS NULL")
    int markDelivered(@Param("id") UUID id, @Param("at") Instant at);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE CampaignSend s SET s.openedAt = :at, s.updatedAt = :at WHERE s.id = :id AND s.openedAt IS NULL")
    int markOpened(@Param("id") UUID id, @Param("at") Instant at);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE CampaignSend s SET s.clickedAt = :at, s.updatedAt = :at WHERE s.id = :id AND s.clickedAt IS NULL")
    int markClicked(@Param("id") UUID id, @Param("at") Instant at);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE CampaignSend s SET s.bouncedAt = :at, s.errorMessage = :error, s.updatedAt = :at " +
           "WHERE s.id = :id AND s.bouncedAt IS NULL")
    int markBounced(@Param("id") UUID id, @Param("at") Instant at, @Param("error") String error);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE CampaignSend s SET s.status = :status, s.updatedAt = :at WHERE s.id = :id AND s.status IN :from")
    int advanceStatus(@Param("id") UUID id,
                      @Param("status") CampaignSendStatus status,
                      @Param("from") Collection<CampaignSendStatus> from,
                      @Param("at") Instant at);
}
