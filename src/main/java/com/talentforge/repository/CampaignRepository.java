package com.talentforge.repository;

import com.talentforge.model.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Counter increments are single UPDATE statements so concurrent events for
 * different sends of the same campaign never lose an increment.
 */
@Repository
public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.totalSent = c.totalSent + 1, c.updatedAt = :now WHERE c.id = :id")
    int incrementSent(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.totalOpened = c.totalOpened + 1, c.updatedAt = :now WHERE c.id = :id")
    int incrementOpened(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.totalClicked = c.totalClicked + 1, c.updatedAt = :now WHERE c.id = :id")
    int incrementClicked(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.totalBounced = c.totalBounced + 1, c.updatedAt = :now WHERE c.id = :id")
    int incrementBounced(@Param("id") UUID id, @Param("now") Instant now);
}
