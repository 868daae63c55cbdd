package com.talentforge.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One send of a campaign to one candidate. Every engagement timestamp is
 * written at most once.
 */
@Entity
@Table(name = "campaign_sends", indexes = {
        @Index(name = "idx_campaign_sends_campaign", columnList = "campaign_id"),
        @Index(name = "idx_campaign_sends_provider_message", columnList = "provider_message_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignSend {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "campaign_id", nullable = false)
    private UUID campaignId;

    @Column(name = "candidate_id", nullable = false)
    private UUID candidateId;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private CampaignSendStatus status = CampaignSendStatus.PENDING;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "clicked_at")
    private Instant clickedAt;

    @Column(name = "replied_at")
    private Instant repliedAt;

    @Column(name = "bounced_at")
    private Instant bouncedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
