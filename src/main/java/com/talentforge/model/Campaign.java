package com.talentforge.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Outreach campaign aggregate. Counters are only ever incremented through
 * {@code CampaignRepository} update queries, never by read-modify-write.
 */
@Entity
@Table(name = "campaigns", indexes = {
        @Index(name = "idx_campaigns_company", columnList = "company_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "company_id", nullable = false)
    private UUID companyId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "total_recipients", nullable = false)
    @Builder.Default
    private int totalRecipients = 0;

    @Column(name = "total_sent", nullable = false)
    @Builder.Default
    private int totalSent = 0;

    @Column(name = "total_opened", nullable = false)
    @Builder.Default
    private int totalOpened = 0;

    @Column(name = "total_clicked", nullable = false)
    @Builder.Default
    private int totalClicked = 0;

    @Column(name = "total_replied", nullable = false)
    @Builder.Default
    private int totalReplied = 0;

    @Column(name = "total_bounced", nullable = false)
    @Builder.Default
    private int totalBounced = 0;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
