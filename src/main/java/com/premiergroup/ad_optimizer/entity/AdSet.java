package com.premiergroup.ad_optimizer.entity;

import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.LearningPhaseStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "ad_sets", indexes = {
        @Index(name = "idx_ad_sets_account_status", columnList = "account_id, status"),
        @Index(name = "idx_ad_sets_campaign_status", columnList = "campaign_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdSet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "ad_set_id", nullable = false, unique = true)
    private String adSetId;

    @Column(name = "campaign_id", nullable = false)
    private String campaignId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EntityStatus status;

    // daily budget
    private BigDecimal budget;

    @Enumerated(EnumType.STRING)
    @Column(name = "learning_phase_status")
    private LearningPhaseStatus learningPhaseStatus;

    @Column(name = "optimization_events_count")
    private Long optimizationEventsCount;

    @Column(name = "age_days")
    private Integer ageDays;
}
