package com.premiergroup.ad_optimizer.entity;

import com.premiergroup.ad_optimizer.enums.AdEffectiveStatus;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "ads", indexes = {
        @Index(name = "idx_ads_account_status", columnList = "account_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ad {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "ad_id", nullable = false, unique = true)
    private String adId;

    @Column(name = "ad_set_id", nullable = false)
    private String adSetId;

    @Column(name = "campaign_id", nullable = false)
    private String campaignId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EntityStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "effective_status")
    private AdEffectiveStatus effectiveStatus;

    @Column(name = "age_days")
    private Integer ageDays;
}
