package com.premiergroup.ad_optimizer.entity;

import com.premiergroup.ad_optimizer.enums.EntityStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "campaigns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "campaign_id", nullable = false, unique = true)
    private String campaignId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    private String name;

    @Enumerated(EnumType.STRING)
    private EntityStatus status;

    // lifetime budget shared by all ad sets of the campaign
    @Column(name = "total_budget")
    private BigDecimal totalBudget;
}
