package com.premiergroup.ad_optimizer.entity;

import com.premiergroup.ad_optimizer.enums.EntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One day of delivery telemetry for an ad set or ad.
 */
@Entity
@Table(name = "performance_snapshots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"entity_type", "entity_id", "stats_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "account_id")
    private String accountId;

    @Column(name = "stats_date", nullable = false)
    private LocalDate statsDate;

    private Long impressions;
    private Long clicks;
    private Long conversions;
    private Long reach;
    private BigDecimal spend;
    private BigDecimal revenue;
}
