package com.premiergroup.ad_optimizer.entity;

import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Audit record of one executed optimization decision. Rows are written once and never updated,
 * hence getters only.
 */
@Entity
@Table(name = "optimization_logs", indexes = {
        @Index(name = "idx_optimization_logs_entity", columnList = "entity_type, entity_id, performed_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private String entityId;

    @Column(name = "account_id", updatable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private OptimizationAction action;

    @Column(length = 1024, updatable = false)
    private String reason;

    @Column(name = "previous_value", length = 1024, updatable = false)
    private String previousValue;

    @Column(name = "new_value", length = 1024, updatable = false)
    private String newValue;

    @Column(name = "performed_by", nullable = false, updatable = false)
    private String performedBy;

    @Column(name = "performed_at", nullable = false, updatable = false)
    private Instant performedAt;

    @Column(nullable = false, updatable = false)
    private boolean success;
}
