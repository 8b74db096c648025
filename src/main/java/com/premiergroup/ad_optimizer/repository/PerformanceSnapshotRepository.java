package com.premiergroup.ad_optimizer.repository;

import com.premiergroup.ad_optimizer.entity.PerformanceSnapshot;
import com.premiergroup.ad_optimizer.enums.EntityType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface PerformanceSnapshotRepository extends JpaRepository<PerformanceSnapshot, Integer> {

    List<PerformanceSnapshot> findByEntityTypeAndEntityIdAndStatsDateBetween(
            EntityType entityType,
            String entityId,
            LocalDate start,
            LocalDate end
    );
}
