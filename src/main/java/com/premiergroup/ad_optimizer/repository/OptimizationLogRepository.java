package com.premiergroup.ad_optimizer.repository;

import com.premiergroup.ad_optimizer.entity.OptimizationLog;
import com.premiergroup.ad_optimizer.enums.EntityType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OptimizationLogRepository extends JpaRepository<OptimizationLog, Long> {

    List<OptimizationLog> findAllByOrderByPerformedAtDesc(Pageable pageable);

    List<OptimizationLog> findByEntityTypeOrderByPerformedAtDesc(EntityType entityType, Pageable pageable);

    List<OptimizationLog> findByEntityTypeAndEntityIdOrderByPerformedAtDesc(EntityType entityType,
                                                                             String entityId,
                                                                             Pageable pageable);
}
