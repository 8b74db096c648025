package com.premiergroup.ad_optimizer.store;

import com.premiergroup.ad_optimizer.entity.OptimizationLog;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.repository.OptimizationLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaAuditLogSink implements AuditLogSink {

    private final OptimizationLogRepository logRepository;

    @Override
    @Transactional
    public OptimizationLog append(OptimizationLog record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("Audit records are append-only, got persisted id " + record.getId());
        }
        return logRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OptimizationLog> recent(EntityType entityType, String entityId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(limit, 1));
        if (entityType == null) {
            return logRepository.findAllByOrderByPerformedAtDesc(page);
        }
        if (entityId == null || entityId.isBlank()) {
            return logRepository.findByEntityTypeOrderByPerformedAtDesc(entityType, page);
        }
        return logRepository.findByEntityTypeAndEntityIdOrderByPerformedAtDesc(entityType, entityId, page);
    }
}
