package com.premiergroup.ad_optimizer.store;

import com.premiergroup.ad_optimizer.dto.PerformanceTotals;
import com.premiergroup.ad_optimizer.entity.PerformanceSnapshot;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.repository.PerformanceSnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

@Component
@RequiredArgsConstructor
public class JpaTelemetryStore implements TelemetryStore {

    private final PerformanceSnapshotRepository snapshotRepository;

    @Override
    @Transactional(readOnly = true)
    public PerformanceTotals aggregate(EntityType entityType, String entityId, LocalDate start, LocalDate end) {
        List<PerformanceSnapshot> snapshots = snapshotRepository
                .findByEntityTypeAndEntityIdAndStatsDateBetween(entityType, entityId, start, end);
        if (snapshots.isEmpty()) {
            return PerformanceTotals.EMPTY;
        }
        return new PerformanceTotals(
                sumLong(snapshots, PerformanceSnapshot::getImpressions),
                sumLong(snapshots, PerformanceSnapshot::getClicks),
                sumLong(snapshots, PerformanceSnapshot::getConversions),
                sumDecimal(snapshots, PerformanceSnapshot::getSpend),
                sumDecimal(snapshots, PerformanceSnapshot::getRevenue),
                sumLong(snapshots, PerformanceSnapshot::getReach));
    }

    private static long sumLong(List<PerformanceSnapshot> snapshots, Function<PerformanceSnapshot, Long> field) {
        return snapshots.stream().map(field).filter(Objects::nonNull).mapToLong(Long::longValue).sum();
    }

    private static BigDecimal sumDecimal(List<PerformanceSnapshot> snapshots,
                                         Function<PerformanceSnapshot, BigDecimal> field) {
        return snapshots.stream().map(field).filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
