package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.MaintenanceReport;
import com.freightoptimization.tracking.model.MonthlyPartition;
import com.freightoptimization.tracking.repository.PositionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Keeps the next month's partition ready and drops partitions that left the retention window.
 */
@Slf4j
@Service
public class PartitionMaintenanceScheduler {

    private final PositionStore positionStore;
    private final int retentionMonths;
    private final Clock clock;

    public PartitionMaintenanceScheduler(PositionStore positionStore, TrackingProperties properties, Clock clock) {
        this.positionStore = positionStore;
        this.retentionMonths = properties.getStore().getRetentionMonths();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        runMaintenance();
    }

    @Scheduled(cron = "${tracking.store.maintenance-cron:0 15 0 * * *}", zone = "UTC")
    public void scheduledMaintenance() {
        runMaintenance();
    }

    public MaintenanceReport runMaintenance() {
        Instant now = clock.instant();
        List<MonthlyPartition> created = positionStore.ensureUpcomingPartition(now);
        List<MonthlyPartition> dropped = positionStore.pruneOldPartitions(now, retentionMonths);
        List<MonthlyPartition> existing = positionStore.partitions();
        log.info("Partition maintenance: {} created, {} dropped, {} existing",
                created.size(), dropped.size(), existing.size());
        return new MaintenanceReport(now, created, dropped, existing);
    }
}
