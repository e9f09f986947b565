package com.freightoptimization.tracking.controller;

import com.freightoptimization.tracking.dto.MaintenanceReport;
import com.freightoptimization.tracking.model.MonthlyPartition;
import com.freightoptimization.tracking.repository.PositionStore;
import com.freightoptimization.tracking.service.PartitionMaintenanceScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tracking/partitions")
@RequiredArgsConstructor
@Tag(name = "Partitions", description = "Monthly position history partitions")
public class PartitionController {

    private final PositionStore positionStore;
    private final PartitionMaintenanceScheduler maintenanceScheduler;

    @Operation(summary = "List partitions", description = "Existing monthly partitions, oldest first")
    @GetMapping
    public List<MonthlyPartition> getPartitions() {
        return positionStore.partitions();
    }

    @Operation(summary = "Run maintenance", description = "Create upcoming partitions and drop those past retention")
    @PostMapping("/maintenance")
    public ResponseEntity<MaintenanceReport> runMaintenance() {
        return ResponseEntity.ok(maintenanceScheduler.runMaintenance());
    }
}
