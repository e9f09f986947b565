package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.MonthlyPartition;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceReport {
    private Instant ranAt;
    private List<MonthlyPartition> created;
    private List<MonthlyPartition> dropped;
    private List<MonthlyPartition> existing;
}
