package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.LoadStatus;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.model.Trajectory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comprehensive tracking view of a load. Each part is resolved independently and is null when
 * it could not be computed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadTrackingResult {
    private String loadId;
    private LoadStatus loadStatus;
    private String vehicleId;
    private PositionSample position;
    private EtaEstimate eta;
    private Trajectory route;
}
