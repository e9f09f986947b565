package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.EntityType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MapMarker {
    private String markerId;
    private EntityType entityType;
    private double latitude;
    private double longitude;
    private Map<String, Object> metadata;
}
