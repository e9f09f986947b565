package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.GeoPoint;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of the batch ETA endpoints. The multi-entity form reads {@code entityType}, {@code entityIds}
 * and the single destination; the multi-destination form reads {@code destinations}.
 */
@Data
@NoArgsConstructor
public class EtaBatchRequest {
    private String entityType;
    private List<String> entityIds = new ArrayList<>();
    private Double latitude;
    private Double longitude;
    private List<GeoPoint> destinations = new ArrayList<>();
    private boolean considerTraffic;
    private boolean considerWeather;
    private boolean considerDriverPatterns;
    private boolean considerHOS;

    public EtaOptions toOptions() {
        return EtaOptions.builder()
                .considerTraffic(considerTraffic)
                .considerWeather(considerWeather)
                .considerDriverPatterns(considerDriverPatterns)
                .considerHOS(considerHOS)
                .build();
    }
}
