package com.freightoptimization.tracking.dto;

import com.freightoptimization.tracking.model.PositionSample;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * GeoJSON LineString. Coordinates are {@code [longitude, latitude]} pairs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineString {
    private String type = "LineString";
    private List<double[]> coordinates = new ArrayList<>();

    public static LineString fromSamples(List<PositionSample> samples) {
        List<double[]> coordinates = new ArrayList<>(samples.size());
        for (PositionSample sample : samples) {
            coordinates.add(new double[]{sample.getLongitude(), sample.getLatitude()});
        }
        return new LineString("LineString", coordinates);
    }

    public static LineString straightLine(double fromLat, double fromLon, double toLat, double toLon) {
        List<double[]> coordinates = new ArrayList<>();
        coordinates.add(new double[]{fromLon, fromLat});
        coordinates.add(new double[]{toLon, toLat});
        return new LineString("LineString", coordinates);
    }
}
