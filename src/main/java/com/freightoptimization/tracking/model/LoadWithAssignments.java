package com.freightoptimization.tracking.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Load as returned by the load service, with its carrier assignments and stops.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadWithAssignments implements Serializable {
    private static final long serialVersionUID = 1L;

    private String loadId;
    private LoadStatus status;
    private List<LoadAssignment> assignments = new ArrayList<>();
    private List<LoadLocation> locations = new ArrayList<>();

    public Optional<LoadAssignment> findActiveAssignment() {
        if (assignments == null) {
            return Optional.empty();
        }
        return assignments.stream().filter(LoadAssignment::isActive).findFirst();
    }

    public Optional<LoadLocation> findLocation(LoadLocation.LocationType type) {
        if (locations == null) {
            return Optional.empty();
        }
        return locations.stream().filter(l -> l.getLocationType() == type).findFirst();
    }

    public List<LoadLocation> findStops() {
        if (locations == null) {
            return List.of();
        }
        return locations.stream()
                .filter(l -> l.getLocationType() == LoadLocation.LocationType.STOP)
                .collect(Collectors.toList());
    }
}
