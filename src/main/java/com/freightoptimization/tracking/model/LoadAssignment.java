package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadAssignment implements Serializable {
    private static final long serialVersionUID = 1L;

    private String assignmentId;
    private String driverId;
    private String vehicleId;
    private String status;

    @JsonIgnore
    public boolean isActive() {
        return status == null
                || !("completed".equalsIgnoreCase(status) || "cancelled".equalsIgnoreCase(status));
    }
}
