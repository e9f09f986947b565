package com.freightoptimization.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadLocation implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum LocationType {
        PICKUP,
        DELIVERY,
        STOP;

        @JsonCreator
        public static LocationType fromValue(String value) {
            if (value == null) {
                return null;
            }
            return LocationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private LocationType locationType;
    private String facilityName;
    private Double latitude;
    private Double longitude;

    @JsonIgnore
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
