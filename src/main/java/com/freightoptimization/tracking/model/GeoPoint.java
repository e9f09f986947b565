package com.freightoptimization.tracking.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeoPoint implements Serializable {
    private static final long serialVersionUID = 1L;

    private double latitude;
    private double longitude;
}
