package com.freightoptimization.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadStatusUpdate {
    private String loadId;
    private String status;
    private Map<String, Object> details;
}
