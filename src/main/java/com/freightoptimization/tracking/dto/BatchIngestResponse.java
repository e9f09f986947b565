package com.freightoptimization.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResponse {
    private int accepted;
    private int duplicates;
    private int rejected;
    private List<RejectionDetail> rejections;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectionDetail {
        private int index;
        private String entityId;
        private String reason;
    }
}
