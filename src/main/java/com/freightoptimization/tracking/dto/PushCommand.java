package com.freightoptimization.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound frame on the push connection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PushCommand {
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String SUBSCRIBE_LOAD_STATUS = "subscribe_load_status";
    public static final String UNSUBSCRIBE_LOAD_STATUS = "unsubscribe_load_status";

    private String op;
    private String entityId;
    private String entityType;
    private String loadId;
}
