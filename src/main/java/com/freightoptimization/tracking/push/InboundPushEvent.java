package com.freightoptimization.tracking.push;

import com.freightoptimization.tracking.dto.LoadStatusUpdate;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.Value;

/**
 * Decoded inbound frame: either a position update for an entity key or a load status change.
 */
@Value
public class InboundPushEvent {

    public enum Kind {
        POSITION_UPDATE,
        LOAD_STATUS
    }

    Kind kind;
    EntityKey key;
    PositionSample position;
    LoadStatusUpdate loadStatus;

    public static InboundPushEvent positionUpdate(EntityKey key, PositionSample position) {
        return new InboundPushEvent(Kind.POSITION_UPDATE, key, position, null);
    }

    public static InboundPushEvent loadStatus(LoadStatusUpdate update) {
        return new InboundPushEvent(Kind.LOAD_STATUS, null, null, update);
    }
}
