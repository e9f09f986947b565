package com.freightoptimization.tracking.push;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.freightoptimization.tracking.dto.LoadStatusUpdate;
import com.freightoptimization.tracking.dto.PushCommand;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.geo.GeoUtils;
import com.freightoptimization.tracking.model.EntityKey;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * JSON frames of the push protocol.
 *
 * <p>Outbound: {@code {op, entityId, entityType}} or {@code {op, loadId}}. Inbound:
 * {@code {event:"position_update", key, payload}} and {@code {event:"load_status", loadId, status, details}}.
 * Malformed or unknown frames decode to empty.
 */
@Slf4j
@Component
public class PushMessageCodec {

    public static final String POSITION_UPDATE = "position_update";
    public static final String LOAD_STATUS = "load_status";

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PushMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String subscribe(EntityKey key) {
        return encode(new PushCommand(PushCommand.SUBSCRIBE, key.getEntityId(), key.getEntityType().name(), null));
    }

    public String unsubscribe(EntityKey key) {
        return encode(new PushCommand(PushCommand.UNSUBSCRIBE, key.getEntityId(), key.getEntityType().name(), null));
    }

    public String subscribeLoadStatus(String loadId) {
        return encode(new PushCommand(PushCommand.SUBSCRIBE_LOAD_STATUS, null, null, loadId));
    }

    public String unsubscribeLoadStatus(String loadId) {
        return encode(new PushCommand(PushCommand.UNSUBSCRIBE_LOAD_STATUS, null, null, loadId));
    }

    public String encode(PushCommand command) {
        try {
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new TrackingException("Failed to encode push command " + command.getOp(), e);
        }
    }

    public Optional<InboundPushEvent> decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed push frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Dropping non-object push frame");
            return Optional.empty();
        }

        String event = root.path("event").asText("");
        switch (event) {
            case POSITION_UPDATE:
                return decodePositionUpdate(root);
            case LOAD_STATUS:
                return decodeLoadStatus(root);
            default:
                log.debug("Ignoring push event '{}'", event);
                return Optional.empty();
        }
    }

    private Optional<InboundPushEvent> decodePositionUpdate(JsonNode root) {
        JsonNode payload = root.path("payload");
        if (!payload.isObject()) {
            log.warn("Dropping position_update without payload");
            return Optional.empty();
        }
        try {
            EntityKey key = EntityKey.parse(root.path("key").asText(null));
            // the key is authoritative for identity
            ObjectNode sampleNode = payload.deepCopy();
            sampleNode.put("entityId", key.getEntityId());
            sampleNode.put("entityType", key.getEntityType().name());
            PositionSample sample = objectMapper.treeToValue(sampleNode, PositionSample.class);
            if (!hasValidCoordinates(sample)) {
                log.warn("Dropping position_update for {} without valid coordinates", key);
                return Optional.empty();
            }
            return Optional.of(InboundPushEvent.positionUpdate(key, sample));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unreadable position_update: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean hasValidCoordinates(PositionSample sample) {
        return sample.getLatitude() != null && sample.getLongitude() != null
                && GeoUtils.isValidLatitude(sample.getLatitude())
                && GeoUtils.isValidLongitude(sample.getLongitude());
    }

    private Optional<InboundPushEvent> decodeLoadStatus(JsonNode root) {
        String loadId = root.path("loadId").asText(null);
        if (loadId == null || loadId.isBlank()) {
            log.warn("Dropping load_status without loadId");
            return Optional.empty();
        }
        Map<String, Object> details = root.path("details").isObject()
                ? objectMapper.convertValue(root.path("details"), DETAILS_TYPE)
                : Map.of();
        return Optional.of(InboundPushEvent.loadStatus(
                new LoadStatusUpdate(loadId, root.path("status").asText(null), details)));
    }
}
