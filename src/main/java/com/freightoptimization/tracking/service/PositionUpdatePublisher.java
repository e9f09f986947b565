package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.dto.LoadStatusUpdate;
import com.freightoptimization.tracking.model.GeofenceEvent;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Re-broadcasts positions, load status changes and geofence events to the platform's STOMP topics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionUpdatePublisher {

    public static final String POSITION_TOPIC_PREFIX = "/topic/positions/";
    public static final String LOAD_STATUS_TOPIC_PREFIX = "/topic/load-status/";
    public static final String ENTITY_GEOFENCE_TOPIC_PREFIX = "/topic/geofence-events/";
    public static final String GEOFENCE_TOPIC_PREFIX = "/topic/geofences/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Publish a position to {@code /topic/positions/{ENTITY_TYPE}_{entityId}}
     */
    public void publishPosition(PositionSample sample) {
        messagingTemplate.convertAndSend(POSITION_TOPIC_PREFIX + sample.key().toWireKey(), sample);
        log.debug("Sent position {} -> ({}, {})", sample.key(), sample.getLatitude(), sample.getLongitude());
    }

    /**
     * Publish a load status change to {@code /topic/load-status/{loadId}}
     */
    public void publishLoadStatus(LoadStatusUpdate update) {
        messagingTemplate.convertAndSend(LOAD_STATUS_TOPIC_PREFIX + update.getLoadId(), update);
        log.debug("Sent load status {} -> {}", update.getLoadId(), update.getStatus());
    }

    /**
     * Publish a geofence event to {@code /topic/geofence-events/{ENTITY_TYPE}_{entityId}} and
     * {@code /topic/geofences/{geofenceId}/events}
     */
    public void publishGeofenceEvent(GeofenceEvent event) {
        messagingTemplate.convertAndSend(ENTITY_GEOFENCE_TOPIC_PREFIX + event.entityKey().toWireKey(), event);
        messagingTemplate.convertAndSend(GEOFENCE_TOPIC_PREFIX + event.getGeofenceId() + "/events", event);
        log.debug("Sent geofence {} {} for {}", event.getEventType(), event.getGeofenceId(), event.entityKey());
    }
}
