package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import com.freightoptimization.tracking.model.PositionSource;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;

import java.time.Instant;

/**
 * Row of a monthly {@code position_history_yYYYYmMM} collection. {@code location} carries the
 * 2dsphere-indexed copy of the coordinates.
 */
@Data
@NoArgsConstructor
public class PositionHistoryDocument {

    @Id
    private String id;
    private String entityId;
    private EntityType entityType;
    private double latitude;
    private double longitude;
    private GeoJsonPoint location;
    private Double heading;
    private Double speed;
    private Double accuracy;
    private PositionSource source;
    private Instant recordedAt;
    private Instant createdAt;
    private String sourceLogId;

    public static PositionHistoryDocument from(PositionSample sample) {
        PositionHistoryDocument doc = new PositionHistoryDocument();
        doc.setEntityId(sample.getEntityId());
        doc.setEntityType(sample.getEntityType());
        doc.setLatitude(sample.getLatitude());
        doc.setLongitude(sample.getLongitude());
        doc.setLocation(new GeoJsonPoint(sample.getLongitude(), sample.getLatitude()));
        doc.setHeading(sample.getHeading());
        doc.setSpeed(sample.getSpeed());
        doc.setAccuracy(sample.getAccuracy());
        doc.setSource(sample.getSource());
        doc.setRecordedAt(sample.getRecordedAt());
        doc.setCreatedAt(sample.getCreatedAt());
        doc.setSourceLogId(sample.getSourceLogId());
        return doc;
    }

    public PositionSample toSample() {
        return PositionSample.builder()
                .entityId(entityId)
                .entityType(entityType)
                .latitude(latitude)
                .longitude(longitude)
                .heading(heading)
                .speed(speed)
                .accuracy(accuracy)
                .source(source)
                .recordedAt(recordedAt)
                .createdAt(createdAt)
                .sourceLogId(sourceLogId)
                .build();
    }
}
