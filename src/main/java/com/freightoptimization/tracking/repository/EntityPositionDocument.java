package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.PositionSample;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One document per entity that has ever reported, holding its newest sample. Its presence is what
 * makes an entity "known".
 */
@Data
@NoArgsConstructor
@Document(collection = "entity_positions")
public class EntityPositionDocument {

    @Id
    private String id;
    private String entityId;
    @Indexed
    private EntityType entityType;
    private Instant recordedAt;
    private PositionHistoryDocument position;
    private Instant firstSeenAt;
    private Instant updatedAt;

    public static EntityPositionDocument first(PositionSample sample, Instant now) {
        EntityPositionDocument doc = new EntityPositionDocument();
        doc.setId(sample.key().toWireKey());
        doc.setEntityId(sample.getEntityId());
        doc.setEntityType(sample.getEntityType());
        doc.setRecordedAt(sample.getRecordedAt());
        doc.setPosition(PositionHistoryDocument.from(sample));
        doc.setFirstSeenAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }
}
