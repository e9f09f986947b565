package com.freightoptimization.tracking.repository;

import com.freightoptimization.tracking.model.EntityType;
import com.freightoptimization.tracking.model.Geofence;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GeofenceRepository extends MongoRepository<Geofence, String> {

    List<Geofence> findByEntityType(EntityType entityType);

    List<Geofence> findByEntityTypeAndActiveTrue(EntityType entityType);

    List<Geofence> findByEntityTypeAndEntityId(EntityType entityType, String entityId);
}
