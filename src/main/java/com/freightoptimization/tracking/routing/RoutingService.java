package com.freightoptimization.tracking.routing;

import com.freightoptimization.tracking.dto.RouteEstimate;
import com.freightoptimization.tracking.model.GeoPoint;

/**
 * Road-network distance provider. Optional: without one, distances are great-circle.
 */
public interface RoutingService {

    /**
     * @throws com.freightoptimization.tracking.exception.TrackingException when no route could be computed
     */
    RouteEstimate routeDistance(GeoPoint origin, GeoPoint destination);
}
