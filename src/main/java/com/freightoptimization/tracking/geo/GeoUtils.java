package com.freightoptimization.tracking.geo;

import com.freightoptimization.tracking.model.GeoPoint;
import com.freightoptimization.tracking.model.PositionSample;

import java.util.List;

public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtils() {
    }

    /**
     * Great-circle distance in kilometers.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double pathLengthKm(List<PositionSample> samples) {
        double total = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            PositionSample prev = samples.get(i - 1);
            PositionSample curr = samples.get(i);
            total += haversineKm(prev.getLatitude(), prev.getLongitude(), curr.getLatitude(), curr.getLongitude());
        }
        return total;
    }

    /**
     * Planar distance from point P to segment AB, in the units of the inputs (degrees here).
     */
    public static double distanceToSegment(double px, double py, double ax, double ay, double bx, double by) {
        double dx = bx - ax;
        double dy = by - ay;
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared == 0.0) {
            return Math.hypot(px - ax, py - ay);
        }
        double t = ((px - ax) * dx + (py - ay) * dy) / lengthSquared;
        t = Math.max(0.0, Math.min(1.0, t));
        return Math.hypot(px - (ax + t * dx), py - (ay + t * dy));
    }

    /**
     * Ray casting on raw degrees. The ring may be open or closed.
     */
    public static boolean isPointInPolygon(double latitude, double longitude, List<GeoPoint> polygon) {
        boolean inside = false;
        for (int i = 0, j = polygon.size() - 1; i < polygon.size(); j = i++) {
            double xi = polygon.get(i).getLongitude();
            double yi = polygon.get(i).getLatitude();
            double xj = polygon.get(j).getLongitude();
            double yj = polygon.get(j).getLatitude();
            boolean crosses = (yi > latitude) != (yj > latitude)
                    && longitude < (xj - xi) * (latitude - yi) / (yj - yi) + xi;
            if (crosses) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * Shortest distance in kilometers from a point to a polyline, measured on an equirectangular
     * projection centred on the point. Accurate to well under a percent at geofence scales.
     */
    public static double distanceToPolylineKm(double latitude, double longitude, List<GeoPoint> path) {
        if (path.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        double cosLat = Math.cos(Math.toRadians(latitude));
        if (path.size() == 1) {
            return haversineKm(latitude, longitude, path.get(0).getLatitude(), path.get(0).getLongitude());
        }
        double best = Double.POSITIVE_INFINITY;
        for (int i = 1; i < path.size(); i++) {
            GeoPoint a = path.get(i - 1);
            GeoPoint b = path.get(i);
            double d = distanceToSegment(0.0, 0.0,
                    projectX(a.getLongitude() - longitude, cosLat), projectY(a.getLatitude() - latitude),
                    projectX(b.getLongitude() - longitude, cosLat), projectY(b.getLatitude() - latitude));
            best = Math.min(best, d);
        }
        return best;
    }

    private static double projectX(double deltaLongitude, double cosLat) {
        return Math.toRadians(deltaLongitude) * cosLat * EARTH_RADIUS_KM;
    }

    private static double projectY(double deltaLatitude) {
        return Math.toRadians(deltaLatitude) * EARTH_RADIUS_KM;
    }

    public static boolean isValidLatitude(double latitude) {
        return Double.isFinite(latitude) && latitude >= -90.0 && latitude <= 90.0;
    }

    public static boolean isValidLongitude(double longitude) {
        return Double.isFinite(longitude) && longitude >= -180.0 && longitude <= 180.0;
    }
}
