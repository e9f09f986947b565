package com.freightoptimization.tracking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code tracking.*} prefix. Read once at startup.
 */
@Data
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    private Cache cache = new Cache();
    private Store store = new Store();
    private Push push = new Push();
    private Eta eta = new Eta();
    private Routing routing = new Routing();
    private LoadApi loadApi = new LoadApi();
    private Http http = new Http();
    private Geofence geofence = new Geofence();

    @Data
    public static class Cache {
        private Duration positionTtl = Duration.ofSeconds(30);
        private Duration trajectoryTtl = Duration.ofSeconds(60);
        private Duration etaTtl = Duration.ofSeconds(60);
    }

    @Data
    public static class Store {
        /** "mongo" or "memory". */
        private String type = "mongo";
        private int retentionMonths = 3;
        private Duration queryTimeout = Duration.ofSeconds(5);
        private boolean enforceUniqueSamples = false;
        private int queryThreads = 8;
        private int trajectoryPageSize = 5000;
    }

    @Data
    public static class Push {
        private String url = "wss://api.freightoptimization.com/tracking";
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Eta {
        private double minSpeedKmh = 5.0;
        private double defaultSpeedKmh = 65.0;
        private int trailingSamples = 10;
        private double weatherFactor = 1.1;
        private int historicalWindowDays = 30;
        private int historicalSampleLimit = 500;
        /** Upper bound on entities or destinations in one batch request. */
        private int maxBatchSize = 100;
    }

    @Data
    public static class Routing {
        private boolean enabled = false;
        private String url = "https://router.project-osrm.org";
    }

    @Data
    public static class LoadApi {
        private String url = "http://load-service:8080";
    }

    @Data
    public static class Geofence {
        private boolean enabled = true;
        /** Time inside a geofence before a DWELL event, and between repeated DWELL events. */
        private Duration dwellThreshold = Duration.ofMinutes(5);
        private Duration stateTtl = Duration.ofHours(24);
        private double defaultSearchRadiusMeters = 1000.0;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
    }
}
