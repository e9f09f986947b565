package com.freightoptimization.tracking.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.dto.RouteEstimate;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import com.freightoptimization.tracking.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Driving distance and duration from an OSRM server.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "tracking.routing.enabled", havingValue = "true")
public class OsrmRoutingService implements RoutingService {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public OsrmRoutingService(RestTemplate restTemplate, ObjectMapper objectMapper, TrackingProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getRouting().getUrl();
    }

    @Override
    @Cacheable(value = "routes", key = "#origin.latitude + ',' + #origin.longitude + ':' + #destination.latitude + ',' + #destination.longitude")
    public RouteEstimate routeDistance(GeoPoint origin, GeoPoint destination) {
        // OSRM uses lng,lat order
        String coordinates = String.format(Locale.ROOT, "%f,%f;%f,%f",
                origin.getLongitude(), origin.getLatitude(),
                destination.getLongitude(), destination.getLatitude());
        String url = baseUrl + "/route/v1/driving/" + coordinates + "?overview=false";

        try {
            String response = restTemplate.getForObject(url, String.class);
            JsonNode root = objectMapper.readTree(response);
            String code = root.path("code").asText();
            if (!"Ok".equals(code) || !root.path("routes").has(0)) {
                log.warn("OSRM returned code {} for {}", code, coordinates);
                throw new TrackingException("Routing service returned " + code);
            }
            JsonNode route = root.path("routes").get(0);
            RouteEstimate estimate = new RouteEstimate(
                    route.path("distance").asDouble() / 1000.0,
                    route.path("duration").asDouble() / 60.0);
            log.debug("OSRM route {} -> {} km, {} min", coordinates, estimate.getDistanceKm(), estimate.getDurationMinutes());
            return estimate;
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TrackingTimeoutException("Routing service timed out", e);
            }
            throw new TrackingException("Routing service unreachable: " + e.getMessage(), e);
        } catch (RestClientException | IOException e) {
            throw new TrackingException("Failed to fetch route: " + e.getMessage(), e);
        }
    }
}
