package com.freightoptimization.tracking.load;

import com.freightoptimization.tracking.config.TrackingProperties;
import com.freightoptimization.tracking.exception.EntityNotFoundException;
import com.freightoptimization.tracking.exception.TrackingException;
import com.freightoptimization.tracking.exception.TrackingTimeoutException;
import com.freightoptimization.tracking.model.LoadWithAssignments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

@Service
@Slf4j
public class RestLoadService implements LoadService {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestLoadService(RestTemplate restTemplate, TrackingProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getLoadApi().getUrl();
    }

    @Override
    @Cacheable(value = "loads", key = "#loadId")
    public LoadWithAssignments getLoadWithAssignments(String loadId) {
        log.debug("Fetching load {} from load service", loadId);
        try {
            LoadWithAssignments load = restTemplate.getForObject(
                    baseUrl + "/api/v1/loads/{loadId}?includeDetails=true", LoadWithAssignments.class, loadId);
            if (load == null) {
                throw new EntityNotFoundException("Load not found: " + loadId);
            }
            return load;
        } catch (HttpClientErrorException.NotFound e) {
            throw new EntityNotFoundException("Load not found: " + loadId);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TrackingTimeoutException("Load service timed out for " + loadId, e);
            }
            throw new TrackingException("Load service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TrackingException("Failed to fetch load " + loadId + ": " + e.getMessage(), e);
        }
    }
}
