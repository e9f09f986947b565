package com.freightoptimization.tracking.service;

import com.freightoptimization.tracking.cache.EtaCache;
import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.cache.TrajectoryCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CacheSweepScheduler {

    private final PositionCache positionCache;
    private final TrajectoryCache trajectoryCache;
    private final EtaCache etaCache;
    private final GeofenceDetector geofenceDetector;

    @Scheduled(fixedDelayString = "${tracking.cache.sweep-interval-ms:60000}")
    public void sweep() {
        int positions = positionCache.evictExpired();
        int trajectories = trajectoryCache.evictExpired();
        int etas = etaCache.evictExpired();
        int geofenceStates = geofenceDetector.evictExpired();
        if (positions + trajectories + etas + geofenceStates > 0) {
            log.debug("Evicted {} positions, {} trajectories, {} ETAs and {} geofence states",
                    positions, trajectories, etas, geofenceStates);
        }
    }
}
