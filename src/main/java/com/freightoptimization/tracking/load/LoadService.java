package com.freightoptimization.tracking.load;

import com.freightoptimization.tracking.model.LoadWithAssignments;

/**
 * Read-only view of loads owned by the load service.
 */
public interface LoadService {

    /**
     * @throws com.freightoptimization.tracking.exception.EntityNotFoundException for an unknown load
     */
    LoadWithAssignments getLoadWithAssignments(String loadId);
}
