package com.scrapyard.targets;

import com.scrapyard.navigation.WorldPosition;

import java.util.Optional;

/**
 * Source of targets for idle agents.
 *
 * @see InMemoryTargetRegistry
 */
public interface TargetRegistry {

    /**
     * Find the closest target an agent may take on.
     *
     * @param origin the agent's world position
     * @param radius search radius in world units
     * @return the nearest eligible target, or empty if none lies within the radius
     */
    Optional<TargetRef> findNearestEligible(WorldPosition origin, double radius);

    /**
     * Check if a previously issued target still exists and can be acted on.
     */
    boolean isStillValid(TargetRef target);

    /**
     * Current world position of a target.
     */
    default WorldPosition locate(TargetRef target) {
        return target.getPosition();
    }
}
