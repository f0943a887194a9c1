package com.scrapyard.config;

import com.scrapyard.navigation.Heuristic;
import lombok.Builder;
import lombok.Value;

/**
 * Tuning for path search and agent behaviour.
 *
 * <p>Distances are in world units (pixels) unless stated otherwise. Defaults match a
 * 32-pixel tile grid.
 *
 * @see NavigatorConfigLoader
 */
@Value
@Builder(toBuilder = true)
public class NavigatorConfig {

    /**
     * Radius around an idle agent searched for eligible targets.
     */
    @Builder.Default
    double searchRadius = 640.0;

    /**
     * Distance to the target at which the agent stops and starts acting on it.
     */
    @Builder.Default
    double actionRadius = 40.0;

    /**
     * Distance to a waypoint centre at which the waypoint counts as reached.
     */
    @Builder.Default
    double arrivalTolerance = 4.0;

    /**
     * Distance to the base tile centre at which the agent starts unloading.
     */
    @Builder.Default
    double baseArrivalRadius = 48.0;

    /**
     * Movement speed of newly spawned agents, world units per second.
     */
    @Builder.Default
    double agentSpeed = 100.0;

    /**
     * Inventory capacity of newly spawned agents, in kg.
     */
    @Builder.Default
    double agentCapacity = 100.0;

    /**
     * Maximum A* node expansions per search before giving up.
     */
    @Builder.Default
    int maxSearchIterations = 1000;

    @Builder.Default
    Heuristic heuristic = Heuristic.OCTILE;

    /**
     * Whether planned routes are reduced with line-of-sight smoothing before following.
     */
    @Builder.Default
    boolean smoothPaths = true;

    @Builder.Default
    double powerCapacity = 1000.0;

    /**
     * Power drained per second of movement.
     */
    @Builder.Default
    double powerDrainPerSecond = 1.0;

    /**
     * Idle agents at or below this power level head home to recharge. 0 disables it.
     */
    @Builder.Default
    double lowPowerThreshold = 0.0;

    /**
     * Consecutive ticks without progress toward a waypoint before the route is replanned.
     */
    @Builder.Default
    int stallTickLimit = 30;

    public static NavigatorConfig defaults() {
        return NavigatorConfig.builder().build();
    }
}
