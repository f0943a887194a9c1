package com.scrapyard.tasks;

import com.scrapyard.config.NavigatorConfig;
import com.scrapyard.navigation.GridCoordinate;
import com.scrapyard.navigation.GridPath;
import com.scrapyard.navigation.PathFinder;
import com.scrapyard.navigation.TileGrid;
import com.scrapyard.navigation.WorldPosition;
import com.scrapyard.state.Agent;
import com.scrapyard.targets.ActionHandler;
import com.scrapyard.targets.InventorySink;
import com.scrapyard.targets.TargetRef;
import com.scrapyard.targets.TargetRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Tick-driven task state machine for one agent.
 *
 * <p>Each call to {@link #tick(double, TileGrid, TargetRegistry)} evaluates the agent's
 * current {@link AgentState} once:
 * <ul>
 *   <li>IDLE: head home when full (or low on power), otherwise look for the nearest target</li>
 *   <li>MOVING_TO_TARGET: drop vanished targets, act when in range, otherwise follow the route</li>
 *   <li>PERFORMING_ACTION: run the action until it reports completion</li>
 *   <li>RETURNING_TO_BASE: follow the route home, retrying planning until it succeeds</li>
 *   <li>UNLOADING: hand the whole inventory to the sink once</li>
 * </ul>
 *
 * <p>Routes are requested when a travelling state has no route, when the route is exhausted
 * before arrival, or when the agent has stalled on a waypoint for too long. An unreachable
 * target is abandoned immediately; the agent reconsiders it on a later IDLE evaluation. The
 * registry keeps offering the nearest target, so an unreachable nearest target is searched for
 * again on every IDLE tick and farther reachable targets are not tried in the meantime.
 *
 * <p>Power only clamps at zero: a depleted agent keeps moving, and an idle one with a known
 * base heads home to recharge before taking new work.
 *
 * <p>Single-threaded: the grid and registry are borrowed for the duration of the call.
 */
@Slf4j
public class AgentController {

    private static final double PROGRESS_EPSILON = 1e-6;

    @Getter
    private final Agent agent;

    private final PathFinder pathFinder;
    private final ActionHandler actionHandler;
    private final InventorySink inventorySink;
    private final NavigatorConfig config;

    /**
     * Number of ticks processed.
     */
    @Getter
    private long ticks;

    /**
     * Number of route requests made to the path finder.
     */
    @Getter
    private int planRequests;

    /**
     * Number of route requests that found no route.
     */
    @Getter
    private int failedPlans;

    /**
     * Consecutive travelling ticks without getting closer to the current waypoint.
     */
    @Getter
    private int stallTicks;

    private double lastWaypointDistance = Double.MAX_VALUE;

    public AgentController(Agent agent,
                           PathFinder pathFinder,
                           ActionHandler actionHandler,
                           InventorySink inventorySink,
                           NavigatorConfig config) {
        if (agent == null || pathFinder == null || actionHandler == null
                || inventorySink == null || config == null) {
            throw new NullPointerException("AgentController collaborators are required");
        }
        this.agent = agent;
        this.pathFinder = pathFinder;
        this.actionHandler = actionHandler;
        this.inventorySink = inventorySink;
        this.config = config;
    }

    // ========================================================================
    // Tick
    // ========================================================================

    /**
     * Advance the agent by one time step.
     *
     * @param dt       elapsed time in seconds, not negative
     * @param grid     the grid for this tick
     * @param registry the target registry for this tick
     */
    public void tick(double dt, TileGrid grid, TargetRegistry registry) {
        if (dt < 0) {
            throw new IllegalArgumentException("dt must not be negative: " + dt);
        }
        if (grid == null || registry == null) {
            throw new NullPointerException("grid and registry are required");
        }
        ticks++;

        switch (agent.getState()) {
            case IDLE:
                tickIdle(grid, registry);
                break;
            case MOVING_TO_TARGET:
                tickMovingToTarget(dt, grid, registry);
                break;
            case PERFORMING_ACTION:
                tickPerformingAction(dt, registry);
                break;
            case RETURNING_TO_BASE:
                tickReturningToBase(dt, grid);
                break;
            case UNLOADING:
                tickUnloading();
                break;
            default:
                log.warn("Agent {} in unhandled state {}", agent.getId(), agent.getState());
                break;
        }
    }

    /**
     * Drop the current task and go back to IDLE.
     */
    public void abandonTask() {
        if (agent.getState() == AgentState.IDLE) {
            return;
        }
        log.debug("Agent {} abandoning {} in state {}", agent.getId(), agent.getTask(), agent.getState());
        transitionTo(AgentState.IDLE, null);
    }

    // ========================================================================
    // Per-state behaviour
    // ========================================================================

    private void tickIdle(TileGrid grid, TargetRegistry registry) {
        GridCoordinate base = agent.getBase();

        if (agent.getInventory().isFull()) {
            if (base != null) {
                startReturn(grid, base);
            }
            // Full with nowhere to unload: nothing useful to pick up
            return;
        }

        if (base != null && isLowOnPower()) {
            log.debug("Agent {} low on power ({}), heading home", agent.getId(), agent.getPower());
            startReturn(grid, base);
            return;
        }

        Optional<TargetRef> found = registry.findNearestEligible(agent.getPosition(), config.getSearchRadius());
        if (found.isEmpty()) {
            return;
        }

        TargetRef target = found.get();
        transitionTo(AgentState.MOVING_TO_TARGET, TaskTarget.target(target));
        if (!planTo(grid, grid.worldToGrid(registry.locate(target)))) {
            log.debug("Agent {} cannot reach target {}, staying idle", agent.getId(), target.getId());
            abandonTask();
        }
    }

    private void tickMovingToTarget(double dt, TileGrid grid, TargetRegistry registry) {
        TargetRef target = agent.getTask().requireTarget();

        if (!registry.isStillValid(target)) {
            log.debug("Agent {} target {} no longer valid", agent.getId(), target.getId());
            abandonTask();
            return;
        }

        WorldPosition targetPosition = registry.locate(target);
        if (agent.getPosition().distanceTo(targetPosition) <= config.getActionRadius()) {
            transitionTo(AgentState.PERFORMING_ACTION, agent.getTask());
            return;
        }

        if (needsRoute()) {
            if (!planTo(grid, grid.worldToGrid(targetPosition))) {
                log.debug("Agent {} lost its route to target {}", agent.getId(), target.getId());
                abandonTask();
                return;
            }
        }

        followPath(dt, grid, targetPosition);
    }

    private void tickPerformingAction(double dt, TargetRegistry registry) {
        TargetRef target = agent.getTask().requireTarget();

        if (!registry.isStillValid(target)) {
            log.debug("Agent {} target {} vanished before the action finished", agent.getId(), target.getId());
            abandonTask();
            return;
        }

        boolean complete;
        try {
            complete = actionHandler.perform(agent, target, dt);
        } catch (RuntimeException e) {
            log.error("Agent {} action on target {} failed", agent.getId(), target.getId(), e);
            abandonTask();
            return;
        }

        if (!complete) {
            return;
        }

        GridCoordinate base = agent.getBase();
        if (agent.getInventory().isFull() && base != null) {
            transitionTo(AgentState.RETURNING_TO_BASE, TaskTarget.base(base));
        } else {
            transitionTo(AgentState.IDLE, null);
        }
    }

    private void tickReturningToBase(double dt, TileGrid grid) {
        GridCoordinate base = agent.getTask().requireBase();
        WorldPosition baseCenter = grid.gridToWorldCenter(base);

        if (agent.getPosition().distanceTo(baseCenter) <= config.getBaseArrivalRadius()) {
            transitionTo(AgentState.UNLOADING, agent.getTask());
            return;
        }

        if (needsRoute() && !planTo(grid, base)) {
            // Base is expected to come back into reach; retry next tick
            log.debug("Agent {} has no route to base {}, retrying", agent.getId(), base);
            return;
        }

        followPath(dt, grid, baseCenter);
    }

    private void tickUnloading() {
        Map<String, Double> cargo = agent.getInventory().drain();
        if (!cargo.isEmpty()) {
            try {
                inventorySink.deposit(cargo);
                log.info("Agent {} unloaded {}", agent.getId(), cargo);
            } catch (RuntimeException e) {
                log.error("Agent {} failed to unload, keeping cargo", agent.getId(), e);
                cargo.forEach((material, quantity) -> agent.getInventory().add(material, quantity));
            }
        }
        agent.recharge();
        transitionTo(AgentState.IDLE, null);
    }

    private void startReturn(TileGrid grid, GridCoordinate base) {
        transitionTo(AgentState.RETURNING_TO_BASE, TaskTarget.base(base));
        if (!planTo(grid, base)) {
            log.debug("Agent {} has no route to base {} yet", agent.getId(), base);
        }
    }

    private boolean isLowOnPower() {
        if (agent.isPowerDepleted()) {
            return true;
        }
        return config.getLowPowerThreshold() > 0
                && agent.getPowerCapacity() > 0
                && agent.getPower() <= config.getLowPowerThreshold();
    }

    // ========================================================================
    // Routing
    // ========================================================================

    private boolean needsRoute() {
        return agent.getPath().isEmpty() || agent.isPathExhausted();
    }

    /**
     * Plan a route from the agent's tile to the goal and install it.
     *
     * @return false if no route exists; the agent's route is cleared in that case
     */
    private boolean planTo(TileGrid grid, GridCoordinate goal) {
        GridCoordinate start = grid.worldToGrid(agent.getPosition());
        planRequests++;
        resetStall();

        Optional<GridPath> route = pathFinder.findPath(grid, start, goal);
        if (route.isEmpty()) {
            failedPlans++;
            agent.clearPath();
            return false;
        }

        GridPath path = config.isSmoothPaths() ? pathFinder.smoothPath(grid, route.get()) : route.get();
        agent.setPath(path);
        log.trace("Agent {} planned {} -> {} with {} waypoints", agent.getId(), start, goal, path.size());
        return true;
    }

    // ========================================================================
    // Path following
    // ========================================================================

    /**
     * Move toward the next unconsumed waypoint: consume it when within the arrival
     * tolerance, otherwise step along the straight line to it.
     *
     * @param destination exact end point used in place of the last waypoint's centre
     */
    private void followPath(double dt, TileGrid grid, WorldPosition destination) {
        GridCoordinate waypointTile = agent.getCurrentWaypoint();
        if (waypointTile == null) {
            return;
        }

        WorldPosition waypoint = agent.isOnLastWaypoint() && grid.worldToGrid(destination).equals(waypointTile)
                ? destination
                : grid.gridToWorldCenter(waypointTile);

        WorldPosition position = agent.getPosition();
        double distance = position.distanceTo(waypoint);

        if (distance <= config.getArrivalTolerance()) {
            agent.advanceWaypoint();
            resetStall();
            log.trace("Agent {} reached waypoint {} ({}/{})",
                    agent.getId(), waypointTile, agent.getPathIndex(), agent.getPath().size());
            return;
        }

        // A waypoint that has since been built over cannot be entered
        if (!grid.isWalkable(waypointTile)) {
            recordStall(distance);
            return;
        }

        double step = agent.getSpeed() * dt;
        if (step >= distance) {
            agent.moveTo(waypoint);
        } else if (step > 0) {
            double scale = step / distance;
            agent.moveTo(position.translate((waypoint.getX() - position.getX()) * scale,
                    (waypoint.getY() - position.getY()) * scale));
        }

        if (step > 0) {
            agent.drainPower(config.getPowerDrainPerSecond() * dt);
        }
        recordStall(agent.getPosition().distanceTo(waypoint));
    }

    private void recordStall(double distance) {
        if (distance < lastWaypointDistance - PROGRESS_EPSILON) {
            stallTicks = 0;
        } else {
            stallTicks++;
        }
        lastWaypointDistance = distance;

        if (config.getStallTickLimit() > 0 && stallTicks >= config.getStallTickLimit()) {
            log.debug("Agent {} stalled for {} ticks on waypoint {}, replanning",
                    agent.getId(), stallTicks, agent.getCurrentWaypoint());
            agent.clearPath();
            resetStall();
        }
    }

    private void resetStall() {
        stallTicks = 0;
        lastWaypointDistance = Double.MAX_VALUE;
    }

    // ========================================================================
    // State Management
    // ========================================================================

    private void transitionTo(AgentState newState, TaskTarget task) {
        AgentState oldState = agent.getState();
        if (oldState != newState && !oldState.canTransitionTo(newState)) {
            throw new IllegalStateException("Invalid agent transition " + oldState + " -> " + newState);
        }
        agent.assign(newState, task);
        if (oldState != newState) {
            agent.clearPath();
            resetStall();
        }
        log.debug("Agent {} transitioned: {} -> {} ({})", agent.getId(), oldState, newState, task);
    }

    @Override
    public String toString() {
        return String.format("AgentController[agent=%d, state=%s, ticks=%d]", agent.getId(), agent.getState(), ticks);
    }
}
