package com.scrapyard.state;

import com.scrapyard.navigation.GridCoordinate;
import com.scrapyard.navigation.GridPath;
import com.scrapyard.navigation.WorldPosition;
import com.scrapyard.tasks.AgentState;
import com.scrapyard.tasks.TaskTarget;
import lombok.Getter;
import lombok.Setter;

import javax.annotation.Nullable;

/**
 * A grid-bound robot: continuous position, behavioural state, current route and cargo.
 *
 * <p>Invariants:
 * <ul>
 *   <li>A non-IDLE state always has a task target; IDLE never has one</li>
 *   <li>{@code pathIndex} stays in [0, path size]; equal to the size means exhausted</li>
 *   <li>The inventory load never exceeds its capacity</li>
 * </ul>
 *
 * <p>The agent borrows the grid and the registry from its host and owns neither.
 */
@Getter
public class Agent {

    private final long id;

    private WorldPosition position;

    /**
     * Movement speed in world units per second.
     */
    @Setter
    private double speed;

    private AgentState state = AgentState.IDLE;

    @Nullable
    private TaskTarget task;

    private GridPath path = GridPath.empty();

    private int pathIndex;

    /**
     * Home tile, where the inventory is unloaded. Null until the host assigns one.
     */
    @Nullable
    @Setter
    private GridCoordinate base;

    private final Inventory inventory;

    private final double powerCapacity;

    private double power;

    public Agent(long id, WorldPosition position, double speed, double capacity, double powerCapacity) {
        if (position == null) {
            throw new NullPointerException("position");
        }
        if (speed < 0) {
            throw new IllegalArgumentException("Speed must not be negative: " + speed);
        }
        this.id = id;
        this.position = position;
        this.speed = speed;
        this.inventory = new Inventory(capacity);
        this.powerCapacity = powerCapacity;
        this.power = powerCapacity;
    }

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Enter a state with its task target.
     *
     * @param newState the state
     * @param newTask  the target, required for every state but IDLE
     * @throws IllegalStateException if the pairing breaks the task invariant
     */
    public void assign(AgentState newState, @Nullable TaskTarget newTask) {
        if (newState.requiresTaskTarget() && newTask == null) {
            throw new IllegalStateException("State " + newState + " requires a task target");
        }
        if (!newState.requiresTaskTarget() && newTask != null) {
            throw new IllegalStateException("State " + newState + " cannot hold a task target");
        }
        this.state = newState;
        this.task = newTask;
    }

    // ========================================================================
    // Path
    // ========================================================================

    /**
     * Replace the current route and start from its first waypoint.
     */
    public void setPath(GridPath newPath) {
        this.path = newPath == null ? GridPath.empty() : newPath;
        this.pathIndex = 0;
    }

    public void clearPath() {
        setPath(GridPath.empty());
    }

    /**
     * Check if every waypoint has been consumed (or there is no route at all).
     */
    public boolean isPathExhausted() {
        return pathIndex >= path.size();
    }

    /**
     * Get the next unconsumed waypoint, or null if the path is exhausted.
     */
    @Nullable
    public GridCoordinate getCurrentWaypoint() {
        return isPathExhausted() ? null : path.get(pathIndex);
    }

    public boolean isOnLastWaypoint() {
        return !path.isEmpty() && pathIndex == path.size() - 1;
    }

    public void advanceWaypoint() {
        if (pathIndex < path.size()) {
            pathIndex++;
        }
    }

    // ========================================================================
    // Movement and power
    // ========================================================================

    public void moveTo(WorldPosition newPosition) {
        if (newPosition == null) {
            throw new NullPointerException("position");
        }
        this.position = newPosition;
    }

    public boolean isPowerDepleted() {
        return powerCapacity > 0 && power <= 0;
    }

    public void drainPower(double amount) {
        power = Math.max(0, power - amount);
    }

    public void recharge() {
        power = powerCapacity;
    }

    @Override
    public String toString() {
        return String.format("Agent(id=%d, pos=%s, state=%s, load=%.1f/%.1fkg)",
                id, position, state, inventory.getLoad(), inventory.getCapacity());
    }
}
