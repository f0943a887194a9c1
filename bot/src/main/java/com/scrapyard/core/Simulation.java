package com.scrapyard.core;

import com.scrapyard.navigation.GridCoordinate;
import com.scrapyard.navigation.TileGrid;
import com.scrapyard.navigation.WorldPosition;
import com.scrapyard.state.Agent;
import com.scrapyard.targets.TargetRegistry;
import com.scrapyard.tasks.AgentController;
import com.scrapyard.tasks.AgentControllerFactory;
import com.scrapyard.tasks.AgentState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Host loop owning the agents.
 *
 * <p>Every {@link #tick(double)} advances each agent once, in spawn order. The grid and the
 * target registry belong to the host world; agents only borrow them for the tick.
 */
@Slf4j
public class Simulation {

    @Getter
    private final TileGrid grid;

    @Getter
    private final TargetRegistry registry;

    private final AgentControllerFactory controllerFactory;

    private final Map<Long, AgentController> controllers = new LinkedHashMap<>();
    private final AtomicLong nextAgentId = new AtomicLong(1);

    @Nullable
    @Getter
    private GridCoordinate base;

    @Getter
    private long tickCount;

    @Inject
    public Simulation(TileGrid grid, TargetRegistry registry, AgentControllerFactory controllerFactory) {
        this.grid = grid;
        this.registry = registry;
        this.controllerFactory = controllerFactory;
    }

    /**
     * Create an agent at the given position, configured from the navigator config.
     */
    public Agent spawnAgent(WorldPosition position) {
        Agent agent = controllerFactory.newAgent(nextAgentId.getAndIncrement(), position);
        agent.setBase(base);
        controllers.put(agent.getId(), controllerFactory.create(agent));
        log.info("Spawned agent {} at {}", agent.getId(), position);
        return agent;
    }

    public boolean removeAgent(long id) {
        AgentController removed = controllers.remove(id);
        if (removed == null) {
            return false;
        }
        log.info("Removed agent {} ({})", id, removed.getAgent().getState());
        return true;
    }

    /**
     * Set the unloading point for all current and future agents.
     */
    public void setBase(@Nullable GridCoordinate base) {
        this.base = base;
        for (AgentController controller : controllers.values()) {
            controller.getAgent().setBase(base);
        }
        log.debug("Base set to {}", base);
    }

    /**
     * Advance every agent by one time step.
     */
    public void tick(double dt) {
        tickCount++;
        for (AgentController controller : new ArrayList<>(controllers.values())) {
            controller.tick(dt, grid, registry);
        }
    }

    /**
     * Run a number of fixed-size ticks.
     */
    public void run(int ticks, double dt) {
        for (int i = 0; i < ticks; i++) {
            tick(dt);
        }
    }

    public List<Agent> getAgents() {
        List<Agent> agents = new ArrayList<>(controllers.size());
        for (AgentController controller : controllers.values()) {
            agents.add(controller.getAgent());
        }
        return agents;
    }

    @Nullable
    public Agent getAgent(long id) {
        AgentController controller = controllers.get(id);
        return controller != null ? controller.getAgent() : null;
    }

    @Nullable
    public AgentController getController(long id) {
        return controllers.get(id);
    }

    public long countByState(AgentState state) {
        return controllers.values().stream()
                .filter(c -> c.getAgent().getState() == state)
                .count();
    }
}
