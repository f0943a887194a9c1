package com.scrapyard.tasks;

import com.scrapyard.config.NavigatorConfig;
import com.scrapyard.navigation.PathFinder;
import com.scrapyard.navigation.WorldPosition;
import com.scrapyard.state.Agent;
import com.scrapyard.targets.ActionHandler;
import com.scrapyard.targets.InventorySink;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Creates one {@link AgentController} per agent around the shared collaborators.
 */
@Singleton
public class AgentControllerFactory {

    private final PathFinder pathFinder;
    private final ActionHandler actionHandler;
    private final InventorySink inventorySink;
    private final NavigatorConfig config;

    @Inject
    public AgentControllerFactory(PathFinder pathFinder,
                                  ActionHandler actionHandler,
                                  InventorySink inventorySink,
                                  NavigatorConfig config) {
        this.pathFinder = pathFinder;
        this.actionHandler = actionHandler;
        this.inventorySink = inventorySink;
        this.config = config;
    }

    public AgentController create(Agent agent) {
        return new AgentController(agent, pathFinder, actionHandler, inventorySink, config);
    }

    /**
     * Create a new agent with the configured speed, capacity and power.
     */
    public Agent newAgent(long id, WorldPosition position) {
        return new Agent(id, position, config.getAgentSpeed(), config.getAgentCapacity(), config.getPowerCapacity());
    }
}
