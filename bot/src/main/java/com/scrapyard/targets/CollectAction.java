package com.scrapyard.targets;

import com.scrapyard.state.Agent;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads as much of a collectible as the agent can carry, in a single tick.
 */
@Slf4j
public class CollectAction implements ActionHandler {

    private final InMemoryTargetRegistry registry;

    public CollectAction(InMemoryTargetRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean perform(Agent agent, TargetRef target, double dt) {
        Collectible collectible = registry.get(target);
        if (collectible == null) {
            return true;
        }

        double taken = collectible.take(agent.getInventory().getFreeSpace());
        double added = agent.getInventory().add(collectible.getMaterial(), taken);
        if (added > 0) {
            log.debug("Agent {} collected {}kg of {}", agent.getId(), added, collectible.getMaterial());
        }
        if (agent.getInventory().isFull()) {
            log.debug("Agent {} inventory is full", agent.getId());
        }
        return true;
    }
}
