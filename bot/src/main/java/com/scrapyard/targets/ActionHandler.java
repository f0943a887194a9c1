package com.scrapyard.targets;

import com.scrapyard.state.Agent;

/**
 * The domain action an agent performs once in range of its target.
 *
 * @see CollectAction
 */
public interface ActionHandler {

    /**
     * Perform one tick of the action.
     *
     * @param agent  the acting agent
     * @param target the target in range
     * @param dt     elapsed time in seconds
     * @return true when the action is finished
     */
    boolean perform(Agent agent, TargetRef target, double dt);
}
