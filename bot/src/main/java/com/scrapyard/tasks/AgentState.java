package com.scrapyard.tasks;

/**
 * Behavioural state of an agent. Exactly one is active per agent per tick.
 *
 * <p>The machine has no terminal state:
 * IDLE -> MOVING_TO_TARGET -> PERFORMING_ACTION -> (IDLE | RETURNING_TO_BASE)
 * and RETURNING_TO_BASE -> UNLOADING -> IDLE.
 */
public enum AgentState {

    /**
     * Looking for work. The only state without a task target.
     */
    IDLE,

    /**
     * Travelling to a target picked from the registry.
     */
    MOVING_TO_TARGET,

    /**
     * In range of the target and acting on it.
     */
    PERFORMING_ACTION,

    /**
     * Travelling home with a full inventory or low power.
     */
    RETURNING_TO_BASE,

    /**
     * At base, handing the inventory over.
     */
    UNLOADING;

    /**
     * Check if an agent in this state must hold a task target.
     */
    public boolean requiresTaskTarget() {
        return this != IDLE;
    }

    /**
     * Check if this state follows a path.
     */
    public boolean isTravelling() {
        return this == MOVING_TO_TARGET || this == RETURNING_TO_BASE;
    }

    /**
     * Check if the machine may move from this state to the given one.
     *
     * @param to the target state
     * @return true if the transition is part of the machine
     */
    public boolean canTransitionTo(AgentState to) {
        switch (this) {
            case IDLE:
                return to == MOVING_TO_TARGET || to == RETURNING_TO_BASE;
            case MOVING_TO_TARGET:
                return to == IDLE || to == PERFORMING_ACTION;
            case PERFORMING_ACTION:
                return to == IDLE || to == RETURNING_TO_BASE;
            case RETURNING_TO_BASE:
                return to == UNLOADING || to == IDLE;
            case UNLOADING:
                return to == IDLE;
            default:
                return false;
        }
    }
}
