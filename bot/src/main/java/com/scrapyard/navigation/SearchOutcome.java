package com.scrapyard.navigation;

/**
 * How a single path search ended.
 *
 * <p>Callers that only need a route should use {@link PathFinder#findPath}; every outcome
 * other than {@link #FOUND} collapses to "no path" there.
 */
public enum SearchOutcome {

    /**
     * A route to the goal was found.
     */
    FOUND,

    /**
     * Start or goal was out of bounds or not walkable when the search began.
     */
    INVALID_ENDPOINT,

    /**
     * The open set ran dry: the goal is walled off from the start.
     */
    UNREACHABLE,

    /**
     * The expansion ceiling was hit before the goal was reached.
     */
    ITERATION_LIMIT;

    public boolean isFound() {
        return this == FOUND;
    }
}
