package com.scrapyard.navigation;

import lombok.Value;

import java.util.Optional;

/**
 * Diagnostic result of one {@link PathFinder} search.
 */
@Value
public class SearchResult {

    SearchOutcome outcome;

    /**
     * The route, empty unless {@link #outcome} is {@link SearchOutcome#FOUND}.
     */
    GridPath path;

    /**
     * Number of nodes taken off the open set and expanded.
     */
    int expansions;

    static SearchResult found(GridPath path, int expansions) {
        return new SearchResult(SearchOutcome.FOUND, path, expansions);
    }

    static SearchResult failed(SearchOutcome outcome, int expansions) {
        return new SearchResult(outcome, GridPath.empty(), expansions);
    }

    public boolean isFound() {
        return outcome.isFound();
    }

    public Optional<GridPath> getRoute() {
        return isFound() ? Optional.of(path) : Optional.empty();
    }
}
