package com.scrapyard.navigation;

/**
 * Remaining-cost estimates for the A* search.
 */
public enum Heuristic {

    /**
     * |dx| + |dy|. Cheap, but it overestimates diagonal travel (2 against sqrt(2)), so
     * routes found with it are not guaranteed to be the cheapest.
     */
    MANHATTAN {
        @Override
        public double estimate(GridCoordinate from, GridCoordinate to) {
            return from.manhattanDistance(to);
        }
    },

    /**
     * Exact cost of the unobstructed 8-directional route: straight diagonal plus the
     * cardinal remainder. Admissible and consistent for this grid's edge costs.
     */
    OCTILE {
        @Override
        public double estimate(GridCoordinate from, GridCoordinate to) {
            int dx = Math.abs(from.getColumn() - to.getColumn());
            int dy = Math.abs(from.getRow() - to.getRow());
            return Math.max(dx, dy) + (Math.sqrt(2) - 1) * Math.min(dx, dy);
        }
    };

    public abstract double estimate(GridCoordinate from, GridCoordinate to);
}
