package com.scrapyard.navigation;

import lombok.experimental.UtilityClass;

/**
 * Single-step movement legality on a {@link TileGrid}.
 *
 * <p>Shared by {@link PathFinder} and {@link LineOfSight} so that search and smoothing agree
 * on which steps are legal, in particular the corner-cutting rule: a diagonal step is only
 * legal when both orthogonal tiles it passes between are walkable.
 */
@UtilityClass
public class MovementRules {

    /**
     * Check if an agent on {@code from} may step by (dx, dy), each component in [-1, 1].
     *
     * @param grid the grid
     * @param from the source tile
     * @param dx   column step
     * @param dy   row step
     * @return true if the destination is walkable and, for diagonal steps, neither
     *         flanking orthogonal tile is blocked
     */
    public boolean canStep(TileGrid grid, GridCoordinate from, int dx, int dy) {
        if (!grid.isWalkable(from.offset(dx, dy))) {
            return false;
        }
        if (dx != 0 && dy != 0) {
            return grid.isWalkable(from.offset(dx, 0)) && grid.isWalkable(from.offset(0, dy));
        }
        return true;
    }

    /**
     * Check if the step between two adjacent (or identical) tiles is legal.
     */
    public boolean isLegalStep(TileGrid grid, GridCoordinate from, GridCoordinate to) {
        int dx = to.getColumn() - from.getColumn();
        int dy = to.getRow() - from.getRow();
        if (Math.abs(dx) > 1 || Math.abs(dy) > 1) {
            return false;
        }
        if (dx == 0 && dy == 0) {
            return grid.isWalkable(to);
        }
        return canStep(grid, from, dx, dy);
    }
}
