package com.scrapyard.navigation;

import lombok.experimental.UtilityClass;

/**
 * Grid line-of-sight using an integer Bresenham walk.
 */
@UtilityClass
public class LineOfSight {

    /**
     * Check if a straight line between two tile centres stays on walkable tiles.
     *
     * <p>The walk rejects the line at the first non-walkable tile, and also when a diagonal
     * step of the raster squeezes between two blocked orthogonal tiles.
     *
     * @param grid the grid
     * @param from start tile
     * @param to   end tile
     * @return true if the sightline is clear
     */
    public boolean isClear(TileGrid grid, GridCoordinate from, GridCoordinate to) {
        int x = from.getColumn();
        int y = from.getRow();
        int x1 = to.getColumn();
        int y1 = to.getRow();

        int dx = Math.abs(x1 - x);
        int dy = Math.abs(y1 - y);
        int sx = x < x1 ? 1 : -1;
        int sy = y < y1 ? 1 : -1;
        int err = dx - dy;

        if (!grid.isWalkable(from)) {
            return false;
        }

        while (x != x1 || y != y1) {
            int e2 = 2 * err;
            int stepX = 0;
            int stepY = 0;
            if (e2 > -dy) {
                err -= dy;
                stepX = sx;
            }
            if (e2 < dx) {
                err += dx;
                stepY = sy;
            }
            if (!MovementRules.canStep(grid, new GridCoordinate(x, y), stepX, stepY)) {
                return false;
            }
            x += stepX;
            y += stepY;
        }
        return true;
    }
}
