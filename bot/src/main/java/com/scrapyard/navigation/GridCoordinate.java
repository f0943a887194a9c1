package com.scrapyard.navigation;

import lombok.Value;

/**
 * An integer tile position on the grid (column, row).
 *
 * <p>Rows grow downwards, matching world space where y increases towards the bottom
 * of the map.
 */
@Value
public class GridCoordinate {

    int column;
    int row;

    public static GridCoordinate of(int column, int row) {
        return new GridCoordinate(column, row);
    }

    /**
     * Get the coordinate shifted by the given offset.
     */
    public GridCoordinate offset(int dColumn, int dRow) {
        return new GridCoordinate(column + dColumn, row + dRow);
    }

    /**
     * Manhattan distance (|dx| + |dy|) to another coordinate.
     */
    public int manhattanDistance(GridCoordinate other) {
        return Math.abs(column - other.column) + Math.abs(row - other.row);
    }

    /**
     * Chebyshev distance (max(|dx|, |dy|)) to another coordinate.
     */
    public int chebyshevDistance(GridCoordinate other) {
        return Math.max(Math.abs(column - other.column), Math.abs(row - other.row));
    }

    /**
     * Check if the other coordinate is one of the 8 neighbours of this one.
     */
    public boolean isAdjacentTo(GridCoordinate other) {
        return chebyshevDistance(other) == 1;
    }

    /**
     * Check if the step to the other coordinate changes both column and row.
     */
    public boolean isDiagonalTo(GridCoordinate other) {
        return column != other.column && row != other.row;
    }

    @Override
    public String toString() {
        return "(" + column + ", " + row + ")";
    }
}
