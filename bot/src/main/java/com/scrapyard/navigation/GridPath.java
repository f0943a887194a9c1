package com.scrapyard.navigation;

import lombok.EqualsAndHashCode;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable route over the grid, from start to goal inclusive.
 *
 * <p>Paths straight out of {@link PathFinder} step between adjacent tiles. Smoothed paths
 * may jump several tiles between waypoints along a clear line of sight.
 */
@EqualsAndHashCode
public final class GridPath {

    private static final GridPath EMPTY = new GridPath(Collections.emptyList());

    private static final double DIAGONAL_COST = Math.sqrt(2);

    private final List<GridCoordinate> waypoints;

    private GridPath(List<GridCoordinate> waypoints) {
        this.waypoints = waypoints;
    }

    public static GridPath of(List<GridCoordinate> waypoints) {
        if (waypoints == null || waypoints.isEmpty()) {
            return EMPTY;
        }
        return new GridPath(Collections.unmodifiableList(new ArrayList<>(waypoints)));
    }

    public static GridPath of(GridCoordinate... waypoints) {
        return of(List.of(waypoints));
    }

    public static GridPath empty() {
        return EMPTY;
    }

    public List<GridCoordinate> getWaypoints() {
        return waypoints;
    }

    public int size() {
        return waypoints.size();
    }

    public boolean isEmpty() {
        return waypoints.isEmpty();
    }

    public GridCoordinate get(int index) {
        return waypoints.get(index);
    }

    @Nullable
    public GridCoordinate getStart() {
        return isEmpty() ? null : waypoints.get(0);
    }

    @Nullable
    public GridCoordinate getGoal() {
        return isEmpty() ? null : waypoints.get(waypoints.size() - 1);
    }

    /**
     * Total travel cost in tiles: 1 per cardinal step, sqrt(2) per diagonal step and the
     * Euclidean length for longer segments of a smoothed path.
     */
    public double weightedLength() {
        double length = 0;
        for (int i = 1; i < waypoints.size(); i++) {
            length += segmentCost(waypoints.get(i - 1), waypoints.get(i));
        }
        return length;
    }

    static double segmentCost(GridCoordinate from, GridCoordinate to) {
        int dx = Math.abs(to.getColumn() - from.getColumn());
        int dy = Math.abs(to.getRow() - from.getRow());
        if (dx <= 1 && dy <= 1) {
            return dx + dy == 2 ? DIAGONAL_COST : dx + dy;
        }
        return Math.hypot(dx, dy);
    }

    @Override
    public String toString() {
        return "GridPath" + waypoints;
    }
}
