package com.scrapyard.navigation;

import com.scrapyard.config.NavigatorConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * A* pathfinding on the tile grid.
 *
 * <p>Features:
 * <ul>
 *   <li>8-directional movement, cost 1 cardinal and sqrt(2) diagonal</li>
 *   <li>No corner cutting: a diagonal step needs both flanking orthogonal tiles walkable</li>
 *   <li>Deterministic ties: equal f goes to the lower h, then to the earlier discovery</li>
 *   <li>Closed tiles are never reopened</li>
 *   <li>Expansion ceiling guarding against runaway searches</li>
 *   <li>Line-of-sight path smoothing</li>
 * </ul>
 *
 * <p>The finder keeps no state between calls. The grid is passed to every call, so one
 * instance serves any number of grids and agents.
 */
@Slf4j
@Singleton
public class PathFinder {

    public static final int DEFAULT_MAX_EXPANSIONS = 1000;

    private static final double CARDINAL_COST = 1.0;
    private static final double DIAGONAL_COST = Math.sqrt(2);

    /**
     * Movement directions as (dColumn, dRow), rows growing downwards:
     * N, E, S, W, NE, SE, SW, NW.
     */
    private static final int[][] DIRECTIONS = {
            {0, -1},  // N
            {1, 0},   // E
            {0, 1},   // S
            {-1, 0},  // W
            {1, -1},  // NE
            {1, 1},   // SE
            {-1, 1},  // SW
            {-1, -1}  // NW
    };

    private static final Comparator<Node> OPEN_ORDER = Comparator
            .comparingDouble((Node n) -> n.f)
            .thenComparingDouble(n -> n.h)
            .thenComparingInt(n -> n.handle);

    @Getter
    private final int maxExpansions;

    @Getter
    private final Heuristic heuristic;

    public PathFinder() {
        this(DEFAULT_MAX_EXPANSIONS, Heuristic.OCTILE);
    }

    @Inject
    public PathFinder(NavigatorConfig config) {
        this(config.getMaxSearchIterations(), config.getHeuristic());
    }

    public PathFinder(int maxExpansions, Heuristic heuristic) {
        if (maxExpansions <= 0) {
            throw new IllegalArgumentException("maxExpansions must be positive: " + maxExpansions);
        }
        this.maxExpansions = maxExpansions;
        this.heuristic = heuristic;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Find a route from start to goal.
     *
     * @param grid  the grid to search
     * @param start the starting tile
     * @param goal  the destination tile
     * @return the route, or empty if either endpoint is not walkable, the goal is
     *         unreachable or the search hit its expansion ceiling
     */
    public Optional<GridPath> findPath(TileGrid grid, GridCoordinate start, GridCoordinate goal) {
        return search(grid, start, goal).getRoute();
    }

    /**
     * Check if a route exists between two tiles.
     */
    public boolean hasPath(TileGrid grid, GridCoordinate start, GridCoordinate goal) {
        return search(grid, start, goal).isFound();
    }

    /**
     * Run a search and report how it ended.
     *
     * @param grid  the grid to search
     * @param start the starting tile
     * @param goal  the destination tile
     * @return the search result with outcome and expansion count
     */
    public SearchResult search(TileGrid grid, GridCoordinate start, GridCoordinate goal) {
        if (grid == null || start == null || goal == null) {
            throw new NullPointerException("grid, start and goal are required");
        }

        if (!grid.isWalkable(start) || !grid.isWalkable(goal)) {
            log.debug("PathFinder: endpoint not walkable ({} -> {})", start, goal);
            return SearchResult.failed(SearchOutcome.INVALID_ENDPOINT, 0);
        }

        // Already at destination
        if (start.equals(goal)) {
            return SearchResult.found(GridPath.of(start), 0);
        }

        SearchResult result = runAStar(grid, start, goal);
        if (result.isFound()) {
            log.debug("PathFinder: found path with {} tiles from {} to {} ({} expansions)",
                    result.getPath().size(), start, goal, result.getExpansions());
        } else {
            log.debug("PathFinder: no path from {} to {} ({})", start, goal, result.getOutcome());
        }
        return result;
    }

    /**
     * Remove waypoints that can be skipped along a clear line of sight.
     *
     * <p>From each kept waypoint the farthest later waypoint with a clear sightline becomes
     * the next kept waypoint; if none is visible, the next waypoint is kept as is.
     * The first and last waypoints always survive, and smoothing a smoothed path returns it
     * unchanged.
     *
     * @param grid the grid the path was planned on
     * @param path the path to smooth
     * @return the smoothed path
     */
    public GridPath smoothPath(TileGrid grid, GridPath path) {
        if (path == null || path.size() <= 2) {
            return path;
        }

        List<GridCoordinate> waypoints = path.getWaypoints();
        List<GridCoordinate> smoothed = new ArrayList<>();
        smoothed.add(waypoints.get(0));

        int current = 0;
        while (current < waypoints.size() - 1) {
            int next = current + 1;
            for (int i = waypoints.size() - 1; i > current + 1; i--) {
                if (LineOfSight.isClear(grid, waypoints.get(current), waypoints.get(i))) {
                    next = i;
                    break;
                }
            }
            smoothed.add(waypoints.get(next));
            current = next;
        }

        if (smoothed.size() < waypoints.size()) {
            log.trace("PathFinder: smoothed {} waypoints down to {}", waypoints.size(), smoothed.size());
        }
        return GridPath.of(smoothed);
    }

    // ========================================================================
    // A* Implementation
    // ========================================================================

    private SearchResult runAStar(TileGrid grid, GridCoordinate start, GridCoordinate goal) {
        NodeArena arena = new NodeArena();
        PriorityQueue<Node> openSet = new PriorityQueue<>(OPEN_ORDER);

        Node startNode = arena.create(start);
        startNode.g = 0;
        startNode.h = heuristic.estimate(start, goal);
        startNode.f = startNode.h;
        startNode.open = true;
        openSet.add(startNode);

        int expansions = 0;

        while (!openSet.isEmpty()) {
            if (expansions >= maxExpansions) {
                log.warn("PathFinder: max expansions ({}) reached searching {} -> {}, search abandoned",
                        maxExpansions, start, goal);
                return SearchResult.failed(SearchOutcome.ITERATION_LIMIT, expansions);
            }

            Node current = openSet.poll();
            current.open = false;
            current.closed = true;
            expansions++;

            if (current.coordinate.equals(goal)) {
                return SearchResult.found(reconstructPath(arena, current), expansions);
            }

            for (int[] direction : DIRECTIONS) {
                int dx = direction[0];
                int dy = direction[1];
                GridCoordinate neighborCoord = current.coordinate.offset(dx, dy);

                Node neighbor = arena.find(neighborCoord);
                if (neighbor != null && neighbor.closed) {
                    continue;
                }
                if (!MovementRules.canStep(grid, current.coordinate, dx, dy)) {
                    continue;
                }

                double moveCost = (dx != 0 && dy != 0) ? DIAGONAL_COST : CARDINAL_COST;
                double tentativeG = current.g + moveCost;

                if (neighbor == null) {
                    neighbor = arena.create(neighborCoord);
                } else if (tentativeG >= neighbor.g) {
                    continue;
                }

                // Re-key: a node must leave the heap before its priority changes
                if (neighbor.open) {
                    openSet.remove(neighbor);
                }
                neighbor.parent = current.handle;
                neighbor.g = tentativeG;
                neighbor.h = heuristic.estimate(neighborCoord, goal);
                neighbor.f = neighbor.g + neighbor.h;
                neighbor.open = true;
                openSet.add(neighbor);
            }
        }

        return SearchResult.failed(SearchOutcome.UNREACHABLE, expansions);
    }

    /**
     * Walk parent handles from the goal back to the start, then reverse.
     */
    private GridPath reconstructPath(NodeArena arena, Node goal) {
        List<GridCoordinate> path = new ArrayList<>();
        Node current = goal;
        while (current != null) {
            path.add(current.coordinate);
            current = arena.get(current.parent);
        }
        Collections.reverse(path);
        return GridPath.of(path);
    }

    // ========================================================================
    // Inner Classes
    // ========================================================================

    /**
     * Per-search node table. Nodes reference their parent by handle (index into the
     * table), and the whole table is dropped when the search returns.
     */
    private static final class NodeArena {
        private final List<Node> nodes = new ArrayList<>();
        private final Map<GridCoordinate, Node> byCoordinate = new HashMap<>();

        Node create(GridCoordinate coordinate) {
            Node node = new Node(nodes.size(), coordinate);
            nodes.add(node);
            byCoordinate.put(coordinate, node);
            return node;
        }

        Node find(GridCoordinate coordinate) {
            return byCoordinate.get(coordinate);
        }

        Node get(int handle) {
            return handle == Node.NO_PARENT ? null : nodes.get(handle);
        }
    }

    /**
     * A* search node.
     */
    private static final class Node {
        static final int NO_PARENT = -1;

        final int handle;
        final GridCoordinate coordinate;
        int parent = NO_PARENT;
        double g = Double.MAX_VALUE;
        double h;
        double f = Double.MAX_VALUE;
        boolean open;
        boolean closed;

        Node(int handle, GridCoordinate coordinate) {
            this.handle = handle;
            this.coordinate = coordinate;
        }
    }
}
