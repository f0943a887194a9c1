package com.scrapyard.navigation;

/**
 * Walkability and coordinate conversion for a tile grid.
 *
 * <p>The navigation core only reads from the grid. Mutation (construction, deconstruction,
 * occupancy changes) belongs to the owner of the grid, and the owner must keep the grid
 * stable for the duration of a tick if agents are updated in parallel.
 *
 * @see ArrayTileGrid
 */
public interface TileGrid {

    /**
     * Check if an agent may stand on or traverse the tile.
     *
     * @param coordinate the tile
     * @return true iff the tile is in bounds, its type does not block movement and
     *         it is not occupied by a static obstacle
     */
    boolean isWalkable(GridCoordinate coordinate);

    /**
     * Size of one tile edge in world units.
     */
    int getTileSize();

    /**
     * Convert a world position to the tile that contains it.
     */
    default GridCoordinate worldToGrid(double worldX, double worldY) {
        int tileSize = getTileSize();
        return new GridCoordinate((int) Math.floor(worldX / tileSize), (int) Math.floor(worldY / tileSize));
    }

    default GridCoordinate worldToGrid(WorldPosition position) {
        return worldToGrid(position.getX(), position.getY());
    }

    /**
     * Convert a tile to the world position of its top-left corner.
     */
    default WorldPosition gridToWorld(GridCoordinate coordinate) {
        int tileSize = getTileSize();
        return new WorldPosition((double) coordinate.getColumn() * tileSize, (double) coordinate.getRow() * tileSize);
    }

    /**
     * Convert a tile to the world position of its centre.
     */
    default WorldPosition gridToWorldCenter(GridCoordinate coordinate) {
        double half = getTileSize() / 2.0;
        return gridToWorld(coordinate).translate(half, half);
    }
}
