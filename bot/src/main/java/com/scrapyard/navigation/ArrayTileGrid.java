package com.scrapyard.navigation;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Array-backed {@link TileGrid} holding a {@link TileType} and an occupancy flag per tile.
 *
 * <p>A tile is walkable when it is in bounds, its type does not block and nothing
 * occupies it. Occupancy models static obstacles placed on otherwise open ground
 * (construction sites, dropped machinery).
 */
@Slf4j
public class ArrayTileGrid implements TileGrid {

    public static final int DEFAULT_TILE_SIZE = 32;

    /**
     * Map symbol for a walkable tile occupied by a static obstacle.
     */
    public static final char OCCUPIED_SYMBOL = 'o';

    @Getter
    private final int width;

    @Getter
    private final int height;

    @Getter
    private final int tileSize;

    private final TileType[][] tiles;
    private final boolean[][] occupied;

    public ArrayTileGrid(int width, int height) {
        this(width, height, DEFAULT_TILE_SIZE);
    }

    public ArrayTileGrid(int width, int height, int tileSize) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
        this.width = width;
        this.height = height;
        this.tileSize = tileSize;
        this.tiles = new TileType[height][width];
        this.occupied = new boolean[height][width];
        for (TileType[] row : tiles) {
            Arrays.fill(row, TileType.GRASS);
        }
        log.debug("Created grid {}x{} tiles ({}x{} world units)", width, height, width * tileSize, height * tileSize);
    }

    /**
     * Build a grid from ASCII rows, one string per row, using {@link TileType#getSymbol()}
     * plus {@link #OCCUPIED_SYMBOL} for occupied grass.
     *
     * @param tileSize tile edge length in world units
     * @param rows     map rows, all of the same length
     * @return the parsed grid
     */
    public static ArrayTileGrid fromRows(int tileSize, String... rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("Map must have at least one row");
        }
        int width = rows[0].length();
        ArrayTileGrid grid = new ArrayTileGrid(width, rows.length, tileSize);
        for (int row = 0; row < rows.length; row++) {
            if (rows[row].length() != width) {
                throw new IllegalArgumentException("Row " + row + " has length " + rows[row].length()
                        + ", expected " + width);
            }
            for (int column = 0; column < width; column++) {
                char symbol = rows[row].charAt(column);
                if (symbol == OCCUPIED_SYMBOL) {
                    grid.occupied[row][column] = true;
                } else {
                    grid.tiles[row][column] = TileType.fromSymbol(symbol);
                }
            }
        }
        return grid;
    }

    public boolean isInBounds(GridCoordinate coordinate) {
        return coordinate.getColumn() >= 0 && coordinate.getColumn() < width
                && coordinate.getRow() >= 0 && coordinate.getRow() < height;
    }

    @Override
    public boolean isWalkable(GridCoordinate coordinate) {
        if (!isInBounds(coordinate)) {
            return false;
        }
        int column = coordinate.getColumn();
        int row = coordinate.getRow();
        return !tiles[row][column].isBlocking() && !occupied[row][column];
    }

    /**
     * Get the tile type, or null when out of bounds.
     */
    public TileType getTileType(GridCoordinate coordinate) {
        return isInBounds(coordinate) ? tiles[coordinate.getRow()][coordinate.getColumn()] : null;
    }

    public void setTileType(GridCoordinate coordinate, TileType type) {
        requireInBounds(coordinate);
        tiles[coordinate.getRow()][coordinate.getColumn()] = type;
    }

    public boolean isOccupied(GridCoordinate coordinate) {
        return isInBounds(coordinate) && occupied[coordinate.getRow()][coordinate.getColumn()];
    }

    public void setOccupied(GridCoordinate coordinate, boolean value) {
        requireInBounds(coordinate);
        occupied[coordinate.getRow()][coordinate.getColumn()] = value;
    }

    /**
     * Fill a rectangle (inclusive corners) with a tile type.
     */
    public void fill(GridCoordinate from, GridCoordinate to, TileType type) {
        int minColumn = Math.max(0, Math.min(from.getColumn(), to.getColumn()));
        int maxColumn = Math.min(width - 1, Math.max(from.getColumn(), to.getColumn()));
        int minRow = Math.max(0, Math.min(from.getRow(), to.getRow()));
        int maxRow = Math.min(height - 1, Math.max(from.getRow(), to.getRow()));
        for (int row = minRow; row <= maxRow; row++) {
            for (int column = minColumn; column <= maxColumn; column++) {
                tiles[row][column] = type;
            }
        }
    }

    private void requireInBounds(GridCoordinate coordinate) {
        if (!isInBounds(coordinate)) {
            throw new IllegalArgumentException("Coordinate " + coordinate + " outside " + width + "x" + height + " grid");
        }
    }

    @Override
    public String toString() {
        return "ArrayTileGrid(" + width + "x" + height + ", tileSize=" + tileSize + ")";
    }
}
