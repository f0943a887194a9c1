package com.scrapyard.navigation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of terrain a tile can hold.
 */
@Getter
@RequiredArgsConstructor
public enum TileType {

    EMPTY('_', false),
    GRASS('.', false),
    DIRT(',', false),
    LANDFILL('%', false),
    ROAD_DIRT('=', false),
    ROAD_TAR('-', false),
    ROAD_ASPHALT('+', false),

    /**
     * Factory footprint. Robots unload next to it, never on it.
     */
    FACTORY('F', true),

    BUILDING('#', true),

    /**
     * Rivers and ocean. Bridges are modelled as walkable road tiles.
     */
    WATER('~', true);

    /**
     * Symbol used by {@link ArrayTileGrid#fromRows(int, String...)}.
     */
    private final char symbol;

    /**
     * Whether this tile type permanently blocks movement.
     */
    private final boolean blocking;

    /**
     * Look up a tile type by its map symbol.
     *
     * @param symbol the map character
     * @return the matching type
     * @throws IllegalArgumentException if no type uses the symbol
     */
    public static TileType fromSymbol(char symbol) {
        for (TileType type : values()) {
            if (type.symbol == symbol) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tile symbol: '" + symbol + "'");
    }
}
