package com.scrapyard.navigation;

import lombok.Value;

/**
 * A continuous position in world units (pixels), independent of the tile grid.
 */
@Value
public class WorldPosition {

    double x;
    double y;

    public static WorldPosition of(double x, double y) {
        return new WorldPosition(x, y);
    }

    public double distanceTo(WorldPosition other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    public WorldPosition translate(double dx, double dy) {
        return new WorldPosition(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f)", x, y);
    }
}
