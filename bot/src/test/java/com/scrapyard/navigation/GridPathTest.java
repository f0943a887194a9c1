package com.scrapyard.navigation;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class GridPathTest {

    @Test
    public void testEmpty() {
        GridPath path = GridPath.of(new ArrayList<>());
        assertTrue(path.isEmpty());
        assertSame(GridPath.empty(), path);
        assertNull(path.getStart());
        assertNull(path.getGoal());
        assertEquals(0.0, path.weightedLength(), 0.0);
    }

    @Test
    public void testWeightedLength() {
        GridPath path = GridPath.of(
                GridCoordinate.of(0, 0),
                GridCoordinate.of(1, 0),
                GridCoordinate.of(2, 1),
                GridCoordinate.of(5, 5));
        // 1 + sqrt(2) + hypot(3, 4)
        assertEquals(1 + Math.sqrt(2) + 5, path.weightedLength(), 1e-9);
        assertEquals(GridCoordinate.of(0, 0), path.getStart());
        assertEquals(GridCoordinate.of(5, 5), path.getGoal());
    }

    @Test
    public void testDefensiveCopy() {
        List<GridCoordinate> source = new ArrayList<>();
        source.add(GridCoordinate.of(0, 0));
        GridPath path = GridPath.of(source);
        source.add(GridCoordinate.of(1, 1));
        assertEquals("Later changes to the source list must not leak in", 1, path.size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testWaypointsAreUnmodifiable() {
        GridPath.of(GridCoordinate.of(0, 0)).getWaypoints().add(GridCoordinate.of(1, 0));
    }
}
