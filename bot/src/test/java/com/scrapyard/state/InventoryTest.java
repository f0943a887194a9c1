package com.scrapyard.state;

import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class InventoryTest {

    private Inventory inventory;

    @Before
    public void setUp() {
        inventory = new Inventory(100);
    }

    @Test
    public void testAddWithinCapacity() {
        assertEquals(40.0, inventory.add("steel", 40), 0.0);
        assertEquals(40.0, inventory.getLoad(), 0.0);
        assertEquals(60.0, inventory.getFreeSpace(), 0.0);
        assertFalse(inventory.isFull());
    }

    @Test
    public void testAddClipsToCapacity() {
        inventory.add("steel", 70);
        double accepted = inventory.add("copper", 50);

        assertEquals("Only the free space is accepted", 30.0, accepted, 0.0);
        assertEquals(100.0, inventory.getLoad(), 0.0);
        assertTrue(inventory.isFull());
        assertEquals(0.0, inventory.add("copper", 1), 0.0);
    }

    @Test
    public void testNonPositiveAddIgnored() {
        assertEquals(0.0, inventory.add("steel", -5), 0.0);
        assertTrue(inventory.isEmpty());
    }

    @Test
    public void testDrain() {
        inventory.add("steel", 10);
        inventory.add("steel", 5);
        inventory.add("plastic", 20);

        Map<String, Double> drained = inventory.drain();

        assertEquals(15.0, drained.get("steel"), 0.0);
        assertEquals(20.0, drained.get("plastic"), 0.0);
        assertTrue(inventory.isEmpty());
        assertEquals(0.0, inventory.getLoad(), 0.0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testContentsAreReadOnly() {
        inventory.getContents().put("steel", 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCapacity() {
        new Inventory(-1);
    }

    @Test
    public void testZeroCapacityIsAlwaysFull() {
        assertTrue(new Inventory(0).isFull());
    }
}
