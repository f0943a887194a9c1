package com.scrapyard.state;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Materials carried by an agent, by type, bounded by a weight capacity.
 *
 * <p>All additions go through {@link #add(String, double)}, which clips to the free
 * space, so the load never exceeds the capacity.
 */
public class Inventory {

    private static final double EPSILON = 1e-9;

    private final Map<String, Double> materials = new LinkedHashMap<>();

    @Getter
    private final double capacity;

    @Getter
    private double load;

    public Inventory(double capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Add material, limited by the remaining capacity.
     *
     * @param material material type
     * @param quantity requested amount in kg
     * @return the amount actually added
     */
    public double add(String material, double quantity) {
        if (quantity <= 0) {
            return 0;
        }
        double accepted = Math.min(quantity, getFreeSpace());
        if (accepted > 0) {
            materials.merge(material, accepted, Double::sum);
            load += accepted;
        }
        return accepted;
    }

    public double getFreeSpace() {
        return Math.max(0, capacity - load);
    }

    public boolean isFull() {
        return load >= capacity - EPSILON;
    }

    public boolean isEmpty() {
        return materials.isEmpty();
    }

    public double getQuantity(String material) {
        return materials.getOrDefault(material, 0.0);
    }

    public Map<String, Double> getContents() {
        return Collections.unmodifiableMap(materials);
    }

    /**
     * Empty the inventory.
     *
     * @return the materials that were carried
     */
    public Map<String, Double> drain() {
        Map<String, Double> drained = new LinkedHashMap<>(materials);
        materials.clear();
        load = 0;
        return drained;
    }

    @Override
    public String toString() {
        return String.format("Inventory(%.1f/%.1fkg, %s)", load, capacity, materials);
    }
}
