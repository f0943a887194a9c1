package com.scrapyard.targets;

import com.scrapyard.navigation.WorldPosition;
import lombok.Getter;

/**
 * A pile of material lying in the world, waiting to be collected.
 */
@Getter
public class Collectible {

    private final String id;
    private final String material;
    private final WorldPosition position;
    private double quantity;

    public Collectible(String id, String material, WorldPosition position, double quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + quantity);
        }
        this.id = id;
        this.material = material;
        this.position = position;
        this.quantity = quantity;
    }

    /**
     * Take up to the requested amount from the pile.
     *
     * @param requested amount wanted in kg
     * @return amount actually taken
     */
    public double take(double requested) {
        double taken = Math.max(0, Math.min(requested, quantity));
        quantity -= taken;
        return taken;
    }

    public boolean isDepleted() {
        return quantity <= 0;
    }

    public TargetRef toRef() {
        return new TargetRef(id, position);
    }

    @Override
    public String toString() {
        return String.format("Collectible(%s, %.1fkg %s at %s)", id, quantity, material, position);
    }
}
