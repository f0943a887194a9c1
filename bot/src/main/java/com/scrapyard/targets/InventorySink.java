package com.scrapyard.targets;

import java.util.Map;

/**
 * Receives an agent's load when it unloads at base.
 *
 * @see MaterialStockpile
 */
public interface InventorySink {

    /**
     * Accept a full hand-off of materials. Partial deposits do not exist.
     *
     * @param materials material type to quantity (kg)
     */
    void deposit(Map<String, Double> materials);
}
