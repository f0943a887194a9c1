package com.scrapyard.targets;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulating {@link InventorySink}: the factory warehouse robots unload into.
 */
@Slf4j
public class MaterialStockpile implements InventorySink {

    private final Map<String, Double> totals = new LinkedHashMap<>();

    @Getter
    private int depositCount;

    @Override
    public void deposit(Map<String, Double> materials) {
        materials.forEach((material, quantity) -> totals.merge(material, quantity, Double::sum));
        depositCount++;
        log.debug("Stockpile received {} (deposit #{})", materials, depositCount);
    }

    public double getAmount(String material) {
        return totals.getOrDefault(material, 0.0);
    }

    public double getTotal() {
        return totals.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public Map<String, Double> getTotals() {
        return Collections.unmodifiableMap(totals);
    }
}
