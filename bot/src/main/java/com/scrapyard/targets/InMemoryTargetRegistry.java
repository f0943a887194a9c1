package com.scrapyard.targets;

import com.scrapyard.navigation.WorldPosition;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TargetRegistry} over collectibles held in memory.
 *
 * <p>A collectible is eligible while it is registered and not depleted. Nearest-target
 * ties are broken by id so lookups are deterministic.
 */
@Slf4j
public class InMemoryTargetRegistry implements TargetRegistry {

    private final Map<String, Collectible> collectibles = new LinkedHashMap<>();

    public void register(Collectible collectible) {
        collectibles.put(collectible.getId(), collectible);
        log.debug("Registered {}", collectible);
    }

    public boolean remove(String id) {
        return collectibles.remove(id) != null;
    }

    @Nullable
    public Collectible get(String id) {
        return collectibles.get(id);
    }

    @Nullable
    public Collectible get(TargetRef target) {
        return collectibles.get(target.getId());
    }

    public List<Collectible> getAll() {
        return new ArrayList<>(collectibles.values());
    }

    public int size() {
        return collectibles.size();
    }

    /**
     * Drop collectibles that have been picked clean.
     *
     * @return number removed
     */
    public int removeDepleted() {
        int before = collectibles.size();
        collectibles.values().removeIf(Collectible::isDepleted);
        return before - collectibles.size();
    }

    @Override
    public Optional<TargetRef> findNearestEligible(WorldPosition origin, double radius) {
        return collectibles.values().stream()
                .filter(c -> !c.isDepleted())
                .filter(c -> c.getPosition().distanceTo(origin) <= radius)
                .min(Comparator.comparingDouble((Collectible c) -> c.getPosition().distanceTo(origin))
                        .thenComparing(Collectible::getId))
                .map(Collectible::toRef);
    }

    @Override
    public boolean isStillValid(TargetRef target) {
        Collectible collectible = collectibles.get(target.getId());
        return collectible != null && !collectible.isDepleted();
    }
}
