package com.scrapyard.tasks;

import com.scrapyard.navigation.GridCoordinate;
import com.scrapyard.targets.TargetRef;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * What a busy agent is working toward: either a registry target or its base tile.
 *
 * <p>Exactly one payload is set, selected by {@link #getKind()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskTarget {

    public enum Kind {
        TARGET,
        BASE
    }

    Kind kind;

    @Nullable
    TargetRef target;

    @Nullable
    GridCoordinate base;

    public static TaskTarget target(TargetRef target) {
        if (target == null) {
            throw new NullPointerException("target");
        }
        return new TaskTarget(Kind.TARGET, target, null);
    }

    public static TaskTarget base(GridCoordinate base) {
        if (base == null) {
            throw new NullPointerException("base");
        }
        return new TaskTarget(Kind.BASE, null, base);
    }

    public boolean isTarget() {
        return kind == Kind.TARGET;
    }

    public boolean isBase() {
        return kind == Kind.BASE;
    }

    /**
     * Get the target payload.
     *
     * @throws IllegalStateException if this is a base task
     */
    public TargetRef requireTarget() {
        if (target == null) {
            throw new IllegalStateException("Task " + this + " has no target");
        }
        return target;
    }

    /**
     * Get the base payload.
     *
     * @throws IllegalStateException if this is a target task
     */
    public GridCoordinate requireBase() {
        if (base == null) {
            throw new IllegalStateException("Task " + this + " has no base");
        }
        return base;
    }

    @Override
    public String toString() {
        return isTarget() ? "target " + target.getId() : "base " + base;
    }
}
