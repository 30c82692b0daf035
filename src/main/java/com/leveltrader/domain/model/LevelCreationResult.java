package com.leveltrader.domain.model;

/**
 * Outcome of {@code LevelManager.createLevel}. For DUPLICATE the snapshot is the Level
 * already active for the same threshold and side; for CAPACITY_REACHED it is null.
 */
public record LevelCreationResult(LevelSnapshot level, Outcome outcome) {

    public enum Outcome {
        CREATED,
        DUPLICATE,
        CAPACITY_REACHED
    }

    public static LevelCreationResult created(LevelSnapshot level) {
        return new LevelCreationResult(level, Outcome.CREATED);
    }

    public static LevelCreationResult duplicate(LevelSnapshot existing) {
        return new LevelCreationResult(existing, Outcome.DUPLICATE);
    }

    public static LevelCreationResult capacityReached() {
        return new LevelCreationResult(null, Outcome.CAPACITY_REACHED);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
