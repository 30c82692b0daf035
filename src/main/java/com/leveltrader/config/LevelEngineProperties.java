package com.leveltrader.config;

import com.leveltrader.exception.ConfigurationException;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Engine settings bound from {@code leveltrader.engine.*}.
 *
 * <p>Entry levels are signal magnitudes in deviation units. Exit levels are multipliers of the
 * entry threshold: 0.5 exits half-way back to zero, 0 at zero, a negative value past zero.
 * The time fields are optional; null disables the corresponding rule.
 */
@Data
@Builder
public class LevelEngineProperties {

    private String instrumentId;
    private List<Double> entryLevels;
    private List<Double> exitLevels;
    private int maxConcurrentLevels;
    private int positionSize;
    private BigDecimal instrumentFactor;

    /** Time of day from which every Level is flattened and no new entry is made. */
    private LocalTime forceExitTime;

    private LocalTime entryStartTime;
    private LocalTime entryEndTime;
    private boolean reconcileOnBar;

    /** @throws ConfigurationException naming the first invalid property */
    public void validate() {
        if (instrumentId == null || instrumentId.isBlank()) {
            throw new ConfigurationException("leveltrader.engine.instrument-id", "must not be blank");
        }
        if (entryLevels == null || entryLevels.isEmpty()) {
            throw new ConfigurationException("leveltrader.engine.entry-levels", "at least one entry level is required");
        }
        if (entryLevels.stream().anyMatch(level -> level < 0)) {
            throw new ConfigurationException("leveltrader.engine.entry-levels", "entry levels must not be negative");
        }
        if (exitLevels == null || exitLevels.isEmpty()) {
            throw new ConfigurationException("leveltrader.engine.exit-levels", "at least one exit level is required");
        }
        if (maxConcurrentLevels <= 0) {
            throw new ConfigurationException("leveltrader.engine.max-concurrent-levels", "must be positive");
        }
        if (positionSize <= 0) {
            throw new ConfigurationException("leveltrader.engine.position-size", "must be positive");
        }
        if (instrumentFactor == null || instrumentFactor.signum() <= 0) {
            throw new ConfigurationException("leveltrader.engine.instrument-factor", "must be positive");
        }
        if (entryStartTime != null && entryEndTime != null && !entryStartTime.isBefore(entryEndTime)) {
            throw new ConfigurationException(
                    "leveltrader.engine.entry-start-time", "must be before entry-end-time " + entryEndTime);
        }
    }

    /** True when entries are allowed at {@code time}: inside [start, end) for whichever bounds are set. */
    public boolean isWithinEntryWindow(LocalTime time) {
        if (entryStartTime != null && time.isBefore(entryStartTime)) {
            return false;
        }
        return entryEndTime == null || time.isBefore(entryEndTime);
    }

    public boolean isForceExitTime(LocalTime time) {
        return forceExitTime != null && !time.isBefore(forceExitTime);
    }
}
