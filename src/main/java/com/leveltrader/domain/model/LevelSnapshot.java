package com.leveltrader.domain.model;

import com.leveltrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable copy of a Level's state. The LevelManager owns live Levels exclusively;
 * callers outside it (listeners, REST, the engine) only ever see snapshots.
 */
@Getter
@Builder
public class LevelSnapshot {

    private final int id;
    private final double entrySignalThreshold;
    private final double actualEntrySignal;
    private final BigDecimal entryPrice;
    private final LocalDateTime entryTime;
    private final OrderSide side;
    private final int positionSize;
    private final int currentPosition;
    private final List<Double> exitLevels;

    /** Exit tranche index -> remaining quantity. */
    private final Map<Integer, Integer> exitLevelStatus;

    private final Map<Long, LevelOrder> orders;
    private final boolean entryComplete;
    private final boolean levelComplete;

    public int getRemainingExitQuantity() {
        return exitLevelStatus.values().stream().mapToInt(Integer::intValue).sum();
    }
}
