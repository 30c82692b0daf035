package com.leveltrader.event;

import com.leveltrader.domain.model.LevelSnapshot;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a Level is created, exits a tranche, completes, or is drained by a force close.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>EngineMetricsService: level and exit counters</li>
 * </ul>
 */
public class LevelEvent extends ApplicationEvent {

    private final LevelSnapshot level;
    private final LevelEventType eventType;
    private final int exitLevelIndex;
    private final int quantity;
    private final BigDecimal price;

    /**
     * @param exitLevelIndex tranche index for EXIT_EXECUTED, -1 otherwise or when all tranches exited at once
     * @param quantity       quantity exited for EXIT_EXECUTED, 0 otherwise
     * @param price          exit price for EXIT_EXECUTED, null otherwise
     */
    public LevelEvent(
            Object source,
            LevelSnapshot level,
            LevelEventType eventType,
            int exitLevelIndex,
            int quantity,
            BigDecimal price) {
        super(source);
        this.level = level;
        this.eventType = eventType;
        this.exitLevelIndex = exitLevelIndex;
        this.quantity = quantity;
        this.price = price;
    }

    public LevelEvent(Object source, LevelSnapshot level, LevelEventType eventType) {
        this(source, level, eventType, -1, 0, null);
    }

    public LevelSnapshot getLevel() {
        return level;
    }

    public LevelEventType getEventType() {
        return eventType;
    }

    public int getExitLevelIndex() {
        return exitLevelIndex;
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }
}
