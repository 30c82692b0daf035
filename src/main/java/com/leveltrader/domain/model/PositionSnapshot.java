package com.leveltrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time copy of a PositionManager book. {@code averagePrice} is null while flat.
 */
@Data
@Builder
public class PositionSnapshot {

    private String book;

    /** Signed quantity: positive = long, negative = short. */
    private int currentPosition;

    private BigDecimal averagePrice;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;
    private BigDecimal lastPrice;
    private LocalDateTime firstEntryTime;
    private LocalDateTime lastEntryTime;
    private int completedCycles;
}
