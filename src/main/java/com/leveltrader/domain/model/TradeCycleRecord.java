package com.leveltrader.domain.model;

import com.leveltrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Audit record of one completed trade cycle (flat -> flat). Produced once when the
 * cycle closes and never rewritten.
 *
 * <p>Excursions and {@code averagePriceDelta} are measured from the cycle's first entry
 * price. {@code maxAdverseExcursion} is zero or negative, {@code maxFavorableExcursion}
 * zero or positive, both in price points per unit.
 */
@Getter
@Builder
@ToString
public class TradeCycleRecord {

    private final String book;
    private final LocalDateTime firstFill;
    private final LocalDateTime lastFill;
    private final OrderSide side;
    private final BigDecimal entryPrice;
    private final BigDecimal averagePrice;
    private final BigDecimal exitPrice;
    private final BigDecimal averagePriceDelta;

    /** Minutes from first fill to the last marked price. */
    private final double cycleTime;

    private final BigDecimal maxAdverseExcursion;
    private final BigDecimal maxFavorableExcursion;
    private final int maxPosition;

    /** Minutes from the last fill to the last marked price. */
    private final double timeSinceLastFill;

    private final BigDecimal pnl;
}
