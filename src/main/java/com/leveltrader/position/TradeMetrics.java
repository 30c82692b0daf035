package com.leveltrader.position;

import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.model.TradeCycleRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.Getter;

/**
 * Running analytics of one trade cycle, from the first fill out of flat to the fill that
 * flattens the position again.
 *
 * <p>Excursions and the final price delta are measured from {@link #entryPrice}, the price of
 * the first fill, not from the running average. Adding to the position moves
 * {@link #averagePrice} but leaves the excursion baseline where the cycle started.
 */
@Getter
public class TradeMetrics {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final LocalDateTime firstFill;
    private final BigDecimal entryPrice;
    private final OrderSide side;

    private LocalDateTime lastFill;
    private BigDecimal averagePrice;
    private int maxPosition;

    private BigDecimal maxFavorableExcursion = BigDecimal.ZERO;
    private BigDecimal maxAdverseExcursion = BigDecimal.ZERO;
    private double cycleTime;
    private double timeSinceLastFill;

    private BigDecimal exitPrice;
    private BigDecimal averagePriceDelta;
    private BigDecimal pnl;
    private boolean closed;

    public TradeMetrics(LocalDateTime firstFill, BigDecimal price, int position, OrderSide side) {
        this.firstFill = firstFill;
        this.lastFill = firstFill;
        this.entryPrice = price;
        this.averagePrice = price;
        this.maxPosition = Math.abs(position);
        this.side = side;
    }

    /** Records an addition to the open position. */
    public void updateFill(int position, BigDecimal averagePrice, LocalDateTime time) {
        this.maxPosition = Math.max(maxPosition, Math.abs(position));
        this.averagePrice = averagePrice;
        this.lastFill = time;
        this.timeSinceLastFill = 0;
    }

    /** Records a reducing or closing fill; the position size bookkeeping is unchanged. */
    public void recordFill(LocalDateTime time) {
        this.lastFill = time;
        this.timeSinceLastFill = 0;
    }

    /** Feeds a mark price into the excursion and timing trackers. */
    public void updatePrice(BigDecimal price, LocalDateTime time) {
        BigDecimal delta = directionalDelta(price);
        if (delta.compareTo(maxFavorableExcursion) > 0) {
            maxFavorableExcursion = delta;
        } else if (delta.compareTo(maxAdverseExcursion) < 0) {
            maxAdverseExcursion = delta;
        }

        cycleTime = minutesBetween(firstFill, time);
        timeSinceLastFill = minutesBetween(lastFill, time);
    }

    /**
     * Finalizes the cycle at {@code exitPrice}: the last mark is applied, then
     * {@code averagePriceDelta} and {@code pnl = maxPosition * delta * instrumentFactor}
     * are fixed.
     */
    public void close(BigDecimal exitPrice, LocalDateTime time, BigDecimal instrumentFactor) {
        updatePrice(exitPrice, time);
        this.exitPrice = exitPrice;
        this.averagePriceDelta = directionalDelta(exitPrice);
        this.pnl = averagePriceDelta.multiply(BigDecimal.valueOf(maxPosition)).multiply(instrumentFactor);
        this.closed = true;
    }

    private BigDecimal directionalDelta(BigDecimal price) {
        BigDecimal move = price.subtract(entryPrice);
        return side == OrderSide.BUY ? move : move.negate();
    }

    private static double minutesBetween(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return 0;
        }
        return Duration.between(from, to).toMillis() / MILLIS_PER_MINUTE;
    }

    public TradeCycleRecord toRecord(String book) {
        return TradeCycleRecord.builder()
                .book(book)
                .firstFill(firstFill)
                .lastFill(lastFill)
                .side(side)
                .entryPrice(entryPrice)
                .averagePrice(averagePrice)
                .exitPrice(exitPrice)
                .averagePriceDelta(averagePriceDelta)
                .cycleTime(cycleTime)
                .maxAdverseExcursion(maxAdverseExcursion)
                .maxFavorableExcursion(maxFavorableExcursion)
                .maxPosition(maxPosition)
                .timeSinceLastFill(timeSinceLastFill)
                .pnl(pnl)
                .build();
    }
}
