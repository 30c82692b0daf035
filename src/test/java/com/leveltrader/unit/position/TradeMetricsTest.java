package com.leveltrader.unit.position;

import static org.assertj.core.api.Assertions.assertThat;

import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.position.TradeMetrics;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class TradeMetricsTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 3, 10, 0);

    @Test
    void shortCycleTracksExcursionsInItsDirection() {
        TradeMetrics metrics = new TradeMetrics(T0, new BigDecimal("100"), -2, OrderSide.SELL);

        metrics.updatePrice(new BigDecimal("103"), T0.plusMinutes(5));
        metrics.updatePrice(new BigDecimal("97"), T0.plusMinutes(10));

        assertThat(metrics.getMaxAdverseExcursion()).isEqualByComparingTo("-3");
        assertThat(metrics.getMaxFavorableExcursion()).isEqualByComparingTo("3");
        assertThat(metrics.getCycleTime()).isEqualTo(10.0);
    }

    @Test
    void addingUpdatesMaxPositionAndResetsIdleTime() {
        TradeMetrics metrics = new TradeMetrics(T0, new BigDecimal("100"), 1, OrderSide.BUY);
        metrics.updatePrice(new BigDecimal("100"), T0.plusMinutes(4));
        assertThat(metrics.getTimeSinceLastFill()).isEqualTo(4.0);

        metrics.updateFill(3, new BigDecimal("99"), T0.plusMinutes(4));
        metrics.updatePrice(new BigDecimal("99"), T0.plusMinutes(5));

        assertThat(metrics.getMaxPosition()).isEqualTo(3);
        assertThat(metrics.getAveragePrice()).isEqualByComparingTo("99");
        assertThat(metrics.getTimeSinceLastFill()).isEqualTo(1.0);
        assertThat(metrics.getCycleTime()).isEqualTo(5.0);
    }

    @Test
    void reducingFillMovesLastFillWithoutChangingMaxPosition() {
        TradeMetrics metrics = new TradeMetrics(T0, new BigDecimal("100"), 2, OrderSide.BUY);
        metrics.updatePrice(new BigDecimal("101"), T0.plusMinutes(6));
        assertThat(metrics.getTimeSinceLastFill()).isEqualTo(6.0);

        metrics.recordFill(T0.plusMinutes(6));

        assertThat(metrics.getLastFill()).isEqualTo(T0.plusMinutes(6));
        assertThat(metrics.getTimeSinceLastFill()).isZero();
        assertThat(metrics.getMaxPosition()).isEqualTo(2);
    }

    @Test
    void closeFixesDeltaAndPnl() {
        TradeMetrics metrics = new TradeMetrics(T0, new BigDecimal("100"), 2, OrderSide.BUY);

        metrics.close(new BigDecimal("101.5"), T0.plusMinutes(90), new BigDecimal("50"));

        TradeCycleRecord record = metrics.toRecord("actual");
        assertThat(metrics.isClosed()).isTrue();
        assertThat(record.getAveragePriceDelta()).isEqualByComparingTo("1.5");
        assertThat(record.getPnl()).isEqualByComparingTo("150");
        assertThat(record.getMaxFavorableExcursion()).isEqualByComparingTo("1.5");
        assertThat(record.getCycleTime()).isEqualTo(90.0);
        assertThat(record.getBook()).isEqualTo("actual");
    }

    @Test
    void openCycleRecordHasNoExitYet() {
        TradeMetrics metrics = new TradeMetrics(T0, new BigDecimal("100"), 1, OrderSide.BUY);

        TradeCycleRecord record = metrics.toRecord("theo");

        assertThat(record.getExitPrice()).isNull();
        assertThat(record.getPnl()).isNull();
        assertThat(record.getEntryPrice()).isEqualByComparingTo("100");
    }
}
