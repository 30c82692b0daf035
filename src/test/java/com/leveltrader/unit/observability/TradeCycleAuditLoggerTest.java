package com.leveltrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.event.TradeCycleEvent;
import com.leveltrader.observability.TradeCycleAuditLogger;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradeCycleAuditLoggerTest {

    private TradeCycleAuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        auditLogger = new TradeCycleAuditLogger();
    }

    private static TradeCycleRecord cycle(String book, String pnl) {
        return TradeCycleRecord.builder()
                .book(book)
                .firstFill(LocalDateTime.of(2025, 3, 3, 10, 0))
                .lastFill(LocalDateTime.of(2025, 3, 3, 10, 5))
                .side(OrderSide.BUY)
                .entryPrice(new BigDecimal("100"))
                .averagePrice(new BigDecimal("100"))
                .exitPrice(new BigDecimal("101"))
                .averagePriceDelta(BigDecimal.ONE)
                .cycleTime(12.5)
                .maxAdverseExcursion(new BigDecimal("-0.5"))
                .maxFavorableExcursion(new BigDecimal("1.25"))
                .maxPosition(2)
                .timeSinceLastFill(7.5)
                .pnl(new BigDecimal(pnl))
                .build();
    }

    @Test
    @DisplayName("records are kept newest first and filtered by book")
    void recentNewestFirst() {
        auditLogger.onTradeCycle(new TradeCycleEvent(this, cycle("theo", "1")));
        auditLogger.onTradeCycle(new TradeCycleEvent(this, cycle("actual", "2")));
        auditLogger.onTradeCycle(new TradeCycleEvent(this, cycle("theo", "3")));

        assertThat(auditLogger.getRecent(null, 10))
                .extracting(TradeCycleRecord::getPnl)
                .containsExactly(new BigDecimal("3"), new BigDecimal("2"), new BigDecimal("1"));
        assertThat(auditLogger.getRecent("theo", 1))
                .extracting(TradeCycleRecord::getPnl)
                .containsExactly(new BigDecimal("3"));
        assertThat(auditLogger.getRecent("actual", 0)).isEmpty();
    }

    @Test
    @DisplayName("ring buffer evicts the oldest records")
    void ringBufferEvicts() {
        for (int i = 0; i < TradeCycleAuditLogger.RING_BUFFER_SIZE + 5; i++) {
            auditLogger.record(cycle("theo", String.valueOf(i)));
        }

        assertThat(auditLogger.size()).isEqualTo(TradeCycleAuditLogger.RING_BUFFER_SIZE);
        assertThat(auditLogger.getRecent(null, Integer.MAX_VALUE))
                .last()
                .extracting(TradeCycleRecord::getPnl)
                .isEqualTo(new BigDecimal("5"));
    }

    @Test
    @DisplayName("csv line follows the header column order")
    void csvLine() {
        String csv = TradeCycleAuditLogger.toCsv(cycle("theo", "100"));

        assertThat(csv).isEqualTo("2025-03-03T10:00,2025-03-03T10:05,BUY,100,101,1,12.5,-0.5,1.25,2,7.5,100");
        assertThat(csv.split(",", -1)).hasSameSizeAs(TradeCycleAuditLogger.HEADER.split(","));
    }

    @Test
    @DisplayName("missing values are written as empty columns")
    void csvEmptyColumns() {
        String csv = TradeCycleAuditLogger.toCsv(TradeCycleRecord.builder().side(OrderSide.SELL).build());

        assertThat(csv).isEqualTo(",,SELL,,,,0.0,,,0,0.0,");
    }
}
