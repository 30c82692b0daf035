package com.leveltrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.domain.model.ReconciliationResult;
import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.event.LevelEvent;
import com.leveltrader.event.LevelEventType;
import com.leveltrader.event.ReconciliationEvent;
import com.leveltrader.event.TradeCycleEvent;
import com.leveltrader.level.LevelManager;
import com.leveltrader.observability.EngineMetricsService;
import com.leveltrader.oms.TradeManager;
import com.leveltrader.position.PositionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for {@link EngineMetricsService}.
 *
 * <p>Verifies: counters follow level, cycle and reconciliation events; gauges read the
 * level manager and the actual book.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EngineMetricsServiceTest {

    @Mock
    private LevelManager levelManager;

    @Mock
    private PositionManager actualPositionManager;

    private SimpleMeterRegistry meterRegistry;
    private EngineMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new EngineMetricsService(meterRegistry, levelManager, actualPositionManager);
    }

    private LevelEvent levelEvent(LevelEventType type) {
        return new LevelEvent(this, LevelSnapshot.builder().id(1).build(), type);
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("level lifecycle events drive the level counters")
    void levelCounters() {
        metricsService.onLevelEvent(levelEvent(LevelEventType.CREATED));
        metricsService.onLevelEvent(levelEvent(LevelEventType.CREATED));
        metricsService.onLevelEvent(new LevelEvent(
                this, LevelSnapshot.builder().id(1).build(), LevelEventType.EXIT_EXECUTED, 0, 2, BigDecimal.TEN));
        metricsService.onLevelEvent(levelEvent(LevelEventType.COMPLETED));
        metricsService.onLevelEvent(levelEvent(LevelEventType.FORCE_CLOSED));

        assertThat(count("leveltrader.levels.created")).isEqualTo(2.0);
        assertThat(count("leveltrader.exits.executed")).isEqualTo(1.0);
        assertThat(count("leveltrader.levels.completed")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("completed cycles are counted per book")
    void cycleCounterTaggedByBook() {
        metricsService.onTradeCycleEvent(new TradeCycleEvent(this, TradeCycleRecord.builder().book("theo").build()));
        metricsService.onTradeCycleEvent(new TradeCycleEvent(this, TradeCycleRecord.builder().book("theo").build()));
        metricsService.onTradeCycleEvent(
                new TradeCycleEvent(this, TradeCycleRecord.builder().book("actual").build()));

        assertThat(meterRegistry.get("leveltrader.cycles.completed").tag("book", "theo").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("leveltrader.cycles.completed").tag("book", "actual").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("only reconciliations that sent an order are counted")
    void reconciliationCorrections() {
        metricsService.onReconciliationEvent(new ReconciliationEvent(this, ReconciliationResult.builder()
                .discrepancy(2)
                .correctiveQuantity(2)
                .correctiveOrderId(7L)
                .build()));
        metricsService.onReconciliationEvent(new ReconciliationEvent(this, ReconciliationResult.builder()
                .discrepancy(0)
                .correctiveOrderId(TradeManager.NO_ORDER)
                .build()));

        assertThat(count("leveltrader.reconciliation.corrections")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("gauges read live state")
    void gauges() {
        when(levelManager.getActiveLevelCount()).thenReturn(3);
        when(actualPositionManager.getCurrentPosition()).thenReturn(-4);

        assertThat(meterRegistry.get("leveltrader.levels.active").gauge().value()).isEqualTo(3.0);
        assertThat(meterRegistry.get("leveltrader.position.actual").gauge().value()).isEqualTo(-4.0);
    }
}
