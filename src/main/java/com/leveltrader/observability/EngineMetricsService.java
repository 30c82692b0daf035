package com.leveltrader.observability;

import com.leveltrader.event.LevelEvent;
import com.leveltrader.event.ReconciliationEvent;
import com.leveltrader.event.TradeCycleEvent;
import com.leveltrader.level.LevelManager;
import com.leveltrader.position.PositionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers the engine's Micrometer metrics.
 *
 * <ul>
 *   <li><b>leveltrader.levels.created</b> / <b>leveltrader.levels.completed</b> (counters)</li>
 *   <li><b>leveltrader.exits.executed</b> (counter): one per exited tranche or flatten</li>
 *   <li><b>leveltrader.cycles.completed</b> (counter, tagged by book)</li>
 *   <li><b>leveltrader.reconciliation.corrections</b> (counter): corrective orders sent</li>
 *   <li><b>leveltrader.levels.active</b> / <b>leveltrader.position.actual</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are read by Micrometer at scrape time; counters follow the engine's events.
 */
@Service
public class EngineMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter levelsCreatedCounter;
    private final Counter levelsCompletedCounter;
    private final Counter exitsExecutedCounter;
    private final Counter reconciliationCorrectionsCounter;

    public EngineMetricsService(
            MeterRegistry meterRegistry,
            LevelManager levelManager,
            @Qualifier("actualPositionManager") PositionManager actualPositionManager) {
        this.meterRegistry = meterRegistry;

        this.levelsCreatedCounter = Counter.builder("leveltrader.levels.created")
                .description("Levels entered")
                .register(meterRegistry);

        this.levelsCompletedCounter = Counter.builder("leveltrader.levels.completed")
                .description("Levels fully exited or drained")
                .register(meterRegistry);

        this.exitsExecutedCounter = Counter.builder("leveltrader.exits.executed")
                .description("Exit tranches executed")
                .register(meterRegistry);

        this.reconciliationCorrectionsCounter = Counter.builder("leveltrader.reconciliation.corrections")
                .description("Corrective orders sent by reconciliation")
                .register(meterRegistry);

        meterRegistry.gauge("leveltrader.levels.active", levelManager, LevelManager::getActiveLevelCount);
        meterRegistry.gauge(
                "leveltrader.position.actual", actualPositionManager, PositionManager::getCurrentPosition);
    }

    @EventListener
    @Order(20)
    public void onLevelEvent(LevelEvent event) {
        switch (event.getEventType()) {
            case CREATED -> levelsCreatedCounter.increment();
            case EXIT_EXECUTED -> exitsExecutedCounter.increment();
            case COMPLETED, FORCE_CLOSED -> levelsCompletedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onTradeCycleEvent(TradeCycleEvent event) {
        meterRegistry
                .counter("leveltrader.cycles.completed", "book", event.getRecord().getBook())
                .increment();
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        if (event.getResult().isCorrectionSent()) {
            reconciliationCorrectionsCounter.increment();
        }
    }
}
