package com.leveltrader.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.leveltrader.config.LevelEngineProperties;
import com.leveltrader.core.engine.HostEventRouter;
import com.leveltrader.core.engine.LevelTradingEngine;
import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.enums.OrderStatus;
import com.leveltrader.domain.model.Bar;
import com.leveltrader.domain.model.Fill;
import com.leveltrader.domain.model.OrderStatusUpdate;
import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.event.BarEvent;
import com.leveltrader.event.EventPublisherHelper;
import com.leveltrader.event.FillEvent;
import com.leveltrader.event.LevelEvent;
import com.leveltrader.event.OrderStatusEvent;
import com.leveltrader.event.ReconciliationEvent;
import com.leveltrader.event.TradeCycleEvent;
import com.leveltrader.level.LevelManager;
import com.leveltrader.level.ThresholdEntryPolicy;
import com.leveltrader.observability.EngineMetricsService;
import com.leveltrader.observability.TradeCycleAuditLogger;
import com.leveltrader.oms.GatewayTradeManager;
import com.leveltrader.oms.TradeManager;
import com.leveltrader.position.PositionManager;
import com.leveltrader.reconciliation.PositionReconciler;
import com.leveltrader.simulator.SimulatorBrokerGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-component test of the bar -> order -> fill -> cycle flow.
 * Wires engine, simulator gateway, event helper, metrics and audit by hand and routes events
 * through a lambda publisher in the same order Spring would.
 */
class LevelEngineFlowIntegrationTest {

    private static final LocalDateTime OPEN = LocalDateTime.of(2025, 3, 3, 9, 30);

    private SimpleMeterRegistry meterRegistry;
    private TradeCycleAuditLogger auditLogger;
    private HostEventRouter router;
    private EventPublisherHelper eventPublisherHelper;
    private SimulatorBrokerGateway gateway;
    private PositionManager theo;
    private PositionManager actual;
    private LevelManager levelManager;

    @BeforeEach
    void setUp() {
        AtomicReference<HostEventRouter> routerRef = new AtomicReference<>();
        AtomicReference<EngineMetricsService> metricsRef = new AtomicReference<>();
        auditLogger = new TradeCycleAuditLogger();

        // Order mirrors the @Order values: router, audit, metrics
        ApplicationEventPublisher publisher = event -> {
            if (event instanceof BarEvent barEvent) {
                routerRef.get().onBar(barEvent);
            } else if (event instanceof FillEvent fillEvent) {
                routerRef.get().onFill(fillEvent);
            } else if (event instanceof OrderStatusEvent statusEvent) {
                routerRef.get().onOrderStatus(statusEvent);
            } else if (event instanceof TradeCycleEvent cycleEvent) {
                auditLogger.onTradeCycle(cycleEvent);
                metricsRef.get().onTradeCycleEvent(cycleEvent);
            } else if (event instanceof LevelEvent levelEvent) {
                metricsRef.get().onLevelEvent(levelEvent);
            } else if (event instanceof ReconciliationEvent reconciliationEvent) {
                metricsRef.get().onReconciliationEvent(reconciliationEvent);
            }
        };
        eventPublisherHelper = new EventPublisherHelper(publisher);

        LevelEngineProperties properties = LevelEngineProperties.builder()
                .instrumentId("ES")
                .entryLevels(List.of(1.0, 2.0))
                .exitLevels(List.of(0.5, 0.0))
                .maxConcurrentLevels(4)
                .positionSize(2)
                .instrumentFactor(new BigDecimal("50"))
                .forceExitTime(LocalTime.of(15, 45))
                .entryStartTime(LocalTime.of(9, 30))
                .entryEndTime(LocalTime.of(15, 30))
                .reconcileOnBar(true)
                .build();
        properties.validate();

        levelManager = new LevelManager(
                properties.getEntryLevels(),
                properties.getExitLevels(),
                properties.getMaxConcurrentLevels(),
                properties.getInstrumentFactor(),
                new ThresholdEntryPolicy(),
                eventPublisherHelper);
        theo = new PositionManager("theo", properties.getInstrumentFactor(), eventPublisherHelper);
        actual = new PositionManager("actual", properties.getInstrumentFactor(), eventPublisherHelper);
        gateway = new SimulatorBrokerGateway();
        TradeManager tradeManager = new GatewayTradeManager(gateway);
        PositionReconciler reconciler =
                new PositionReconciler(theo, actual, tradeManager, "ES", eventPublisherHelper);
        LevelTradingEngine engine =
                new LevelTradingEngine(properties, levelManager, theo, actual, tradeManager, reconciler);

        meterRegistry = new SimpleMeterRegistry();
        metricsRef.set(new EngineMetricsService(meterRegistry, levelManager, actual));
        router = new HostEventRouter(engine);
        routerRef.set(router);
    }

    private void bar(int minute, String close, double signal) {
        Bar bar = Bar.builder()
                .instrumentId("ES")
                .timestamp(OPEN.plusMinutes(minute))
                .close(new BigDecimal(close))
                .build();
        eventPublisherHelper.publishBar(this, bar, signal);
    }

    private void fillAndComplete(long orderId, OrderSide side, int quantity, String price, int minute) {
        eventPublisherHelper.publishFill(this, Fill.builder()
                .orderId(orderId)
                .side(side)
                .quantity(quantity)
                .price(new BigDecimal(price))
                .timestamp(OPEN.plusMinutes(minute))
                .build());
        eventPublisherHelper.publishOrderStatus(
                this, OrderStatusUpdate.builder().orderId(orderId).status(OrderStatus.FILLED).build());
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("a fully filled level produces matching theo and actual cycles, metrics and audit records")
    void fullyFilledLevel() {
        bar(0, "100", -1.5);
        fillAndComplete(1L, OrderSide.BUY, 2, "100", 0);

        bar(1, "101", -0.4);
        fillAndComplete(2L, OrderSide.SELL, 1, "101", 1);

        bar(2, "102", 0.2);
        fillAndComplete(3L, OrderSide.SELL, 1, "102", 2);

        assertThat(theo.isFlat()).isTrue();
        assertThat(actual.isFlat()).isTrue();
        assertThat(theo.getRealizedPnl()).isEqualByComparingTo("150");
        assertThat(actual.getRealizedPnl()).isEqualByComparingTo("150");

        assertThat(count("leveltrader.levels.created")).isEqualTo(1.0);
        assertThat(count("leveltrader.exits.executed")).isEqualTo(2.0);
        assertThat(count("leveltrader.levels.completed")).isEqualTo(1.0);
        assertThat(meterRegistry.get("leveltrader.cycles.completed").tag("book", "theo").counter().count())
                .isEqualTo(1.0);
        assertThat(count("leveltrader.reconciliation.corrections")).isZero();

        assertThat(auditLogger.getRecent(null, 10))
                .extracting(TradeCycleRecord::getBook)
                .containsExactly("actual", "theo");
        assertThat(auditLogger.getRecent("theo", 1).get(0).getMaxPosition()).isEqualTo(2);
    }

    @Test
    @DisplayName("a partial fill is made whole by reconciliation on the next bar")
    void partialFillReconciled() {
        bar(0, "100", -1.5);
        eventPublisherHelper.publishFill(this, Fill.builder()
                .orderId(1L)
                .side(OrderSide.BUY)
                .quantity(1)
                .price(new BigDecimal("100"))
                .timestamp(OPEN)
                .build());
        eventPublisherHelper.publishOrderStatus(
                this, OrderStatusUpdate.builder().orderId(1L).status(OrderStatus.CANCELLED).build());

        bar(1, "99.75", -1.5);

        assertThat(actual.getCurrentPosition()).isEqualTo(1);
        assertThat(theo.getCurrentPosition()).isEqualTo(2);
        assertThat(count("leveltrader.reconciliation.corrections")).isEqualTo(1.0);
        assertThat(gateway.getOpenOrders())
                .filteredOn(order -> "RECONCILE".equals(order.getTag()))
                .singleElement()
                .satisfies(order -> {
                    assertThat(order.getSide()).isEqualTo(OrderSide.BUY);
                    assertThat(order.getQuantity()).isEqualTo(1);
                });
    }

    @Test
    @DisplayName("force-exit time flattens the theo book and counts the completed level")
    void forceExitAtSessionEnd() {
        bar(0, "100", -2.5);
        assertThat(levelManager.getActiveLevelCount()).isEqualTo(2);

        bar(375, "98", -2.5);

        assertThat(levelManager.getActiveLevelCount()).isZero();
        assertThat(theo.isFlat()).isTrue();
        // buy 4 @ 100, flattened @ 98, 50 per point
        assertThat(theo.getRealizedPnl()).isEqualByComparingTo("-400");
        assertThat(count("leveltrader.levels.completed")).isEqualTo(2.0);
    }
}
