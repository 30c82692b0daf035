package com.leveltrader.event;

import com.leveltrader.domain.model.Bar;
import com.leveltrader.domain.model.Fill;
import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.domain.model.OrderStatusUpdate;
import com.leveltrader.domain.model.ReconciliationResult;
import com.leveltrader.domain.model.TradeCycleRecord;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Bridges the engine's {@link LevelEngineListener} callbacks onto Spring's
 * {@link ApplicationEventPublisher}, and gives hosts typed methods for the inbound events.
 *
 * <p>The core components only know the listener interface; this class is what wires them to
 * metrics, audit and any other {@code @EventListener}. Delivery is synchronous unless a
 * listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper implements LevelEngineListener {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Level lifecycle ----

    @Override
    public void onLevelCreated(LevelSnapshot level) {
        applicationEventPublisher.publishEvent(new LevelEvent(this, level, LevelEventType.CREATED));
    }

    @Override
    public void onExitExecuted(LevelSnapshot level, int exitLevelIndex, int quantity, BigDecimal price) {
        applicationEventPublisher.publishEvent(
                new LevelEvent(this, level, LevelEventType.EXIT_EXECUTED, exitLevelIndex, quantity, price));
    }

    @Override
    public void onLevelCompleted(LevelSnapshot level) {
        applicationEventPublisher.publishEvent(new LevelEvent(this, level, LevelEventType.COMPLETED));
    }

    @Override
    public void onLevelsForceClosed(List<LevelSnapshot> levels) {
        for (LevelSnapshot level : levels) {
            applicationEventPublisher.publishEvent(new LevelEvent(this, level, LevelEventType.FORCE_CLOSED));
        }
    }

    // ---- Positions ----

    @Override
    public void onTradeCycleCompleted(TradeCycleRecord record) {
        applicationEventPublisher.publishEvent(new TradeCycleEvent(this, record));
    }

    @Override
    public void onReconciliation(ReconciliationResult result) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, result));
    }

    // ---- Inbound (host side) ----

    public void publishBar(Object source, Bar bar, double signal) {
        applicationEventPublisher.publishEvent(new BarEvent(source, bar, signal));
    }

    public void publishFill(Object source, Fill fill) {
        applicationEventPublisher.publishEvent(new FillEvent(source, fill));
    }

    public void publishOrderStatus(Object source, OrderStatusUpdate update) {
        applicationEventPublisher.publishEvent(new OrderStatusEvent(source, update));
    }
}
