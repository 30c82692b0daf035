package com.leveltrader.core.engine;

import com.leveltrader.event.BarEvent;
import com.leveltrader.event.FillEvent;
import com.leveltrader.event.OrderStatusEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Routes host events to the {@link LevelTradingEngine}.
 *
 * <p>Runs at @Order(1) so that engine state is updated before metrics and audit listeners
 * observe the events derived from it. Fills and status updates are routed in delivery order;
 * nothing is buffered or reordered here.
 */
@Component
public class HostEventRouter {

    private final LevelTradingEngine levelTradingEngine;

    public HostEventRouter(LevelTradingEngine levelTradingEngine) {
        this.levelTradingEngine = levelTradingEngine;
    }

    @EventListener
    @Order(1)
    public void onBar(BarEvent event) {
        levelTradingEngine.onBar(event.getBar(), event.getSignal());
    }

    @EventListener
    @Order(1)
    public void onFill(FillEvent event) {
        levelTradingEngine.onFill(event.getFill());
    }

    @EventListener
    @Order(1)
    public void onOrderStatus(OrderStatusEvent event) {
        levelTradingEngine.onOrderStatus(event.getUpdate());
    }
}
