package com.leveltrader.event;

import com.leveltrader.domain.model.OrderStatusUpdate;
import org.springframework.context.ApplicationEvent;

/** Inbound: an order status change reported by the host gateway. */
public class OrderStatusEvent extends ApplicationEvent {

    private final OrderStatusUpdate update;

    public OrderStatusEvent(Object source, OrderStatusUpdate update) {
        super(source);
        this.update = update;
    }

    public OrderStatusUpdate getUpdate() {
        return update;
    }
}
