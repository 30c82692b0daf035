package com.leveltrader.event;

import com.leveltrader.domain.model.Fill;
import org.springframework.context.ApplicationEvent;

/** Inbound: an execution reported by the host gateway. Delivered exactly once per execution. */
public class FillEvent extends ApplicationEvent {

    private final Fill fill;

    public FillEvent(Object source, Fill fill) {
        super(source);
        this.fill = fill;
    }

    public Fill getFill() {
        return fill;
    }
}
