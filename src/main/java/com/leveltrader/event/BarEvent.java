package com.leveltrader.event;

import com.leveltrader.domain.model.Bar;
import org.springframework.context.ApplicationEvent;

/**
 * Inbound: a completed bar together with the signal value computed for it by the host.
 * The engine does not compute the signal; it only compares it against configured thresholds.
 */
public class BarEvent extends ApplicationEvent {

    private final Bar bar;
    private final double signal;

    public BarEvent(Object source, Bar bar, double signal) {
        super(source);
        this.bar = bar;
        this.signal = signal;
    }

    public Bar getBar() {
        return bar;
    }

    public double getSignal() {
        return signal;
    }
}
