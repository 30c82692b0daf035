package com.leveltrader.event;

import com.leveltrader.domain.model.TradeCycleRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per completed trade cycle (flat to flat) of either book.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>TradeCycleAuditLogger: audit line and in-memory ring buffer</li>
 *   <li>EngineMetricsService: cycle counter</li>
 * </ul>
 */
public class TradeCycleEvent extends ApplicationEvent {

    private final TradeCycleRecord record;

    public TradeCycleEvent(Object source, TradeCycleRecord record) {
        super(source);
        this.record = record;
    }

    public TradeCycleRecord getRecord() {
        return record;
    }
}
