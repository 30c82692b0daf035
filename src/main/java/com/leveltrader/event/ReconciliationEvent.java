package com.leveltrader.event;

import com.leveltrader.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/** Published after every reconciliation of the theoretical and actual books. */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;

    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
    }

    public ReconciliationResult getResult() {
        return result;
    }
}
