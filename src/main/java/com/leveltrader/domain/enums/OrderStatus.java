package com.leveltrader.domain.enums;

/**
 * Lifecycle status of an order as reported by the host order gateway.
 * PENDING_NEW is the state between submission and the gateway's acknowledgement.
 */
public enum OrderStatus {
    PENDING_NEW,
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    REPLACED;

    /** FILLED, CANCELLED and REJECTED release an order from pending tracking. */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    /** True while the order can still produce fills at the venue. */
    public boolean isWorking() {
        return this == PENDING_NEW || this == NEW || this == PARTIALLY_FILLED;
    }
}
