package com.leveltrader.oms;

import com.leveltrader.domain.model.OrderStatusUpdate;
import java.math.BigDecimal;
import java.util.List;

/**
 * Order gateway the engine talks to. Creates and cancels orders and tracks which ones are
 * still live. Status callbacks from the host arrive through {@link #handleOrderUpdate}.
 *
 * <p>Implementations may block on the host and must never be called while an engine lock
 * is held.
 */
public interface TradeManager {

    /** Returned by {@link #createOrder} on failure and by {@link #getCurrentOrderId} when no order is live. */
    long NO_ORDER = -1L;

    /**
     * @return the order id, or {@link #NO_ORDER} if the gateway refused the order
     * @throws IllegalArgumentException if the request has no side or instrument or a non-positive quantity
     */
    long createOrder(OrderRequest request);

    /** @return false if the order is unknown or the cancel request failed */
    boolean cancelOrder(long orderId);

    /** @return number of cancel requests sent */
    int cancelAllOrders();

    /** @return false if the order is unknown or the modify request failed */
    boolean replaceOrder(long orderId, BigDecimal newPrice, int newQuantity);

    /**
     * Applies a status callback. NEW, REPLACED and the other working statuses keep the order
     * live; FILLED, CANCELLED and REJECTED release it.
     *
     * @return false if the order is not tracked
     */
    boolean handleOrderUpdate(OrderStatusUpdate update);

    boolean hasLiveOrder();

    /** Most recent live order id, or {@link #NO_ORDER}. */
    long getCurrentOrderId();

    List<TrackedOrder> getActiveOrders();

    void reset();
}
