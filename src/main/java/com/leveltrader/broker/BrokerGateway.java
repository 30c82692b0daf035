package com.leveltrader.broker;

import com.leveltrader.oms.OrderRequest;
import java.math.BigDecimal;

/**
 * Host order-routing contract. The engine reaches the market only through this interface,
 * always via {@link com.leveltrader.oms.TradeManager}.
 *
 * <p>Fills and status changes are not returned from these calls; the host delivers them
 * later as {@code FillEvent} and {@code OrderStatusEvent}.
 */
public interface BrokerGateway {

    /**
     * Places a new order.
     *
     * @return the gateway-assigned order id (non-negative)
     * @throws com.leveltrader.exception.BrokerException if the order is rejected or the gateway is unavailable
     */
    long placeOrder(OrderRequest request);

    /**
     * Changes price and quantity of an open order.
     *
     * @throws com.leveltrader.exception.BrokerException if the order is unknown or the modification fails
     */
    void modifyOrder(long orderId, BigDecimal newPrice, int newQuantity);

    /**
     * Requests cancellation of an open order.
     *
     * @throws com.leveltrader.exception.BrokerException if the order is unknown or cancellation fails
     */
    void cancelOrder(long orderId);

    /**
     * Forgets an order the host reported FILLED, CANCELLED or REJECTED. Gateways that keep no
     * local order state ignore it.
     */
    default void releaseOrder(long orderId) {}

    /** Drops local order state at a session boundary. */
    default void reset() {}
}
