package com.leveltrader.simulator;

import com.leveltrader.broker.BrokerGateway;
import com.leveltrader.exception.BrokerException;
import com.leveltrader.oms.OrderRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper implementation of {@link BrokerGateway}. Acknowledges every order with a monotonically
 * increasing id and keeps a copy of it open until it is cancelled or released by a terminal
 * status; it never fills anything itself. Fills are delivered by the host (replay driver, test
 * harness) as {@code FillEvent}s.
 *
 * <p>Active when {@code leveltrader.broker.mode=SIMULATOR}, the default.
 */
@Service
@ConditionalOnProperty(name = "leveltrader.broker.mode", havingValue = "SIMULATOR", matchIfMissing = true)
public class SimulatorBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBrokerGateway.class);

    private final AtomicLong orderIdSequence = new AtomicLong(1);

    private final Map<Long, OrderRequest> openOrders = new ConcurrentHashMap<>();

    @Override
    public long placeOrder(OrderRequest request) {
        long orderId = orderIdSequence.getAndIncrement();
        openOrders.put(orderId, request.toBuilder().build());
        log.debug(
                "Simulator placeOrder {}: {} {} qty={} limit={}",
                orderId,
                request.getSide(),
                request.getInstrumentId(),
                request.getQuantity(),
                request.getLimitPrice());
        return orderId;
    }

    @Override
    public void modifyOrder(long orderId, BigDecimal newPrice, int newQuantity) {
        OrderRequest modified = openOrders.computeIfPresent(
                orderId,
                (id, request) -> request.toBuilder()
                        .limitPrice(newPrice)
                        .quantity(newQuantity)
                        .build());
        if (modified == null) {
            throw new BrokerException("Simulator has no open order " + orderId);
        }
        log.debug("Simulator modifyOrder {}: price={} qty={}", orderId, newPrice, newQuantity);
    }

    @Override
    public void cancelOrder(long orderId) {
        if (openOrders.remove(orderId) == null) {
            throw new BrokerException("Simulator has no open order " + orderId);
        }
        log.debug("Simulator cancelOrder {}", orderId);
    }

    @Override
    public void releaseOrder(long orderId) {
        if (openOrders.remove(orderId) != null) {
            log.debug("Simulator released order {}", orderId);
        }
    }

    /** Forgets every open order. Ids keep increasing so they never collide with an earlier session. */
    @Override
    public void reset() {
        int dropped = openOrders.size();
        openOrders.clear();
        log.info("Simulator reset, {} open orders dropped", dropped);
    }

    public List<OrderRequest> getOpenOrders() {
        return openOrders.values().stream()
                .map(request -> request.toBuilder().build())
                .toList();
    }

    public boolean isOpen(long orderId) {
        return openOrders.containsKey(orderId);
    }
}
