package com.leveltrader.oms;

import com.leveltrader.broker.BrokerGateway;
import com.leveltrader.domain.enums.OrderStatus;
import com.leveltrader.domain.model.OrderStatusUpdate;
import com.leveltrader.exception.BrokerException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TradeManager} backed by the host {@link BrokerGateway}.
 *
 * <p>An order is live from the moment the gateway acknowledges it until a FILLED, CANCELLED
 * or REJECTED status arrives. Gateway failures are logged and surface as {@link #NO_ORDER}
 * or {@code false}; they never propagate into the engine.
 *
 * <p><b>Thread safety:</b> live orders sit in a ConcurrentHashMap and the current order id
 * in an AtomicLong. Status callbacks may arrive on any thread.
 */
public class GatewayTradeManager implements TradeManager {

    private static final Logger log = LoggerFactory.getLogger(GatewayTradeManager.class);

    private final BrokerGateway brokerGateway;

    private final ConcurrentHashMap<Long, TrackedOrder> liveOrders = new ConcurrentHashMap<>();

    private final AtomicLong currentOrderId = new AtomicLong(NO_ORDER);

    public GatewayTradeManager(BrokerGateway brokerGateway) {
        this.brokerGateway = Objects.requireNonNull(brokerGateway, "brokerGateway");
    }

    @Override
    public long createOrder(OrderRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.getSide() == null) {
            throw new IllegalArgumentException("Order side is required");
        }
        if (request.getInstrumentId() == null || request.getInstrumentId().isBlank()) {
            throw new IllegalArgumentException("Instrument id is required");
        }
        if (request.getQuantity() <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + request.getQuantity());
        }

        long orderId;
        try {
            orderId = brokerGateway.placeOrder(request);
        } catch (BrokerException e) {
            log.error(
                    "Order rejected by gateway: {} {} qty={} [{}]: {}",
                    request.getSide(),
                    request.getInstrumentId(),
                    request.getQuantity(),
                    request.getTag(),
                    e.getMessage());
            return NO_ORDER;
        }

        LocalDateTime now = LocalDateTime.now();
        liveOrders.put(
                orderId,
                TrackedOrder.builder()
                        .orderId(orderId)
                        .request(request)
                        .status(OrderStatus.PENDING_NEW)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
        currentOrderId.set(orderId);

        log.info(
                "Order {} sent: {} {} qty={} limit={} [{}]",
                orderId,
                request.getSide(),
                request.getInstrumentId(),
                request.getQuantity(),
                request.getLimitPrice(),
                request.getTag());
        return orderId;
    }

    @Override
    public boolean cancelOrder(long orderId) {
        if (!liveOrders.containsKey(orderId)) {
            log.debug("Cancel for unknown order {} ignored", orderId);
            return false;
        }
        try {
            brokerGateway.cancelOrder(orderId);
            log.info("Cancel requested for order {}", orderId);
            return true;
        } catch (BrokerException e) {
            log.error("Cancel failed for order {}: {}", orderId, e.getMessage());
            return false;
        }
    }

    @Override
    public int cancelAllOrders() {
        int sent = 0;
        for (Long orderId : new ArrayList<>(liveOrders.keySet())) {
            if (cancelOrder(orderId)) {
                sent++;
            }
        }
        return sent;
    }

    @Override
    public boolean replaceOrder(long orderId, BigDecimal newPrice, int newQuantity) {
        if (newQuantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + newQuantity);
        }
        TrackedOrder order = liveOrders.get(orderId);
        if (order == null) {
            log.debug("Replace for unknown order {} ignored", orderId);
            return false;
        }
        try {
            brokerGateway.modifyOrder(orderId, newPrice, newQuantity);
        } catch (BrokerException e) {
            log.error("Replace failed for order {}: {}", orderId, e.getMessage());
            return false;
        }
        liveOrders.computeIfPresent(orderId, (id, tracked) -> {
            OrderRequest replaced = tracked.getRequest().toBuilder()
                    .limitPrice(newPrice)
                    .quantity(newQuantity)
                    .build();
            return tracked.toBuilder().request(replaced).updatedAt(LocalDateTime.now()).build();
        });
        return true;
    }

    @Override
    public boolean handleOrderUpdate(OrderStatusUpdate update) {
        if (update == null || update.getStatus() == null) {
            return false;
        }
        long orderId = update.getOrderId();
        OrderStatus status = update.getStatus();

        if (status.isTerminal()) {
            brokerGateway.releaseOrder(orderId);
            TrackedOrder removed = liveOrders.remove(orderId);
            if (removed == null) {
                log.debug("Terminal status {} for untracked order {}", status, orderId);
                return false;
            }
            currentOrderId.compareAndSet(orderId, latestLiveOrderId());
            log.info("Order {} {}{}", orderId, status, update.getText() != null ? ": " + update.getText() : "");
            return true;
        }

        TrackedOrder updated = liveOrders.computeIfPresent(
                orderId,
                (id, tracked) -> tracked.toBuilder()
                        .status(status)
                        .updatedAt(LocalDateTime.now())
                        .build());
        if (updated == null) {
            log.debug("Status {} for untracked order {}", status, orderId);
            return false;
        }
        return true;
    }

    private long latestLiveOrderId() {
        return liveOrders.keySet().stream().max(Comparator.naturalOrder()).orElse(NO_ORDER);
    }

    @Override
    public boolean hasLiveOrder() {
        return !liveOrders.isEmpty();
    }

    @Override
    public long getCurrentOrderId() {
        return liveOrders.isEmpty() ? NO_ORDER : currentOrderId.get();
    }

    @Override
    public List<TrackedOrder> getActiveOrders() {
        return liveOrders.values().stream()
                .sorted(Comparator.comparingLong(TrackedOrder::getOrderId))
                .toList();
    }

    @Override
    public void reset() {
        liveOrders.clear();
        currentOrderId.set(NO_ORDER);
        brokerGateway.reset();
        log.info("Trade manager reset");
    }
}
