package com.leveltrader.level;

import com.leveltrader.domain.enums.LevelOrderType;
import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.enums.OrderStatus;
import com.leveltrader.domain.model.LevelOrder;
import com.leveltrader.domain.model.LevelSnapshot;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One entry tranche of exposure with its own partitioned exits.
 *
 * <p>A Level is entered once ({@link #executeEntry}) on a single side and is then worked
 * down through its exit tranches. The entered size is split as evenly as possible across
 * the configured exit multipliers, with any remainder going to the lowest indices
 * (size 10 over 3 exits -> 4/3/3). Each tranche is exited whole by {@link #executeExit}.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code |currentPosition| <= positionSize}, and currentPosition never crosses zero</li>
 *   <li>sum of remaining tranche quantities == {@code |currentPosition|}</li>
 * </ul>
 *
 * <p>Not thread-safe. Levels are owned and guarded by their {@link LevelManager}.
 */
public class Level {

    private static final Logger log = LoggerFactory.getLogger(Level.class);

    /** Exit index reported when every remaining tranche is exited at once. */
    public static final int ALL_TRANCHES = -1;

    @Getter
    private final int id;

    /** Signal magnitude (deviation units) that triggered this level. */
    @Getter
    private final double entrySignalThreshold;

    /** Multipliers of {@link #entrySignalThreshold} giving each tranche's exit threshold. */
    private final List<Double> exitLevels;

    /** Exit tranche index -> remaining quantity. */
    private final Map<Integer, Integer> exitLevelStatus = new TreeMap<>();

    private final Map<Long, LevelOrder> orders = new LinkedHashMap<>();

    @Getter
    private double actualEntrySignal;

    @Getter
    private BigDecimal entryPrice;

    @Getter
    private LocalDateTime entryTime;

    @Getter
    private OrderSide side;

    @Getter
    private int positionSize;

    /** Signed remaining size: positive for a BUY level, negative for a SELL level. */
    @Getter
    private int currentPosition;

    @Getter
    private boolean entryComplete;

    public Level(int id, double entrySignalThreshold, List<Double> exitLevels) {
        Objects.requireNonNull(exitLevels, "exitLevels");
        if (exitLevels.isEmpty()) {
            throw new IllegalArgumentException("Level " + id + " needs at least one exit level");
        }
        if (Double.isNaN(entrySignalThreshold) || entrySignalThreshold < 0) {
            throw new IllegalArgumentException("Entry signal threshold must be non-negative: " + entrySignalThreshold);
        }
        this.id = id;
        this.entrySignalThreshold = entrySignalThreshold;
        this.exitLevels = List.copyOf(exitLevels);
    }

    // ---- Entry ----

    /**
     * Records the entry fill of this level and partitions its size across the exit tranches.
     *
     * @return false (and changes nothing) if the level was already entered or the
     *         arguments cannot describe an entry
     */
    public boolean executeEntry(
            LocalDateTime time, OrderSide side, int positionSize, BigDecimal entryPrice, double actualSignal) {
        if (entryComplete) {
            log.warn("Level {} already entered, ignoring second entry", id);
            return false;
        }
        if (side == null || entryPrice == null || positionSize <= 0) {
            log.warn("Level {} entry rejected: side={}, size={}, price={}", id, side, positionSize, entryPrice);
            return false;
        }

        this.entryTime = time;
        this.side = side;
        this.positionSize = positionSize;
        this.currentPosition = positionSize * side.sign();
        this.entryPrice = entryPrice;
        this.actualEntrySignal = actualSignal;
        this.entryComplete = true;

        partitionExits();
        return true;
    }

    private void partitionExits() {
        exitLevelStatus.clear();

        int total = Math.abs(currentPosition);
        int perTranche = total / exitLevels.size();
        int remainder = total % exitLevels.size();

        for (int i = 0; i < exitLevels.size(); i++) {
            exitLevelStatus.put(i, perTranche + (i < remainder ? 1 : 0));
        }
    }

    // ---- Exit ----

    /**
     * Returns the exit tranche indices (ascending) whose threshold the signal has reverted to.
     *
     * <p>For tranche i the threshold is {@code entrySignalThreshold * exitLevels[i]}. A BUY level
     * exits once {@code signal >= -threshold}; a SELL level once {@code signal <= threshold}.
     * Tranches already exited are never returned.
     */
    public List<Integer> getTriggeredExitLevels(double currentSignal) {
        if (!entryComplete || isLevelComplete()) {
            return List.of();
        }

        List<Integer> triggered = new ArrayList<>();
        for (Map.Entry<Integer, Integer> tranche : exitLevelStatus.entrySet()) {
            if (tranche.getValue() > 0 && shouldExitAtLevel(currentSignal, tranche.getKey())) {
                triggered.add(tranche.getKey());
            }
        }
        return triggered;
    }

    private boolean shouldExitAtLevel(double currentSignal, int exitLevelIndex) {
        double exitThreshold = getExitThreshold(exitLevelIndex);
        if (side == OrderSide.BUY) {
            return currentSignal >= -exitThreshold;
        }
        return currentSignal <= exitThreshold;
    }

    public double getExitThreshold(int exitLevelIndex) {
        return entrySignalThreshold * exitLevels.get(exitLevelIndex);
    }

    /**
     * Exits the whole remaining quantity of one tranche, reducing |currentPosition| by it.
     *
     * @return quantity exited; 0 for an unknown or already exhausted tranche
     */
    public int executeExit(int exitLevelIndex, BigDecimal exitPrice, LocalDateTime time) {
        Integer remaining = exitLevelStatus.get(exitLevelIndex);
        if (remaining == null || remaining <= 0) {
            return 0;
        }

        int exitSize = remaining;
        int open = Math.abs(currentPosition);
        if (exitSize > open) {
            log.error(
                    "Level {} tranche {} holds {} but only {} is open, clamping exit",
                    id,
                    exitLevelIndex,
                    exitSize,
                    open);
            exitSize = open;
        }

        exitLevelStatus.put(exitLevelIndex, 0);
        currentPosition -= exitSize * side.sign();
        if (currentPosition == 0) {
            drainRemainingTranches();
        }

        log.debug(
                "Level {} exit tranche {}: qty={} price={} time={} remaining={}",
                id,
                exitLevelIndex,
                exitSize,
                exitPrice,
                time,
                currentPosition);
        return exitSize;
    }

    /** A flat Level holds no exit quantity; leftovers only exist after a clamped exit. */
    private void drainRemainingTranches() {
        for (Map.Entry<Integer, Integer> tranche : exitLevelStatus.entrySet()) {
            if (tranche.getValue() > 0) {
                log.error(
                        "Level {} is flat but tranche {} still held {}, zeroing it",
                        id,
                        tranche.getKey(),
                        tranche.getValue());
                tranche.setValue(0);
            }
        }
    }

    /**
     * Exits every remaining tranche at once.
     *
     * @return total quantity exited
     */
    public int forceExit(BigDecimal exitPrice, LocalDateTime time) {
        int total = 0;
        for (Integer index : new ArrayList<>(exitLevelStatus.keySet())) {
            total += executeExit(index, exitPrice, time);
        }
        return total;
    }

    public boolean isLevelComplete() {
        return entryComplete && currentPosition == 0;
    }

    public int getExitQuantityForLevel(int exitLevelIndex) {
        return exitLevelStatus.getOrDefault(exitLevelIndex, 0);
    }

    public int getTotalRemainingExitQuantity() {
        return exitLevelStatus.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<Double> getExitLevels() {
        return exitLevels;
    }

    // ---- Orders ----

    public void addOrder(
            long orderId, LevelOrderType orderType, int quantity, BigDecimal price, int exitLevelIndex) {
        orders.put(
                orderId,
                LevelOrder.builder()
                        .orderId(orderId)
                        .orderType(orderType)
                        .quantity(quantity)
                        .price(price)
                        .exitLevelIndex(exitLevelIndex)
                        .status(OrderStatus.PENDING_NEW)
                        .createdAt(LocalDateTime.now())
                        .build());
    }

    public boolean hasOrder(long orderId) {
        return orders.containsKey(orderId);
    }

    public boolean updateOrderStatus(long orderId, OrderStatus status) {
        LevelOrder order = orders.get(orderId);
        if (order == null) {
            return false;
        }
        order.setStatus(status);
        return true;
    }

    /**
     * Accumulates a fill on a tracked order.
     *
     * @return false if the order is not tracked on this level
     */
    public boolean applyFill(long orderId, int quantity) {
        LevelOrder order = orders.get(orderId);
        if (order == null) {
            return false;
        }
        order.setFilledQuantity(order.getFilledQuantity() + quantity);
        order.setStatus(
                order.getFilledQuantity() >= order.getQuantity() ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED);
        return true;
    }

    /**
     * Drops FILLED, CANCELLED and REJECTED orders.
     *
     * @return ids of the removed orders
     */
    public List<Long> cleanupCompletedOrders() {
        List<Long> removed = new ArrayList<>();
        orders.entrySet().removeIf(entry -> {
            if (entry.getValue().getStatus().isTerminal()) {
                removed.add(entry.getKey());
                return true;
            }
            return false;
        });
        return removed;
    }

    /** True iff any order is PENDING_NEW, NEW or PARTIALLY_FILLED. */
    public boolean hasPendingOrders() {
        return orders.values().stream().anyMatch(order -> order.getStatus().isWorking());
    }

    public int getOrderCount() {
        return orders.size();
    }

    public List<Long> getOrderIds() {
        return List.copyOf(orders.keySet());
    }

    // ---- Valuation ----

    /**
     * Unrealized PnL of the remaining quantity in price points: |currentPosition| times the
     * directional move from the entry price. Zero while flat or not yet entered.
     */
    public BigDecimal calculateUnrealizedPnl(BigDecimal currentPrice) {
        if (currentPosition == 0 || currentPrice == null) {
            return BigDecimal.ZERO;
        }
        return currentPrice
                .subtract(entryPrice)
                .multiply(BigDecimal.valueOf((long) Math.abs(currentPosition) * side.sign()));
    }

    public LevelSnapshot snapshot() {
        Map<Long, LevelOrder> orderCopies = new LinkedHashMap<>();
        orders.forEach((orderId, order) -> orderCopies.put(orderId, order.copy()));

        return LevelSnapshot.builder()
                .id(id)
                .entrySignalThreshold(entrySignalThreshold)
                .actualEntrySignal(actualEntrySignal)
                .entryPrice(entryPrice)
                .entryTime(entryTime)
                .side(side)
                .positionSize(positionSize)
                .currentPosition(currentPosition)
                .exitLevels(exitLevels)
                .exitLevelStatus(Collections.unmodifiableMap(new TreeMap<>(exitLevelStatus)))
                .orders(Collections.unmodifiableMap(orderCopies))
                .entryComplete(entryComplete)
                .levelComplete(isLevelComplete())
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "Level %d: threshold=%s side=%s position=%d/%d entry=%s complete=%s",
                id, entrySignalThreshold, side, currentPosition, positionSize, entryPrice, isLevelComplete());
    }
}
