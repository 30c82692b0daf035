package com.leveltrader.level;

import com.leveltrader.domain.enums.LevelOrderType;
import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.enums.OrderStatus;
import com.leveltrader.domain.model.LevelCreationResult;
import com.leveltrader.domain.model.LevelManagerStats;
import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.event.LevelEngineListener;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the active and completed {@link Level}s of one instrument.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li><b>Entry bookkeeping:</b> evaluates entry thresholds through an {@link EntryPolicy}
 *       and creates Levels, suppressing duplicates (same threshold and side already active)
 *       and refusing creation once {@code maxConcurrentLevels} are active</li>
 *   <li><b>Exit bookkeeping:</b> aggregates triggered exit tranches across Levels and moves a
 *       Level from active to completed in the same critical section that flattens it</li>
 *   <li><b>Order routing:</b> maintains the order id to level id index. An order id belongs to
 *       at most one Level. The index also covers completed Levels so that late callbacks for
 *       a Level's final exit order are still attributed</li>
 * </ul>
 *
 * <p><b>Concurrency model:</b> one ReadWriteLock per manager. Mutations take the write lock;
 * queries take the read lock and return {@link LevelSnapshot} copies, never live Levels.
 * Listener callbacks are collected inside the critical section and dispatched after the
 * lock is released.
 *
 * <p>Business conditions (unknown ids, duplicates, exhausted tranches) are no-ops with a
 * defined return value. Only construction and argument validation throw.
 */
public class LevelManager {

    private static final Logger log = LoggerFactory.getLogger(LevelManager.class);

    /** Returned by {@link #findLevelForOrder} when no Level owns the order. Level ids start at 1. */
    public static final int NOT_FOUND = -1;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Integer, Level> activeLevels = new LinkedHashMap<>();

    /** Completed Levels in completion order. */
    private final Map<Integer, Level> completedLevels = new LinkedHashMap<>();

    /** Order id -> owning level id, across active and completed Levels. */
    private final Map<Long, Integer> orderIndex = new HashMap<>();

    private final List<Double> entryLevels;
    private final List<Double> exitLevels;
    private final int maxConcurrentLevels;
    private final BigDecimal instrumentFactor;
    private final EntryPolicy entryPolicy;
    private final LevelEngineListener listener;

    private int nextLevelId = 1;

    public LevelManager(
            List<Double> entryLevels,
            List<Double> exitLevels,
            int maxConcurrentLevels,
            BigDecimal instrumentFactor,
            EntryPolicy entryPolicy,
            LevelEngineListener listener) {
        Objects.requireNonNull(entryLevels, "entryLevels");
        Objects.requireNonNull(exitLevels, "exitLevels");
        Objects.requireNonNull(instrumentFactor, "instrumentFactor");
        this.entryPolicy = Objects.requireNonNull(entryPolicy, "entryPolicy");
        this.listener = Objects.requireNonNull(listener, "listener");

        if (entryLevels.isEmpty()) {
            throw new IllegalArgumentException("At least one entry level is required");
        }
        if (exitLevels.isEmpty()) {
            throw new IllegalArgumentException("At least one exit level is required");
        }
        if (maxConcurrentLevels <= 0) {
            throw new IllegalArgumentException("maxConcurrentLevels must be positive: " + maxConcurrentLevels);
        }
        if (instrumentFactor.signum() <= 0) {
            throw new IllegalArgumentException("instrumentFactor must be positive: " + instrumentFactor);
        }
        for (Double entry : entryLevels) {
            if (entry == null || entry.isNaN() || entry < 0) {
                throw new IllegalArgumentException("Invalid entry level: " + entry);
            }
        }
        for (Double exit : exitLevels) {
            if (exit == null || exit.isNaN() || exit.isInfinite()) {
                throw new IllegalArgumentException("Invalid exit level: " + exit);
            }
        }

        this.entryLevels = List.copyOf(entryLevels);
        this.exitLevels = List.copyOf(exitLevels);
        this.maxConcurrentLevels = maxConcurrentLevels;
        this.instrumentFactor = instrumentFactor;
    }

    // ---- Entry ----

    /**
     * Returns the entry thresholds (in configured order) the policy would enter on for this
     * signal and side. Thresholds that already have an active Level on the side are skipped,
     * and the result never exceeds the remaining capacity.
     */
    public List<Double> getTriggeredEntryLevels(double signal, OrderSide side) {
        lock.readLock().lock();
        try {
            int capacity = maxConcurrentLevels - activeLevels.size();
            List<Double> triggered = new ArrayList<>();
            for (Double threshold : entryLevels) {
                if (triggered.size() >= capacity) {
                    break;
                }
                if (entryPolicy.shouldEnter(signal, threshold, side) && findActive(threshold, side) == null) {
                    triggered.add(threshold);
                }
            }
            return triggered;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Creates and enters a new Level.
     *
     * <p>If a Level with the same threshold and side is already active it is returned with
     * outcome DUPLICATE. If {@code maxConcurrentLevels} Levels are active nothing is created
     * and the outcome is CAPACITY_REACHED.
     *
     * @throws IllegalArgumentException if side or price is null or size is not positive
     */
    public LevelCreationResult createLevel(
            double threshold, OrderSide side, int size, BigDecimal price, double signal, LocalDateTime time) {
        if (side == null || price == null || size <= 0) {
            throw new IllegalArgumentException(
                    "Cannot create level: side=" + side + ", size=" + size + ", price=" + price);
        }

        LevelSnapshot created;
        lock.writeLock().lock();
        try {
            Level existing = findActive(threshold, side);
            if (existing != null) {
                log.debug("Level for threshold {} {} already active as {}", threshold, side, existing.getId());
                return LevelCreationResult.duplicate(existing.snapshot());
            }
            if (activeLevels.size() >= maxConcurrentLevels) {
                log.info(
                        "Max concurrent levels ({}) reached, refusing {} level at threshold {}",
                        maxConcurrentLevels,
                        side,
                        threshold);
                return LevelCreationResult.capacityReached();
            }

            Level level = new Level(nextLevelId++, threshold, exitLevels);
            level.executeEntry(time, side, size, price, signal);
            activeLevels.put(level.getId(), level);
            created = level.snapshot();

            log.info(
                    "Created level {}: {} {} @ {} threshold={} signal={}",
                    level.getId(),
                    side,
                    size,
                    price,
                    threshold,
                    signal);
        } finally {
            lock.writeLock().unlock();
        }

        dispatch(() -> listener.onLevelCreated(created));
        return LevelCreationResult.created(created);
    }

    // ---- Exit ----

    /** Level id -> triggered exit tranche indices, for every active Level with at least one trigger. */
    public Map<Integer, List<Integer>> getAllTriggeredExitLevels(double signal) {
        lock.readLock().lock();
        try {
            Map<Integer, List<Integer>> triggered = new LinkedHashMap<>();
            for (Level level : activeLevels.values()) {
                List<Integer> indices = level.getTriggeredExitLevels(signal);
                if (!indices.isEmpty()) {
                    triggered.put(level.getId(), indices);
                }
            }
            return triggered;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Exits one tranche of an active Level. A Level flattened by this exit is moved to the
     * completed set before the lock is released.
     *
     * @return quantity exited; 0 if the Level is not active or the tranche is exhausted
     */
    public int executeExit(int levelId, int exitLevelIndex, BigDecimal price, LocalDateTime time) {
        List<Runnable> events = new ArrayList<>();
        int exited;

        lock.writeLock().lock();
        try {
            Level level = activeLevels.get(levelId);
            if (level == null) {
                log.debug("Exit for level {} ignored, level not active", levelId);
                return 0;
            }

            exited = level.executeExit(exitLevelIndex, price, time);
            if (exited == 0) {
                return 0;
            }

            LevelSnapshot afterExit = level.snapshot();
            events.add(() -> listener.onExitExecuted(afterExit, exitLevelIndex, exited, price));
            completeIfFlat(level, events);
        } finally {
            lock.writeLock().unlock();
        }

        events.forEach(this::dispatch);
        return exited;
    }

    /**
     * Exits every remaining tranche of an active Level and completes it.
     *
     * @return total quantity exited; 0 if the Level is not active
     */
    public int forceExitLevel(int levelId, BigDecimal price, LocalDateTime time) {
        List<Runnable> events = new ArrayList<>();
        int exited;

        lock.writeLock().lock();
        try {
            Level level = activeLevels.get(levelId);
            if (level == null) {
                return 0;
            }

            exited = level.forceExit(price, time);
            if (exited > 0) {
                LevelSnapshot afterExit = level.snapshot();
                events.add(() -> listener.onExitExecuted(afterExit, Level.ALL_TRANCHES, exited, price));
            }
            log.info("Force exited level {}: qty={} price={}", levelId, exited, price);
            completeIfFlat(level, events);
        } finally {
            lock.writeLock().unlock();
        }

        events.forEach(this::dispatch);
        return exited;
    }

    private void completeIfFlat(Level level, List<Runnable> events) {
        if (!level.isLevelComplete()) {
            return;
        }
        activeLevels.remove(level.getId());
        completedLevels.put(level.getId(), level);

        LevelSnapshot completed = level.snapshot();
        events.add(() -> listener.onLevelCompleted(completed));
        log.info(
                "Level {} completed ({} active, {} completed)",
                level.getId(),
                activeLevels.size(),
                completedLevels.size());
    }

    /**
     * Moves every active Level to the completed set without exiting anything. Used for
     * host-directed shutdown; no exit orders are produced.
     *
     * @return snapshots of the Levels that were drained
     */
    public List<LevelSnapshot> forceCloseAllLevels() {
        List<LevelSnapshot> drained = new ArrayList<>();

        lock.writeLock().lock();
        try {
            for (Level level : activeLevels.values()) {
                completedLevels.put(level.getId(), level);
                drained.add(level.snapshot());
            }
            activeLevels.clear();
        } finally {
            lock.writeLock().unlock();
        }

        if (!drained.isEmpty()) {
            log.warn("Force closed {} active levels", drained.size());
            List<LevelSnapshot> closed = List.copyOf(drained);
            dispatch(() -> listener.onLevelsForceClosed(closed));
        }
        return drained;
    }

    // ---- Order routing ----

    /**
     * Registers an order on an active Level.
     *
     * @return false if the Level is not active or the order id already belongs to another Level
     */
    public boolean addOrderToLevel(
            int levelId, long orderId, LevelOrderType orderType, int quantity, BigDecimal price, int exitLevelIndex) {
        lock.writeLock().lock();
        try {
            Level level = activeLevels.get(levelId);
            if (level == null) {
                log.warn("Cannot add order {} to level {}: level not active", orderId, levelId);
                return false;
            }
            Integer owner = orderIndex.get(orderId);
            if (owner != null && owner != levelId) {
                log.warn("Order {} already belongs to level {}, not adding it to level {}", orderId, owner, levelId);
                return false;
            }

            level.addOrder(orderId, orderType, quantity, price, exitLevelIndex);
            orderIndex.put(orderId, levelId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return false if no Level owns the order */
    public boolean updateOrderStatus(long orderId, OrderStatus status) {
        lock.writeLock().lock();
        try {
            Level level = levelForOrder(orderId);
            if (level == null) {
                log.debug("Status {} for unknown order {} ignored", status, orderId);
                return false;
            }
            return level.updateOrderStatus(orderId, status);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a fill against the Level that owns the order.
     *
     * @return the owning level id, or {@link #NOT_FOUND}
     */
    public int applyFill(long orderId, int quantity) {
        lock.writeLock().lock();
        try {
            Level level = levelForOrder(orderId);
            if (level == null || !level.applyFill(orderId, quantity)) {
                return NOT_FOUND;
            }
            return level.getId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int findLevelForOrder(long orderId) {
        lock.readLock().lock();
        try {
            return orderIndex.getOrDefault(orderId, NOT_FOUND);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops FILLED, CANCELLED and REJECTED orders from every Level and from the order index.
     *
     * @return number of orders removed
     */
    public int cleanupCompletedOrders() {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (Level level : allLevels()) {
                List<Long> orderIds = level.cleanupCompletedOrders();
                orderIds.forEach(orderIndex::remove);
                removed += orderIds.size();
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Level levelForOrder(long orderId) {
        Integer levelId = orderIndex.get(orderId);
        if (levelId == null) {
            return null;
        }
        Level level = activeLevels.get(levelId);
        return level != null ? level : completedLevels.get(levelId);
    }

    // ---- Queries ----

    public Optional<LevelSnapshot> getLevel(int levelId) {
        lock.readLock().lock();
        try {
            Level level = activeLevels.get(levelId);
            if (level == null) {
                level = completedLevels.get(levelId);
            }
            return Optional.ofNullable(level).map(Level::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<LevelSnapshot> getActiveLevels() {
        lock.readLock().lock();
        try {
            return activeLevels.values().stream().map(Level::snapshot).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<LevelSnapshot> getCompletedLevels() {
        lock.readLock().lock();
        try {
            return completedLevels.values().stream().map(Level::snapshot).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<LevelSnapshot> getLevelsForSide(OrderSide side) {
        lock.readLock().lock();
        try {
            return activeLevels.values().stream()
                    .filter(level -> level.getSide() == side)
                    .map(Level::snapshot)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getActiveLevelCount() {
        lock.readLock().lock();
        try {
            return activeLevels.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasCapacity() {
        return getActiveLevelCount() < maxConcurrentLevels;
    }

    /** Signed sum of currentPosition across active Levels. */
    public int getTotalCurrentPosition() {
        lock.readLock().lock();
        try {
            return activeLevels.values().stream().mapToInt(Level::getCurrentPosition).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Unrealized PnL of all active Levels at {@code price}, scaled by the instrument factor. */
    public BigDecimal calculateTotalUnrealizedPnl(BigDecimal price) {
        lock.readLock().lock();
        try {
            BigDecimal total = BigDecimal.ZERO;
            for (Level level : activeLevels.values()) {
                total = total.add(level.calculateUnrealizedPnl(price));
            }
            return total.multiply(instrumentFactor);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasAnyPendingOrders() {
        lock.readLock().lock();
        try {
            return activeLevels.values().stream().anyMatch(Level::hasPendingOrders);
        } finally {
            lock.readLock().unlock();
        }
    }

    public LevelManagerStats getStats() {
        lock.readLock().lock();
        try {
            int totalPosition = 0;
            int longLevels = 0;
            int shortLevels = 0;
            int trackedOrders = 0;
            for (Level level : activeLevels.values()) {
                totalPosition += level.getCurrentPosition();
                if (level.getSide() == OrderSide.BUY) {
                    longLevels++;
                } else {
                    shortLevels++;
                }
                trackedOrders += level.getOrderCount();
            }
            return LevelManagerStats.builder()
                    .activeLevels(activeLevels.size())
                    .completedLevels(completedLevels.size())
                    .maxConcurrentLevels(maxConcurrentLevels)
                    .totalPosition(totalPosition)
                    .longLevels(longLevels)
                    .shortLevels(shortLevels)
                    .trackedOrders(trackedOrders)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Double> getEntryLevels() {
        return entryLevels;
    }

    public List<Double> getExitLevels() {
        return exitLevels;
    }

    public int getMaxConcurrentLevels() {
        return maxConcurrentLevels;
    }

    public BigDecimal getInstrumentFactor() {
        return instrumentFactor;
    }

    /** Clears every Level and the order index. Level ids keep increasing across resets. */
    public void reset() {
        lock.writeLock().lock();
        try {
            activeLevels.clear();
            completedLevels.clear();
            orderIndex.clear();
            log.info("Level manager reset, next level id {}", nextLevelId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---- Internals ----

    private Level findActive(double threshold, OrderSide side) {
        for (Level level : activeLevels.values()) {
            if (level.getSide() == side && Double.compare(level.getEntrySignalThreshold(), threshold) == 0) {
                return level;
            }
        }
        return null;
    }

    private List<Level> allLevels() {
        List<Level> all = new ArrayList<>(activeLevels.values());
        all.addAll(completedLevels.values());
        return all;
    }

    private void dispatch(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.error("Level listener failed: {}", e.getMessage(), e);
        }
    }
}
