package com.leveltrader.position;

import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.model.Bar;
import com.leveltrader.domain.model.PositionSnapshot;
import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.event.LevelEngineListener;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregate position of one book across every fill, independent of which Level produced it.
 *
 * <p>Each fill is netted into the running position:
 * <ul>
 *   <li><b>Open:</b> flat position, a new trade cycle starts at the fill price</li>
 *   <li><b>Add:</b> same direction, average price is volume-weighted</li>
 *   <li><b>Reduce / close:</b> opposite direction within the open size, PnL is realized
 *       against the average price; reaching zero closes the trade cycle</li>
 *   <li><b>Reverse:</b> opposite direction larger than the open size, the whole position is
 *       closed at the fill price and the residual opens a new cycle</li>
 * </ul>
 *
 * <p>Realized PnL = direction * closedQty * (exitPrice - averagePrice) * instrumentFactor.
 * Unrealized PnL is marked against the average price; trade-cycle excursions are tracked
 * separately from the cycle's entry price by {@link TradeMetrics}.
 *
 * <p>Thread-safe. Mutations take the write lock, queries the read lock. Completed cycles
 * are reported to the listener after the lock is released.
 */
public class PositionManager {

    private static final Logger log = LoggerFactory.getLogger(PositionManager.class);

    private static final int AVERAGE_PRICE_SCALE = 8;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final String book;
    private final BigDecimal instrumentFactor;
    private final LevelEngineListener listener;

    private int currentPosition;
    private BigDecimal averagePrice;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;
    private BigDecimal lastPrice;
    private LocalDateTime firstEntryTime;
    private LocalDateTime lastEntryTime;
    private TradeMetrics currentTradeMetric;
    private final List<TradeCycleRecord> cycleMetrics = new ArrayList<>();

    public PositionManager(String book, BigDecimal instrumentFactor, LevelEngineListener listener) {
        this.book = Objects.requireNonNull(book, "book");
        this.instrumentFactor = Objects.requireNonNull(instrumentFactor, "instrumentFactor");
        this.listener = Objects.requireNonNull(listener, "listener");
        if (instrumentFactor.signum() <= 0) {
            throw new IllegalArgumentException("instrumentFactor must be positive: " + instrumentFactor);
        }
    }

    /**
     * Nets one fill into the position.
     *
     * @return false if the fill was ignored (null side or price, non-positive quantity)
     */
    public boolean updatePosition(LocalDateTime time, OrderSide side, int quantity, BigDecimal price) {
        if (side == null || price == null || quantity <= 0) {
            log.warn("[{}] Ignoring invalid fill: side={} qty={} price={}", book, side, quantity, price);
            return false;
        }

        int signedQuantity = quantity * side.sign();
        List<TradeCycleRecord> closedCycles = new ArrayList<>();

        lock.writeLock().lock();
        try {
            lastPrice = price;

            if (currentPosition == 0) {
                openPosition(time, signedQuantity, price);
            } else if ((double) signedQuantity / currentPosition < -1) {
                int residual = currentPosition + signedQuantity;
                log.info("[{}] Reversal: {} -> {} @ {}", book, currentPosition, residual, price);
                reduce(time, -currentPosition, price, closedCycles);
                openPosition(time, residual, price);
            } else if ((double) signedQuantity / currentPosition > 0) {
                addToPosition(time, signedQuantity, price);
            } else {
                reduce(time, signedQuantity, price, closedCycles);
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (TradeCycleRecord cycle : closedCycles) {
            try {
                listener.onTradeCycleCompleted(cycle);
            } catch (RuntimeException e) {
                log.error("[{}] Trade cycle listener failed: {}", book, e.getMessage(), e);
            }
        }
        return true;
    }

    private void openPosition(LocalDateTime time, int signedQuantity, BigDecimal price) {
        currentPosition = signedQuantity;
        averagePrice = price;
        firstEntryTime = time;
        lastEntryTime = time;
        unrealizedPnl = BigDecimal.ZERO;
        currentTradeMetric = new TradeMetrics(time, price, signedQuantity, OrderSide.ofSignedQuantity(signedQuantity));

        log.debug("[{}] Opened {} @ {}", book, signedQuantity, price);
    }

    private void addToPosition(LocalDateTime time, int signedQuantity, BigDecimal price) {
        int newPosition = currentPosition + signedQuantity;
        BigDecimal totalCost = averagePrice
                .multiply(BigDecimal.valueOf(Math.abs(currentPosition)))
                .add(price.multiply(BigDecimal.valueOf(Math.abs(signedQuantity))));
        averagePrice =
                totalCost.divide(BigDecimal.valueOf(Math.abs(newPosition)), AVERAGE_PRICE_SCALE, RoundingMode.HALF_UP);
        currentPosition = newPosition;
        lastEntryTime = time;
        currentTradeMetric.updateFill(newPosition, averagePrice, time);

        log.debug("[{}] Added {} @ {}, position={} avg={}", book, signedQuantity, price, currentPosition, averagePrice);
    }

    /** Reduces by an opposite-signed quantity whose magnitude does not exceed the open position. */
    private void reduce(LocalDateTime time, int signedQuantity, BigDecimal price, List<TradeCycleRecord> closedCycles) {
        BigDecimal pnl = realizePnl(Math.abs(signedQuantity), price);
        realizedPnl = realizedPnl.add(pnl);
        currentPosition += signedQuantity;

        currentTradeMetric.recordFill(time);
        if (currentPosition == 0) {
            currentTradeMetric.close(price, time, instrumentFactor);
            TradeCycleRecord cycle = currentTradeMetric.toRecord(book);
            cycleMetrics.add(cycle);
            closedCycles.add(cycle);

            log.info(
                    "[{}] Cycle closed: {} avg={} exit={} pnl={} realized={}",
                    book,
                    cycle.getSide(),
                    averagePrice,
                    price,
                    cycle.getPnl(),
                    realizedPnl);

            currentTradeMetric = null;
            averagePrice = null;
            unrealizedPnl = BigDecimal.ZERO;
        } else {
            currentTradeMetric.updatePrice(price, time);
            log.debug("[{}] Reduced by {} @ {}, position={} pnl={}", book, signedQuantity, price, currentPosition, pnl);
        }
    }

    /** PnL of closing {@code closedQuantity} of the open position at {@code exitPrice}. */
    private BigDecimal realizePnl(int closedQuantity, BigDecimal exitPrice) {
        if (closedQuantity == 0) {
            return BigDecimal.ZERO;
        }
        int direction = currentPosition > 0 ? 1 : -1;
        return exitPrice
                .subtract(averagePrice)
                .multiply(BigDecimal.valueOf((long) closedQuantity * direction))
                .multiply(instrumentFactor);
    }

    /** Marks the open position to the bar close. Only updates the last price while flat. */
    public void updateTradeMetric(Bar bar) {
        if (bar == null || bar.getClose() == null) {
            return;
        }
        updateTradeMetric(bar.getClose(), bar.getTimestamp());
    }

    public void updateTradeMetric(BigDecimal price, LocalDateTime time) {
        lock.writeLock().lock();
        try {
            lastPrice = price;
            if (currentPosition == 0) {
                unrealizedPnl = BigDecimal.ZERO;
                return;
            }
            unrealizedPnl = price.subtract(averagePrice)
                    .multiply(BigDecimal.valueOf(currentPosition))
                    .multiply(instrumentFactor);
            currentTradeMetric.updatePrice(price, time);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---- Queries ----

    public String getBook() {
        return book;
    }

    public int getCurrentPosition() {
        lock.readLock().lock();
        try {
            return currentPosition;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Volume-weighted average price of the open position; empty while flat. */
    public Optional<BigDecimal> getAveragePrice() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(averagePrice);
        } finally {
            lock.readLock().unlock();
        }
    }

    public BigDecimal getRealizedPnl() {
        lock.readLock().lock();
        try {
            return realizedPnl;
        } finally {
            lock.readLock().unlock();
        }
    }

    public BigDecimal getUnrealizedPnl() {
        lock.readLock().lock();
        try {
            return unrealizedPnl;
        } finally {
            lock.readLock().unlock();
        }
    }

    public BigDecimal getTotalPnl() {
        lock.readLock().lock();
        try {
            return realizedPnl.add(unrealizedPnl);
        } finally {
            lock.readLock().unlock();
        }
    }

    public BigDecimal getLastPrice() {
        lock.readLock().lock();
        try {
            return lastPrice;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isFlat() {
        return getCurrentPosition() == 0;
    }

    /** The in-progress cycle as a record (exit price and pnl not yet set), if a position is open. */
    public Optional<TradeCycleRecord> getOpenCycle() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(currentTradeMetric).map(metric -> metric.toRecord(book));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TradeCycleRecord> getCycleMetrics() {
        lock.readLock().lock();
        try {
            return List.copyOf(cycleMetrics);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCompletedCycleCount() {
        lock.readLock().lock();
        try {
            return cycleMetrics.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public PositionSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return PositionSnapshot.builder()
                    .book(book)
                    .currentPosition(currentPosition)
                    .averagePrice(averagePrice)
                    .realizedPnl(realizedPnl)
                    .unrealizedPnl(unrealizedPnl)
                    .lastPrice(lastPrice)
                    .firstEntryTime(firstEntryTime)
                    .lastEntryTime(lastEntryTime)
                    .completedCycles(cycleMetrics.size())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Clears position, PnL and cycle history. */
    public void reset() {
        lock.writeLock().lock();
        try {
            currentPosition = 0;
            averagePrice = null;
            realizedPnl = BigDecimal.ZERO;
            unrealizedPnl = BigDecimal.ZERO;
            lastPrice = null;
            firstEntryTime = null;
            lastEntryTime = null;
            currentTradeMetric = null;
            cycleMetrics.clear();
            log.info("[{}] Position manager reset", book);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
