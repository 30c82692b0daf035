package com.leveltrader.core.engine;

import com.leveltrader.config.LevelEngineProperties;
import com.leveltrader.domain.enums.LevelOrderType;
import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.model.Bar;
import com.leveltrader.domain.model.Fill;
import com.leveltrader.domain.model.LevelCreationResult;
import com.leveltrader.domain.model.LevelOrder;
import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.domain.model.OrderStatusUpdate;
import com.leveltrader.domain.model.ReconciliationResult;
import com.leveltrader.level.Level;
import com.leveltrader.level.LevelManager;
import com.leveltrader.oms.OrderRequest;
import com.leveltrader.oms.TradeManager;
import com.leveltrader.position.PositionManager;
import com.leveltrader.reconciliation.PositionReconciler;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the level engine for one instrument from host events.
 *
 * <p>Per bar ({@link #onBar}):
 * <ol>
 *   <li>Mark both books to the close</li>
 *   <li>At or after the force-exit time: flatten every Level and make no entries</li>
 *   <li>Exits: every triggered tranche gets an exit order at the close, is executed on its
 *       Level and applied to the theoretical book</li>
 *   <li>Entries: inside the entry window, with capacity left and no live order, each triggered
 *       threshold (BUY first, then SELL) creates a Level, sends the entry order and applies the
 *       theoretical fill</li>
 *   <li>Reconcile theoretical vs actual, when enabled</li>
 * </ol>
 *
 * <p>Gateway fills go to the actual book only ({@link #onFill}); the theoretical book is fed by
 * the engine's own decisions. The gateway is always called between LevelManager/PositionManager
 * operations, never while one of their locks is held.
 *
 * <p>Bars are expected in order from a single host thread. Fills and status updates may arrive
 * on other threads.
 */
public class LevelTradingEngine {

    private static final Logger log = LoggerFactory.getLogger(LevelTradingEngine.class);

    private static final List<OrderSide> ENTRY_SIDES = List.of(OrderSide.BUY, OrderSide.SELL);

    private final LevelEngineProperties properties;
    private final LevelManager levelManager;
    private final PositionManager theoPositionManager;
    private final PositionManager actualPositionManager;
    private final TradeManager tradeManager;
    private final PositionReconciler positionReconciler;

    private volatile Bar lastBar;

    public LevelTradingEngine(
            LevelEngineProperties properties,
            LevelManager levelManager,
            PositionManager theoPositionManager,
            PositionManager actualPositionManager,
            TradeManager tradeManager,
            PositionReconciler positionReconciler) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.levelManager = Objects.requireNonNull(levelManager, "levelManager");
        this.theoPositionManager = Objects.requireNonNull(theoPositionManager, "theoPositionManager");
        this.actualPositionManager = Objects.requireNonNull(actualPositionManager, "actualPositionManager");
        this.tradeManager = Objects.requireNonNull(tradeManager, "tradeManager");
        this.positionReconciler = Objects.requireNonNull(positionReconciler, "positionReconciler");
    }

    // ---- Bars ----

    public void onBar(Bar bar, double signal) {
        if (bar == null || bar.getClose() == null || bar.getTimestamp() == null) {
            log.warn("Ignoring incomplete bar {}", bar);
            return;
        }
        lastBar = bar;

        theoPositionManager.updateTradeMetric(bar);
        actualPositionManager.updateTradeMetric(bar);

        LocalTime timeOfDay = bar.getTimestamp().toLocalTime();
        log.debug("Bar {} close={} signal={}", bar.getTimestamp(), bar.getClose(), signal);

        if (properties.isForceExitTime(timeOfDay)) {
            flattenAll(bar);
        } else {
            processExits(bar, signal);
            processEntries(bar, signal, timeOfDay);
        }

        if (properties.isReconcileOnBar()) {
            positionReconciler.reconcile(bar.getClose(), "BAR");
        }
    }

    private void processExits(Bar bar, double signal) {
        Map<Integer, List<Integer>> triggered = levelManager.getAllTriggeredExitLevels(signal);

        for (Map.Entry<Integer, List<Integer>> entry : triggered.entrySet()) {
            int levelId = entry.getKey();
            for (Integer exitIndex : entry.getValue()) {
                Optional<LevelSnapshot> level = levelManager.getLevel(levelId);
                if (level.isEmpty() || level.get().isLevelComplete()) {
                    break;
                }
                int quantity = level.get().getExitLevelStatus().getOrDefault(exitIndex, 0);
                if (quantity > 0) {
                    exitTranche(level.get(), exitIndex, quantity, bar, signal);
                }
            }
        }
    }

    private void exitTranche(LevelSnapshot level, int exitIndex, int quantity, Bar bar, double signal) {
        OrderSide exitSide = level.getSide().opposite();
        String tag = "EXIT L" + level.getId() + "#" + exitIndex;
        long orderId = tradeManager.createOrder(orderRequest(exitSide, quantity, bar.getClose(), tag));
        if (orderId == TradeManager.NO_ORDER) {
            log.warn("Exit order for level {} tranche {} not accepted, retrying next bar", level.getId(), exitIndex);
            return;
        }

        levelManager.addOrderToLevel(level.getId(), orderId, LevelOrderType.EXIT, quantity, bar.getClose(), exitIndex);
        int exited = levelManager.executeExit(level.getId(), exitIndex, bar.getClose(), bar.getTimestamp());
        if (exited > 0) {
            theoPositionManager.updatePosition(bar.getTimestamp(), exitSide, exited, bar.getClose());
            log.info(
                    "Level {} exit #{}: {} {} @ {} signal={} threshold={}",
                    level.getId(),
                    exitIndex,
                    exitSide,
                    exited,
                    bar.getClose(),
                    signal,
                    level.getEntrySignalThreshold() * level.getExitLevels().get(exitIndex));
        }
    }

    private void processEntries(Bar bar, double signal, LocalTime timeOfDay) {
        if (!properties.isWithinEntryWindow(timeOfDay)) {
            log.debug("Outside entry window at {}", timeOfDay);
            return;
        }
        if (tradeManager.hasLiveOrder()) {
            log.debug("Entries skipped, order {} still live", tradeManager.getCurrentOrderId());
            return;
        }

        for (OrderSide side : ENTRY_SIDES) {
            for (Double threshold : levelManager.getTriggeredEntryLevels(signal, side)) {
                if (!levelManager.hasCapacity()) {
                    log.debug("No level capacity left at signal {}", signal);
                    return;
                }
                enterLevel(threshold, side, bar, signal);
            }
        }
    }

    private void enterLevel(double threshold, OrderSide side, Bar bar, double signal) {
        int size = properties.getPositionSize();
        LevelCreationResult result =
                levelManager.createLevel(threshold, side, size, bar.getClose(), signal, bar.getTimestamp());
        if (!result.isCreated()) {
            return;
        }

        int levelId = result.level().getId();
        long orderId = tradeManager.createOrder(orderRequest(side, size, bar.getClose(), "ENTRY L" + levelId));
        if (orderId != TradeManager.NO_ORDER) {
            levelManager.addOrderToLevel(
                    levelId, orderId, LevelOrderType.ENTRY, size, bar.getClose(), LevelOrder.NO_EXIT_INDEX);
        } else {
            log.warn("Entry order for level {} not accepted, reconciliation will close the gap", levelId);
        }
        theoPositionManager.updatePosition(bar.getTimestamp(), side, size, bar.getClose());
    }

    /** Sends one flatten order per active Level and exits it completely at the bar close. */
    private void flattenAll(Bar bar) {
        List<LevelSnapshot> active = levelManager.getActiveLevels();
        if (active.isEmpty()) {
            return;
        }
        log.info("Force exit time {} reached, flattening {} levels", properties.getForceExitTime(), active.size());

        for (LevelSnapshot level : active) {
            int quantity = Math.abs(level.getCurrentPosition());
            if (quantity == 0) {
                continue;
            }
            OrderSide exitSide = level.getSide().opposite();
            long orderId = tradeManager.createOrder(
                    orderRequest(exitSide, quantity, bar.getClose(), "FLATTEN L" + level.getId()));
            if (orderId != TradeManager.NO_ORDER) {
                levelManager.addOrderToLevel(
                        level.getId(), orderId, LevelOrderType.EXIT, quantity, bar.getClose(), Level.ALL_TRANCHES);
            }
            int exited = levelManager.forceExitLevel(level.getId(), bar.getClose(), bar.getTimestamp());
            if (exited > 0) {
                theoPositionManager.updatePosition(bar.getTimestamp(), exitSide, exited, bar.getClose());
            }
        }
    }

    private OrderRequest orderRequest(OrderSide side, int quantity, BigDecimal limitPrice, String tag) {
        return OrderRequest.builder()
                .instrumentId(properties.getInstrumentId())
                .side(side)
                .quantity(quantity)
                .limitPrice(limitPrice)
                .tag(tag)
                .build();
    }

    // ---- Gateway callbacks ----

    /** Applies an execution to the actual book and to the Level that owns the order, if any. */
    public void onFill(Fill fill) {
        if (fill == null) {
            return;
        }
        boolean applied = actualPositionManager.updatePosition(
                fill.getTimestamp(), fill.getSide(), fill.getQuantity(), fill.getPrice());
        if (!applied) {
            return;
        }

        int levelId = levelManager.applyFill(fill.getOrderId(), fill.getQuantity());
        if (levelId == LevelManager.NOT_FOUND) {
            log.debug("Fill for order {} is not attributed to a level", fill.getOrderId());
        } else {
            log.debug("Fill {} {} @ {} on level {}", fill.getSide(), fill.getQuantity(), fill.getPrice(), levelId);
        }
    }

    public void onOrderStatus(OrderStatusUpdate update) {
        if (update == null || update.getStatus() == null) {
            return;
        }
        levelManager.updateOrderStatus(update.getOrderId(), update.getStatus());
        tradeManager.handleOrderUpdate(update);

        if (update.getStatus().isTerminal()) {
            levelManager.cleanupCompletedOrders();
        }
    }

    // ---- Host control ----

    /** Reconciles at the last bar close; without a bar the corrective order carries no limit price. */
    public ReconciliationResult reconcile(String trigger) {
        Bar bar = lastBar;
        return positionReconciler.reconcile(bar != null ? bar.getClose() : null, trigger);
    }

    /** Cancels every live order and drains active Levels without sending exit orders. */
    public List<LevelSnapshot> forceCloseAll() {
        int cancelled = tradeManager.cancelAllOrders();
        List<LevelSnapshot> drained = levelManager.forceCloseAllLevels();
        log.warn("Force close: {} cancel requests sent, {} levels drained", cancelled, drained.size());
        return drained;
    }

    public void shutdown() {
        log.info("Level engine shutting down");
        forceCloseAll();
    }

    /** Clears all Levels, both books and order tracking for a new session. */
    public void reset() {
        levelManager.reset();
        theoPositionManager.reset();
        actualPositionManager.reset();
        tradeManager.reset();
        lastBar = null;
        log.info("Level engine reset");
    }

    public Optional<Bar> getLastBar() {
        return Optional.ofNullable(lastBar);
    }
}
