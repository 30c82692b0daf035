package com.leveltrader.reconciliation;

import com.leveltrader.domain.enums.OrderSide;
import com.leveltrader.domain.model.PerformanceComparison;
import com.leveltrader.domain.model.ReconciliationResult;
import com.leveltrader.event.LevelEngineListener;
import com.leveltrader.oms.OrderRequest;
import com.leveltrader.oms.TradeManager;
import com.leveltrader.position.PositionManager;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the actual (broker-filled) book aligned with the theoretical book.
 *
 * <p>The theoretical book receives every fill the engine intends at the bar close; the actual
 * book receives what the gateway really executed. Their difference is closed by a corrective
 * order for {@code theo - actual}:
 * <ul>
 *   <li>discrepancy 0: nothing to do</li>
 *   <li>a live order exists: skipped, the pending order may still close the gap</li>
 *   <li>otherwise: BUY for a positive discrepancy, SELL for a negative one</li>
 * </ul>
 *
 * <p>Every run is logged and reported through {@link LevelEngineListener#onReconciliation}.
 * Must not be called while a LevelManager or PositionManager lock is held.
 */
public class PositionReconciler {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciler.class);

    public static final String SKIP_IN_SYNC = "IN_SYNC";
    public static final String SKIP_LIVE_ORDER = "LIVE_ORDER";
    public static final String SKIP_ORDER_REJECTED = "ORDER_REJECTED";

    private static final int PCT_SCALE = 4;

    private final PositionManager theoPositionManager;
    private final PositionManager actualPositionManager;
    private final TradeManager tradeManager;
    private final String instrumentId;
    private final LevelEngineListener listener;

    private final AtomicReference<ReconciliationResult> lastResult = new AtomicReference<>();

    public PositionReconciler(
            PositionManager theoPositionManager,
            PositionManager actualPositionManager,
            TradeManager tradeManager,
            String instrumentId,
            LevelEngineListener listener) {
        this.theoPositionManager = Objects.requireNonNull(theoPositionManager, "theoPositionManager");
        this.actualPositionManager = Objects.requireNonNull(actualPositionManager, "actualPositionManager");
        this.tradeManager = Objects.requireNonNull(tradeManager, "tradeManager");
        this.instrumentId = Objects.requireNonNull(instrumentId, "instrumentId");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** theo - actual. Positive means the actual book is short of the model. */
    public int getPositionDiscrepancy() {
        return theoPositionManager.getCurrentPosition() - actualPositionManager.getCurrentPosition();
    }

    /**
     * Compares both books and sends a corrective order when they differ and no order is live.
     *
     * @param referencePrice limit price of the corrective order, normally the last bar close
     * @param trigger        what initiated the run, e.g. "BAR", "MANUAL"
     */
    public ReconciliationResult reconcile(BigDecimal referencePrice, String trigger) {
        int theo = theoPositionManager.getCurrentPosition();
        int actual = actualPositionManager.getCurrentPosition();
        int discrepancy = theo - actual;

        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(LocalDateTime.now())
                .trigger(trigger)
                .theoPosition(theo)
                .actualPosition(actual)
                .discrepancy(discrepancy)
                .referencePrice(referencePrice)
                .correctiveOrderId(TradeManager.NO_ORDER)
                .build();

        if (discrepancy == 0) {
            result.setSkippedReason(SKIP_IN_SYNC);
            log.debug("Reconciliation [{}]: in sync at {}", trigger, actual);
        } else if (tradeManager.hasLiveOrder()) {
            result.setSkippedReason(SKIP_LIVE_ORDER);
            log.info(
                    "Reconciliation [{}]: theo={} actual={} diff={}, order {} still live, skipping",
                    trigger,
                    theo,
                    actual,
                    discrepancy,
                    tradeManager.getCurrentOrderId());
        } else {
            sendCorrection(result, discrepancy, referencePrice);
        }

        lastResult.set(result);
        try {
            listener.onReconciliation(result);
        } catch (RuntimeException e) {
            log.error("Reconciliation listener failed: {}", e.getMessage(), e);
        }
        return result;
    }

    private void sendCorrection(ReconciliationResult result, int discrepancy, BigDecimal referencePrice) {
        OrderSide side = discrepancy > 0 ? OrderSide.BUY : OrderSide.SELL;
        int quantity = Math.abs(discrepancy);

        long orderId = tradeManager.createOrder(OrderRequest.builder()
                .instrumentId(instrumentId)
                .side(side)
                .quantity(quantity)
                .limitPrice(referencePrice)
                .tag("RECONCILE")
                .build());

        result.setCorrectiveSide(side);
        result.setCorrectiveQuantity(quantity);
        result.setCorrectiveOrderId(orderId);

        if (orderId == TradeManager.NO_ORDER) {
            result.setSkippedReason(SKIP_ORDER_REJECTED);
            log.warn(
                    "Reconciliation [{}]: corrective {} {} @ {} was not accepted",
                    result.getTrigger(),
                    side,
                    quantity,
                    referencePrice);
        } else {
            log.info(
                    "Reconciliation [{}]: theo={} actual={}, sent {} {} @ {} as order {}",
                    result.getTrigger(),
                    result.getTheoPosition(),
                    result.getActualPosition(),
                    side,
                    quantity,
                    referencePrice,
                    orderId);
        }
    }

    /** Side-by-side PnL and cycle counts of both books. */
    public PerformanceComparison compare() {
        BigDecimal theoTotal = theoPositionManager.getTotalPnl();
        BigDecimal actualTotal = actualPositionManager.getTotalPnl();
        BigDecimal difference = theoTotal.subtract(actualTotal);

        BigDecimal differencePct = actualTotal.signum() == 0
                ? BigDecimal.ZERO
                : difference.divide(actualTotal.abs(), PCT_SCALE + 2, RoundingMode.HALF_UP)
                        .multiply(BigDecimal.valueOf(100))
                        .setScale(PCT_SCALE, RoundingMode.HALF_UP);

        return PerformanceComparison.builder()
                .theoTotalPnl(theoTotal)
                .actualTotalPnl(actualTotal)
                .totalPnlDifference(difference)
                .totalPnlDifferencePct(differencePct)
                .theoRealizedPnl(theoPositionManager.getRealizedPnl())
                .actualRealizedPnl(actualPositionManager.getRealizedPnl())
                .theoUnrealizedPnl(theoPositionManager.getUnrealizedPnl())
                .actualUnrealizedPnl(actualPositionManager.getUnrealizedPnl())
                .theoCycleCount(theoPositionManager.getCompletedCycleCount())
                .actualCycleCount(actualPositionManager.getCompletedCycleCount())
                .build();
    }

    public Optional<ReconciliationResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }
}
