package com.leveltrader.event;

import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.domain.model.ReconciliationResult;
import com.leveltrader.domain.model.TradeCycleRecord;
import java.math.BigDecimal;
import java.util.List;

/**
 * Observer of level and position lifecycle changes.
 *
 * <p>Callbacks are invoked after the emitting component has released its lock, so an
 * implementation may call back into the LevelManager or PositionManager. Snapshots are
 * copies; mutating them has no effect on the engine.
 */
public interface LevelEngineListener {

    LevelEngineListener NO_OP = new LevelEngineListener() {};

    default void onLevelCreated(LevelSnapshot level) {}

    default void onExitExecuted(LevelSnapshot level, int exitLevelIndex, int quantity, BigDecimal price) {}

    default void onLevelCompleted(LevelSnapshot level) {}

    default void onLevelsForceClosed(List<LevelSnapshot> levels) {}

    default void onTradeCycleCompleted(TradeCycleRecord record) {}

    default void onReconciliation(ReconciliationResult result) {}
}
