package com.leveltrader.api.controller;

import com.leveltrader.api.dto.response.EngineStatsResponse;
import com.leveltrader.config.LevelEngineConfig;
import com.leveltrader.config.LevelEngineProperties;
import com.leveltrader.core.engine.LevelTradingEngine;
import com.leveltrader.domain.model.Bar;
import com.leveltrader.domain.model.LevelSnapshot;
import com.leveltrader.domain.model.PerformanceComparison;
import com.leveltrader.domain.model.PositionSnapshot;
import com.leveltrader.domain.model.ReconciliationResult;
import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.exception.ResourceNotFoundException;
import com.leveltrader.level.LevelManager;
import com.leveltrader.observability.TradeCycleAuditLogger;
import com.leveltrader.oms.TradeManager;
import com.leveltrader.position.PositionManager;
import com.leveltrader.reconciliation.PositionReconciler;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-mostly host control surface for the level engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/engine/stats -- level counters, both books, live order state</li>
 *   <li>GET /api/engine/levels, /levels/completed, /levels/{id} -- Level snapshots</li>
 *   <li>GET /api/engine/positions -- theo and actual books</li>
 *   <li>GET /api/engine/cycles?book= -- completed trade cycles of one book</li>
 *   <li>GET /api/engine/audit -- recent audit records, newest first</li>
 *   <li>GET /api/engine/comparison -- theo vs actual PnL</li>
 *   <li>POST /api/engine/reconcile -- on-demand reconciliation</li>
 *   <li>POST /api/engine/force-close -- cancel live orders and drain all Levels</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine")
public class LevelEngineController {

    private static final Logger log = LoggerFactory.getLogger(LevelEngineController.class);

    private final LevelTradingEngine levelTradingEngine;
    private final LevelManager levelManager;
    private final PositionManager theoPositionManager;
    private final PositionManager actualPositionManager;
    private final TradeManager tradeManager;
    private final PositionReconciler positionReconciler;
    private final TradeCycleAuditLogger tradeCycleAuditLogger;
    private final LevelEngineProperties properties;

    public LevelEngineController(
            LevelTradingEngine levelTradingEngine,
            LevelManager levelManager,
            @Qualifier("theoPositionManager") PositionManager theoPositionManager,
            @Qualifier("actualPositionManager") PositionManager actualPositionManager,
            TradeManager tradeManager,
            PositionReconciler positionReconciler,
            TradeCycleAuditLogger tradeCycleAuditLogger,
            LevelEngineProperties properties) {
        this.levelTradingEngine = levelTradingEngine;
        this.levelManager = levelManager;
        this.theoPositionManager = theoPositionManager;
        this.actualPositionManager = actualPositionManager;
        this.tradeManager = tradeManager;
        this.positionReconciler = positionReconciler;
        this.tradeCycleAuditLogger = tradeCycleAuditLogger;
        this.properties = properties;
    }

    @GetMapping("/stats")
    public ResponseEntity<EngineStatsResponse> getStats() {
        EngineStatsResponse response = EngineStatsResponse.builder()
                .instrumentId(properties.getInstrumentId())
                .levels(levelManager.getStats())
                .theo(theoPositionManager.snapshot())
                .actual(actualPositionManager.snapshot())
                .discrepancy(positionReconciler.getPositionDiscrepancy())
                .liveOrder(tradeManager.hasLiveOrder())
                .currentOrderId(tradeManager.getCurrentOrderId())
                .lastBarTime(levelTradingEngine.getLastBar().map(Bar::getTimestamp).orElse(null))
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/levels")
    public ResponseEntity<List<LevelSnapshot>> getActiveLevels() {
        return ResponseEntity.ok(levelManager.getActiveLevels());
    }

    @GetMapping("/levels/completed")
    public ResponseEntity<List<LevelSnapshot>> getCompletedLevels() {
        return ResponseEntity.ok(levelManager.getCompletedLevels());
    }

    @GetMapping("/levels/{id}")
    public ResponseEntity<LevelSnapshot> getLevel(@PathVariable int id) {
        return levelManager
                .getLevel(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Level", id));
    }

    @GetMapping("/positions")
    public ResponseEntity<Map<String, PositionSnapshot>> getPositions() {
        Map<String, PositionSnapshot> positions = new LinkedHashMap<>();
        positions.put(LevelEngineConfig.THEO_BOOK, theoPositionManager.snapshot());
        positions.put(LevelEngineConfig.ACTUAL_BOOK, actualPositionManager.snapshot());
        return ResponseEntity.ok(positions);
    }

    @GetMapping("/cycles")
    public ResponseEntity<List<TradeCycleRecord>> getCycles(
            @RequestParam(defaultValue = LevelEngineConfig.ACTUAL_BOOK) String book) {
        return ResponseEntity.ok(positionManager(book).getCycleMetrics());
    }

    @GetMapping("/audit")
    public ResponseEntity<List<TradeCycleRecord>> getAudit(
            @RequestParam(required = false) String book, @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(tradeCycleAuditLogger.getRecent(book, limit));
    }

    @GetMapping("/comparison")
    public ResponseEntity<PerformanceComparison> getComparison() {
        return ResponseEntity.ok(positionReconciler.compare());
    }

    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationResult> reconcile() {
        log.info("Manual reconciliation requested");
        return ResponseEntity.ok(levelTradingEngine.reconcile("MANUAL"));
    }

    @PostMapping("/force-close")
    public ResponseEntity<List<LevelSnapshot>> forceClose() {
        log.warn("Manual force close requested");
        return ResponseEntity.ok(levelTradingEngine.forceCloseAll());
    }

    private PositionManager positionManager(String book) {
        if (LevelEngineConfig.THEO_BOOK.equals(book)) {
            return theoPositionManager;
        }
        if (LevelEngineConfig.ACTUAL_BOOK.equals(book)) {
            return actualPositionManager;
        }
        throw new IllegalArgumentException("Unknown book '" + book + "', expected theo or actual");
    }
}
