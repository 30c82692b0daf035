package com.leveltrader.config;

import com.leveltrader.broker.BrokerGateway;
import com.leveltrader.core.engine.LevelTradingEngine;
import com.leveltrader.event.EventPublisherHelper;
import com.leveltrader.exception.ConfigurationException;
import com.leveltrader.level.EntryPolicy;
import com.leveltrader.level.LevelManager;
import com.leveltrader.level.ThresholdEntryPolicy;
import com.leveltrader.oms.GatewayTradeManager;
import com.leveltrader.oms.TradeManager;
import com.leveltrader.position.PositionManager;
import com.leveltrader.reconciliation.PositionReconciler;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the level engine from application.properties.
 *
 * <p>Properties prefix: {@code leveltrader.engine.*}. Lists are comma separated, times are
 * {@code HH:mm}. Invalid values fail startup with a {@link ConfigurationException}.
 *
 * <p>Two {@link PositionManager} books are created: {@code theo} receives the fills the engine
 * intends at the bar close, {@code actual} the fills the gateway reports. Both and the
 * LevelManager publish through {@link EventPublisherHelper}.
 */
@Configuration
public class LevelEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(LevelEngineConfig.class);

    public static final String THEO_BOOK = "theo";
    public static final String ACTUAL_BOOK = "actual";

    @Bean
    public LevelEngineProperties levelEngineProperties(
            @Value("${leveltrader.engine.instrument-id}") String instrumentId,
            @Value("${leveltrader.engine.entry-levels}") String entryLevels,
            @Value("${leveltrader.engine.exit-levels}") String exitLevels,
            @Value("${leveltrader.engine.max-concurrent-levels:10}") int maxConcurrentLevels,
            @Value("${leveltrader.engine.position-size}") int positionSize,
            @Value("${leveltrader.engine.instrument-factor:1}") BigDecimal instrumentFactor,
            @Value("${leveltrader.engine.force-exit-time:#{null}}") String forceExitTime,
            @Value("${leveltrader.engine.entry-start-time:#{null}}") String entryStartTime,
            @Value("${leveltrader.engine.entry-end-time:#{null}}") String entryEndTime,
            @Value("${leveltrader.engine.reconcile-on-bar:true}") boolean reconcileOnBar) {
        LevelEngineProperties properties = LevelEngineProperties.builder()
                .instrumentId(instrumentId)
                .entryLevels(parseLevels("leveltrader.engine.entry-levels", entryLevels))
                .exitLevels(parseLevels("leveltrader.engine.exit-levels", exitLevels))
                .maxConcurrentLevels(maxConcurrentLevels)
                .positionSize(positionSize)
                .instrumentFactor(instrumentFactor)
                .forceExitTime(parseTime("leveltrader.engine.force-exit-time", forceExitTime))
                .entryStartTime(parseTime("leveltrader.engine.entry-start-time", entryStartTime))
                .entryEndTime(parseTime("leveltrader.engine.entry-end-time", entryEndTime))
                .reconcileOnBar(reconcileOnBar)
                .build();
        properties.validate();

        log.info(
                "Level engine for {}: entries={} exits={} maxLevels={} size={} factor={} forceExit={}",
                properties.getInstrumentId(),
                properties.getEntryLevels(),
                properties.getExitLevels(),
                properties.getMaxConcurrentLevels(),
                properties.getPositionSize(),
                properties.getInstrumentFactor(),
                properties.getForceExitTime());
        return properties;
    }

    @Bean
    public EntryPolicy entryPolicy() {
        return new ThresholdEntryPolicy();
    }

    @Bean
    public LevelManager levelManager(
            LevelEngineProperties properties, EntryPolicy entryPolicy, EventPublisherHelper eventPublisherHelper) {
        return new LevelManager(
                properties.getEntryLevels(),
                properties.getExitLevels(),
                properties.getMaxConcurrentLevels(),
                properties.getInstrumentFactor(),
                entryPolicy,
                eventPublisherHelper);
    }

    @Bean
    public PositionManager theoPositionManager(
            LevelEngineProperties properties, EventPublisherHelper eventPublisherHelper) {
        return new PositionManager(THEO_BOOK, properties.getInstrumentFactor(), eventPublisherHelper);
    }

    @Bean
    public PositionManager actualPositionManager(
            LevelEngineProperties properties, EventPublisherHelper eventPublisherHelper) {
        return new PositionManager(ACTUAL_BOOK, properties.getInstrumentFactor(), eventPublisherHelper);
    }

    @Bean
    public TradeManager tradeManager(BrokerGateway brokerGateway) {
        return new GatewayTradeManager(brokerGateway);
    }

    @Bean
    public PositionReconciler positionReconciler(
            @Qualifier("theoPositionManager") PositionManager theoPositionManager,
            @Qualifier("actualPositionManager") PositionManager actualPositionManager,
            TradeManager tradeManager,
            LevelEngineProperties properties,
            EventPublisherHelper eventPublisherHelper) {
        return new PositionReconciler(
                theoPositionManager,
                actualPositionManager,
                tradeManager,
                properties.getInstrumentId(),
                eventPublisherHelper);
    }

    @Bean(destroyMethod = "shutdown")
    public LevelTradingEngine levelTradingEngine(
            LevelEngineProperties properties,
            LevelManager levelManager,
            @Qualifier("theoPositionManager") PositionManager theoPositionManager,
            @Qualifier("actualPositionManager") PositionManager actualPositionManager,
            TradeManager tradeManager,
            PositionReconciler positionReconciler) {
        return new LevelTradingEngine(
                properties, levelManager, theoPositionManager, actualPositionManager, tradeManager, positionReconciler);
    }

    // ---- Parsing ----

    public static List<Double> parseLevels(String property, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException(property, "must not be empty");
        }
        List<Double> levels = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                double value = Double.parseDouble(trimmed);
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    throw new ConfigurationException(property, "not a finite number: " + trimmed);
                }
                levels.add(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException(property, "not a number: " + trimmed, e);
            }
        }
        if (levels.isEmpty()) {
            throw new ConfigurationException(property, "must not be empty");
        }
        return List.copyOf(levels);
    }

    public static LocalTime parseTime(String property, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(property, "expected HH:mm but was " + raw, e);
        }
    }
}
