package com.leveltrader.observability;

import com.leveltrader.domain.model.TradeCycleRecord;
import com.leveltrader.event.TradeCycleEvent;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Audit trail of completed trade cycles.
 *
 * <p>Each cycle is written as one comma-separated line to the {@value #AUDIT_LOGGER} logger
 * (route it to its own appender to get a CSV file) and kept in a ring buffer of the last
 * {@value #RING_BUFFER_SIZE} records, newest first. Records are never rewritten.
 */
@Service
public class TradeCycleAuditLogger {

    public static final String AUDIT_LOGGER = "leveltrader.audit";

    public static final int RING_BUFFER_SIZE = 1000;

    public static final String HEADER =
            "FirstFill,LastFill,Side,AvgPrice,ExitPrice,AvgPriceDelta,CycleTime,MAE,MFE,MaxPosition,TimeSinceLastFill,PnL";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final ConcurrentLinkedDeque<TradeCycleRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public TradeCycleAuditLogger() {
        audit.info("book,{}", HEADER);
    }

    @EventListener
    @Order(10)
    public void onTradeCycle(TradeCycleEvent event) {
        record(event.getRecord());
    }

    public void record(TradeCycleRecord cycle) {
        audit.info("{},{}", cycle.getBook(), toCsv(cycle));

        ringBuffer.addFirst(cycle);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }
    }

    /** Newest first, optionally filtered by book, at most {@code limit} records. */
    public List<TradeCycleRecord> getRecent(String book, int limit) {
        Stream<TradeCycleRecord> records = ringBuffer.stream();
        if (book != null) {
            records = records.filter(cycle -> book.equals(cycle.getBook()));
        }
        return records.limit(Math.max(0, limit)).toList();
    }

    public int size() {
        return ringBuffer.size();
    }

    public static String toCsv(TradeCycleRecord cycle) {
        return Stream.of(
                        cycle.getFirstFill(),
                        cycle.getLastFill(),
                        cycle.getSide(),
                        cycle.getAveragePrice(),
                        cycle.getExitPrice(),
                        cycle.getAveragePriceDelta(),
                        cycle.getCycleTime(),
                        cycle.getMaxAdverseExcursion(),
                        cycle.getMaxFavorableExcursion(),
                        cycle.getMaxPosition(),
                        cycle.getTimeSinceLastFill(),
                        cycle.getPnl())
                .map(value -> value == null ? "" : value.toString())
                .collect(Collectors.joining(","));
    }
}
