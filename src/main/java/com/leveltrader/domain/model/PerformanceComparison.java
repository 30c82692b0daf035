package com.leveltrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Theoretical vs actual performance. Differences are theo - actual; {@code totalPnlDifferencePct}
 * is relative to the absolute actual total and zero when the actual total is zero.
 */
@Data
@Builder
public class PerformanceComparison {

    private BigDecimal theoTotalPnl;
    private BigDecimal actualTotalPnl;
    private BigDecimal totalPnlDifference;
    private BigDecimal totalPnlDifferencePct;

    private BigDecimal theoRealizedPnl;
    private BigDecimal actualRealizedPnl;
    private BigDecimal theoUnrealizedPnl;
    private BigDecimal actualUnrealizedPnl;

    private int theoCycleCount;
    private int actualCycleCount;
}
