package com.leveltrader.domain.model;

import com.leveltrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Result of comparing the theoretical book against the actual (broker-filled) book.
 *
 * <p>{@code discrepancy} is theo - actual. When non-zero and no order is live, a corrective
 * order of {@code correctiveSide}/{@code correctiveQuantity} is sent and its id recorded;
 * otherwise {@code skippedReason} says why nothing was sent.
 */
@Data
@Builder
public class ReconciliationResult {

    private LocalDateTime timestamp;
    private String trigger;

    private int theoPosition;
    private int actualPosition;
    private int discrepancy;

    private OrderSide correctiveSide;
    private int correctiveQuantity;
    private BigDecimal referencePrice;
    private long correctiveOrderId;
    private String skippedReason;

    public boolean isMatched() {
        return discrepancy == 0;
    }

    public boolean isCorrectionSent() {
        return correctiveQuantity > 0 && correctiveOrderId >= 0;
    }
}
