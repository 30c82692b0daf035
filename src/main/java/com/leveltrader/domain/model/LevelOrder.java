package com.leveltrader.domain.model;

import com.leveltrader.domain.enums.LevelOrderType;
import com.leveltrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An order tracked on a single Level: the entry order, or the exit order of one exit tranche.
 * {@code exitLevelIndex} is -1 for entry orders and for flatten orders covering several tranches.
 */
@Data
@Builder
public class LevelOrder {

    public static final int NO_EXIT_INDEX = -1;

    private long orderId;
    private LevelOrderType orderType;
    private int quantity;
    private BigDecimal price;

    @Builder.Default
    private int exitLevelIndex = NO_EXIT_INDEX;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING_NEW;

    private int filledQuantity;
    private LocalDateTime createdAt;

    public LevelOrder copy() {
        return LevelOrder.builder()
                .orderId(orderId)
                .orderType(orderType)
                .quantity(quantity)
                .price(price)
                .exitLevelIndex(exitLevelIndex)
                .status(status)
                .filledQuantity(filledQuantity)
                .createdAt(createdAt)
                .build();
    }
}
