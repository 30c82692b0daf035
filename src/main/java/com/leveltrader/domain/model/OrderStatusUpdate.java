package com.leveltrader.domain.model;

import com.leveltrader.domain.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Order status callback from the host order gateway. {@code text} carries the rejection reason, if any. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusUpdate {

    private long orderId;
    private OrderStatus status;
    private String text;
}
