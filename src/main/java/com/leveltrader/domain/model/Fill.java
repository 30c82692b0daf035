package com.leveltrader.domain.model;

import com.leveltrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An execution reported by the host order gateway. Quantity is always positive;
 * direction comes from {@code side}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fill {

    private long orderId;
    private OrderSide side;
    private int quantity;
    private BigDecimal price;
    private LocalDateTime timestamp;
}
