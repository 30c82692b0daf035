package com.leveltrader.oms;

import com.leveltrader.domain.enums.OrderStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Live order held by {@link GatewayTradeManager} until a terminal status releases it. */
@Data
@Builder(toBuilder = true)
public class TrackedOrder {

    private long orderId;
    private OrderRequest request;
    private OrderStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
