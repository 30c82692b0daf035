package com.leveltrader.oms;

import com.leveltrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Order-creation request sent to the host gateway through {@link TradeManager#createOrder}.
 *
 * <p>The engine only produces limit orders priced at the bar close; {@code limitPrice} may be
 * null for a corrective order when no reference price is known yet.
 */
@Data
@Builder(toBuilder = true)
public class OrderRequest {

    private String instrumentId;
    private OrderSide side;
    private int quantity;
    private BigDecimal limitPrice;

    /** Free-form origin tag, e.g. "ENTRY L3", "EXIT L3#1", "RECONCILE". */
    private String tag;
}
