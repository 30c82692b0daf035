package com.leveltrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A completed OHLCV bar delivered by the host market-data feed.
 *
 * <p>The engine only reads {@code close} and {@code timestamp}: the close marks open
 * positions and is the limit price for orders generated on this bar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bar {

    private String instrumentId;
    private LocalDateTime timestamp;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long volume;
}
