package com.leveltrader.api.dto.response;

import com.leveltrader.domain.model.LevelManagerStats;
import com.leveltrader.domain.model.PositionSnapshot;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EngineStatsResponse {

    private final String instrumentId;
    private final LevelManagerStats levels;
    private final PositionSnapshot theo;
    private final PositionSnapshot actual;

    /** theo - actual position. */
    private final int discrepancy;

    private final boolean liveOrder;
    private final long currentOrderId;
    private final LocalDateTime lastBarTime;
}
