package com.leveltrader.domain.model;

import lombok.Builder;
import lombok.Data;

/** Summary counters of a LevelManager at one point in time. */
@Data
@Builder
public class LevelManagerStats {

    private int activeLevels;
    private int completedLevels;
    private int maxConcurrentLevels;

    /** Signed sum of currentPosition across active levels. */
    private int totalPosition;

    private int longLevels;
    private int shortLevels;

    /** Orders still tracked on active levels (any status not yet cleaned up). */
    private int trackedOrders;
}
