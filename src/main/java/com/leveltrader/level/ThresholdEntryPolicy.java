package com.leveltrader.level;

import com.leveltrader.domain.enums.OrderSide;

/**
 * Mean-reversion entry: buy when the signal has fallen below {@code -threshold},
 * sell when it has risen above {@code +threshold}. Both comparisons are strict.
 */
public class ThresholdEntryPolicy implements EntryPolicy {

    @Override
    public boolean shouldEnter(double signal, double threshold, OrderSide side) {
        if (side == OrderSide.BUY) {
            return signal < -threshold;
        }
        return signal > threshold;
    }
}
