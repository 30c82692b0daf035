package com.leveltrader.level;

import com.leveltrader.domain.enums.OrderSide;

/**
 * Decides whether a signal observation opens a new level at a given threshold.
 *
 * <p>Thresholds arrive already scaled into signal units (entry multiplier times the
 * deviation measure). Pluggable so a momentum variant can sit alongside mean reversion.
 */
public interface EntryPolicy {

    boolean shouldEnter(double signal, double threshold, OrderSide side);
}
