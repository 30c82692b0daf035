package com.leveltrader.domain.enums;

/** Whether an order tracked on a Level opened the tranche or closes one of its exit tranches. */
public enum LevelOrderType {
    ENTRY,
    EXIT
}
