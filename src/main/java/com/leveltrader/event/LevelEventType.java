package com.leveltrader.event;

public enum LevelEventType {
    CREATED,
    EXIT_EXECUTED,
    COMPLETED,
    FORCE_CLOSED
}
