package com.leveltrader.domain.enums;

/** Buy or sell side of an order or fill. A Level is entered on one side and never flips. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for exit and corrective orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL. Multiplies an absolute quantity into a signed position delta. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    /** Side of a non-zero signed position. */
    public static OrderSide ofSignedQuantity(int signedQuantity) {
        return signedQuantity >= 0 ? BUY : SELL;
    }
}
