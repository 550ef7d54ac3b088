package com.darwinlink.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY,
    SELL;

    /**
     * Sign applied to a fill quantity when it hits the position ledger.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
