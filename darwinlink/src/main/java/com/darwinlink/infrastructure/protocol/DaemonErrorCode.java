package com.darwinlink.infrastructure.protocol;

/**
 * Error codes carried by ERR / TRADERR lines.
 */
public enum DaemonErrorCode {
    GENERIC(1000, "Generic error"),
    UNKNOWN_COMMAND(1001, "Command not recognised"),
    INVALID_SYMBOL(1002, "Unknown or non-tradable symbol"),
    INVALID_QUANTITY(1003, "Invalid quantity"),
    INVALID_PRICE(1004, "Invalid price"),
    INSUFFICIENT_LIQUIDITY(1005, "Insufficient liquidity"),
    MARKET_CLOSED(1006, "Market closed"),
    TRADING_DISABLED(1007, "Trading not enabled on this account"),
    EMPTY_PORTFOLIO(1018, "Portfolio is empty"),
    NO_ORDERS(1019, "No orders"),
    ORDER_NOT_FOUND(1020, "Order not found");

    private final int code;
    private final String message;

    DaemonErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    public static DaemonErrorCode fromCode(long code) {
        for (DaemonErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }

    /**
     * Human-readable text for a code, including codes this client does not model.
     */
    public static String describe(long code) {
        DaemonErrorCode known = fromCode(code);
        return known != null ? known.message : "Daemon error " + code;
    }

    /**
     * Codes that mean "nothing to list" rather than a failure.
     */
    public static boolean isEmptyResult(long code) {
        return code == EMPTY_PORTFOLIO.code || code == NO_ORDERS.code;
    }
}
