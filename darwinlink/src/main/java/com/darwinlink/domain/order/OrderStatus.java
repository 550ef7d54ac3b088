package com.darwinlink.domain.order;

/**
 * Order status enum.
 *
 * Wire codes are the numeric status codes carried by TRADOK / ORDER lines.
 */
public enum OrderStatus {
    PENDING(2000),           // Accepted, in negotiation
    PARTIALLY_FILLED(3001),  // Part of the quantity executed
    FILLED(2002),            // Completely executed
    CANCELLED(2003),         // Revoked by user (filled part stands)
    REJECTED(2004);          // Refused by the platform

    /** Order accepted but waiting for a CONFORD from the client. */
    public static final int AWAITING_CONFIRMATION_CODE = 2005;

    private final int wireCode;

    OrderStatus(int wireCode) {
        this.wireCode = wireCode;
    }

    public int wireCode() {
        return wireCode;
    }

    /**
     * No transition leaves FILLED, CANCELLED or REJECTED.
     */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    /**
     * Map a daemon status code to a status.
     *
     * @param code numeric status code from the wire
     * @return matching status, or null if the code is not modelled
     */
    public static OrderStatus fromWireCode(long code) {
        if (code == AWAITING_CONFIRMATION_CODE) {
            return PENDING;
        }
        for (OrderStatus status : values()) {
            if (status.wireCode == code) {
                return status;
            }
        }
        return null;
    }
}
