package com.darwinlink.infrastructure.protocol;

/**
 * Command parameters violate their constraints. Raised before any I/O.
 */
public class CommandValidationException extends RuntimeException {

    private final String field;

    public CommandValidationException(String field, String message) {
        super(field != null ? field + ": " + message : message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
