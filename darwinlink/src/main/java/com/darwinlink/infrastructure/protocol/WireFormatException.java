package com.darwinlink.infrastructure.protocol;

/**
 * Line does not match the schema of its tag: wrong field count, empty
 * required field, or a value that does not parse as the field's type.
 */
public class WireFormatException extends RuntimeException {

    private final String line;

    public WireFormatException(String line, String message) {
        super(message + ": '" + line + "'");
        this.line = line;
    }

    public WireFormatException(String line, String message, Throwable cause) {
        super(message + ": '" + line + "'", cause);
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
