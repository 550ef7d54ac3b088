package com.darwinlink.infrastructure.protocol;

/**
 * Line carries a tag that is not in the schema table.
 *
 * Kept distinct from a malformed line: the daemon emits messages this client
 * does not model yet, and those must never take a session down.
 */
public class UnknownRecordKindException extends WireFormatException {

    private final String tag;

    public UnknownRecordKindException(String line, String tag) {
        super(line, "Unknown record kind '" + tag + "'");
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
