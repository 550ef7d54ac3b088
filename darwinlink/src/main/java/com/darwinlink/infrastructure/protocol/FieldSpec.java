package com.darwinlink.infrastructure.protocol;

/**
 * One positional field of a record or command schema.
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean optional,
    Constraint constraint
) {
    public enum Constraint {
        NONE,
        POSITIVE,       // Numeric value > 0
        IDENTIFIER      // Non-blank, no delimiter or line-break characters
    }

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, false, Constraint.NONE);
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, true, Constraint.NONE);
    }

    public static FieldSpec positive(String name, FieldType type) {
        return new FieldSpec(name, type, false, Constraint.POSITIVE);
    }

    public static FieldSpec identifier(String name) {
        return new FieldSpec(name, FieldType.STRING, false, Constraint.IDENTIFIER);
    }

    public FieldSpec asOptional() {
        return new FieldSpec(name, type, true, constraint);
    }
}
