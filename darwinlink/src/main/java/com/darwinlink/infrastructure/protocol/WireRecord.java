package com.darwinlink.infrastructure.protocol;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded, immutable response or event line.
 *
 * The key set is always exactly the schema of {@link #kind()}; an absent
 * optional field is present as a key with a null value.
 */
public final class WireRecord {

    private final RecordKind kind;
    private final Map<String, Object> fields;

    private WireRecord(RecordKind kind, Map<String, Object> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public RecordKind kind() {
        return kind;
    }

    /**
     * Field values in schema order. Absent optional fields map to null.
     */
    public Map<String, Object> fields() {
        return fields;
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    public Object get(String name) {
        if (!fields.containsKey(name)) {
            throw new IllegalArgumentException(kind.tag() + " has no field '" + name + "'");
        }
        return fields.get(name);
    }

    public String string(String name) {
        return (String) typed(name, FieldType.STRING);
    }

    public Long integer(String name) {
        return (Long) typed(name, FieldType.INTEGER);
    }

    public long integer(String name, long defaultValue) {
        Long value = integer(name);
        return value != null ? value : defaultValue;
    }

    public BigDecimal decimal(String name) {
        return (BigDecimal) typed(name, FieldType.DECIMAL);
    }

    public BigDecimal decimal(String name, BigDecimal defaultValue) {
        BigDecimal value = decimal(name);
        return value != null ? value : defaultValue;
    }

    public LocalTime time(String name) {
        return (LocalTime) typed(name, FieldType.TIME);
    }

    public LocalDateTime timestamp(String name) {
        return (LocalDateTime) typed(name, FieldType.TIMESTAMP);
    }

    private Object typed(String name, FieldType expected) {
        FieldSpec spec = kind.field(name);
        if (spec == null) {
            throw new IllegalArgumentException(kind.tag() + " has no field '" + name + "'");
        }
        if (spec.type() != expected) {
            throw new IllegalArgumentException(kind.tag() + "." + name + " is " + spec.type() + ", not " + expected);
        }
        return fields.get(name);
    }

    public static Builder builder(RecordKind kind) {
        return new Builder(kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WireRecord)) return false;
        WireRecord other = (WireRecord) o;
        return kind == other.kind && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fields);
    }

    @Override
    public String toString() {
        return kind.tag() + fields;
    }

    /**
     * Builds records in-process (simulation, decoding). Enforces the schema:
     * unknown names, wrong types and missing required values are rejected.
     */
    public static final class Builder {
        private final RecordKind kind;
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder(RecordKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder set(String name, Object value) {
            FieldSpec spec = kind.field(name);
            if (spec == null) {
                throw new IllegalArgumentException(kind.tag() + " has no field '" + name + "'");
            }
            if (value instanceof Integer) {
                value = ((Integer) value).longValue();
            }
            if (value != null && !spec.type().accepts(value)) {
                throw new IllegalArgumentException(kind.tag() + "." + name + " expects " + spec.type()
                    + " but got " + value.getClass().getSimpleName());
            }
            values.put(name, value);
            return this;
        }

        public WireRecord build() {
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (FieldSpec spec : kind.fields()) {
                Object value = values.get(spec.name());
                if (value == null && !spec.optional()) {
                    throw new IllegalStateException(kind.tag() + " requires field '" + spec.name() + "'");
                }
                ordered.put(spec.name(), value);
            }
            return new WireRecord(kind, ordered);
        }
    }
}
