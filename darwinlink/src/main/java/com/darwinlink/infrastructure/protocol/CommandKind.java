package com.darwinlink.infrastructure.protocol;

import com.darwinlink.domain.order.OrderKind;
import com.darwinlink.domain.order.OrderSide;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.darwinlink.infrastructure.protocol.FieldSpec.identifier;
import static com.darwinlink.infrastructure.protocol.FieldSpec.positive;
import static com.darwinlink.infrastructure.protocol.FieldSpec.required;
import static com.darwinlink.infrastructure.protocol.FieldType.DECIMAL;
import static com.darwinlink.infrastructure.protocol.FieldType.INTEGER;
import static com.darwinlink.infrastructure.protocol.FieldType.STRING;
import static com.darwinlink.infrastructure.protocol.FieldType.TIMESTAMP;

/**
 * Schema table for every command the client sends.
 *
 * Wire form: the verb alone, or the verb, one space and comma-separated
 * arguments in the order listed here.
 */
public enum CommandKind {

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    BUY_LIMIT("ACQAZ", OrderSide.BUY, OrderKind.LIMIT),
    SELL_LIMIT("VENAZ", OrderSide.SELL, OrderKind.LIMIT),
    BUY_MARKET("ACQMARKET", OrderSide.BUY, OrderKind.MARKET),
    SELL_MARKET("VENMARKET", OrderSide.SELL, OrderKind.MARKET),
    BUY_STOP("ACQSTOP", OrderSide.BUY, OrderKind.STOP),
    SELL_STOP("VENSTOP", OrderSide.SELL, OrderKind.STOP),
    BUY_TRAILING_STOP("ACQTRAILING", OrderSide.BUY, OrderKind.TRAILING_STOP),
    SELL_TRAILING_STOP("VENTRAILING", OrderSide.SELL, OrderKind.TRAILING_STOP),
    BUY_ICEBERG("ACQICEBERG", OrderSide.BUY, OrderKind.ICEBERG),
    SELL_ICEBERG("VENICEBERG", OrderSide.SELL, OrderKind.ICEBERG),

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER MANAGEMENT
    // ═══════════════════════════════════════════════════════════════════════

    CANCEL("REVORD", List.of(identifier("order_id")), ResponseSpec.orderAck()),
    CANCEL_ALL("REVALL", List.of(identifier("symbol")),
        ResponseSpec.list("TRADE", "symbol", RecordKind.TRADOK, RecordKind.TRADERR)),
    MODIFY("MODORD", List.of(identifier("order_id"), positive("price", DECIMAL)), ResponseSpec.orderAck()),
    CONFIRM("CONFORD", List.of(identifier("order_id")), ResponseSpec.orderAck()),

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    PORTFOLIO("INFOSTOCKS", List.of(), ResponseSpec.list("STOCK", null, RecordKind.STOCK)),
    POSITION("GETPOSITION", List.of(identifier("symbol")),
        ResponseSpec.list("STOCK", "symbol", RecordKind.STOCK)),
    ACCOUNT("INFOACCOUNT", List.of(), ResponseSpec.single("INFOACCOUNT", RecordKind.INFOACCOUNT)),
    AVAILABILITY("INFOAVAILABILITY", List.of(), ResponseSpec.single("AVAILABILITY", RecordKind.AVAILABILITY)),
    ORDERS("ORDERLIST", List.of(identifier("symbol").asOptional()),
        ResponseSpec.list("ORDER", "symbol", RecordKind.ORDER)),
    PENDING_ORDERS("ORDERLISTPENDING", List.of(), ResponseSpec.list("ORDER", null, RecordKind.ORDER)),
    STATUS("DARWINSTATUS", List.of(), ResponseSpec.single("DARWIN_STATUS", RecordKind.DARWIN_STATUS)),

    // ═══════════════════════════════════════════════════════════════════════
    // HISTORICAL PORT
    // ═══════════════════════════════════════════════════════════════════════

    CANDLES("CANDLE",
        List.of(identifier("symbol"), positive("days", INTEGER), positive("period", INTEGER)),
        ResponseSpec.framed("HISTORY", "symbol", RecordKind.CANDLE)),
    TICKS("TBT",
        List.of(identifier("symbol"), positive("days", INTEGER)),
        ResponseSpec.framed("HISTORY", "symbol", RecordKind.TBT)),
    CANDLE_RANGE("CANDLERANGE",
        List.of(identifier("symbol"), required("from", TIMESTAMP), required("to", TIMESTAMP),
            positive("period", INTEGER)),
        ResponseSpec.framed("HISTORY", "symbol", RecordKind.CANDLE)),
    TICK_RANGE("TBTRANGE",
        List.of(identifier("symbol"), required("from", TIMESTAMP), required("to", TIMESTAMP)),
        ResponseSpec.framed("HISTORY", "symbol", RecordKind.TBT)),
    AFTER_HOURS("VOLUMEAFTERHOURS", List.of(required("mode", STRING)),
        ResponseSpec.single("VOLUMEAFTERHOURS", RecordKind.VOLUMEAFTERHOURS));

    /** Continuous-session volume only. */
    public static final String MODE_CONTINUOUS = "CNT";
    /** Continuous-session plus after-hours volume. */
    public static final String MODE_WITH_AFTER_HOURS = "CNTAH";

    private static final Map<String, CommandKind> BY_VERB = new HashMap<>();

    static {
        for (CommandKind kind : values()) {
            BY_VERB.put(kind.verb, kind);
        }
    }

    private final String verb;
    private final OrderSide side;
    private final OrderKind orderKind;
    private final List<FieldSpec> params;
    private final ResponseSpec response;

    CommandKind(String verb, OrderSide side, OrderKind orderKind) {
        this(verb, side, orderKind, placementParams(orderKind), ResponseSpec.orderAck());
    }

    CommandKind(String verb, List<FieldSpec> params, ResponseSpec response) {
        this(verb, null, null, params, response);
    }

    CommandKind(String verb, OrderSide side, OrderKind orderKind, List<FieldSpec> params, ResponseSpec response) {
        this.verb = verb;
        this.side = side;
        this.orderKind = orderKind;
        this.params = params;
        this.response = response;
    }

    public String verb() {
        return verb;
    }

    public List<FieldSpec> params() {
        return params;
    }

    public ResponseSpec response() {
        return response;
    }

    /**
     * @return side for placement commands, null otherwise
     */
    public OrderSide side() {
        return side;
    }

    /**
     * @return order kind for placement commands, null otherwise
     */
    public OrderKind orderKind() {
        return orderKind;
    }

    public boolean isPlacement() {
        return orderKind != null;
    }

    public FieldSpec param(String name) {
        for (FieldSpec spec : params) {
            if (spec.name().equals(name)) {
                return spec;
            }
        }
        return null;
    }

    public static CommandKind fromVerb(String verb) {
        return BY_VERB.get(verb);
    }

    public static CommandKind forOrder(OrderSide side, OrderKind kind) {
        for (CommandKind value : values()) {
            if (value.side == side && value.orderKind == kind) {
                return value;
            }
        }
        throw new IllegalArgumentException("No command for " + side + " " + kind);
    }

    /**
     * Check parameter names, types, presence and ranges.
     *
     * @throws CommandValidationException on the first violation
     */
    void validate(Map<String, Object> values) {
        for (String name : values.keySet()) {
            if (param(name) == null) {
                throw new CommandValidationException(name, "not a parameter of " + verb);
            }
        }
        for (FieldSpec spec : params) {
            Object value = values.get(spec.name());
            if (value == null) {
                if (!spec.optional()) {
                    throw new CommandValidationException(spec.name(), "is required for " + verb);
                }
                continue;
            }
            if (!spec.type().accepts(value)) {
                throw new CommandValidationException(spec.name(), "must be " + spec.type());
            }
            checkConstraint(spec, value);
        }
        checkCrossField(values);
    }

    private static void checkConstraint(FieldSpec spec, Object value) {
        switch (spec.constraint()) {
            case POSITIVE -> {
                boolean positive = value instanceof Long
                    ? (Long) value > 0
                    : ((BigDecimal) value).signum() > 0;
                if (!positive) {
                    throw new CommandValidationException(spec.name(), "must be positive, got " + value);
                }
            }
            case IDENTIFIER -> {
                String text = (String) value;
                if (text.isBlank()) {
                    throw new CommandValidationException(spec.name(), "must not be empty");
                }
                for (int i = 0; i < text.length(); i++) {
                    char c = text.charAt(i);
                    if (c == ';' || c == ',' || Character.isWhitespace(c)) {
                        throw new CommandValidationException(spec.name(), "contains illegal character '" + c + "'");
                    }
                }
            }
            case NONE -> { }
        }
    }

    private void checkCrossField(Map<String, Object> values) {
        Object visible = values.get("visible_quantity");
        if (visible != null && (Long) visible > (Long) values.get("quantity")) {
            throw new CommandValidationException("visible_quantity", "cannot exceed quantity");
        }
        Object from = values.get("from");
        Object to = values.get("to");
        if (from != null && to != null && !((LocalDateTime) from).isBefore((LocalDateTime) to)) {
            throw new CommandValidationException("from", "must be before 'to'");
        }
        Object mode = values.get("mode");
        if (mode != null && !MODE_CONTINUOUS.equals(mode) && !MODE_WITH_AFTER_HOURS.equals(mode)) {
            throw new CommandValidationException("mode", "must be " + MODE_CONTINUOUS + " or " + MODE_WITH_AFTER_HOURS);
        }
    }

    private static List<FieldSpec> placementParams(OrderKind kind) {
        List<FieldSpec> specs = new ArrayList<>();
        specs.add(identifier("order_id"));
        specs.add(identifier("symbol"));
        specs.add(positive("quantity", INTEGER));
        if (kind.requiresPrice()) {
            specs.add(positive("price", DECIMAL));
        }
        if (kind == OrderKind.TRAILING_STOP) {
            specs.add(positive("trail_amount", DECIMAL));
        }
        if (kind == OrderKind.ICEBERG) {
            specs.add(positive("visible_quantity", INTEGER));
        }
        return List.copyOf(specs);
    }
}
