package com.darwinlink.infrastructure.protocol;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.darwinlink.infrastructure.protocol.FieldSpec.optional;
import static com.darwinlink.infrastructure.protocol.FieldSpec.required;
import static com.darwinlink.infrastructure.protocol.FieldType.DECIMAL;
import static com.darwinlink.infrastructure.protocol.FieldType.INTEGER;
import static com.darwinlink.infrastructure.protocol.FieldType.STRING;
import static com.darwinlink.infrastructure.protocol.FieldType.TIME;
import static com.darwinlink.infrastructure.protocol.FieldType.TIMESTAMP;

/**
 * Schema table for every line the daemon sends.
 *
 * Each tag maps to an ordered field list. This is the one place to extend
 * when the daemon grows a message; field order has been checked against
 * Darwin 2.x only.
 */
public enum RecordKind {

    // ═══════════════════════════════════════════════════════════════════════
    // TRADING PORT
    // ═══════════════════════════════════════════════════════════════════════

    DARWIN_STATUS("DARWIN_STATUS", Delivery.RESPONSE_AND_EVENT, List.of(
        required("connection_status", STRING),
        required("trading_enabled", STRING),
        optional("release", STRING))),

    STOCK("STOCK", Delivery.RESPONSE, List.of(
        required("symbol", STRING),
        required("time", TIME),
        required("quantity_portfolio", INTEGER),
        optional("quantity_darwin", INTEGER),
        optional("quantity_negotiation", INTEGER),
        optional("average_price", DECIMAL),
        optional("gain", DECIMAL))),

    AVAILABILITY("AVAILABILITY", Delivery.RESPONSE, List.of(
        required("time", TIME),
        required("stock_availability", DECIMAL),
        optional("stock_availability_margin", DECIMAL),
        optional("derivatives_availability", DECIMAL),
        optional("derivatives_availability_margin", DECIMAL),
        optional("total_liquidity", DECIMAL))),

    INFOACCOUNT("INFOACCOUNT", Delivery.RESPONSE, List.of(
        required("time", TIME),
        required("account_code", STRING),
        required("liquidity", DECIMAL),
        optional("gain", DECIMAL),
        optional("open_profit_loss", DECIMAL),
        optional("equity", DECIMAL),
        optional("environment", STRING))),

    ORDER("ORDER", Delivery.RESPONSE, List.of(
        required("symbol", STRING),
        required("time", TIME),
        required("order_id", STRING),
        required("operation", STRING),
        optional("price", DECIMAL),
        required("quantity", INTEGER),
        required("status_code", INTEGER),
        optional("filled_quantity", INTEGER),
        optional("average_price", DECIMAL))),

    TRADOK("TRADOK", Delivery.RESPONSE_AND_EVENT, tradeAckFields()),

    TRADCONFIRM("TRADCONFIRM", Delivery.RESPONSE, tradeAckFields()),

    TRADERR("TRADERR", Delivery.RESPONSE_AND_EVENT, List.of(
        required("symbol", STRING),
        required("order_id", STRING),
        required("error_code", INTEGER),
        optional("operation", STRING),
        optional("message", STRING))),

    TRADEXEC("TRADEXEC", Delivery.EVENT, List.of(
        required("symbol", STRING),
        required("order_id", STRING),
        required("operation", STRING),
        required("quantity", INTEGER),
        required("price", DECIMAL),
        required("time", TIME))),

    ERR("ERR", Delivery.RESPONSE, List.of(
        required("subject", STRING),
        required("error_code", INTEGER))),

    // ═══════════════════════════════════════════════════════════════════════
    // HISTORICAL PORT
    // ═══════════════════════════════════════════════════════════════════════

    CANDLE("CANDLE", Delivery.RESPONSE, List.of(
        required("symbol", STRING),
        required("timestamp", TIMESTAMP),
        required("open", DECIMAL),
        required("high", DECIMAL),
        required("low", DECIMAL),
        required("close", DECIMAL),
        required("volume", INTEGER))),

    TBT("TBT", Delivery.RESPONSE, List.of(
        required("symbol", STRING),
        required("timestamp", TIMESTAMP),
        required("price", DECIMAL),
        required("size", INTEGER))),

    VOLUMEAFTERHOURS("VOLUMEAFTERHOURS", Delivery.RESPONSE, List.of(
        required("mode", STRING))),

    BEGIN_DATA("BEGIN DATA", Delivery.RESPONSE, List.of()),

    END_DATA("END DATA", Delivery.RESPONSE, List.of());

    private static final Map<String, RecordKind> BY_TAG = new HashMap<>();

    static {
        for (RecordKind kind : values()) {
            BY_TAG.put(kind.tag, kind);
        }
    }

    private final String tag;
    private final Delivery delivery;
    private final List<FieldSpec> fields;

    RecordKind(String tag, Delivery delivery, List<FieldSpec> fields) {
        this.tag = tag;
        this.delivery = delivery;
        this.fields = fields;
    }

    public String tag() {
        return tag;
    }

    public Delivery delivery() {
        return delivery;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public FieldSpec field(String name) {
        for (FieldSpec spec : fields) {
            if (spec.name().equals(name)) {
                return spec;
            }
        }
        return null;
    }

    /**
     * @return kind for the tag, or null when the tag is not in the table
     */
    public static RecordKind fromTag(String tag) {
        return BY_TAG.get(tag);
    }

    private static List<FieldSpec> tradeAckFields() {
        return List.of(
            required("symbol", STRING),
            required("order_id", STRING),
            required("status_code", INTEGER),
            required("operation", STRING),
            required("quantity", INTEGER),
            optional("price", DECIMAL),
            optional("filled_quantity", INTEGER),
            optional("remaining_quantity", INTEGER),
            optional("average_price", DECIMAL),
            optional("platform_ref", STRING),
            optional("command", STRING));
    }
}
