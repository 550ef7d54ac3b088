package com.darwinlink.infrastructure.protocol;

import com.darwinlink.domain.order.OrderKind;
import com.darwinlink.domain.order.OrderRequest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound intent: a command kind plus named parameters.
 *
 * Every instance is validated against its kind's parameter table on
 * construction, so an invalid command never reaches a socket.
 */
public record Command(CommandKind kind, Map<String, Object> params) {

    public Command {
        Objects.requireNonNull(kind, "kind");
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    normalized.put(name, value instanceof Integer ? Long.valueOf((Integer) value) : value);
                }
            });
        }
        kind.validate(normalized);
        params = Collections.unmodifiableMap(normalized);
    }

    public static Command of(CommandKind kind, Map<String, Object> params) {
        return new Command(kind, params);
    }

    public boolean has(String name) {
        return params.containsKey(name);
    }

    public String string(String name) {
        return (String) params.get(name);
    }

    public Long integer(String name) {
        return (Long) params.get(name);
    }

    public BigDecimal decimal(String name) {
        return (BigDecimal) params.get(name);
    }

    public LocalDateTime timestamp(String name) {
        return (LocalDateTime) params.get(name);
    }

    public ResponseSpec response() {
        return kind.response();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Turn a placement request into the side/kind specific command.
     *
     * @throws CommandValidationException for missing side/kind, a price on a
     *         market order or any parameter violation
     */
    public static Command placeOrder(OrderRequest request, String orderId) {
        if (request.side() == null) {
            throw new CommandValidationException("side", "is required");
        }
        if (request.kind() == null) {
            throw new CommandValidationException("kind", "is required");
        }
        if (request.kind() == OrderKind.MARKET && request.price() != null) {
            throw new CommandValidationException("price", "must be absent for MARKET orders");
        }
        if (request.kind() != OrderKind.TRAILING_STOP && request.trailAmount() != null) {
            throw new CommandValidationException("trail_amount", "only applies to TRAILING_STOP orders");
        }
        if (request.kind() != OrderKind.ICEBERG && request.visibleQuantity() != null) {
            throw new CommandValidationException("visible_quantity", "only applies to ICEBERG orders");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("order_id", orderId);
        params.put("symbol", request.symbol());
        params.put("quantity", request.quantity());
        params.put("price", request.price());
        params.put("trail_amount", request.trailAmount());
        params.put("visible_quantity", request.visibleQuantity());
        return new Command(CommandKind.forOrder(request.side(), request.kind()), params);
    }

    public static Command cancel(String orderId) {
        return new Command(CommandKind.CANCEL, Map.of("order_id", nonNull(orderId, "order_id")));
    }

    public static Command cancelAll(String symbol) {
        return new Command(CommandKind.CANCEL_ALL, Map.of("symbol", nonNull(symbol, "symbol")));
    }

    public static Command modify(String orderId, BigDecimal price) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("order_id", orderId);
        params.put("price", price);
        return new Command(CommandKind.MODIFY, params);
    }

    public static Command confirm(String orderId) {
        return new Command(CommandKind.CONFIRM, Map.of("order_id", nonNull(orderId, "order_id")));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public static Command portfolio() {
        return new Command(CommandKind.PORTFOLIO, Map.of());
    }

    public static Command position(String symbol) {
        return new Command(CommandKind.POSITION, Map.of("symbol", nonNull(symbol, "symbol")));
    }

    public static Command account() {
        return new Command(CommandKind.ACCOUNT, Map.of());
    }

    public static Command availability() {
        return new Command(CommandKind.AVAILABILITY, Map.of());
    }

    public static Command orders() {
        return new Command(CommandKind.ORDERS, Map.of());
    }

    public static Command orders(String symbol) {
        return new Command(CommandKind.ORDERS, Map.of("symbol", nonNull(symbol, "symbol")));
    }

    public static Command pendingOrders() {
        return new Command(CommandKind.PENDING_ORDERS, Map.of());
    }

    public static Command status() {
        return new Command(CommandKind.STATUS, Map.of());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HISTORICAL
    // ═══════════════════════════════════════════════════════════════════════

    public static Command candles(String symbol, int days, long periodSeconds) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("days", (long) days);
        params.put("period", periodSeconds);
        return new Command(CommandKind.CANDLES, params);
    }

    public static Command ticks(String symbol, int days) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("days", (long) days);
        return new Command(CommandKind.TICKS, params);
    }

    public static Command candleRange(String symbol, LocalDateTime from, LocalDateTime to, long periodSeconds) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("from", from);
        params.put("to", to);
        params.put("period", periodSeconds);
        return new Command(CommandKind.CANDLE_RANGE, params);
    }

    public static Command tickRange(String symbol, LocalDateTime from, LocalDateTime to) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("from", from);
        params.put("to", to);
        return new Command(CommandKind.TICK_RANGE, params);
    }

    public static Command afterHours(boolean include) {
        return new Command(CommandKind.AFTER_HOURS,
            Map.of("mode", include ? CommandKind.MODE_WITH_AFTER_HOURS : CommandKind.MODE_CONTINUOUS));
    }

    private static String nonNull(String value, String field) {
        if (value == null) {
            throw new CommandValidationException(field, "is required");
        }
        return value;
    }
}
