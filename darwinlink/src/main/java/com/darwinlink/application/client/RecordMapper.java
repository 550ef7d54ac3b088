package com.darwinlink.application.client;

import com.darwinlink.domain.market.Candle;
import com.darwinlink.domain.market.Tick;
import com.darwinlink.domain.order.Fill;
import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.order.OrderAck;
import com.darwinlink.domain.order.OrderKind;
import com.darwinlink.domain.order.OrderSide;
import com.darwinlink.domain.order.OrderStatus;
import com.darwinlink.domain.portfolio.AccountSnapshot;
import com.darwinlink.domain.portfolio.Availability;
import com.darwinlink.domain.portfolio.Position;
import com.darwinlink.domain.session.PlatformStatus;
import com.darwinlink.infrastructure.protocol.CommandKind;
import com.darwinlink.infrastructure.protocol.DaemonErrorCode;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Turns decoded records into domain values.
 */
public final class RecordMapper {
    private static final Logger log = LoggerFactory.getLogger(RecordMapper.class);

    private RecordMapper() {
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Map TRADOK, TRADCONFIRM or TRADERR.
     */
    public static OrderAck toOrderAck(WireRecord record) {
        if (record.kind() == RecordKind.TRADERR) {
            long code = record.integer("error_code");
            String message = record.has("message") ? record.string("message") : DaemonErrorCode.describe(code);
            return new OrderAck(
                record.string("order_id"),
                record.string("symbol"),
                OrderStatus.REJECTED,
                OrderStatus.REJECTED.wireCode(),
                record.string("operation"),
                0, null, 0, 0, null,
                false,
                code,
                message);
        }
        expect(record, RecordKind.TRADOK, RecordKind.TRADCONFIRM);

        long statusCode = record.integer("status_code");
        long quantity = record.integer("quantity");
        long filled = record.integer("filled_quantity", 0);
        OrderStatus status = statusOf(statusCode, record.string("order_id"));
        long remaining = record.has("remaining_quantity")
            ? record.integer("remaining_quantity")
            : (status.isTerminal() ? 0 : quantity - filled);
        return new OrderAck(
            record.string("order_id"),
            record.string("symbol"),
            status,
            statusCode,
            record.string("operation"),
            quantity,
            record.decimal("price"),
            filled,
            remaining,
            record.decimal("average_price"),
            record.kind() == RecordKind.TRADCONFIRM || statusCode == OrderStatus.AWAITING_CONFIRMATION_CODE,
            null,
            null);
    }

    public static Order toOrder(WireRecord record) {
        expect(record, RecordKind.ORDER);
        String operation = record.string("operation");
        long statusCode = record.integer("status_code");
        return new Order(
            record.string("order_id"),
            record.string("symbol"),
            sideOf(operation),
            kindOf(operation, record.decimal("price")),
            record.integer("quantity"),
            record.decimal("price"),
            statusOf(statusCode, record.string("order_id")),
            record.integer("filled_quantity", 0),
            record.decimal("average_price"),
            null,
            null);
    }

    public static Fill toFill(WireRecord record) {
        expect(record, RecordKind.TRADEXEC);
        return new Fill(
            record.string("order_id"),
            record.string("symbol"),
            sideOf(record.string("operation")),
            record.integer("quantity"),
            record.decimal("price"),
            record.time("time"));
    }

    /**
     * Status for a daemon code. Codes this client does not know are treated
     * as PENDING: the order exists, its progress is just not understood.
     */
    static OrderStatus statusOf(long code, String orderId) {
        OrderStatus status = OrderStatus.fromWireCode(code);
        if (status == null) {
            log.warn("⚠️ Unknown order status code {} for order {}, treating as PENDING", code, orderId);
            return OrderStatus.PENDING;
        }
        return status;
    }

    /**
     * Side from an operation field: a placement verb or BUY / SELL.
     */
    static OrderSide sideOf(String operation) {
        if (operation == null) {
            return null;
        }
        CommandKind kind = CommandKind.fromVerb(operation);
        if (kind != null && kind.isPlacement()) {
            return kind.side();
        }
        String op = operation.toUpperCase();
        if (op.startsWith("ACQ") || op.startsWith("BUY")) {
            return OrderSide.BUY;
        }
        if (op.startsWith("VEN") || op.startsWith("SELL")) {
            return OrderSide.SELL;
        }
        return null;
    }

    static OrderKind kindOf(String operation, BigDecimal price) {
        CommandKind kind = operation != null ? CommandKind.fromVerb(operation) : null;
        if (kind != null && kind.isPlacement()) {
            return kind.orderKind();
        }
        return price == null ? OrderKind.MARKET : OrderKind.LIMIT;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT / PORTFOLIO
    // ═══════════════════════════════════════════════════════════════════════

    public static Position toPosition(WireRecord record) {
        expect(record, RecordKind.STOCK);
        return new Position(
            record.string("symbol"),
            record.integer("quantity_portfolio"),
            record.decimal("average_price", BigDecimal.ZERO),
            null,
            record.decimal("gain"));
    }

    public static AccountSnapshot toAccount(WireRecord record) {
        expect(record, RecordKind.INFOACCOUNT);
        return new AccountSnapshot(
            record.time("time"),
            record.string("account_code"),
            record.decimal("liquidity"),
            record.decimal("gain"),
            record.decimal("open_profit_loss"),
            record.decimal("equity"),
            record.string("environment"));
    }

    public static Availability toAvailability(WireRecord record) {
        expect(record, RecordKind.AVAILABILITY);
        return new Availability(
            record.time("time"),
            record.decimal("stock_availability"),
            record.decimal("stock_availability_margin"),
            record.decimal("derivatives_availability"),
            record.decimal("derivatives_availability_margin"),
            record.decimal("total_liquidity"));
    }

    public static PlatformStatus toPlatformStatus(WireRecord record, boolean simulation) {
        expect(record, RecordKind.DARWIN_STATUS);
        String trading = record.string("trading_enabled");
        return new PlatformStatus(
            record.string("connection_status"),
            "TRUE".equalsIgnoreCase(trading) || "1".equals(trading),
            record.string("release"),
            simulation);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    public static Candle toCandle(WireRecord record) {
        expect(record, RecordKind.CANDLE);
        return new Candle(
            record.string("symbol"),
            record.timestamp("timestamp"),
            record.decimal("open"),
            record.decimal("high"),
            record.decimal("low"),
            record.decimal("close"),
            record.integer("volume"));
    }

    public static Tick toTick(WireRecord record) {
        expect(record, RecordKind.TBT);
        return new Tick(
            record.string("symbol"),
            record.timestamp("timestamp"),
            record.decimal("price"),
            record.integer("size"));
    }

    private static void expect(WireRecord record, RecordKind first, RecordKind... rest) {
        if (record.kind() == first) {
            return;
        }
        for (RecordKind kind : rest) {
            if (record.kind() == kind) {
                return;
            }
        }
        throw new DaemonResponseException(ApiErrorCode.PROTOCOL,
            "Expected " + first.tag() + " but got " + record.kind().tag());
    }
}
