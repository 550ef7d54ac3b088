package com.darwinlink.application.simulation;

import com.darwinlink.config.SimulationSettings;
import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.order.OrderKind;
import com.darwinlink.domain.order.OrderStatus;
import com.darwinlink.domain.portfolio.Position;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.CommandKind;
import com.darwinlink.infrastructure.protocol.CommandValidationException;
import com.darwinlink.infrastructure.protocol.DaemonErrorCode;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireCodec;
import com.darwinlink.infrastructure.protocol.WireRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * In-process stand-in for the daemon.
 *
 * Answers the trading command set with the same record shapes the daemon
 * sends, and pushes the same events (TRADOK, TRADEXEC) to the event sink.
 * Nothing fills on its own: fills only happen through
 * {@link #executeOrder(String, BigDecimal, Long)}.
 *
 * All state is guarded by this object's monitor. Events are emitted while
 * holding it, so events of one order reach subscribers in emission order.
 */
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    static final String PLATFORM_REF = "SIM";

    private final SimulationSettings settings;
    private final Consumer<WireRecord> eventSink;
    private final Clock clock;

    private VirtualOrderBook book;
    private PortfolioLedger ledger;

    public SimulationEngine(SimulationSettings settings, Consumer<WireRecord> eventSink) {
        this(settings, eventSink, Clock.systemDefaultZone());
    }

    public SimulationEngine(SimulationSettings settings, Consumer<WireRecord> eventSink, Clock clock) {
        this.settings = settings;
        this.eventSink = eventSink;
        this.clock = clock;
        reset();
    }

    /**
     * Drop every order and position and restore the initial liquidity.
     */
    public synchronized void reset() {
        book = new VirtualOrderBook(settings.orderIdPrefix());
        ledger = new PortfolioLedger(settings.initialLiquidity());
        log.info("[SIM] Reset: account {} liquidity {}", settings.accountCode(), settings.initialLiquidity());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // COMMAND DISPATCH
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Answer a command the way the daemon would.
     *
     * @throws OrderNotFoundException for cancel/modify/confirm of an unknown id
     * @throws InvalidOrderStateException for cancel/modify of a terminal order
     * @throws UnsupportedOperationException for historical commands
     */
    public synchronized List<WireRecord> execute(Command command) {
        CommandKind kind = command.kind();
        if (kind.isPlacement()) {
            return List.of(placeOrder(command));
        }
        return switch (kind) {
            case CANCEL -> List.of(cancelOrder(command.string("order_id")));
            case CANCEL_ALL -> cancelAll(command.string("symbol"));
            case MODIFY -> List.of(modifyOrder(command.string("order_id"), command.decimal("price")));
            case CONFIRM -> List.of(tradeAck(book.get(command.string("order_id")), WireCodec.encode(command)));
            case PORTFOLIO -> portfolioRecords(null);
            case POSITION -> portfolioRecords(command.string("symbol"));
            case ACCOUNT -> List.of(accountRecord());
            case AVAILABILITY -> List.of(availabilityRecord());
            case ORDERS -> orderRecords(command.has("symbol") ? book.forSymbol(command.string("symbol")) : book.all());
            case PENDING_ORDERS -> orderRecords(book.open());
            case STATUS -> List.of(statusRecord());
            default -> throw new UnsupportedOperationException(kind.verb() + " is not available in simulation");
        };
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Insert a PENDING order under a fresh sequential id.
     * The id in the command is the caller's tag and is not kept.
     *
     * @return TRADOK with status 2000, also emitted as an event
     */
    public synchronized WireRecord placeOrder(Command command) {
        CommandKind kind = command.kind();
        if (!kind.isPlacement()) {
            throw new IllegalArgumentException(kind.verb() + " is not an order placement");
        }
        SimulatedOrder order = new SimulatedOrder(book.nextOrderId(), command.string("symbol"), kind.side(),
            kind.orderKind(), command.integer("quantity"), command.decimal("price"), clock.instant());
        book.add(order);

        log.info("[SIM] Order {} placed: {} {} {} @ {}", order.orderId(), order.side(),
            order.quantity(), order.symbol(), order.price() != null ? order.price() : "MKT");

        WireRecord ack = tradeAck(order, WireCodec.encode(command));
        eventSink.accept(ack);
        return ack;
    }

    /**
     * Fill part or all of an open order.
     *
     * @param price fill price; defaults to the order price (required for MARKET)
     * @param quantity fill quantity; defaults to the whole remainder
     * @return order after the fill
     * @throws OrderNotFoundException if the id is unknown
     * @throws InvalidOrderStateException if the order is filled, cancelled or rejected
     * @throws CommandValidationException for a bad price or quantity
     */
    public synchronized Order executeOrder(String orderId, BigDecimal price, Long quantity) {
        SimulatedOrder order = book.get(orderId);
        if (!order.isOpen()) {
            throw new InvalidOrderStateException(orderId, order.status(), "execute");
        }

        BigDecimal fillPrice = price != null ? price : order.price();
        if (fillPrice == null) {
            throw new CommandValidationException("price", "required to execute a MARKET order");
        }
        if (fillPrice.signum() <= 0) {
            throw new CommandValidationException("price", "must be positive, got " + fillPrice);
        }
        long fillQuantity = quantity != null ? quantity : order.remainingQuantity();
        if (fillQuantity <= 0 || fillQuantity > order.remainingQuantity()) {
            throw new CommandValidationException("quantity",
                "must be between 1 and " + order.remainingQuantity() + ", got " + fillQuantity);
        }

        order.fill(fillQuantity, fillPrice, clock.instant());
        ledger.applyFill(order.symbol(), order.side(), fillQuantity, fillPrice);
        if (!order.isOpen()) {
            book.markClosed(order);
        }

        log.info("[SIM] Order {} executed: {} @ {} ({} / {}, {})", orderId, fillQuantity, fillPrice,
            order.filledQuantity(), order.quantity(), order.status());

        eventSink.accept(tradeAck(order, null));
        eventSink.accept(WireRecord.builder(RecordKind.TRADEXEC)
            .set("symbol", order.symbol())
            .set("order_id", orderId)
            .set("operation", order.operation())
            .set("quantity", fillQuantity)
            .set("price", fillPrice)
            .set("time", now())
            .build());
        return order.snapshot();
    }

    /**
     * Cancel the unfilled remainder. The filled part stands.
     */
    public synchronized WireRecord cancelOrder(String orderId) {
        SimulatedOrder order = book.get(orderId);
        order.cancel(clock.instant());
        book.markClosed(order);
        log.info("[SIM] Order {} cancelled ({} of {} filled)", orderId, order.filledQuantity(), order.quantity());

        WireRecord ack = tradeAck(order, WireCodec.encode(Command.cancel(orderId)));
        eventSink.accept(ack);
        return ack;
    }

    /**
     * Cancel every open order for a symbol.
     *
     * @return one TRADOK per cancelled order, or ERR 1019 when none was open
     */
    public synchronized List<WireRecord> cancelAll(String symbol) {
        List<WireRecord> acks = new ArrayList<>();
        for (SimulatedOrder order : book.openForSymbol(symbol)) {
            acks.add(cancelOrder(order.orderId()));
        }
        return acks.isEmpty() ? List.of(error(DaemonErrorCode.NO_ORDERS)) : acks;
    }

    public synchronized WireRecord modifyOrder(String orderId, BigDecimal price) {
        SimulatedOrder order = book.get(orderId);
        if (!order.isOpen()) {
            throw new InvalidOrderStateException(orderId, order.status(), "modify");
        }
        if (order.kind() == OrderKind.MARKET) {
            throw new CommandValidationException("price", "MARKET orders have no price to modify");
        }
        if (price == null || price.signum() <= 0) {
            throw new CommandValidationException("price", "must be positive");
        }
        order.reprice(price, clock.instant());
        log.info("[SIM] Order {} repriced to {}", orderId, price);

        WireRecord ack = tradeAck(order, WireCodec.encode(Command.modify(orderId, price)));
        eventSink.accept(ack);
        return ack;
    }

    public synchronized void updateAccount(BigDecimal liquidity) {
        if (liquidity == null) {
            throw new CommandValidationException("liquidity", "is required");
        }
        ledger.setLiquidity(liquidity);
        log.info("[SIM] Liquidity set to {}", liquidity);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // STATE ACCESS
    // ═══════════════════════════════════════════════════════════════════════

    public synchronized Order order(String orderId) {
        return book.get(orderId).snapshot();
    }

    public synchronized List<Order> orders() {
        List<Order> result = new ArrayList<>();
        for (SimulatedOrder order : book.all()) {
            result.add(order.snapshot());
        }
        return result;
    }

    /**
     * @return position for the symbol, or null when flat
     */
    public synchronized Position position(String symbol) {
        return ledger.position(symbol);
    }

    public synchronized List<Position> positions() {
        return ledger.positions();
    }

    public synchronized BigDecimal liquidity() {
        return ledger.liquidity();
    }

    public synchronized BigDecimal realizedGain() {
        return ledger.realizedGain();
    }

    public synchronized BigDecimal equity() {
        return ledger.equity();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RECORD SYNTHESIS
    // ═══════════════════════════════════════════════════════════════════════

    private WireRecord tradeAck(SimulatedOrder order, String commandLine) {
        return WireRecord.builder(RecordKind.TRADOK)
            .set("symbol", order.symbol())
            .set("order_id", order.orderId())
            .set("status_code", (long) order.status().wireCode())
            .set("operation", order.operation())
            .set("quantity", order.quantity())
            .set("price", order.price())
            .set("filled_quantity", order.filledQuantity())
            .set("remaining_quantity", order.status() == OrderStatus.CANCELLED ? 0L : order.remainingQuantity())
            .set("average_price", order.averageFillPrice())
            .set("platform_ref", PLATFORM_REF)
            .set("command", commandLine)
            .build();
    }

    private List<WireRecord> portfolioRecords(String symbol) {
        List<WireRecord> records = new ArrayList<>();
        for (Position position : ledger.positions()) {
            if (symbol != null && !symbol.equals(position.symbol())) {
                continue;
            }
            records.add(WireRecord.builder(RecordKind.STOCK)
                .set("symbol", position.symbol())
                .set("time", now())
                .set("quantity_portfolio", position.quantity())
                .set("quantity_darwin", 0L)
                .set("quantity_negotiation", openQuantity(position.symbol()))
                .set("average_price", position.averageCost())
                .set("gain", position.gain())
                .build());
        }
        return records.isEmpty() ? List.of(error(DaemonErrorCode.EMPTY_PORTFOLIO)) : records;
    }

    private long openQuantity(String symbol) {
        long total = 0;
        for (SimulatedOrder order : book.openForSymbol(symbol)) {
            total += order.remainingQuantity();
        }
        return total;
    }

    private List<WireRecord> orderRecords(List<SimulatedOrder> orders) {
        if (orders.isEmpty()) {
            return List.of(error(DaemonErrorCode.NO_ORDERS));
        }
        List<WireRecord> records = new ArrayList<>(orders.size());
        for (SimulatedOrder order : orders) {
            records.add(WireRecord.builder(RecordKind.ORDER)
                .set("symbol", order.symbol())
                .set("time", now())
                .set("order_id", order.orderId())
                .set("operation", order.operation())
                .set("price", order.price())
                .set("quantity", order.quantity())
                .set("status_code", (long) order.status().wireCode())
                .set("filled_quantity", order.filledQuantity())
                .set("average_price", order.averageFillPrice())
                .build());
        }
        return records;
    }

    private WireRecord accountRecord() {
        return WireRecord.builder(RecordKind.INFOACCOUNT)
            .set("time", now())
            .set("account_code", settings.accountCode())
            .set("liquidity", ledger.liquidity())
            .set("gain", ledger.realizedGain())
            .set("open_profit_loss", ledger.unrealizedGain())
            .set("equity", ledger.equity())
            .set("environment", settings.environment())
            .build();
    }

    private WireRecord availabilityRecord() {
        BigDecimal liquidity = ledger.liquidity();
        return WireRecord.builder(RecordKind.AVAILABILITY)
            .set("time", now())
            .set("stock_availability", liquidity)
            .set("stock_availability_margin", liquidity)
            .set("derivatives_availability", BigDecimal.ZERO)
            .set("derivatives_availability_margin", BigDecimal.ZERO)
            .set("total_liquidity", liquidity)
            .build();
    }

    private WireRecord statusRecord() {
        return WireRecord.builder(RecordKind.DARWIN_STATUS)
            .set("connection_status", "CONN_OK")
            .set("trading_enabled", "TRUE")
            .set("release", settings.release())
            .build();
    }

    private static WireRecord error(DaemonErrorCode code) {
        return WireRecord.builder(RecordKind.ERR)
            .set("subject", "N/A")
            .set("error_code", (long) code.code())
            .build();
    }

    private LocalTime now() {
        return LocalTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
