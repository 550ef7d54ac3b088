package com.darwinlink.application.client;

import com.darwinlink.application.port.TradingGateway;
import com.darwinlink.application.simulation.InvalidOrderStateException;
import com.darwinlink.application.simulation.OrderNotFoundException;
import com.darwinlink.config.ClientConfig;
import com.darwinlink.domain.order.Fill;
import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.order.OrderAck;
import com.darwinlink.domain.order.OrderRequest;
import com.darwinlink.domain.order.OrderSide;
import com.darwinlink.domain.portfolio.AccountSnapshot;
import com.darwinlink.domain.portfolio.Availability;
import com.darwinlink.domain.portfolio.Position;
import com.darwinlink.domain.session.LivenessState;
import com.darwinlink.domain.session.PlatformStatus;
import com.darwinlink.domain.session.Session;
import com.darwinlink.domain.session.SessionMode;
import com.darwinlink.infrastructure.connection.DarwinConnectionException;
import com.darwinlink.infrastructure.connection.NotConnectedException;
import com.darwinlink.infrastructure.metrics.ConnectionMetricsSnapshot;
import com.darwinlink.infrastructure.metrics.PrometheusConnectionMetrics;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.CommandValidationException;
import com.darwinlink.infrastructure.protocol.DaemonErrorCode;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireFormatException;
import com.darwinlink.infrastructure.protocol.WireRecord;
import com.darwinlink.infrastructure.routing.RecordSubscriber;
import com.darwinlink.infrastructure.routing.RequestCancelledException;
import com.darwinlink.infrastructure.routing.RequestTimeoutException;
import com.darwinlink.infrastructure.routing.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Trading operations against the Darwin daemon, or against the simulation
 * engine when the config asks for simulation.
 *
 * Every operation returns an {@link ApiResult} and never throws for
 * transport, protocol or daemon failures. The exception is {@link #open},
 * which throws so that it can be used in try-with-resources:
 *
 * <pre>
 * try (DarwinTradingClient client = DarwinTradingClient.open(config)) {
 *     ApiResult&lt;OrderAck&gt; ack = client.placeLimitOrder("INTC", OrderSide.BUY, 100, new BigDecimal("50.25"));
 * }
 * </pre>
 */
public class DarwinTradingClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DarwinTradingClient.class);

    static final String DEGRADED_WARNING = "Heartbeat overdue, session degraded";

    private final ClientConfig config;
    private final TradingGateway gateway;
    private final OrderIdGenerator orderIds;

    public DarwinTradingClient(ClientConfig config) {
        this(config, createGateway(config));
    }

    public DarwinTradingClient(ClientConfig config, TradingGateway gateway) {
        this(config, gateway, new OrderIdGenerator());
    }

    DarwinTradingClient(ClientConfig config, TradingGateway gateway, OrderIdGenerator orderIds) {
        this.config = config;
        this.gateway = gateway;
        this.orderIds = orderIds;
    }

    /**
     * Create and connect a client.
     *
     * @throws DarwinConnectionException if the session cannot be started
     */
    public static DarwinTradingClient open(ClientConfig config) {
        DarwinTradingClient client = new DarwinTradingClient(config);
        client.gateway.connect();
        return client;
    }

    private static TradingGateway createGateway(ClientConfig config) {
        PrometheusConnectionMetrics metrics = new PrometheusConnectionMetrics();
        if (config.simulation()) {
            return new SimulatedTradingGateway(config.simulationSettings(), metrics);
        }
        return new LiveTradingGateway(config, metrics);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════════════

    public ApiResult<Session> connect() {
        try {
            gateway.connect();
            return ApiResult.ofSuccess(gateway.session());
        } catch (DarwinConnectionException e) {
            log.error("[trading] Connect failed: {}", e.getMessage());
            return ApiResult.ofFailure(e.getMessage(), ApiErrorCode.CONNECTION);
        }
    }

    public ApiResult<Session> disconnect() {
        gateway.disconnect();
        return ApiResult.ofSuccess(gateway.session());
    }

    @Override
    public void close() {
        gateway.disconnect();
    }

    public Session session() {
        return gateway.session();
    }

    public SessionMode mode() {
        return gateway.mode();
    }

    public boolean isSimulation() {
        return gateway.mode() == SessionMode.SIMULATION;
    }

    public ConnectionMetricsSnapshot connectionMetrics() {
        return gateway.metrics();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    public ApiResult<OrderAck> placeMarketOrder(String symbol, OrderSide side, long quantity) {
        return placeOrder(OrderRequest.market(symbol, side, quantity));
    }

    public ApiResult<OrderAck> placeLimitOrder(String symbol, OrderSide side, long quantity, BigDecimal price) {
        return placeOrder(OrderRequest.limit(symbol, side, quantity, price));
    }

    public ApiResult<OrderAck> placeStopOrder(String symbol, OrderSide side, long quantity, BigDecimal triggerPrice) {
        return placeOrder(OrderRequest.stop(symbol, side, quantity, triggerPrice));
    }

    public ApiResult<OrderAck> placeTrailingStopOrder(String symbol, OrderSide side, long quantity,
                                                      BigDecimal triggerPrice, BigDecimal trailAmount) {
        return placeOrder(OrderRequest.trailingStop(symbol, side, quantity, triggerPrice, trailAmount));
    }

    public ApiResult<OrderAck> placeIcebergOrder(String symbol, OrderSide side, long quantity,
                                                 BigDecimal price, long visibleQuantity) {
        return placeOrder(OrderRequest.iceberg(symbol, side, quantity, price, visibleQuantity));
    }

    /**
     * Place any kind of order. A rejection by the daemon is a successful
     * result whose ack has status REJECTED.
     */
    public ApiResult<OrderAck> placeOrder(OrderRequest request) {
        return call("placeOrder", () -> {
            Command command = Command.placeOrder(request, orderIds.next());
            OrderAck ack = orderAck(gateway.execute(command, config.requestTimeout()));
            if (ack.confirmationRequired() && config.autoConfirmOrders()) {
                log.info("[trading] Order {} needs confirmation, sending CONFORD", ack.orderId());
                ack = orderAck(gateway.execute(Command.confirm(ack.orderId()), config.requestTimeout()));
            }
            if (ack.isRejected()) {
                log.warn("[trading] ⚠️ Order {} rejected: {} {}", ack.orderId(), ack.rejectionCode(), ack.rejectionMessage());
            } else {
                log.info("[trading] Order {} accepted: {} {} {}", ack.orderId(), request.side(), request.quantity(), request.symbol());
            }
            return ack;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER MANAGEMENT
    // ═══════════════════════════════════════════════════════════════════════

    public ApiResult<OrderAck> cancelOrder(String orderId) {
        return call("cancelOrder", () -> orderAck(gateway.execute(Command.cancel(orderId), config.requestTimeout())));
    }

    /**
     * Cancel every open order for a symbol. The daemon answers ERR 1019 when
     * nothing is open, which gives an empty list; a daemon that stays silent
     * instead ends in TIMEOUT.
     */
    public ApiResult<List<OrderAck>> cancelAllOrders(String symbol) {
        return call("cancelAllOrders", () ->
            mapList(gateway.execute(Command.cancelAll(symbol), config.requestTimeout()), RecordMapper::toOrderAck));
    }

    public ApiResult<OrderAck> modifyOrder(String orderId, BigDecimal newPrice) {
        return call("modifyOrder", () ->
            orderAck(gateway.execute(Command.modify(orderId, newPrice), config.requestTimeout())));
    }

    /**
     * Send CONFORD for an order that is awaiting confirmation. Only needed
     * when automatic confirmation is off.
     */
    public ApiResult<OrderAck> confirmOrder(String orderId) {
        return call("confirmOrder", () ->
            orderAck(gateway.execute(Command.confirm(orderId), config.requestTimeout())));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public ApiResult<AccountSnapshot> getAccountInfo() {
        return call("getAccountInfo", () ->
            RecordMapper.toAccount(single(gateway.execute(Command.account(), config.requestTimeout()))));
    }

    public ApiResult<Availability> getAvailability() {
        return call("getAvailability", () ->
            RecordMapper.toAvailability(single(gateway.execute(Command.availability(), config.requestTimeout()))));
    }

    public ApiResult<List<Position>> getPortfolio() {
        return call("getPortfolio", () ->
            mapList(gateway.execute(Command.portfolio(), config.requestTimeout()), RecordMapper::toPosition));
    }

    /**
     * @return position for the symbol; data is null when there is none
     */
    public ApiResult<Position> getPosition(String symbol) {
        return call("getPosition", () -> {
            List<Position> positions = mapList(
                gateway.execute(Command.position(symbol), config.requestTimeout()), RecordMapper::toPosition);
            for (Position position : positions) {
                if (position.symbol().equals(symbol)) {
                    return position;
                }
            }
            return null;
        });
    }

    public ApiResult<List<Order>> getOrders() {
        return call("getOrders", () ->
            mapList(gateway.execute(Command.orders(), config.requestTimeout()), RecordMapper::toOrder));
    }

    public ApiResult<List<Order>> getOrders(String symbol) {
        return call("getOrders", () ->
            mapList(gateway.execute(Command.orders(symbol), config.requestTimeout()), RecordMapper::toOrder));
    }

    public ApiResult<List<Order>> getPendingOrders() {
        return call("getPendingOrders", () ->
            mapList(gateway.execute(Command.pendingOrders(), config.requestTimeout()), RecordMapper::toOrder));
    }

    public ApiResult<PlatformStatus> getDarwinStatus() {
        return call("getDarwinStatus", () -> RecordMapper.toPlatformStatus(
            single(gateway.execute(Command.status(), config.requestTimeout())), isSimulation()));
    }

    /**
     * Send any command and return the raw records of its response.
     */
    public ApiResult<List<WireRecord>> execute(Command command, Duration timeout) {
        return call("execute " + command.kind().verb(), () -> gateway.execute(command, timeout));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SIMULATION
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Fill the whole remainder of a simulated order at the given price.
     */
    public ApiResult<Order> simulateOrderExecution(String orderId, BigDecimal executedPrice) {
        return simulateOrderExecution(orderId, executedPrice, null);
    }

    /**
     * Fill a simulated order. Null price uses the order price; null quantity
     * fills the remainder. NOT_SUPPORTED in live mode.
     */
    public ApiResult<Order> simulateOrderExecution(String orderId, BigDecimal executedPrice, Long executedQuantity) {
        return call("simulateOrderExecution", () -> gateway.simulateExecution(orderId, executedPrice, executedQuantity));
    }

    public ApiResult<AccountSnapshot> updateSimulatedAccount(BigDecimal liquidity) {
        return call("updateSimulatedAccount", () -> {
            gateway.updateAccount(liquidity);
            return RecordMapper.toAccount(single(gateway.execute(Command.account(), config.requestTimeout())));
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Order status pushes (TRADOK) and rejections (TRADERR).
     */
    public Subscription onOrderUpdate(Consumer<OrderAck> listener) {
        RecordSubscriber subscriber = record -> listener.accept(RecordMapper.toOrderAck(record));
        Subscription status = gateway.subscribe(RecordKind.TRADOK, subscriber);
        Subscription rejections = gateway.subscribe(RecordKind.TRADERR, subscriber);
        return () -> {
            status.close();
            rejections.close();
        };
    }

    public Subscription onFill(Consumer<Fill> listener) {
        return gateway.subscribe(RecordKind.TRADEXEC, record -> listener.accept(RecordMapper.toFill(record)));
    }

    public Subscription subscribe(RecordKind kind, RecordSubscriber subscriber) {
        return gateway.subscribe(kind, subscriber);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RESULT PLUMBING
    // ═══════════════════════════════════════════════════════════════════════

    private <T> ApiResult<T> call(String operation, Supplier<T> action) {
        try {
            T data = action.get();
            return gateway.session().state() == LivenessState.DEGRADED
                ? ApiResult.ofSuccess(data, DEGRADED_WARNING)
                : ApiResult.ofSuccess(data);
        } catch (CommandValidationException e) {
            return failure(operation, e, ApiErrorCode.VALIDATION);
        } catch (NotConnectedException e) {
            return failure(operation, e, ApiErrorCode.NOT_CONNECTED);
        } catch (RequestTimeoutException e) {
            return failure(operation, e, ApiErrorCode.TIMEOUT);
        } catch (RequestCancelledException e) {
            return failure(operation, e, ApiErrorCode.CANCELLED);
        } catch (DarwinConnectionException e) {
            return failure(operation, e, ApiErrorCode.CONNECTION);
        } catch (OrderNotFoundException e) {
            return failure(operation, e, ApiErrorCode.ORDER_NOT_FOUND);
        } catch (InvalidOrderStateException e) {
            return failure(operation, e, ApiErrorCode.INVALID_STATE);
        } catch (DaemonResponseException e) {
            return failure(operation, e, e.getErrorCode());
        } catch (WireFormatException e) {
            return failure(operation, e, ApiErrorCode.PROTOCOL);
        } catch (UnsupportedOperationException e) {
            return failure(operation, e, ApiErrorCode.NOT_SUPPORTED);
        } catch (RuntimeException e) {
            log.error("[trading] {} failed unexpectedly", operation, e);
            return ApiResult.ofFailure(operation + ": " + e.getMessage(), ApiErrorCode.INTERNAL);
        }
    }

    private static <T> ApiResult<T> failure(String operation, RuntimeException e, ApiErrorCode code) {
        log.warn("[trading] {} failed ({}): {}", operation, code, e.getMessage());
        return ApiResult.ofFailure(e.getMessage(), code);
    }

    /**
     * The one record of a single-line answer. ERR becomes a failure.
     */
    static WireRecord single(List<WireRecord> records) {
        if (records.isEmpty()) {
            throw new DaemonResponseException(ApiErrorCode.PROTOCOL, "Empty response");
        }
        WireRecord record = records.get(0);
        if (record.kind() == RecordKind.ERR) {
            throw daemonError(record);
        }
        return record;
    }

    /**
     * Map a list answer. ERR 1018 / 1019 mean an empty list.
     */
    static <T> List<T> mapList(List<WireRecord> records, Function<WireRecord, T> mapper) {
        List<T> values = new ArrayList<>(records.size());
        for (WireRecord record : records) {
            if (record.kind() == RecordKind.ERR) {
                if (DaemonErrorCode.isEmptyResult(record.integer("error_code"))) {
                    continue;
                }
                throw daemonError(record);
            }
            values.add(mapper.apply(record));
        }
        return values;
    }

    private static OrderAck orderAck(List<WireRecord> records) {
        return RecordMapper.toOrderAck(single(records));
    }

    private static DaemonResponseException daemonError(WireRecord err) {
        long code = err.integer("error_code");
        ApiErrorCode apiCode = code == DaemonErrorCode.ORDER_NOT_FOUND.code()
            ? ApiErrorCode.ORDER_NOT_FOUND
            : ApiErrorCode.DAEMON_ERROR;
        return new DaemonResponseException(apiCode,
            "Daemon error " + code + ": " + DaemonErrorCode.describe(code));
    }
}
