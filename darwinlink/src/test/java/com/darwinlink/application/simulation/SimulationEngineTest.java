package com.darwinlink.application.simulation;

import com.darwinlink.config.SimulationSettings;
import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.order.OrderRequest;
import com.darwinlink.domain.order.OrderSide;
import com.darwinlink.domain.order.OrderStatus;
import com.darwinlink.domain.portfolio.Position;
import com.darwinlink.infrastructure.protocol.Command;
import com.darwinlink.infrastructure.protocol.CommandValidationException;
import com.darwinlink.infrastructure.protocol.RecordKind;
import com.darwinlink.infrastructure.protocol.WireRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order lifecycle, ledger effects and emitted records of the simulation engine.
 */
class SimulationEngineTest {

    private static final BigDecimal START_CASH = new BigDecimal("10000");

    private List<WireRecord> events;
    private SimulationEngine engine;

    @BeforeEach
    void setUp() {
        events = new CopyOnWriteArrayList<>();
        engine = new SimulationEngine(SimulationSettings.defaults(), events::add,
            Clock.fixed(Instant.parse("2024-01-15T09:30:00Z"), ZoneOffset.UTC));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testPlaceLimitOrder() {
        WireRecord ack = placeLimitBuy(100, "50.25");

        assertEquals(RecordKind.TRADOK, ack.kind());
        assertEquals("SIM000001", ack.string("order_id"));
        assertEquals((long) OrderStatus.PENDING.wireCode(), ack.integer("status_code"));
        assertEquals("ACQAZ", ack.string("operation"));

        Order order = engine.order("SIM000001");
        assertEquals(OrderStatus.PENDING, order.status());
        assertEquals(100, order.quantity());
        assertEquals(0, new BigDecimal("50.25").compareTo(order.price()));
        assertEquals(List.of(ack), events, "Placement is also pushed as an event");
    }

    @Test
    void testOrderIdsAreSequentialAndIgnoreCallerTag() {
        placeLimitBuy(10, "50");
        WireRecord second = engine.placeOrder(Command.placeOrder(
            OrderRequest.market("INTC", OrderSide.SELL, 5), "CALLER42"));

        assertEquals("SIM000002", second.string("order_id"));
        assertThrows(OrderNotFoundException.class, () -> engine.order("CALLER42"));
    }

    @Test
    void testResetClearsOrdersAndPositions() {
        placeLimitBuy(100, "50");
        engine.executeOrder("SIM000001", null, null);

        engine.reset();

        assertTrue(engine.orders().isEmpty());
        assertTrue(engine.positions().isEmpty());
        assertEquals(0, START_CASH.compareTo(engine.liquidity()));
        assertEquals("SIM000001", placeLimitBuy(1, "50").string("order_id"), "Sequence restarts");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EXECUTION
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Full fill of a 100-share INTC limit buy at 50.00")
    void testFullFill() {
        placeLimitBuy(100, "50.25");

        Order order = engine.executeOrder("SIM000001", new BigDecimal("50.00"), null);

        assertEquals(OrderStatus.FILLED, order.status());
        assertEquals(100, order.filledQuantity());
        assertEquals(0, new BigDecimal("50.00").compareTo(order.averageFillPrice()));

        Position position = engine.position("INTC");
        assertEquals(100, position.quantity());
        assertEquals(0, new BigDecimal("50.00").compareTo(position.averageCost()));
        assertEquals(0, new BigDecimal("5000.00").compareTo(engine.liquidity()),
            "Liquidity drops by 100 x 50.00");
    }

    @Test
    @DisplayName("Partial fill of 40 at 50.10 leaves 60 cancellable")
    void testPartialFillThenCancel() {
        placeLimitBuy(100, "50.25");

        Order partial = engine.executeOrder("SIM000001", new BigDecimal("50.10"), 40L);
        assertEquals(OrderStatus.PARTIALLY_FILLED, partial.status());
        assertEquals(40, partial.filledQuantity());
        assertEquals(60, partial.remainingQuantity());
        assertEquals(0, new BigDecimal("50.10").compareTo(partial.averageFillPrice()));

        WireRecord cancelled = engine.cancelOrder("SIM000001");
        assertEquals((long) OrderStatus.CANCELLED.wireCode(), cancelled.integer("status_code"));
        assertEquals(40L, cancelled.integer("filled_quantity"), "Filled part stands");

        Order order = engine.order("SIM000001");
        assertEquals(OrderStatus.CANCELLED, order.status());
        assertEquals(40, order.filledQuantity());
        assertEquals(40, engine.position("INTC").quantity());
    }

    @Test
    void testAverageFillPriceIsQuantityWeighted() {
        placeLimitBuy(100, "50");

        engine.executeOrder("SIM000001", new BigDecimal("50.00"), 30L);
        engine.executeOrder("SIM000001", new BigDecimal("51.00"), 50L);
        Order order = engine.executeOrder("SIM000001", new BigDecimal("49.00"), 20L);

        // (30*50 + 50*51 + 20*49) / 100 = 50.30
        assertEquals(0, new BigDecimal("50.30").compareTo(order.averageFillPrice()));
        assertEquals(OrderStatus.FILLED, order.status());
    }

    @Test
    void testFillEmitsStatusThenExecution() {
        placeLimitBuy(100, "50");
        events.clear();

        engine.executeOrder("SIM000001", new BigDecimal("50"), 25L);

        assertEquals(2, events.size());
        assertEquals(RecordKind.TRADOK, events.get(0).kind());
        assertEquals((long) OrderStatus.PARTIALLY_FILLED.wireCode(), events.get(0).integer("status_code"));
        assertEquals(RecordKind.TRADEXEC, events.get(1).kind());
        assertEquals(25L, events.get(1).integer("quantity"));
        assertEquals("ACQAZ", events.get(1).string("operation"));
    }

    @Test
    void testExecuteUnknownOrder() {
        assertThrows(OrderNotFoundException.class,
            () -> engine.executeOrder("SIM999999", BigDecimal.ONE, null));
    }

    @Test
    void testExecuteFilledOrder() {
        placeLimitBuy(10, "50");
        engine.executeOrder("SIM000001", null, null);

        InvalidOrderStateException e = assertThrows(InvalidOrderStateException.class,
            () -> engine.executeOrder("SIM000001", null, null));
        assertEquals(OrderStatus.FILLED, e.getStatus());
    }

    @Test
    void testOverfillIsRejected() {
        placeLimitBuy(10, "50");

        assertThrows(CommandValidationException.class,
            () -> engine.executeOrder("SIM000001", null, 11L));
        assertEquals(0, engine.order("SIM000001").filledQuantity(), "Order untouched");
    }

    @Test
    void testMarketOrderNeedsExecutionPrice() {
        engine.placeOrder(Command.placeOrder(OrderRequest.market("INTC", OrderSide.BUY, 10), "T"));

        assertThrows(CommandValidationException.class, () -> engine.executeOrder("SIM000001", null, null));
        assertEquals(OrderStatus.FILLED,
            engine.executeOrder("SIM000001", new BigDecimal("50"), null).status());
    }

    @Test
    void testConcurrentFillsNeverDoubleCount() throws Exception {
        placeLimitBuy(100, "50");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < 20; i++) {
            pool.submit(() -> {
                try {
                    start.await();
                    engine.executeOrder("SIM000001", new BigDecimal("50"), 10L);
                } catch (InvalidOrderStateException | CommandValidationException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        Order order = engine.order("SIM000001");
        assertEquals(100, order.filledQuantity());
        assertEquals(OrderStatus.FILLED, order.status());
        assertEquals(10, rejected.get(), "Fills beyond the quantity are refused");
        assertEquals(100, engine.position("INTC").quantity());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CANCEL / MODIFY
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testCancelFilledOrderFails() {
        placeLimitBuy(100, "50.25");
        engine.executeOrder("SIM000001", null, null);

        assertThrows(InvalidOrderStateException.class, () -> engine.cancelOrder("SIM000001"));
        assertEquals(OrderStatus.FILLED, engine.order("SIM000001").status(), "State unchanged");
    }

    @Test
    void testCancelTwiceFails() {
        placeLimitBuy(100, "50.25");
        engine.cancelOrder("SIM000001");

        assertThrows(InvalidOrderStateException.class, () -> engine.cancelOrder("SIM000001"));
    }

    @Test
    void testCancelUnknownOrder() {
        OrderNotFoundException e = assertThrows(OrderNotFoundException.class, () -> engine.cancelOrder("NOPE"));
        assertEquals("NOPE", e.getOrderId());
    }

    @Test
    void testCancelAllForSymbol() {
        placeLimitBuy(10, "50");
        placeLimitBuy(20, "49");
        engine.placeOrder(Command.placeOrder(OrderRequest.limit("ENI", OrderSide.BUY, 5, BigDecimal.TEN), "T"));
        engine.executeOrder("SIM000001", null, null);

        List<WireRecord> acks = engine.cancelAll("INTC");

        assertEquals(1, acks.size(), "Only the open INTC order is cancelled");
        assertEquals("SIM000002", acks.get(0).string("order_id"));
        assertEquals(OrderStatus.PENDING, engine.order("SIM000003").status());
    }

    @Test
    void testCancelAllWithNothingOpenAnswersNoOrders() {
        placeLimitBuy(10, "50");
        engine.cancelOrder("SIM000001");
        events.clear();

        List<WireRecord> answer = engine.cancelAll("INTC");

        assertEquals(1, answer.size());
        assertEquals(RecordKind.ERR, answer.get(0).kind());
        assertEquals(1019L, answer.get(0).integer("error_code"));
        assertTrue(events.isEmpty(), "Nothing cancelled, nothing pushed");
    }

    @Test
    void testModifyRepricesOpenOrder() {
        placeLimitBuy(10, "50");

        WireRecord ack = engine.modifyOrder("SIM000001", new BigDecimal("49.5"));

        assertEquals(0, new BigDecimal("49.5").compareTo(ack.decimal("price")));
        assertEquals(0, new BigDecimal("49.5").compareTo(engine.order("SIM000001").price()));
    }

    @Test
    void testModifyTerminalOrderFails() {
        placeLimitBuy(10, "50");
        engine.cancelOrder("SIM000001");

        assertThrows(InvalidOrderStateException.class,
            () -> engine.modifyOrder("SIM000001", new BigDecimal("49")));
    }

    @Test
    void testModifyFilledMarketOrderIsInvalidState() {
        engine.placeOrder(Command.placeOrder(OrderRequest.market("INTC", OrderSide.BUY, 10), "T1"));
        engine.executeOrder("SIM000001", new BigDecimal("50"), null);

        InvalidOrderStateException e = assertThrows(InvalidOrderStateException.class,
            () -> engine.modifyOrder("SIM000001", new BigDecimal("49")));

        assertTrue(e.getMessage().contains("SIM000001"), e.getMessage());
        assertEquals(OrderStatus.FILLED, engine.order("SIM000001").status());
    }

    @Test
    void testModifyOpenMarketOrderIsRejected() {
        engine.placeOrder(Command.placeOrder(OrderRequest.market("INTC", OrderSide.BUY, 10), "T1"));

        assertThrows(CommandValidationException.class,
            () -> engine.modifyOrder("SIM000001", new BigDecimal("49")));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testEmptyPortfolioAnswersErr() {
        List<WireRecord> records = engine.execute(Command.portfolio());

        assertEquals(1, records.size());
        assertEquals(RecordKind.ERR, records.get(0).kind());
        assertEquals(1018L, records.get(0).integer("error_code"));
    }

    @Test
    void testNoOrdersAnswersErr() {
        List<WireRecord> records = engine.execute(Command.orders());

        assertEquals(1019L, records.get(0).integer("error_code"));
    }

    @Test
    void testPortfolioRecords() {
        placeLimitBuy(100, "50");
        engine.executeOrder("SIM000001", null, 60L);

        List<WireRecord> records = engine.execute(Command.portfolio());

        assertEquals(1, records.size());
        WireRecord stock = records.get(0);
        assertEquals(RecordKind.STOCK, stock.kind());
        assertEquals(60L, stock.integer("quantity_portfolio"));
        assertEquals(40L, stock.integer("quantity_negotiation"), "Open remainder still working");
    }

    @Test
    void testOrderQueries() {
        placeLimitBuy(10, "50");
        placeLimitBuy(10, "50");
        engine.cancelOrder("SIM000002");

        assertEquals(2, engine.execute(Command.orders()).size());
        assertEquals(2, engine.execute(Command.orders("INTC")).size());
        assertEquals(1019L, engine.execute(Command.orders("ENI")).get(0).integer("error_code"));

        List<WireRecord> pending = engine.execute(Command.pendingOrders());
        assertEquals(1, pending.size());
        assertEquals("SIM000001", pending.get(0).string("order_id"));
    }

    @Test
    void testAccountReflectsFillsAndLiquidityUpdate() {
        placeLimitBuy(100, "50");
        engine.executeOrder("SIM000001", null, null);

        WireRecord account = engine.execute(Command.account()).get(0);
        assertEquals("SIM1234", account.string("account_code"));
        assertEquals(0, new BigDecimal("5000").compareTo(account.decimal("liquidity")));
        assertEquals(0, new BigDecimal("10000").compareTo(account.decimal("equity")));

        engine.updateAccount(new BigDecimal("25000"));
        WireRecord availability = engine.execute(Command.availability()).get(0);
        assertEquals(0, new BigDecimal("25000").compareTo(availability.decimal("stock_availability")));
    }

    @Test
    void testStatusQuery() {
        WireRecord status = engine.execute(Command.status()).get(0);

        assertEquals("CONN_OK", status.string("connection_status"));
        assertEquals("SIMULATION", status.string("release"));
    }

    @Test
    void testHistoricalCommandsAreNotSimulated() {
        assertThrows(UnsupportedOperationException.class, () -> engine.execute(Command.ticks("INTC", 1)));
    }

    @Test
    void testConfirmAnswersWithCurrentState() {
        placeLimitBuy(10, "50");

        WireRecord ack = engine.execute(Command.confirm("SIM000001")).get(0);

        assertEquals(RecordKind.TRADOK, ack.kind());
        assertEquals("CONFORD SIM000001", ack.string("command"));
    }

    private WireRecord placeLimitBuy(long quantity, String price) {
        return engine.placeOrder(Command.placeOrder(
            OrderRequest.limit("INTC", OrderSide.BUY, quantity, new BigDecimal(price)), "ORD-TAG"));
    }
}
