package com.darwinlink.application.simulation;

import com.darwinlink.domain.order.OrderSide;
import com.darwinlink.domain.portfolio.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioLedgerTest {

    private PortfolioLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PortfolioLedger(new BigDecimal("10000"));
    }

    @Test
    void testBuyOpensLongPosition() {
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("50"));

        Position position = ledger.position("INTC");
        assertEquals(100, position.quantity());
        assertTrue(position.isLong());
        assertEquals(0, new BigDecimal("5000").compareTo(ledger.liquidity()));
    }

    @Test
    void testSellOpensShortPosition() {
        ledger.applyFill("INTC", OrderSide.SELL, 50, new BigDecimal("50"));

        assertEquals(-50, ledger.position("INTC").quantity());
        assertEquals(0, new BigDecimal("12500").compareTo(ledger.liquidity()), "Short sale adds cash");
    }

    @Test
    void testAddingUsesWeightedCost() {
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("50"));
        ledger.applyFill("INTC", OrderSide.BUY, 50, new BigDecimal("53"));

        Position position = ledger.position("INTC");
        assertEquals(150, position.quantity());
        assertEquals(0, new BigDecimal("51").compareTo(position.averageCost()));
        assertEquals(0, new BigDecimal("53").compareTo(position.lastPrice()));
        assertEquals(0, new BigDecimal("300").compareTo(position.gain()), "150 x (53 - 51)");
    }

    @Test
    void testReducingRealizesGainAndKeepsCost() {
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("50"));
        ledger.applyFill("INTC", OrderSide.SELL, 40, new BigDecimal("55"));

        Position position = ledger.position("INTC");
        assertEquals(60, position.quantity());
        assertEquals(0, new BigDecimal("50").compareTo(position.averageCost()));
        assertEquals(0, new BigDecimal("200").compareTo(ledger.realizedGain()));
    }

    @Test
    void testClosingRemovesPosition() {
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("50"));
        ledger.applyFill("INTC", OrderSide.SELL, 100, new BigDecimal("48"));

        assertNull(ledger.position("INTC"));
        assertTrue(ledger.positions().isEmpty());
        assertEquals(0, new BigDecimal("-200").compareTo(ledger.realizedGain()));
        assertEquals(0, new BigDecimal("9800").compareTo(ledger.liquidity()));
    }

    @Test
    void testCrossingZeroFlipsAtFillPrice() {
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("50"));
        ledger.applyFill("INTC", OrderSide.SELL, 150, new BigDecimal("60"));

        Position position = ledger.position("INTC");
        assertEquals(-50, position.quantity());
        assertEquals(0, new BigDecimal("60").compareTo(position.averageCost()));
        assertEquals(0, new BigDecimal("1000").compareTo(ledger.realizedGain()), "Only the closed 100 realize");
    }

    @Test
    void testCoveringShortRealizesGain() {
        ledger.applyFill("INTC", OrderSide.SELL, 100, new BigDecimal("50"));
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("45"));

        assertNull(ledger.position("INTC"));
        assertEquals(0, new BigDecimal("500").compareTo(ledger.realizedGain()));
    }

    @Test
    void testEquityMarksPositionsAtLastPrice() {
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("50"));
        ledger.applyFill("INTC", OrderSide.BUY, 100, new BigDecimal("52"));

        // cash 10000 - 5000 - 5200 = -200, position 200 x 52 = 10400
        assertEquals(0, new BigDecimal("10200").compareTo(ledger.equity()));
        assertEquals(0, new BigDecimal("200").compareTo(ledger.unrealizedGain()));
    }

    @Test
    void testPositionsAreSortedBySymbol() {
        ledger.applyFill("INTC", OrderSide.BUY, 1, BigDecimal.ONE);
        ledger.applyFill("ENI", OrderSide.BUY, 1, BigDecimal.ONE);

        assertEquals("ENI", ledger.positions().get(0).symbol());
    }
}
