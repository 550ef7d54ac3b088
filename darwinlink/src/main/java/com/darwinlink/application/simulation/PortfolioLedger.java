package com.darwinlink.application.simulation;

import com.darwinlink.domain.order.OrderSide;
import com.darwinlink.domain.portfolio.Position;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simulated cash and positions.
 *
 * Fills that reduce a position realize P&L against the average cost; a fill
 * that crosses zero closes the old position and opens the remainder at the
 * fill price. Cash moves by price × quantity on every fill.
 * Not thread-safe: only touched under the engine monitor.
 */
final class PortfolioLedger {

    private final Map<String, Position> positions = new TreeMap<>();
    private BigDecimal liquidity;
    private BigDecimal realizedGain = BigDecimal.ZERO;

    PortfolioLedger(BigDecimal initialLiquidity) {
        this.liquidity = initialLiquidity;
    }

    void applyFill(String symbol, OrderSide side, long quantity, BigDecimal price) {
        BigDecimal notional = price.multiply(BigDecimal.valueOf(quantity));
        liquidity = side == OrderSide.BUY ? liquidity.subtract(notional) : liquidity.add(notional);

        long signed = side.sign() * quantity;
        Position current = positions.get(symbol);
        if (current == null) {
            positions.put(symbol, position(symbol, signed, price, price));
            return;
        }

        long held = current.quantity();
        if (Long.signum(held) == Long.signum(signed)) {
            // Adding to the position: weighted cost
            BigDecimal cost = current.averageCost().multiply(BigDecimal.valueOf(Math.abs(held))).add(notional);
            BigDecimal average = cost.divide(BigDecimal.valueOf(Math.abs(held) + quantity),
                SimulatedOrder.PRICE_SCALE, RoundingMode.HALF_EVEN);
            positions.put(symbol, position(symbol, held + signed, average, price));
            return;
        }

        long closing = Math.min(Math.abs(held), quantity);
        BigDecimal perShare = price.subtract(current.averageCost());
        realizedGain = realizedGain.add(perShare.multiply(BigDecimal.valueOf(closing * Long.signum(held))));

        long remaining = held + signed;
        if (remaining == 0) {
            positions.remove(symbol);
        } else if (Long.signum(remaining) == Long.signum(held)) {
            positions.put(symbol, position(symbol, remaining, current.averageCost(), price));
        } else {
            positions.put(symbol, position(symbol, remaining, price, price));
        }
    }

    void setLiquidity(BigDecimal liquidity) {
        this.liquidity = liquidity;
    }

    BigDecimal liquidity() {
        return liquidity;
    }

    BigDecimal realizedGain() {
        return realizedGain;
    }

    BigDecimal unrealizedGain() {
        BigDecimal total = BigDecimal.ZERO;
        for (Position p : positions.values()) {
            total = total.add(p.gain());
        }
        return total;
    }

    /**
     * Liquidity plus every position marked at its last price.
     */
    BigDecimal equity() {
        BigDecimal total = liquidity;
        for (Position p : positions.values()) {
            total = total.add(p.marketValue());
        }
        return total;
    }

    Position position(String symbol) {
        return positions.get(symbol);
    }

    List<Position> positions() {
        return new ArrayList<>(positions.values());
    }

    private static Position position(String symbol, long quantity, BigDecimal averageCost, BigDecimal lastPrice) {
        BigDecimal gain = lastPrice.subtract(averageCost).multiply(BigDecimal.valueOf(quantity));
        return new Position(symbol, quantity, averageCost, lastPrice, gain);
    }
}
