package com.darwinlink.application.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simulated order table.
 *
 * STRUCTURE:
 * - orderId → order, in placement order
 * - symbol → ids of open orders, kept in step with status changes
 *
 * Not thread-safe: only touched under the engine monitor.
 */
final class VirtualOrderBook {

    private final String idPrefix;
    private final Map<String, SimulatedOrder> orders = new LinkedHashMap<>();
    private final Map<String, Set<String>> openBySymbol = new HashMap<>();
    private long sequence = 0;

    VirtualOrderBook(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    String nextOrderId() {
        sequence++;
        return String.format("%s%06d", idPrefix, sequence);
    }

    void add(SimulatedOrder order) {
        orders.put(order.orderId(), order);
        openBySymbol.computeIfAbsent(order.symbol(), k -> new LinkedHashSet<>()).add(order.orderId());
    }

    /**
     * @throws OrderNotFoundException if the id is unknown
     */
    SimulatedOrder get(String orderId) {
        SimulatedOrder order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    /**
     * Drop a terminal order from the open index. The order itself stays
     * queryable.
     */
    void markClosed(SimulatedOrder order) {
        Set<String> ids = openBySymbol.get(order.symbol());
        if (ids != null) {
            ids.remove(order.orderId());
            if (ids.isEmpty()) {
                openBySymbol.remove(order.symbol());
            }
        }
    }

    List<SimulatedOrder> all() {
        return new ArrayList<>(orders.values());
    }

    List<SimulatedOrder> forSymbol(String symbol) {
        List<SimulatedOrder> result = new ArrayList<>();
        for (SimulatedOrder order : orders.values()) {
            if (order.symbol().equals(symbol)) {
                result.add(order);
            }
        }
        return result;
    }

    List<SimulatedOrder> open() {
        List<SimulatedOrder> result = new ArrayList<>();
        for (SimulatedOrder order : orders.values()) {
            if (order.isOpen()) {
                result.add(order);
            }
        }
        return result;
    }

    List<SimulatedOrder> openForSymbol(String symbol) {
        Set<String> ids = openBySymbol.getOrDefault(symbol, Collections.emptySet());
        List<SimulatedOrder> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(orders.get(id));
        }
        return result;
    }

    int size() {
        return orders.size();
    }

    void clear() {
        orders.clear();
        openBySymbol.clear();
        sequence = 0;
    }
}
