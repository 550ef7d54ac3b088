package com.darwinlink.application.client;

import com.darwinlink.infrastructure.protocol.WireRecord;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finite, restartable sequence of candles or ticks.
 *
 * Holds the decoded records of one response and maps each to its domain
 * value only when iterated. Every call to {@link #iterator()} starts from
 * the first entry again.
 */
public final class MarketSeries<T> implements Iterable<T> {

    private final String symbol;
    private final List<WireRecord> records;
    private final Function<WireRecord, T> mapper;

    MarketSeries(String symbol, List<WireRecord> records, Function<WireRecord, T> mapper) {
        this.symbol = symbol;
        this.records = List.copyOf(records);
        this.mapper = mapper;
    }

    public String symbol() {
        return symbol;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<WireRecord> source = records.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public T next() {
                return mapper.apply(source.next());
            }
        };
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<T> toList() {
        List<T> values = new ArrayList<>(records.size());
        for (T value : this) {
            values.add(value);
        }
        return values;
    }
}
