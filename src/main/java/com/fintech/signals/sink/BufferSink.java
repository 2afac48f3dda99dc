package com.fintech.signals.sink;

import com.fintech.signals.actor.Actor;
import com.fintech.signals.actor.ActorContext;
import com.fintech.signals.domain.BufferDataRequest;
import com.fintech.signals.domain.PerformanceIndicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Worker that keeps the most recent indicators in memory.
 *
 * <p>Entries are kept newest first and never exceed the capacity; the oldest
 * entry is evicted on overflow. Queries ({@link BufferDataRequest}) are answered
 * with an immutable copy. Inserts and queries go through the same mailbox, so
 * a query always sees the buffer between two inserts, never during one.
 */
public class BufferSink implements Actor {

    private static final Logger log = LoggerFactory.getLogger(BufferSink.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<PerformanceIndicators> entries;

    public BufferSink(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity + 1);
    }

    @Override
    public void preStart(ActorContext context) {
        context.subscribe(PerformanceIndicators.class);
    }

    @Override
    public Object receive(Object message) {
        if (message instanceof PerformanceIndicators indicators) {
            insert(indicators);
            return null;
        }
        if (message instanceof BufferDataRequest request) {
            return snapshot(request.n());
        }
        log.warn("Ignoring unexpected message: {}", message);
        return null;
    }

    private void insert(PerformanceIndicators indicators) {
        entries.addFirst(indicators);
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    /**
     * Copies the first {@code n} entries, newest first.
     */
    private List<PerformanceIndicators> snapshot(int n) {
        int size = Math.min(n, entries.size());
        List<PerformanceIndicators> copy = new ArrayList<>(size);
        Iterator<PerformanceIndicators> iterator = entries.iterator();
        while (copy.size() < size && iterator.hasNext()) {
            copy.add(iterator.next());
        }
        return List.copyOf(copy);
    }

    public int size() {
        return entries.size();
    }
}
