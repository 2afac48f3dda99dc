package com.fintech.signals.actor;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A fixed number of identical workers behind one address.
 *
 * <p>Each message is routed to a worker chosen by hashing its routing key, so
 * messages with the same key are handled by the same worker in publish order.
 * The pool size is the cap on how many messages the pool handles concurrently.
 * Workers subscribe through the pool's address, which is registered on the bus
 * once however many workers there are.
 */
public class ActorPool implements ActorRef {

    private final String name;
    private final MessageBus bus;
    private final Function<Object, Object> routingKey;
    private final List<Supervisor> workers;

    public ActorPool(String name, int size, Supplier<? extends Actor> factory, Function<Object, Object> routingKey,
                     MessageBus bus, MailboxSettings settings, MeterRegistry meterRegistry) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool " + name + " needs at least one worker, got " + size);
        }
        this.name = name;
        this.bus = bus;
        this.routingKey = routingKey;

        List<Supervisor> members = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            members.add(new Supervisor(name + "-" + i, factory, bus, settings, meterRegistry, this));
        }
        this.workers = List.copyOf(members);
    }

    /**
     * Starts every worker. If one fails, the ones already started are stopped.
     */
    public void start() {
        List<Supervisor> started = new ArrayList<>(workers.size());
        try {
            for (Supervisor worker : workers) {
                worker.start();
                started.add(worker);
            }
        } catch (RuntimeException e) {
            bus.unsubscribeAll(this);
            started.forEach(Supervisor::stop);
            throw e;
        }
    }

    public void stop() {
        bus.unsubscribeAll(this);
        workers.forEach(Supervisor::stop);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean tell(Object message) {
        return route(message).tell(message);
    }

    @Override
    public <R> CompletableFuture<R> ask(Object message) {
        return route(message).ask(message);
    }

    /** Returns the worker responsible for a message. */
    Supervisor route(Object message) {
        Object key = routingKey.apply(message);
        int index = key == null ? 0 : Math.floorMod(key.hashCode(), workers.size());
        return workers.get(index);
    }

    public List<Supervisor> getWorkers() {
        return workers;
    }

    public int size() {
        return workers.size();
    }
}
