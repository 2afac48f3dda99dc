package com.fintech.signals.actor;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Creates workers and starts and stops them as a group.
 *
 * <p>Workers start in the order they were spawned and stop in reverse order.
 * Spawn consumers before producers: then every subscription is in place before
 * the first message is published, and on shutdown producers go quiet before the
 * consumers drain.
 */
public class ActorSystem {

    private static final Logger log = LoggerFactory.getLogger(ActorSystem.class);

    private final MessageBus bus;
    private final MailboxSettings settings;
    private final MeterRegistry meterRegistry;

    private final List<Managed> managed = new ArrayList<>();
    private final List<Managed> running = new ArrayList<>();

    public ActorSystem(MessageBus bus, MailboxSettings settings, MeterRegistry meterRegistry) {
        this.bus = bus;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
    }

    /** Registers a single supervised worker. Not started until {@link #start()}. */
    public synchronized Supervisor spawn(String name, Supplier<? extends Actor> factory) {
        Supervisor supervisor = new Supervisor(name, factory, bus, settings, meterRegistry);
        managed.add(new Managed(name, supervisor::start, supervisor::stop));
        return supervisor;
    }

    /** Registers a pool of supervised workers routed by key. Not started until {@link #start()}. */
    public synchronized ActorPool spawnPool(String name, int size, Supplier<? extends Actor> factory,
                                            Function<Object, Object> routingKey) {
        ActorPool pool = new ActorPool(name, size, factory, routingKey, bus, settings, meterRegistry);
        managed.add(new Managed(name, pool::start, pool::stop));
        return pool;
    }

    /**
     * Starts every registered worker. On failure the workers already started are
     * stopped again and the failure is rethrown.
     */
    public synchronized void start() {
        for (Managed entry : managed) {
            if (running.contains(entry)) {
                continue;
            }
            try {
                entry.start().run();
                running.add(entry);
            } catch (RuntimeException e) {
                log.error("Failed to start {}, stopping {} started worker(s)", entry.name(), running.size());
                shutdown();
                throw e;
            }
        }
        log.info("Actor system started with {} worker group(s)", running.size());
    }

    /** Stops running workers in reverse start order. */
    public synchronized void shutdown() {
        for (int i = running.size() - 1; i >= 0; i--) {
            Managed entry = running.get(i);
            try {
                entry.stop().run();
            } catch (RuntimeException e) {
                log.error("Failed to stop {}", entry.name(), e);
            }
        }
        running.clear();
    }

    public synchronized boolean isRunning() {
        return !running.isEmpty();
    }

    private record Managed(String name, Runnable start, Runnable stop) {}
}
