package com.fintech.signals.actor;

import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs one {@link Actor} behind a bounded mailbox and restarts it when it crashes.
 *
 * <p>The mailbox is an LMAX Disruptor ring buffer with a single event handler,
 * so messages are handled strictly one after another on a dedicated thread.
 * Lifecycle callbacks are queued through the same ring buffer, which confines
 * every actor field to that thread.
 *
 * <p>Restart policy: when {@link Actor#receive} throws, the crashed instance is
 * stopped, a fresh one is created from the factory and started, immediately and
 * without an attempt limit. If the fresh instance cannot start, the worker waits
 * for the next message and tries again. The supervisor's own address never
 * changes, so bus registrations survive restarts.
 */
public class Supervisor implements ActorRef {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private static final long STOP_TIMEOUT_SECONDS = 30;

    public enum State { CREATED, STARTING, RUNNING, STOPPING, STOPPED }

    /** Lifecycle commands travelling through the mailbox. */
    private enum Signal { START, STOP }

    private final String name;
    private final Supplier<? extends Actor> factory;
    private final MessageBus bus;
    private final MailboxSettings settings;
    private final MeterRegistry meterRegistry;
    private final ActorContext context;

    private final AtomicLong restarts = new AtomicLong(0);
    private final AtomicLong messagesProcessed = new AtomicLong(0);
    private final AtomicLong messagesRejected = new AtomicLong(0);

    private volatile State state = State.CREATED;
    private Disruptor<Envelope> disruptor;
    private volatile RingBuffer<Envelope> ringBuffer;

    // Confined to the mailbox thread
    private Actor current;

    public Supervisor(String name, Supplier<? extends Actor> factory, MessageBus bus,
                      MailboxSettings settings, MeterRegistry meterRegistry) {
        this(name, factory, bus, settings, meterRegistry, null);
    }

    /**
     * @param subscriptionHandle address the actor registers on the bus; {@code null} means this supervisor
     */
    Supervisor(String name, Supplier<? extends Actor> factory, MessageBus bus,
               MailboxSettings settings, MeterRegistry meterRegistry, ActorRef subscriptionHandle) {
        this.name = name;
        this.factory = factory;
        this.bus = bus;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
        this.context = new ActorContext(this, subscriptionHandle != null ? subscriptionHandle : this, bus);
    }

    /**
     * Starts the mailbox thread and the first actor instance. Blocks until
     * {@link Actor#preStart} has finished.
     *
     * @throws ActorInitializationException if the first instance cannot start
     */
    public synchronized void start() {
        if (state != State.CREATED) {
            throw new IllegalStateException("Actor " + name + " already started (state=" + state + ")");
        }
        state = State.STARTING;

        disruptor = new Disruptor<>(
            Envelope::new,
            settings.bufferSize(),
            threadFactory(),
            ProducerType.MULTI,
            settings.createWaitStrategy()
        );
        disruptor.handleEventsWith(this::dispatch);
        disruptor.setDefaultExceptionHandler(new CrashHandler());
        ringBuffer = disruptor.start();

        meterRegistry.gauge("actor.mailbox.depth", Tags.of("actor", name), this, Supervisor::getMailboxDepth);

        CompletableFuture<Object> started = new CompletableFuture<>();
        enqueue(Signal.START, started);
        try {
            started.get();
        } catch (ExecutionException e) {
            abortStart();
            throw new ActorInitializationException("Actor " + name + " failed to start", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortStart();
            throw new ActorInitializationException("Interrupted while starting actor " + name, e);
        }

        state = State.RUNNING;
        log.info("Actor {} started: mailboxSize={}", name, settings.bufferSize());
    }

    /**
     * Stops accepting messages, drains the mailbox, runs {@link Actor#postStop}
     * and halts the mailbox thread.
     */
    public synchronized void stop() {
        if (state == State.CREATED || state == State.STOPPED) {
            state = State.STOPPED;
            return;
        }
        state = State.STOPPING;
        if (context.subscriptionHandle() == this) {
            bus.unsubscribeAll(this);
        }

        CompletableFuture<Object> stopped = new CompletableFuture<>();
        enqueue(Signal.STOP, stopped);
        try {
            stopped.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            disruptor.shutdown(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping actor {}", name);
            disruptor.halt();
        } catch (ExecutionException | java.util.concurrent.TimeoutException | TimeoutException e) {
            log.warn("Actor {} did not stop cleanly, halting: {}", name, e.toString());
            disruptor.halt();
        }

        state = State.STOPPED;
        log.info("Actor {} stopped: processed={}, restarts={}", name, messagesProcessed.get(), restarts.get());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean tell(Object message) {
        return offer(message, null);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> CompletableFuture<R> ask(Object message) {
        CompletableFuture<Object> reply = new CompletableFuture<>();
        if (!offer(message, reply)) {
            return CompletableFuture.failedFuture(new MessageDeliveryException(
                "Mailbox of " + name + " refused " + message.getClass().getSimpleName()));
        }
        return (CompletableFuture<R>) (CompletableFuture<?>) reply;
    }

    /**
     * Non-blocking enqueue. Refuses when the worker is not running or the ring buffer is full.
     */
    private boolean offer(Object message, CompletableFuture<Object> reply) {
        State observed = state;
        if (observed != State.STARTING && observed != State.RUNNING) {
            messagesRejected.incrementAndGet();
            return false;
        }
        try {
            long sequence = ringBuffer.tryNext();
            try {
                Envelope envelope = ringBuffer.get(sequence);
                envelope.message = message;
                envelope.reply = reply;
            } finally {
                ringBuffer.publish(sequence);
            }
            return true;
        } catch (InsufficientCapacityException e) {
            messagesRejected.incrementAndGet();
            return false;
        }
    }

    /**
     * Blocking enqueue for lifecycle signals, which must never be dropped.
     */
    private void enqueue(Signal signal, CompletableFuture<Object> reply) {
        long sequence = ringBuffer.next();
        try {
            Envelope envelope = ringBuffer.get(sequence);
            envelope.message = signal;
            envelope.reply = reply;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Event handler: runs on the mailbox thread.
     */
    private void dispatch(Envelope envelope, long sequence, boolean endOfBatch) throws Exception {
        Object message = envelope.message;
        CompletableFuture<Object> reply = envelope.reply;
        envelope.clear();

        if (message == Signal.START) {
            try {
                current = newInstance();
                reply.complete(null);
            } catch (Exception e) {
                reply.completeExceptionally(e);
            }
            return;
        }
        if (message == Signal.STOP) {
            stopInstance();
            reply.complete(null);
            return;
        }

        if (current == null && (state == State.STOPPING || state == State.STOPPED || !restartInstance())) {
            log.warn("Actor {} has no running instance, dropping {}", name, message.getClass().getSimpleName());
            if (reply != null) {
                reply.completeExceptionally(new MessageDeliveryException("Actor " + name + " is not running"));
            }
            return;
        }

        try {
            Object result = current.receive(message);
            messagesProcessed.incrementAndGet();
            if (reply != null) {
                reply.complete(result);
            }
        } catch (Throwable t) {
            if (reply != null) {
                reply.completeExceptionally(t);
            }
            throw t;
        }
    }

    private Actor newInstance() throws Exception {
        Actor actor = factory.get();
        try {
            actor.preStart(context);
        } catch (Exception e) {
            try {
                actor.postStop();
            } catch (Exception cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        return actor;
    }

    private void stopInstance() {
        if (current == null) {
            return;
        }
        try {
            current.postStop();
        } catch (Exception e) {
            log.error("Actor {} failed to release resources on stop", name, e);
        } finally {
            current = null;
        }
    }

    private boolean restartInstance() {
        restarts.incrementAndGet();
        meterRegistry.counter("actor.restarts", "actor", name).increment();
        try {
            current = newInstance();
            log.info("Actor {} restarted with fresh state (restart #{})", name, restarts.get());
            return true;
        } catch (Exception e) {
            current = null;
            log.error("Actor {} failed to restart, retrying on next message", name, e);
            return false;
        }
    }

    private void abortStart() {
        state = State.STOPPED;
        if (context.subscriptionHandle() == this) {
            bus.unsubscribeAll(this);
        }
        disruptor.halt();
    }

    private ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("actor-" + name);
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Crash handling: invoked by the Disruptor on the mailbox thread.
     */
    private class CrashHandler implements ExceptionHandler<Envelope> {

        @Override
        public void handleEventException(Throwable ex, long sequence, Envelope event) {
            stopInstance();
            if (state == State.STOPPING) {
                log.error("Actor {} crashed at sequence {} while stopping", name, sequence, ex);
                return;
            }
            log.error("Actor {} crashed at sequence {}, restarting", name, sequence, ex);
            restartInstance();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception starting mailbox of actor {}", name, ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception shutting down mailbox of actor {}", name, ex);
        }
    }

    /**
     * Ring buffer slot. Pre-allocated and reused.
     */
    private static class Envelope {
        Object message;
        CompletableFuture<Object> reply;

        void clear() {
            message = null;
            reply = null;
        }
    }

    public State getState() {
        return state;
    }

    public long getRestartCount() {
        return restarts.get();
    }

    public long getMessagesProcessed() {
        return messagesProcessed.get();
    }

    public long getMessagesRejected() {
        return messagesRejected.get();
    }

    public long getMailboxDepth() {
        RingBuffer<Envelope> buffer = ringBuffer;
        return buffer == null ? 0 : buffer.getBufferSize() - buffer.remainingCapacity();
    }
}
