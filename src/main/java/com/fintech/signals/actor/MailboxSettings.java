package com.fintech.signals.actor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ring buffer settings shared by every mailbox.
 *
 * @param bufferSize slots per mailbox, must be a power of two
 * @param waitStrategy BLOCKING, SLEEPING, YIELDING or BUSY_SPIN
 */
public record MailboxSettings(int bufferSize, String waitStrategy) {

    private static final Logger log = LoggerFactory.getLogger(MailboxSettings.class);

    public static final MailboxSettings DEFAULT = new MailboxSettings(1024, "BLOCKING");

    public MailboxSettings {
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1) {
            throw new IllegalArgumentException("Mailbox buffer size must be a power of 2, got " + bufferSize);
        }
    }

    /**
     * Creates a fresh wait strategy instance. Each mailbox needs its own.
     */
    public WaitStrategy createWaitStrategy() {
        String strategy = waitStrategy == null ? "BLOCKING" : waitStrategy;

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }
}
