package com.fintech.signals.actor;

import com.lmax.disruptor.WaitStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MailboxSettings Tests")
class MailboxSettingsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "BLOCKING, com.lmax.disruptor.BlockingWaitStrategy",
        "sleeping, com.lmax.disruptor.SleepingWaitStrategy",
        "YIELDING, com.lmax.disruptor.YieldingWaitStrategy",
        "BUSY_SPIN, com.lmax.disruptor.BusySpinWaitStrategy",
        "UNKNOWN, com.lmax.disruptor.BlockingWaitStrategy"
    })
    @DisplayName("Should map wait strategy names")
    void testWaitStrategies(String name, Class<? extends WaitStrategy> expected) {
        assertThat(new MailboxSettings(16, name).createWaitStrategy()).isInstanceOf(expected);
    }

    @Test
    @DisplayName("Should create a new wait strategy per mailbox")
    void testFreshInstances() {
        MailboxSettings settings = MailboxSettings.DEFAULT;

        assertThat(settings.createWaitStrategy()).isNotSameAs(settings.createWaitStrategy());
    }

    @ParameterizedTest(name = "size={0}")
    @ValueSource(ints = {0, -8, 3, 1000})
    @DisplayName("Should reject sizes that are not a power of two")
    void testInvalidSize(int size) {
        assertThatThrownBy(() -> new MailboxSettings(size, "BLOCKING"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
