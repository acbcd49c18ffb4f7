package com.elssolution.modemmonitor.alerts;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalUncaughtHandlerTest {

    @Test
    void counts_and_remembers_last_uncaught_error() {
        GlobalUncaughtHandler handler = new GlobalUncaughtHandler();
        Thread t = new Thread(() -> {}, "modem-poll-7");

        handler.uncaughtException(t, new IllegalStateException("boom"));

        assertThat(handler.uncaughtCount()).isEqualTo(1);
        assertThat(handler.lastUncaught()).contains("modem-poll-7").contains("boom");
    }

    @Test
    void stays_quiet_once_context_is_closing() {
        GlobalUncaughtHandler handler = new GlobalUncaughtHandler();
        handler.onContextClosed(null);

        handler.uncaughtException(Thread.currentThread(), new RuntimeException("late"));

        assertThat(handler.uncaughtCount()).isZero();
        assertThat(handler.lastUncaught()).isEqualTo("-");
    }
}
