package com.williamcallahan.media_list_sync.util;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class LoggingUtilsTest {

    @Test
    void rootMessage_prefersOwnMessage() {
        assertThat(LoggingUtils.rootMessage(new IllegalStateException("outer", new RuntimeException("inner"))))
                .isEqualTo("outer");
    }

    @Test
    void rootMessage_fallsBackToCauseThenClassName() {
        assertThat(LoggingUtils.rootMessage(new RuntimeException(null, new IllegalArgumentException("inner"))))
                .isEqualTo("inner");
        assertThat(LoggingUtils.rootMessage(new NullPointerException())).isEqualTo("NullPointerException");
        assertThat(LoggingUtils.rootMessage(null)).isNull();
    }

    @Test
    void error_appendsThrowableAfterArguments() {
        Logger log = mock(Logger.class);
        IllegalStateException failure = new IllegalStateException("boom");

        LoggingUtils.error(log, failure, "Job {} failed", "sync");

        verify(log).error("Job {} failed", new Object[]{"sync", failure});
    }

    @Test
    void warn_withoutThrowable_passesArgumentsThrough() {
        Logger log = mock(Logger.class);

        LoggingUtils.warn(log, null, "Decryption failed: {}", "AEADBadTagException");

        verify(log).warn("Decryption failed: {}", new Object[]{"AEADBadTagException"});
    }

    @Test
    void nullLogger_isIgnored() {
        assertDoesNotThrow(() -> LoggingUtils.error(null, new RuntimeException(), "ignored"));
    }
}
