package org.txc.appsec.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RequestContext Tests")
class RequestContextTest {

    @Test
    @DisplayName("Background context should stay active")
    void backgroundStaysActive() {
        RequestContext context = RequestContext.background();

        assertThatCode(context::ensureActive).doesNotThrowAnyException();
        assertThat(context.getDeadline()).isEmpty();
        assertThat(context.remaining()).isEmpty();
    }

    @Test
    @DisplayName("Cancelled context should refuse to run and notify listeners once")
    void cancelNotifiesListenersOnce() {
        RequestContext context = RequestContext.background();
        AtomicInteger calls = new AtomicInteger();
        context.onCancel(calls::incrementAndGet);

        context.cancel();
        context.cancel();

        assertThat(calls).hasValue(1);
        assertThatThrownBy(context::ensureActive)
                .isInstanceOf(ContextCancelledException.class)
                .hasMessage("context canceled");
    }

    @Test
    @DisplayName("Listener registered after cancel should run immediately")
    void lateListenerRunsImmediately() {
        RequestContext context = RequestContext.background();
        context.cancel();
        AtomicInteger calls = new AtomicInteger();

        context.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Closed registration should not be notified")
    void closedRegistrationIsSkipped() {
        RequestContext context = RequestContext.background();
        AtomicInteger calls = new AtomicInteger();

        context.onCancel(calls::incrementAndGet).close();
        context.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("Expired deadline should report deadline exceeded")
    void expiredDeadline() {
        RequestContext context = RequestContext.withDeadline(Instant.now().minusSeconds(1));

        assertThat(context.isExpired()).isTrue();
        assertThat(context.remaining()).contains(Duration.ZERO);
        assertThatThrownBy(context::ensureActive)
                .isInstanceOf(ContextCancelledException.class)
                .hasMessage("context deadline exceeded");
    }

    @Test
    @DisplayName("Future deadline should leave time remaining")
    void futureDeadline() {
        RequestContext context = RequestContext.withTimeout(Duration.ofMinutes(5));

        assertThat(context.isExpired()).isFalse();
        assertThat(context.remaining()).hasValueSatisfying(left -> assertThat(left).isPositive());
    }
}
