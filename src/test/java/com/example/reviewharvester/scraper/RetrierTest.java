package com.example.reviewharvester.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrierTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Retrier retrier = new Retrier(3, Duration.ofMillis(500), sleeps::add);

    @Test
    void retryableFailureSucceedsOnThirdAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String value = retrier.call("extract", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ScriptExecutionException("stale element reference");
            }
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
    }

    @Test
    void fatalFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.run("navigate", () -> {
            calls.incrementAndGet();
            throw NavigationException.httpStatus("https://example.test", 503);
        })).isInstanceOf(NavigationException.class).hasMessageContaining("503");

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void exhaustedRetriesRethrowTheLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.run("open reviews", () -> {
            throw new ElementNotFoundException("attempt " + calls.incrementAndGet());
        })).isInstanceOf(ElementNotFoundException.class).hasMessage("attempt 3");

        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void fatalFailureAfterARetryableOneStopsAtOnce() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.run("scroll", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new ScriptExecutionException("flaky");
            }
            throw new SessionCrashException("gone", null);
        })).isInstanceOf(SessionCrashException.class);

        assertThat(calls).hasValue(2);
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> new Retrier(0, Duration.ZERO, d -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
