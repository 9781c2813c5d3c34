package com.schoolsched.schoolsched_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.schoolsched.schoolsched_api.exception.ScheduleBusyException;

class ScheduleLockRegistryTest {

    private final ScheduleLockRegistry registry = new ScheduleLockRegistry();

    @Test
    void runsWorkAndReleasesTheKey() {
        assertThat(registry.withLock("k", () -> "done")).isEqualTo("done");
        assertThat(registry.isLocked("k")).isFalse();
    }

    @Test
    void releasesTheKeyWhenWorkFails() {
        assertThatThrownBy(() -> registry.withLock("k", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(registry.isLocked("k")).isFalse();
    }

    @Test
    void refusesASecondCallerForTheSameKey() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> holder = CompletableFuture.supplyAsync(() -> registry.withLock("k", () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "first";
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> registry.withLock("k", () -> "second"))
                .isInstanceOf(ScheduleBusyException.class);
        assertThat(registry.withLock("other", () -> "independent")).isEqualTo("independent");

        release.countDown();
        assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(registry.withLock("k", () -> "third")).isEqualTo("third");
    }
}
