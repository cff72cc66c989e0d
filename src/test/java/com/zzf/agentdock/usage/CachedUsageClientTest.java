package com.zzf.agentdock.usage;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CachedUsageClientTest {

    private static UsageSnapshot snapshot(double used) {
        return new UsageSnapshot("codex", new UsageSnapshot.RateWindow(used, 300, null), null, Instant.now());
    }

    @Test
    void successfulFetchBecomesLastKnown() throws Exception {
        UsageSource source = mock(UsageSource.class);
        when(source.name()).thenReturn("codex");
        when(source.fetchUsage()).thenReturn(snapshot(12.5));

        try (CachedUsageClient client = new CachedUsageClient(source, Duration.ofSeconds(2))) {
            assertTrue(client.lastKnown().isEmpty());
            UsageSnapshot got = client.fetchUsage().orElseThrow();
            assertEquals(12.5, got.getPrimary().getUsedPercent(), 1e-9);
            assertSame(got, client.lastKnown().orElseThrow());
        }
    }

    @Test
    void hungSourceFallsBackToLastKnown() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        UsageSnapshot first = snapshot(40.0);
        UsageSource source = new UsageSource() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public UsageSnapshot fetchUsage() {
                if (calls.incrementAndGet() == 1) {
                    return first;
                }
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return snapshot(99.0);
            }
        };

        try (CachedUsageClient client = new CachedUsageClient(source, Duration.ofMillis(100))) {
            assertSame(first, client.fetchUsage().orElseThrow());
            long start = System.nanoTime();
            assertSame(first, client.fetchUsage().orElseThrow());
            assertTrue((System.nanoTime() - start) / 1_000_000L < 2000);
        } finally {
            release.countDown();
        }
    }

    @Test
    void callersShareTheFetchStillRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        UsageSnapshot late = snapshot(70.0);
        UsageSource source = new UsageSource() {
            @Override
            public String name() {
                return "stuck";
            }

            @Override
            public UsageSnapshot fetchUsage() {
                calls.incrementAndGet();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return late;
            }
        };

        try (CachedUsageClient client = new CachedUsageClient(source, Duration.ofMillis(50))) {
            for (int i = 0; i < 5; i++) {
                assertTrue(client.fetchUsage().isEmpty());
            }
            assertEquals(1, calls.get());

            release.countDown();
            long deadline = System.currentTimeMillis() + 2000;
            while (client.lastKnown().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertSame(late, client.lastKnown().orElseThrow());
            assertEquals(1, calls.get());
        }
    }

    @Test
    void failingSourceKeepsPreviousValue() throws Exception {
        UsageSource source = mock(UsageSource.class);
        when(source.name()).thenReturn("codex");
        when(source.fetchUsage()).thenReturn(snapshot(5.0)).thenThrow(new IOException("disk gone"));

        try (CachedUsageClient client = new CachedUsageClient(source, Duration.ofSeconds(2))) {
            client.fetchUsage();
            assertEquals(5.0, client.fetchUsage().orElseThrow().getPrimary().getUsedPercent(), 1e-9);
        }
    }

    @Test
    void emptyUntilAnythingArrives() throws Exception {
        UsageSource source = mock(UsageSource.class);
        when(source.name()).thenReturn("codex");
        when(source.fetchUsage()).thenReturn(null);

        try (CachedUsageClient client = new CachedUsageClient(source, Duration.ofSeconds(2))) {
            assertTrue(client.fetchUsage().isEmpty());
        }
    }
}
