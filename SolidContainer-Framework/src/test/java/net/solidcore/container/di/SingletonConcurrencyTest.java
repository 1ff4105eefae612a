package net.solidcore.container.di;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for singleton materialization when several threads resolve at once.
 */
class SingletonConcurrencyTest {

    private static final int THREADS = 8;

    @Test
    void concurrentFirstResolutionsAgreeOnOneInstance() throws Exception {
        // Arrange: every factory call waits until all threads are inside it
        AtomicInteger constructed = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch insideFactory = new CountDownLatch(THREADS);
        ServiceContainer container = new ServiceContainer();
        container.registerSingleton(Counter.class, resolver -> {
            constructed.incrementAndGet();
            insideFactory.countDown();
            awaitQuietly(insideFactory);
            return new Counter();
        });

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<Counter>> results = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return container.getService(Counter.class);
                }));
            }

            // Act
            start.countDown();
            List<Counter> instances = new ArrayList<>();
            for (Future<Counter> result : results) {
                instances.add(result.get(10, TimeUnit.SECONDS));
            }

            // Assert: several were constructed, exactly one survived
            assertThat(constructed.get()).isEqualTo(THREADS);
            assertThat(instances).allSatisfy(instance -> assertThat(instance).isSameAs(instances.get(0)));
            assertThat(container.getService(Counter.class)).isSameAs(instances.get(0));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentRegistrationsLeaveExactlyOneBinding() throws Exception {
        ServiceContainer container = new ServiceContainer();
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                final int id = i;
                results.add(executor.submit(() -> container.registerSingletonInstance(Counter.class, new Counter(id))));
            }
            for (Future<?> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }

            assertThat(container.getRegistrations()).hasSize(1);
            assertThat(container.getService(Counter.class).id).isBetween(0, THREADS - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    public static class Counter {
        final int id;

        public Counter() {
            this(-1);
        }

        public Counter(int id) {
            this.id = id;
        }
    }
}
