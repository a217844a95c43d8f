package site.minikv.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;

import static org.junit.jupiter.api.Assertions.*;

class StoreConcurrencyTest {

    private static final int THREADS = 8;
    private static final int OPERATIONS = 20_000;

    private static KvBytes bytes(String s) {
        return KvBytes.fromString(s);
    }

    /**
     * 指定线程读时钟时停住，此时它持有读锁，用来观察其他线程是否被阻塞
     */
    private static class GateClock implements TimeSource {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private volatile Thread gatedThread;

        @Override
        public long currentTimeMillis() {
            if (Thread.currentThread() == gatedThread) {
                entered.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return 1_000_000L;
        }
    }

    @Test
    void testReadersDoNotBlockEachOther() throws Exception {
        GateClock clock = new GateClock();
        KeyValueStore store = new KeyValueStore(clock);
        store.set(bytes("k"), bytes("v"), 60_000);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<KvBytes> heldReader = pool.submit(() -> {
                clock.gatedThread = Thread.currentThread();
                return store.get(bytes("k"));
            });
            assertTrue(clock.entered.await(10, TimeUnit.SECONDS));

            // 第一个读者仍持有读锁，第二个读者必须能直接完成
            Future<KvBytes> secondReader = pool.submit(() -> store.get(bytes("k")));
            assertEquals(bytes("v"), secondReader.get(5, TimeUnit.SECONDS));
            assertFalse(heldReader.isDone());

            clock.release.countDown();
            assertEquals(bytes("v"), heldReader.get(10, TimeUnit.SECONDS));
        } finally {
            clock.release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void testWriterWaitsForActiveReader() throws Exception {
        GateClock clock = new GateClock();
        KeyValueStore store = new KeyValueStore(clock);
        store.set(bytes("k"), bytes("v"), 60_000);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<KvBytes> heldReader = pool.submit(() -> {
                clock.gatedThread = Thread.currentThread();
                return store.get(bytes("k"));
            });
            assertTrue(clock.entered.await(10, TimeUnit.SECONDS));

            Future<?> writer = pool.submit(() -> store.set(bytes("other"), bytes("x")));
            assertThrows(TimeoutException.class, () -> writer.get(200, TimeUnit.MILLISECONDS));

            clock.release.countDown();
            writer.get(10, TimeUnit.SECONDS);
            assertEquals(bytes("v"), heldReader.get(10, TimeUnit.SECONDS));
            assertEquals(bytes("x"), store.get(bytes("other")));
        } finally {
            clock.release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void testConcurrentSetAndGetOnDistinctKeys() {
        KeyValueStore store = new KeyValueStore();
        AtomicIntegerArray progress = new AtomicIntegerArray(THREADS);

        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            ExecutorService pool = Executors.newFixedThreadPool(THREADS);
            CountDownLatch startLatch = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            try {
                for (int t = 0; t < THREADS; t++) {
                    final int threadId = t;
                    results.add(pool.submit(() -> {
                        startLatch.await();
                        int mismatches = 0;
                        for (int i = 0; i < OPERATIONS; i++) {
                            KvBytes key = bytes("t" + threadId + "-k" + (i % 100));
                            KvBytes value = bytes("v" + i);
                            store.set(key, value);
                            if (!value.equals(store.get(key))) {
                                mismatches++;
                            }
                            progress.incrementAndGet(threadId);
                        }
                        return mismatches;
                    }));
                }
                startLatch.countDown();
                for (Future<Integer> result : results) {
                    assertEquals(0, result.get());
                }
            } finally {
                pool.shutdownNow();
            }
        });
        for (int t = 0; t < THREADS; t++) {
            assertEquals(OPERATIONS, progress.get(t));
        }
        assertEquals(THREADS * 100, store.size());
    }

    @Test
    void testConcurrentReadersSeeConsistentValues() {
        KeyValueStore store = new KeyValueStore();
        for (int i = 0; i < 100; i++) {
            store.set(bytes("k" + i), bytes("v" + i));
        }

        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            ExecutorService pool = Executors.newFixedThreadPool(THREADS);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch finishLatch = new CountDownLatch(THREADS);
            AtomicInteger mismatches = new AtomicInteger();
            try {
                for (int t = 0; t < THREADS; t++) {
                    pool.execute(() -> {
                        try {
                            startLatch.await();
                            for (int i = 0; i < OPERATIONS; i++) {
                                if (!bytes("v" + (i % 100)).equals(store.get(bytes("k" + (i % 100))))) {
                                    mismatches.incrementAndGet();
                                }
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            finishLatch.countDown();
                        }
                    });
                }
                startLatch.countDown();
                assertTrue(finishLatch.await(20, TimeUnit.SECONDS));
                assertEquals(0, mismatches.get());
            } finally {
                pool.shutdownNow();
            }
        });
    }

    @Test
    void testConcurrentExpirationAndRewrite() throws Exception {
        KeyValueStore store = new KeyValueStore();
        KvBytes key = bytes("shared");
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 2_000; i++) {
                        store.set(key, bytes("v"), 1);
                        store.get(key);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // 最后一次写入的是不带过期时间的值，惰性删除不能把它删掉
        store.set(key, bytes("final"));
        assertEquals(bytes("final"), store.get(key));
    }

    @Test
    void testConcurrentHashWrites() throws Exception {
        HashStore store = new HashStore();
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                final int threadId = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        store.hset(bytes("h"), bytes("f" + threadId + "-" + i), bytes("v" + i));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (int t = 0; t < THREADS; t++) {
            assertEquals(bytes("v999"), store.hget(bytes("h"), bytes("f" + t + "-999")));
        }
        assertEquals(1, store.size());
    }
}
