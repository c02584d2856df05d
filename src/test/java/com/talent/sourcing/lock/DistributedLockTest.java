package com.talent.sourcing.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DistributedLockTest {

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("search_1"));
            assertDoesNotThrow(() -> lock.unlock("search_1"));
        }

        @Test
        @DisplayName("Should allow re-entrant locking from same thread")
        void testReentrant() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("search_1"));
            assertTrue(lock.tryLock("search_1"));
            lock.unlock("search_1");
            lock.unlock("search_1");
        }

        @Test
        @DisplayName("Should ignore unlock from a thread that does not hold the lock")
        void testForeignUnlock() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("never-locked"));
            assertEquals(0, lock.trackedKeys());
        }

        @Test
        @DisplayName("Should drop a released key on forget")
        void testForget() {
            LocalDistributedLock lock = new LocalDistributedLock();
            lock.withLock("search_1", () -> true);
            assertEquals(1, lock.trackedKeys());

            lock.forget("search_1");
            lock.forget("never-locked");

            assertEquals(0, lock.trackedKeys());
            assertTrue(lock.tryLock("search_1"));
            lock.unlock("search_1");
        }

        @Test
        @DisplayName("Should keep a held key on forget")
        void testForgetWhileHeld() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("search_1"));

            lock.forget("search_1");

            assertEquals(1, lock.trackedKeys());
            lock.unlock("search_1");
            lock.forget("search_1");
            assertEquals(0, lock.trackedKeys());
        }

        @Test
        @DisplayName("Should serialize withLock sections on the same key")
        void testMutualExclusion() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(2000));
            AtomicInteger concurrent = new AtomicInteger();
            AtomicInteger maxConcurrent = new AtomicInteger();
            int threads = 5;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                Future<?>[] futures = new Future<?>[threads];
                for (int i = 0; i < threads; i++) {
                    futures[i] = pool.submit(() -> {
                        start.await();
                        return lock.withLock("search_1", () -> {
                            int now = concurrent.incrementAndGet();
                            maxConcurrent.accumulateAndGet(now, Math::max);
                            sleep(20);
                            concurrent.decrementAndGet();
                            return now;
                        });
                    });
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("Should time out when another thread holds the key")
        void testTimeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(50));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.tryLock("search_1");
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("search_1");
                }
            });
            holder.start();
            try {
                assertTrue(held.await(2, TimeUnit.SECONDS));
                assertThrows(LockAcquisitionException.class, () -> lock.tryLock("search_1"));
            } finally {
                release.countDown();
                holder.join(2000);
            }
        }

        @Test
        @DisplayName("Should release the lock when the action throws")
        void testReleaseOnException() {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(50));
            assertThrows(IllegalStateException.class, () -> lock.withLock("search_1", () -> {
                throw new IllegalStateException("boom");
            }));
            assertEquals("ok", lock.withLock("search_1", () -> "ok"));
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should reject a non-positive timeout")
        void testInvalidTimeout() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0));
            assertEquals(5000, LockConfig.defaults().timeoutMs());
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
