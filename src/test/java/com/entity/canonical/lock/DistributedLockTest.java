package com.entity.canonical.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DistributedLockTest {

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("fit:city"));
            assertTrue(lock.isLocked("fit:city"));
            lock.unlock("fit:city");
            assertFalse(lock.isLocked("fit:city"));
        }

        @Test
        @DisplayName("Should allow re-entrant locking from same thread")
        void testReentrant() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("fit:city"));
            assertTrue(lock.tryLock("fit:city"));
            lock.unlock("fit:city");
            lock.unlock("fit:city");
            assertFalse(lock.isLocked("fit:city"));
        }

        @Test
        @DisplayName("Fit keys are per entity type")
        void testFitKey() {
            assertEquals("fit:city", DistributedLock.fitKey("city"));
        }

        @Test
        @DisplayName("Different entity types never contend")
        void testDifferentKeys() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("fit:city"));
            assertTrue(lock.tryLock("fit:airline"));
            lock.unlock("fit:city");
            lock.unlock("fit:airline");
        }

        @Test
        @DisplayName("Unlocking a key not held is a no-op")
        void testUnlockNotHeld() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("fit:never"));
        }

        @Test
        @DisplayName("Should block concurrent access to same key")
        void testConcurrentBlocking() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(LockConfig.withTimeout(2000));
            AtomicInteger concurrentCount = new AtomicInteger(0);
            AtomicInteger maxConcurrent = new AtomicInteger(0);

            int threadCount = 5;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);

            for (int i = 0; i < threadCount; i++) {
                Thread worker = new Thread(() -> {
                    try {
                        startLatch.await();
                        lock.tryLock("fit:city");
                        try {
                            int current = concurrentCount.incrementAndGet();
                            maxConcurrent.accumulateAndGet(current, Math::max);
                            Thread.sleep(20);
                            concurrentCount.decrementAndGet();
                        } finally {
                            lock.unlock("fit:city");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
                worker.start();
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("Should fail after the timeout when another thread holds the lock")
        void testTimeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(LockConfig.withTimeout(100));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Thread holder = new Thread(() -> {
                lock.tryLock("fit:city");
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("fit:city");
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            AtomicReference<Throwable> failure = new AtomicReference<>();
            try {
                lock.tryLock("fit:city");
            } catch (LockAcquisitionException e) {
                failure.set(e);
            } finally {
                release.countDown();
                holder.join(5000);
            }

            LockAcquisitionException e = assertInstanceOf(LockAcquisitionException.class, failure.get());
            assertEquals("fit:city", e.getKey());
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should reject invalid values")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> LockConfig.withTimeout(0));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(Duration.ofMillis(-5)));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(null));
        }

        @Test
        @DisplayName("Defaults to a thirty second wait")
        void testDefaults() {
            assertEquals(Duration.ofSeconds(30), LockConfig.defaults().timeout());
            assertEquals(Duration.ofMillis(500), LockConfig.withTimeout(500).timeout());
        }
    }
}
