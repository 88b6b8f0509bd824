package io.liarslie.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownSignalTest {
    @Test
    void fireShouldBeIdempotentAndNotifyListenersOnce() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        AtomicInteger notified = new AtomicInteger();
        signal.onFire(notified::incrementAndGet);

        assertFalse(signal.isFired());
        assertTrue(signal.fire());
        assertFalse(signal.fire());

        assertTrue(signal.isFired());
        assertEquals(1, notified.get());
    }

    @Test
    void lateListenerShouldRunImmediately() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.fire();
        AtomicInteger notified = new AtomicInteger();

        signal.onFire(notified::incrementAndGet);

        assertEquals(1, notified.get());
    }

    @Test
    void fireFromAnotherThreadShouldNotifyListeners() throws Exception {
        ShutdownSignal signal = new ShutdownSignal();
        CountDownLatch notified = new CountDownLatch(1);
        signal.onFire(notified::countDown);
        Thread firer = new Thread(signal::fire);
        firer.start();

        assertTrue(notified.await(5, TimeUnit.SECONDS));
        firer.join();
    }
}
