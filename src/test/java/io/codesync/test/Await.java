package io.codesync.test;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Await {

    private Await() {
    }

    public static void until(final BooleanSupplier condition, final Duration timeout, final String what) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("Timed out waiting for " + what);
            Thread.sleep(10L);
        }
    }

    public static void until(final BooleanSupplier condition, final String what) throws InterruptedException {
        until(condition, Duration.ofSeconds(5), what);
    }
}
