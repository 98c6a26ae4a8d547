package org.stackmac.cli.commands;

import org.stackmac.runtime.VirtualMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown hook body for a running machine. It asks the machine to stop and then holds the
 * JVM open until the run has reported its result, or the grace period has passed.
 */
final class InterruptHook implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(InterruptHook.class);

    static final long DEFAULT_GRACE_MILLIS = 5000;

    private final VirtualMachine vm;
    private final long graceMillis;
    private final CountDownLatch finished = new CountDownLatch(1);

    InterruptHook(VirtualMachine vm, long graceMillis) {
        this.vm = vm;
        this.graceMillis = graceMillis;
    }

    @Override
    public void run() {
        vm.requestInterrupt();
        try {
            if (!finished.await(graceMillis, TimeUnit.MILLISECONDS)) {
                LOG.warn("Run did not finish within {} ms after the interrupt.", graceMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Releases a waiting hook. Call once the run's output has been written.
     */
    void runFinished() {
        finished.countDown();
    }
}
