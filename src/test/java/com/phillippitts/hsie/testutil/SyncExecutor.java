package com.phillippitts.hsie.testutil;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each analysis call inline on the submitting thread, so stage tests see a fixed call order.
 * Counts the calls it ran.
 */
public class SyncExecutor implements Executor {

    private final AtomicInteger executed = new AtomicInteger();

    @Override
    public void execute(Runnable task) {
        executed.incrementAndGet();
        task.run();
    }

    public int executed() {
        return executed.get();
    }
}
