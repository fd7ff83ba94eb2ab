package com.example.crond.engine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation token for one {@link JobLoop}. Created by the scheduler and handed to the loop at spawn time.
 * Cancelling stops the loop at its next suspension point; a command already running is left alone.
 */
public final class JobHandle {
    private final String taskName;
    private final CountDownLatch finished = new CountDownLatch(1);

    // guarded by this
    private boolean cancelled;
    private Future<?> pending;
    private long armedGeneration;

    public JobHandle(String taskName) {
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }

    /**
     * @return true on the first call, false if the handle was already cancelled
     */
    public boolean cancel() {
        Future<?> toCancel;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toCancel = pending;
            pending = null;
        }
        if (toCancel != null && toCancel.cancel(false)) {
            // the wake-up never runs, nobody else will finish the loop
            markFinished();
        }
        return true;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * True once the loop has exited, by cancellation or because its schedule ran out.
     */
    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    /**
     * Registers the wake-up for the loop's current Waiting state. Generations grow with every wake-up the
     * loop schedules; a wake-up older than the one already armed is ignored, since it may already have fired.
     *
     * @return false if the handle is already cancelled; the wake-up is then cancelled too
     */
    synchronized boolean arm(Future<?> wakeUp, long generation) {
        if (cancelled) {
            if (wakeUp.cancel(false)) {
                markFinished();
            }
            return false;
        }
        if (generation > armedGeneration) {
            pending = wakeUp;
            armedGeneration = generation;
        }
        return true;
    }

    void markFinished() {
        finished.countDown();
    }

    @Override
    public String toString() {
        return "JobHandle{task=" + taskName + ", cancelled=" + isCancelled() + ", finished=" + isFinished() + "}";
    }
}
