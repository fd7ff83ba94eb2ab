package com.example.crond.engine;

import com.example.crond.config.Task;
import com.example.crond.exec.CommandExecutor;
import com.example.crond.exec.ExecutionResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts runs per task and tracks overlap. Optionally holds each run for a fixed time or until released.
 */
public class RecordingExecutor implements CommandExecutor {
    private final List<String> started = new CopyOnWriteArrayList<>();
    private final AtomicInteger finished = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long runMillis;
    private volatile CountDownLatch gate;
    private volatile RuntimeException failWith;

    public RecordingExecutor holdFor(long millis) {
        this.runMillis = millis;
        return this;
    }

    public RecordingExecutor holdUntilReleased() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public RecordingExecutor failWith(RuntimeException e) {
        this.failWith = e;
        return this;
    }

    public void release() {
        gate.countDown();
    }

    @Override
    public ExecutionResult execute(Task task) {
        started.add(task.getName());
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            if (runMillis > 0) {
                Thread.sleep(runMillis);
            }
            if (gate != null && !gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never released");
            }
            if (failWith != null) {
                throw failWith;
            }
            return ExecutionResult.completed(0, "", "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } finally {
            inFlight.decrementAndGet();
            finished.incrementAndGet();
        }
    }

    public int startedCount() {
        return started.size();
    }

    public long startedCount(String taskName) {
        return started.stream().filter(taskName::equals).count();
    }

    public int finishedCount() {
        return finished.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }
}
