package com.example.crond.engine;

import com.example.crond.config.Task;
import com.example.crond.exec.CommandExecutor;
import com.example.crond.exec.ExecutionInterruptedException;
import com.example.crond.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Compute next fire time, wait, run, repeat; for one task.
 *
 * Waiting is a timer registration, not a parked thread. Runs go to the worker pool and the next
 * occurrence is computed only after a run returns, so a task never overlaps itself and ticks missed
 * during a long run are skipped.
 */
public final class JobLoop {
    private static final Logger logger = LoggerFactory.getLogger(JobLoop.class);

    public enum State {
        COMPUTING, WAITING, RUNNING, ENDED
    }

    private final Task task;
    private final JobHandle handle;
    private final CommandExecutor executor;
    private final ScheduledExecutorService timer;
    private final Executor workers;
    private final Clock clock;

    private volatile State state = State.COMPUTING;
    // only touched by the thread currently driving the loop
    private ZonedDateTime lastFire;
    private long wakeUps;

    public JobLoop(Task task, JobHandle handle, CommandExecutor executor, ScheduledExecutorService timer,
            Executor workers, Clock clock) {
        this.task = task;
        this.handle = handle;
        this.executor = executor;
        this.timer = timer;
        this.workers = workers;
        this.clock = clock;
    }

    public void start() {
        scheduleNext();
    }

    public State getState() {
        return state;
    }

    private void scheduleNext() {
        if (handle.isCancelled()) {
            end();
            return;
        }
        state = State.COMPUTING;
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime after = (lastFire != null && lastFire.isAfter(now)) ? lastFire : now;

        Optional<ZonedDateTime> next;
        try {
            next = task.getSchedule().nextAfter(after);
        } catch (RuntimeException e) {
            logger.error("[{}] Failed to compute next run from '{}': {}", task.getName(),
                    task.getSchedule().expression(), e.getMessage(), e);
            next = Optional.empty();
        }
        if (next.isEmpty()) {
            logger.warn("[{}] Schedule ended or failed to calculate next time.", task.getName());
            end();
            return;
        }

        ZonedDateTime fireAt = next.get();
        long delayNanos = Math.max(0L, Duration.between(now, fireAt).toNanos());
        logger.debug("[{}] Next run at {}", task.getName(), fireAt);
        state = State.WAITING;
        // taken before scheduling, the wake-up may run before arm() below
        long generation = ++wakeUps;
        try {
            ScheduledFuture<?> wakeUp = timer.schedule(() -> dispatch(fireAt), delayNanos, TimeUnit.NANOSECONDS);
            handle.arm(wakeUp, generation);
        } catch (RejectedExecutionException e) {
            logger.warn("[{}] Timer is shut down, stopping job loop", task.getName());
            end();
        }
    }

    private void dispatch(ZonedDateTime fireAt) {
        try {
            workers.execute(() -> fire(fireAt));
        } catch (RejectedExecutionException e) {
            logger.warn("[{}] Worker pool is shut down, stopping job loop", task.getName());
            end();
        }
    }

    private void fire(ZonedDateTime fireAt) {
        if (handle.isCancelled()) {
            end();
            return;
        }
        lastFire = fireAt;
        state = State.RUNNING;
        LogContext.start(task.getName());
        try {
            executor.execute(task);
        } catch (ExecutionInterruptedException e) {
            logger.warn("[{}] Run interrupted, stopping job loop", task.getName());
            end();
            return;
        } catch (RuntimeException e) {
            logger.error("[{}] Unexpected error while running task: {}", task.getName(), e.getMessage(), e);
        } finally {
            LogContext.clear();
        }
        scheduleNext();
    }

    private void end() {
        state = State.ENDED;
        handle.markFinished();
    }
}
