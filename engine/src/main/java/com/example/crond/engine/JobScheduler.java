package com.example.crond.engine;

import com.example.crond.config.Configuration;
import com.example.crond.config.Task;
import com.example.crond.exec.CommandExecutor;
import com.example.crond.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Owns the running job loops. {@link #reload(Configuration)} swaps the whole set: every current loop is
 * cancelled, then one fresh loop is started per task of the new configuration.
 *
 * Reload is meant to be driven from one control thread; calls are serialized here anyway.
 * Cancelling a loop does not kill a command it is currently running.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final CommandExecutor executor;
    private final ExecutionMetrics metrics;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService workers;

    private final Object lock = new Object();
    // guarded by lock, replaced wholesale on reload
    private List<JobHandle> handles = List.of();

    public JobScheduler(CommandExecutor executor) {
        this(executor, ExecutionMetrics.noop(), 2, Clock.systemDefaultZone());
    }

    public JobScheduler(CommandExecutor executor, ExecutionMetrics metrics, int timerThreads, Clock clock) {
        this.executor = executor;
        this.metrics = (metrics == null ? ExecutionMetrics.noop() : metrics);
        this.clock = clock;
        this.timer = new ScheduledThreadPoolExecutor(Math.max(1, timerThreads), new NamedThreadFactory("crond-timer"));
        this.timer.setRemoveOnCancelPolicy(true);
        this.workers = Executors.newCachedThreadPool(new NamedThreadFactory("crond-worker"));
    }

    public void reload(Configuration configuration) {
        synchronized (lock) {
            logger.info("[Scheduler] Stopping {} existing tasks...", handles.size());
            for (JobHandle h : handles) {
                h.cancel();
            }
            handles = List.of();

            logger.info("[Scheduler] Existing tasks stopped. Registering {} new tasks...", configuration.size());
            List<JobHandle> started = new ArrayList<>(configuration.size());
            for (Task task : configuration.getTasks()) {
                started.add(register(task));
            }
            handles = List.copyOf(started);
            metrics.setActiveJobs(handles.size());
        }
    }

    private JobHandle register(Task task) {
        logger.info("[Scheduler] Registering task '{}' with schedule: {}", task.getName(),
                task.getSchedule().expression());
        JobHandle handle = new JobHandle(task.getName());
        new JobLoop(task, handle, executor, timer, workers, clock).start();
        return handle;
    }

    /**
     * Number of loops registered by the last reload, finished or not.
     */
    public int jobCount() {
        synchronized (lock) {
            return handles.size();
        }
    }

    /**
     * Number of loops from the last reload that have not exited yet.
     */
    public int runningJobCount() {
        synchronized (lock) {
            return (int) handles.stream().filter(h -> !h.isFinished()).count();
        }
    }

    // visible for tests
    List<JobHandle> currentHandles() {
        synchronized (lock) {
            return handles;
        }
    }

    /**
     * Stops every loop, then shuts the pools down. In-flight commands get a short grace period.
     */
    @Override
    public void close() {
        reload(Configuration.empty());
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("[Scheduler] In-flight commands still running, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        logger.info("[Scheduler] Stopped.");
    }
}
