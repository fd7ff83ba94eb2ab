package com.example.crond.exec;

import com.example.crond.alert.Alerter;
import com.example.crond.config.Task;
import com.example.crond.engine.NamedThreadFactory;
import com.example.crond.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs a task as a child process.
 * <ul>
 * <li>cwd and env are applied to the child; env entries override inherited variables of the same name.</li>
 * <li>Output and exit are awaited together, under the task timeout when one is set.</li>
 * <li>On timeout the child and its descendants are force-killed and the output is dropped.</li>
 * <li>A non-zero exit with a webhook configured raises one alert. Timeouts and spawn failures do not.</li>
 * </ul>
 */
public class ProcessCommandExecutor implements CommandExecutor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandExecutor.class);
    private static final long KILL_WAIT_SECONDS = 5;

    private final Alerter alerter;
    private final ExecutionMetrics metrics;
    private final ExecutorService streamReaders;

    public ProcessCommandExecutor(Alerter alerter) {
        this(alerter, ExecutionMetrics.noop());
    }

    public ProcessCommandExecutor(Alerter alerter, ExecutionMetrics metrics) {
        this.alerter = (alerter == null ? Alerter.noop() : alerter);
        this.metrics = (metrics == null ? ExecutionMetrics.noop() : metrics);
        this.streamReaders = Executors.newCachedThreadPool(new NamedThreadFactory("crond-stream"));
    }

    @Override
    public ExecutionResult execute(Task task) {
        String name = task.getName();
        logger.info("[{}] -> Command starting: {} {}", name, task.getCommand(), task.getArgs());

        List<String> commandLine = new ArrayList<>(task.getArgs().size() + 1);
        commandLine.add(task.getCommand());
        commandLine.addAll(task.getArgs());
        ProcessBuilder pb = new ProcessBuilder(commandLine);

        Optional<String> cwd = task.getCwd();
        if (cwd.isPresent()) {
            pb.directory(new File(cwd.get()));
            logger.info("[{}] CWD set to: {}", name, cwd.get());
        }

        long start = System.nanoTime();
        Process process;
        try {
            if (!task.getEnv().isEmpty()) {
                pb.environment().putAll(task.getEnv());
                logger.info("[{}] Envs set: {}", name, task.getEnv().keySet());
            }
            process = pb.start();
        } catch (IOException | SecurityException | IllegalArgumentException e) {
            logger.error("[{}] -> Failed to spawn command '{}': {}", name, task.getCommand(), e.getMessage());
            metrics.observeExecution(name, ExecutionMetrics.OUTCOME_SPAWN_FAILED, elapsedSeconds(start));
            return ExecutionResult.spawnFailed(e.getMessage());
        }
        closeStdin(name, process);

        CompletableFuture<String> stdout = drain(name, process.getInputStream());
        CompletableFuture<String> stderr = drain(name, process.getErrorStream());
        CompletableFuture<Void> completion = CompletableFuture.allOf(process.onExit(), stdout, stderr);

        Optional<Long> timeout = task.getTimeoutSeconds();
        try {
            if (timeout.isPresent()) {
                logger.info("[{}] Running command with timeout: {}s", name, timeout.get());
                completion.get(timeout.get(), TimeUnit.SECONDS);
            } else {
                logger.info("[{}] Running command (no timeout limit)", name);
                completion.get();
            }
        } catch (TimeoutException e) {
            logger.error("[{}] -> Command TIMEOUT after {} seconds. Killing process.", name, timeout.get());
            kill(name, process);
            metrics.observeExecution(name, ExecutionMetrics.OUTCOME_TIMED_OUT, elapsedSeconds(start));
            return ExecutionResult.timedOut(timeout.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[{}] Interrupted while waiting for PID {}. Killing process.", name, process.pid());
            kill(name, process);
            throw new ExecutionInterruptedException("Interrupted while running task " + name, e);
        } catch (ExecutionException e) {
            // drain() never completes exceptionally, so only onExit() can get here
            throw new IllegalStateException("Failed waiting for task " + name, e.getCause());
        }

        int exitStatus = process.exitValue();
        String out = stdout.join();
        String err = stderr.join();
        ExecutionResult result = ExecutionResult.completed(exitStatus, out, err);

        if (exitStatus == 0) {
            logger.info("[{}] -> Command SUCCESS. Status: {}", name, exitStatus);
            if (!out.isBlank()) {
                logger.info("[{}] -> STDOUT:\n{}", name, out.trim());
            }
            metrics.observeExecution(name, ExecutionMetrics.OUTCOME_SUCCESS, elapsedSeconds(start));
        } else {
            logger.error("[{}] -> Command FAILED. Status: {}", name, exitStatus);
            if (!err.isBlank()) {
                logger.error("[{}] -> STDERR:\n{}", name, err.trim());
            }
            metrics.observeExecution(name, ExecutionMetrics.OUTCOME_FAILED, elapsedSeconds(start));
            task.getWebhookUrl().ifPresent(url -> alerter.alert(url, name,
                    "Command exited with status: " + exitStatus + "\nStderr: " + err.trim()));
        }
        return result;
    }

    private void kill(String name, Process process) {
        long pid = process.pid();
        // snapshot before the parent dies, orphans are re-parented and drop out of descendants()
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.error("[{}] Child process PID {} killed successfully.", name, pid);
            } else {
                logger.error("[{}] Failed to kill child process PID {}.", name, pid);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("[{}] Interrupted while waiting for PID {} to die.", name, pid);
        }
    }

    private static void closeStdin(String name, Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("[{}] Could not close child stdin: {}", name, e.getMessage());
        }
    }

    private CompletableFuture<String> drain(String name, InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            try (InputStream is = in) {
                is.transferTo(buf);
            } catch (IOException e) {
                logger.debug("[{}] Output stream closed early: {}", name, e.getMessage());
            }
            // malformed sequences become U+FFFD
            return new String(buf.toByteArray(), StandardCharsets.UTF_8);
        }, streamReaders);
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    @Override
    public void close() {
        streamReaders.shutdownNow();
    }
}
