package com.example.crond.daemon.command;

import com.example.crond.alert.WebhookAlerter;
import com.example.crond.config.ConfigLoader;
import com.example.crond.config.Configuration;
import com.example.crond.config.ConfigurationException;
import com.example.crond.config.Task;
import com.example.crond.exec.ExecutionResult;
import com.example.crond.exec.ProcessCommandExecutor;
import com.example.crond.logging.LogContext;
import com.example.crond.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Runs one task immediately, once, with the same timeout and alert rules as a scheduled run.
 * Exit code is 0 only when the command completed with status 0.
 */
@Command(name = "exec", description = "Run a single task now and exit.")
public class ExecCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ExecCommand.class);

    @Mixin
    ConfigOption config;

    @Parameters(index = "0", paramLabel = "<task-name>", description = "Name of the task to run")
    String taskName;

    @Override
    public Integer call() {
        Configuration configuration;
        try {
            configuration = new ConfigLoader().load(config.resolve());
        } catch (ConfigurationException e) {
            logger.error("Failed to load config: {}", e.getMessage());
            return 1;
        }

        Optional<Task> task = configuration.findTask(taskName);
        if (task.isEmpty()) {
            logger.error("Task '{}' not found in configuration.", taskName);
            logger.info("Available tasks: {}", configuration.taskNames());
            return 1;
        }

        Duration webhookTimeout;
        try {
            webhookTimeout = RunCommand.webhookTimeout();
        } catch (IllegalArgumentException e) {
            logger.error("[Main] {}", e.getMessage());
            return 1;
        }
        ExecutionMetrics metrics = ExecutionMetrics.noop();
        LogContext.start(taskName);
        try (ProcessCommandExecutor executor = new ProcessCommandExecutor(new WebhookAlerter(webhookTimeout, metrics),
                metrics)) {
            ExecutionResult result = executor.execute(task.get());
            return result.isSuccess() ? 0 : 1;
        } finally {
            LogContext.clear();
        }
    }
}
