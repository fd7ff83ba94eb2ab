package com.example.crond.daemon.command;

import com.example.crond.alert.WebhookAlerter;
import com.example.crond.config.ConfigLoader;
import com.example.crond.config.ConfigurationException;
import com.example.crond.daemon.CrondMain;
import com.example.crond.daemon.DaemonRunner;
import com.example.crond.daemon.Env;
import com.example.crond.daemon.metrics.MetricsServer;
import com.example.crond.daemon.metrics.PromExecutionMetrics;
import com.example.crond.daemon.watch.ConfigWatcher;
import com.example.crond.engine.JobScheduler;
import com.example.crond.exec.ProcessCommandExecutor;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(name = "run", description = "Start the daemon in the foreground and watch the config file for changes.")
public class RunCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);
    private static final long STOP_WAIT_SECONDS = 10;
    private static final long MAX_WEBHOOK_TIMEOUT_SECONDS = 3600;
    private static final int MAX_PORT = 65535;

    @ParentCommand
    CrondMain parent;

    @Mixin
    ConfigOption config;

    @Option(names = "--metrics-port", paramLabel = "<port>",
            description = "Serve /metrics and /healthz on this port (default: $CROND_METRICS_PORT, off when unset)")
    Integer metricsPort;

    @Override
    public Integer call() {
        Path configPath = config.resolve();
        logger.info("Starting crond daemon with config {}", configPath);
        ConfigLoader loader = new ConfigLoader();
        try {
            loader.load(configPath);
        } catch (ConfigurationException e) {
            logger.error("[Main] Failed to load initial config: {}", e.getMessage());
            return 1;
        }

        Duration webhookTimeout;
        Integer port;
        try {
            webhookTimeout = webhookTimeout();
            port = resolveMetricsPort();
        } catch (IllegalArgumentException e) {
            logger.error("[Main] {}", e.getMessage());
            return 1;
        }

        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        PromExecutionMetrics metrics = new PromExecutionMetrics(registry);

        MetricsServer metricsServer = null;
        ConfigWatcher watcher = null;
        try (ProcessCommandExecutor executor = new ProcessCommandExecutor(new WebhookAlerter(webhookTimeout, metrics),
                metrics);
             JobScheduler scheduler = new JobScheduler(executor, metrics, parent.getWorkerThreads(),
                     Clock.systemDefaultZone())) {
            DaemonRunner runner = new DaemonRunner(configPath, loader, scheduler);

            if (port != null) {
                metricsServer = MetricsServer.start(port, registry, runner::isRunning);
            }

            watcher = new ConfigWatcher(configPath, runner::requestReload);
            watcher.start();

            Thread hook = new Thread(() -> {
                logger.info("Received stop signal");
                runner.stop();
                try {
                    if (!runner.awaitStopped(STOP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                        logger.warn("Daemon did not stop within {}s", STOP_WAIT_SECONDS);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "crond-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            runner.run();
            return 0;
        } catch (ConfigurationException e) {
            return 1;
        } catch (IOException e) {
            logger.error("Failed to start daemon: {}", e.getMessage(), e);
            return 1;
        } finally {
            if (watcher != null) {
                watcher.close();
            }
            if (metricsServer != null) {
                metricsServer.close();
            }
        }
    }

    static Duration webhookTimeout() {
        return Duration.ofSeconds(Env.getLong(Env.WEBHOOK_TIMEOUT_SECONDS, 10, 1, MAX_WEBHOOK_TIMEOUT_SECONDS));
    }

    private Integer resolveMetricsPort() {
        if (metricsPort != null) {
            if (metricsPort < 0 || metricsPort > MAX_PORT) {
                throw new IllegalArgumentException("invalid --metrics-port: " + metricsPort + " is outside 0.."
                        + MAX_PORT);
            }
            return metricsPort;
        }
        if (Env.get(Env.METRICS_PORT, null) == null) {
            return null;
        }
        return (int) Env.getLong(Env.METRICS_PORT, 0, 0, MAX_PORT);
    }
}
