package com.example.crond.daemon;

import com.example.crond.config.ConfigLoader;
import com.example.crond.config.Configuration;
import com.example.crond.config.ConfigurationException;
import com.example.crond.engine.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control loop of the daemon: the only caller of {@link JobScheduler#reload(Configuration)}.
 * Reload requests that arrive while one is already pending collapse into it. A rejected
 * configuration leaves the running jobs untouched.
 */
public class DaemonRunner {
    private static final Logger logger = LoggerFactory.getLogger(DaemonRunner.class);

    private enum Signal {
        RELOAD, STOP
    }

    private final Path configPath;
    private final ConfigLoader loader;
    private final JobScheduler scheduler;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final AtomicBoolean reloadPending = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean running;

    public DaemonRunner(Path configPath, ConfigLoader loader, JobScheduler scheduler) {
        this.configPath = configPath;
        this.loader = loader;
        this.scheduler = scheduler;
    }

    /**
     * Loads the initial configuration and serves reload signals until {@link #stop()}.
     *
     * @throws ConfigurationException if the initial configuration cannot be loaded; nothing is started then
     */
    public void run() throws ConfigurationException {
        try {
            Configuration initial;
            try {
                initial = loader.load(configPath);
            } catch (ConfigurationException e) {
                logger.error("[Main] Failed to load initial config: {}", e.getMessage());
                throw e;
            }
            logger.info("Configuration loaded. {} tasks.", initial.size());
            scheduler.reload(initial);
            running = true;
            logger.info("crond daemon started.");

            while (true) {
                Signal signal = signals.take();
                if (signal == Signal.STOP) {
                    break;
                }
                reloadPending.set(false);
                reloadFromDisk();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Control loop interrupted");
        } finally {
            if (running) {
                logger.info("Shutting down gracefully...");
                scheduler.reload(Configuration.empty());
            }
            running = false;
            stopped.countDown();
        }
    }

    private void reloadFromDisk() {
        logger.info(">>> CONFIG CHANGE DETECTED! RELOADING... <<<");
        try {
            Configuration next = loader.load(configPath);
            scheduler.reload(next);
            logger.info("New configuration applied. Tasks reloaded.");
        } catch (ConfigurationException e) {
            logger.error("Error reloading configuration (Configuration rejected): {}", e.getMessage());
        }
    }

    public void requestReload() {
        if (reloadPending.compareAndSet(false, true)) {
            signals.add(Signal.RELOAD);
        } else {
            logger.debug("Reload already pending, coalescing");
        }
    }

    public void stop() {
        signals.add(Signal.STOP);
    }

    public boolean isRunning() {
        return running;
    }

    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }
}
