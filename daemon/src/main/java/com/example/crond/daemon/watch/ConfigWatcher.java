package com.example.crond.daemon.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;

/**
 * Watches the directory holding the config file and calls {@code onChange} whenever the file is
 * created or modified. Editors often emit several events per save; the callback must tolerate that.
 */
public class ConfigWatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConfigWatcher.class);

    private final Path file;
    private final Runnable onChange;
    private WatchService watchService;
    private Thread thread;
    private volatile boolean closed;

    public ConfigWatcher(Path file, Runnable onChange) {
        this.file = file.toAbsolutePath();
        this.onChange = onChange;
    }

    public synchronized void start() throws IOException {
        Path dir = file.getParent();
        watchService = dir.getFileSystem().newWatchService();
        dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
        thread = new Thread(this::loop, "crond-config-watcher");
        thread.setDaemon(true);
        thread.start();
        logger.info("Watching {} for changes", file);
    }

    private void loop() {
        Path name = file.getFileName();
        while (!closed) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    relevant = true;
                } else if (name.equals(event.context())) {
                    relevant = true;
                }
            }
            if (relevant && !closed) {
                logger.debug("Change detected on {}", file);
                onChange.run();
            }
            if (!key.reset()) {
                logger.error("Config directory {} is no longer accessible, stopping watcher", file.getParent());
                return;
            }
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.warn("Failed to close watch service: {}", e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
