package com.example.crond.daemon.command;

import com.example.crond.daemon.Env;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Shared {@code -c/--config-path} option.
 */
public class ConfigOption {
    @Option(names = {"-c", "--config-path"}, paramLabel = "<file>",
            description = "Task configuration file (default: $CROND_CONFIG or ~/.config/crond/config.json)")
    Path configPath;

    public Path resolve() {
        return configPath != null ? configPath : Env.defaultConfigPath();
    }
}
