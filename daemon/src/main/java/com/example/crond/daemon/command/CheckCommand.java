package com.example.crond.daemon.command;

import com.example.crond.config.ConfigLoader;
import com.example.crond.config.Configuration;
import com.example.crond.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Validate the config file without running anything.")
public class CheckCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOption config;

    @Override
    public Integer call() {
        Path path = config.resolve();
        logger.info("Checking configuration at {}", path);
        try {
            Configuration configuration = new ConfigLoader().load(path);
            spec.commandLine().getOut().println("Configuration check passed. " + configuration.size() + " tasks.");
            spec.commandLine().getOut().flush();
            return 0;
        } catch (ConfigurationException e) {
            spec.commandLine().getErr().println("Configuration check failed: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }
}
