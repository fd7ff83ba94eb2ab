package com.example.crond.daemon.command;

import com.example.crond.config.ConfigLoader;
import com.example.crond.config.Configuration;
import com.example.crond.config.ConfigurationException;
import com.example.crond.config.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "list", description = "List the configured tasks.")
public class ListCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOption config;

    @Override
    public Integer call() {
        Configuration configuration;
        try {
            configuration = new ConfigLoader().load(config.resolve());
        } catch (ConfigurationException e) {
            logger.error("Failed to load config: {}", e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (configuration.size() == 0) {
            out.println("No tasks configured.");
        }
        for (Task task : configuration.getTasks()) {
            StringBuilder line = new StringBuilder()
                    .append(task.getName())
                    .append('\t').append(task.getSchedule().expression())
                    .append('\t').append(task.getCommand());
            for (String arg : task.getArgs()) {
                line.append(' ').append(arg);
            }
            task.getTimeoutSeconds().ifPresent(t -> line.append("\ttimeout=").append(t).append('s'));
            out.println(line);
        }
        out.flush();
        return 0;
    }
}
