package com.example.crond.daemon.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "init", description = "Write a sample config file.")
public class InitCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(InitCommand.class);

    static final String SAMPLE = "{\n"
            + "  \"tasks\": [\n"
            + "    {\n"
            + "      \"name\": \"sample_ping\",\n"
            + "      \"cron_schedule\": \"*/10 * * * * *\",\n"
            + "      \"command\": \"echo\",\n"
            + "      \"args\": [\"crond is alive\"],\n"
            + "      \"timeout\": 5\n"
            + "    },\n"
            + "    {\n"
            + "      \"name\": \"sample_cleanup\",\n"
            + "      \"cron_schedule\": \"0 0 3 * * *\",\n"
            + "      \"command\": \"/usr/bin/find\",\n"
            + "      \"args\": [\"/tmp\", \"-maxdepth\", \"1\", \"-name\", \"crond-*.tmp\", \"-mtime\", \"+7\", \"-delete\"],\n"
            + "      \"timeout\": 300\n"
            + "    }\n"
            + "  ]\n"
            + "}\n";

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOption config;

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing file")
    boolean force;

    @Override
    public Integer call() {
        Path path = config.resolve().toAbsolutePath();
        if (Files.exists(path) && !force) {
            spec.commandLine().getErr().println("Config file already exists at " + path + " (use --force to overwrite)");
            spec.commandLine().getErr().flush();
            return 1;
        }
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, SAMPLE.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.error("Failed to write sample config to {}: {}", path, e.getMessage());
            return 1;
        }
        spec.commandLine().getOut().println("Sample configuration written to " + path);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
