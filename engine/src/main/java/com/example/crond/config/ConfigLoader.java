package com.example.crond.config;

import com.example.crond.schedule.CronSchedule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the JSON task file and turns it into a validated {@link Configuration}.
 *
 * <pre>
 * { "tasks": [ { "name": "ping", "cron_schedule": "*&#47;10 * * * * *", "command": "/bin/echo", "args": ["hi"] } ] }
 * </pre>
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Configuration load(Path path) throws ConfigurationException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Configuration file not found at: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    public Configuration parse(String json) throws ConfigurationException {
        ConfigDocument doc;
        try {
            doc = mapper.readValue(json, ConfigDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (doc == null || doc.getTasks() == null) {
            throw new ConfigurationException("Missing required field 'tasks'");
        }

        List<Task> tasks = new ArrayList<>(doc.getTasks().size());
        for (int i = 0; i < doc.getTasks().size(); i++) {
            tasks.add(toTask(i, doc.getTasks().get(i)));
        }
        warnOnDuplicateNames(tasks);
        return new Configuration(tasks);
    }

    private static Task toTask(int index, TaskDefinition def) throws ConfigurationException {
        if (def == null) {
            throw new ConfigurationException("tasks[" + index + "]: task entry is null");
        }
        String name = requireText(index, "name", def.getName(), def.getName());
        String expr = requireText(index, "cron_schedule", def.getCronSchedule(), name);
        String command = requireText(index, "command", def.getCommand(), name);

        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(expr);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(describe(index, name) + ": invalid cron schedule '" + expr + "': "
                    + e.getMessage(), e);
        }
        if (def.getTimeout() != null && def.getTimeout() < 0) {
            throw new ConfigurationException(describe(index, name) + ": timeout must be >= 0, got "
                    + def.getTimeout());
        }
        if (def.getArgs() != null && def.getArgs().contains(null)) {
            throw new ConfigurationException(describe(index, name) + ": args must not contain null");
        }
        if (def.getEnv() != null) {
            for (Map.Entry<String, String> e : def.getEnv().entrySet()) {
                checkEnvEntry(index, name, e.getKey(), e.getValue());
            }
        }

        return Task.builder(name, schedule, command)
                .args(def.getArgs())
                .timeoutSeconds(def.getTimeout())
                .webhookUrl(def.getWebhookUrl())
                .cwd(def.getCwd())
                .env(def.getEnv())
                .build();
    }

    // ProcessBuilder rejects these when the command starts
    private static void checkEnvEntry(int index, String name, String key, String value)
            throws ConfigurationException {
        if (key.isEmpty() || key.indexOf('=') >= 0 || key.indexOf('\0') >= 0) {
            throw new ConfigurationException(describe(index, name) + ": invalid env name '" + key + "'");
        }
        if (value == null) {
            throw new ConfigurationException(describe(index, name) + ": env '" + key + "' must be a string, got null");
        }
        if (value.indexOf('\0') >= 0) {
            throw new ConfigurationException(describe(index, name) + ": env '" + key + "' contains a NUL character");
        }
    }

    private static String requireText(int index, String field, String value, String name)
            throws ConfigurationException {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(describe(index, name) + ": missing required field '" + field + "'");
        }
        return value;
    }

    private static String describe(int index, String name) {
        return name == null || name.isBlank() ? "tasks[" + index + "]" : "tasks[" + index + "] '" + name + "'";
    }

    private static void warnOnDuplicateNames(List<Task> tasks) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Task t : tasks) {
            if (!seen.add(t.getName())) {
                duplicates.add(t.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            logger.warn("[config] Duplicate task names {}: every copy is scheduled, exec picks the first", duplicates);
        }
    }
}
