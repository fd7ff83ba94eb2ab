package com.example.crond.daemon;

import ch.qos.logback.classic.Level;
import com.example.crond.daemon.command.CheckCommand;
import com.example.crond.daemon.command.ExecCommand;
import com.example.crond.daemon.command.InitCommand;
import com.example.crond.daemon.command.ListCommand;
import com.example.crond.daemon.command.RunCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point. Parses the command line, sets the log level, and dispatches to a subcommand.
 */
@Command(name = "crond",
        mixinStandardHelpOptions = true,
        version = "crond 0.1.0",
        description = "Runs shell commands on cron schedules and reloads them when the config file changes.",
        subcommands = {
                RunCommand.class,
                ListCommand.class,
                CheckCommand.class,
                InitCommand.class,
                ExecCommand.class
        })
public class CrondMain implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(CrondMain.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG level")
    boolean verbose;

    @Option(names = {"-t", "--worker-threads"}, paramLabel = "<n>",
            description = "Timer threads used to wake waiting jobs (default: ${DEFAULT-VALUE})")
    int workerThreads = 2;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        CrondMain main = new CrondMain();
        CommandLine cmd = new CommandLine(main);
        cmd.setExecutionStrategy(parseResult -> {
            configureLogging(main.verbose);
            logger.debug("Parsed command line: {}", parseResult.originalArgs());
            return new CommandLine.RunLast().execute(parseResult);
        });
        return cmd;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static void configureLogging(boolean verbose) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(verbose ? Level.DEBUG : Level.INFO);
        }
    }
}
