package com.example.crond.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Six-field cron schedule with seconds precision and an optional year.
 * Layout: sec min hour day-of-month month day-of-week [year].
 * Unlike Quartz, both day fields may be '*' at the same time.
 */
public final class CronSchedule implements Schedule {
    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
            .withSeconds().withValidRange(0, 59).and()
            .withMinutes().withValidRange(0, 59).and()
            .withHours().withValidRange(0, 23).and()
            .withDayOfMonth().withValidRange(1, 31).supportsL().supportsW().supportsLW().supportsQuestionMark().and()
            .withMonth().withValidRange(1, 12).and()
            .withDayOfWeek().withValidRange(1, 7).withMondayDoWValue(2).supportsHash().supportsL()
            .supportsQuestionMark().and()
            .withYear().withValidRange(1970, 2099).withStrictRange().optional().and()
            .instance();

    private static final CronParser PARSER = new CronParser(DEFINITION);

    private final String expression;
    private final ExecutionTime executionTime;

    private CronSchedule(String expression, ExecutionTime executionTime) {
        this.expression = expression;
        this.executionTime = executionTime;
    }

    /**
     * @throws IllegalArgumentException when the expression is blank or not a valid cron expression
     */
    public static CronSchedule parse(String expression) {
        String expr = (expression == null ? "" : expression.trim());
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        Cron cron = PARSER.parse(expr);
        cron.validate();
        return new CronSchedule(expr, ExecutionTime.forCron(cron));
    }

    @Override
    public Optional<ZonedDateTime> nextAfter(ZonedDateTime time) {
        return executionTime.nextExecution(time)
                .filter(next -> next.isAfter(time));
    }

    @Override
    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
