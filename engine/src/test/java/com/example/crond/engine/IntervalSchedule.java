package com.example.crond.engine;

import com.example.crond.schedule.Schedule;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Test schedules that do not need second-granularity cron timing.
 */
public final class IntervalSchedule implements Schedule {
    private final Duration interval;

    private IntervalSchedule(Duration interval) {
        this.interval = interval;
    }

    public static Schedule every(Duration interval) {
        return new IntervalSchedule(interval);
    }

    public static Schedule never() {
        return new Schedule() {
            public Optional<ZonedDateTime> nextAfter(ZonedDateTime time) {
                return Optional.empty();
            }

            public String expression() {
                return "never";
            }
        };
    }

    /**
     * Fires at each given instant that is still in the future, then ends.
     */
    public static Schedule at(List<ZonedDateTime> instants) {
        return new Schedule() {
            public Optional<ZonedDateTime> nextAfter(ZonedDateTime time) {
                return instants.stream().filter(i -> i.isAfter(time)).findFirst();
            }

            public String expression() {
                return "at" + instants;
            }
        };
    }

    @Override
    public Optional<ZonedDateTime> nextAfter(ZonedDateTime time) {
        return Optional.of(time.plus(interval));
    }

    @Override
    public String expression() {
        return "every " + interval;
    }
}
