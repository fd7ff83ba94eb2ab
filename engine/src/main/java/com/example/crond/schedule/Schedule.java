package com.example.crond.schedule;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Lazy source of fire instants for one task.
 */
public interface Schedule {
    /**
     * Next fire instant strictly after {@code time}, or empty once the schedule is exhausted.
     */
    Optional<ZonedDateTime> nextAfter(ZonedDateTime time);

    String expression();
}
