package com.example.crond.daemon;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class EnvTest {
    @Test
    public void unsetVariableFallsBackToDefault() {
        assertThat(Env.parseLong(Env.WEBHOOK_TIMEOUT_SECONDS, null, 10, 1, 3600), is(10L));
    }

    @Test
    public void parsesTrimmedNumber() {
        assertThat(Env.parseLong(Env.METRICS_PORT, " 9100 ", 0, 0, 65535), is(9100L));
    }

    @Test
    public void rejectsGarbage() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Env.parseLong(Env.WEBHOOK_TIMEOUT_SECONDS, "ten", 10, 1, 3600));
        assertThat(e.getMessage(), containsString("invalid CROND_WEBHOOK_TIMEOUT_SECONDS"));
    }

    @Test
    public void rejectsOutOfRange() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Env.parseLong(Env.WEBHOOK_TIMEOUT_SECONDS, "-5", 10, 1, 3600));
        assertThat(e.getMessage(), containsString("outside 1..3600"));

        assertThrows(IllegalArgumentException.class, () -> Env.parseLong(Env.METRICS_PORT, "70000", 0, 0, 65535));
    }
}
