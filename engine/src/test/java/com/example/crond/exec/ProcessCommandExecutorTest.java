package com.example.crond.exec;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.example.crond.config.Task;
import com.example.crond.schedule.CronSchedule;

public class ProcessCommandExecutorTest {
    private static final String HOOK = "http://127.0.0.1:9/hook";

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private RecordingAlerter alerter;
    private ProcessCommandExecutor executor;

    @Before
    public void setUp() {
        Assume.assumeTrue("needs /bin/sh", new File("/bin/sh").canExecute());
        alerter = new RecordingAlerter();
        executor = new ProcessCommandExecutor(alerter);
    }

    @After
    public void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    private static Task.Builder shell(String name, String script) {
        return Task.builder(name, CronSchedule.parse("0 0 0 * * *"), "/bin/sh").args("-c", script);
    }

    @Test
    public void capturesStdoutAndExitStatus() {
        ExecutionResult r = executor.execute(shell("echo", "echo hello").build());

        assertThat(r.getKind(), is(ExecutionResult.Kind.COMPLETED));
        assertThat(r.isSuccess(), is(true));
        assertThat(r.getExitStatus(), is(0));
        assertThat(r.getStdout(), is("hello\n"));
        assertThat(r.getError(), is(nullValue()));
    }

    @Test
    public void reportsRealNonZeroStatusAndStderr() {
        ExecutionResult r = executor.execute(shell("fails", "echo boom >&2; exit 3").build());

        assertThat(r.getKind(), is(ExecutionResult.Kind.COMPLETED));
        assertThat(r.isSuccess(), is(false));
        assertThat(r.getExitStatus(), is(3));
        assertThat(r.getStderr(), is("boom\n"));
    }

    @Test
    public void appliesWorkingDirectoryAndExtraEnv() throws Exception {
        File dir = tmp.newFolder("work");
        Task task = shell("env", "pwd; echo \"$K\"")
                .cwd(dir.getAbsolutePath())
                .env(Map.of("K", "V"))
                .build();

        ExecutionResult r = executor.execute(task);

        assertThat(r.getStdout(), containsString(dir.getCanonicalPath()));
        assertThat(r.getStdout(), containsString("V"));
    }

    @Test
    public void extraEnvOverridesInheritedButKeepsTheRest() {
        Task task = shell("env", "echo \"$HOME|$PATH\"")
                .env(Map.of("HOME", "/custom-home"))
                .build();

        String out = executor.execute(task).getStdout().trim();

        assertThat(out.startsWith("/custom-home|"), is(true));
        assertThat(out.length() > "/custom-home|".length(), is(true));
    }

    @Test
    public void invalidUtf8IsReplacedNotFatal() {
        ExecutionResult r = executor.execute(shell("bytes", "printf '\\377\\376ok'").build());

        assertThat(r.getKind(), is(ExecutionResult.Kind.COMPLETED));
        assertThat(r.getStdout(), containsString("ok"));
        assertThat(r.getStdout(), containsString("�"));
    }

    @Test
    public void timeoutKillsTheProcess() throws Exception {
        File pidFile = new File(tmp.getRoot(), "pid");
        Task task = shell("slow", "echo $$ > '" + pidFile.getAbsolutePath() + "'; exec sleep 30")
                .timeoutSeconds(1L)
                .build();

        long start = System.nanoTime();
        ExecutionResult r = executor.execute(task);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(r.getKind(), is(ExecutionResult.Kind.TIMED_OUT));
        assertThat(r.getError(), containsString("1 seconds"));
        assertThat(elapsedMs, lessThan(10_000L));
        long pid = Long.parseLong(Files.readString(pidFile.toPath(), StandardCharsets.UTF_8).trim());
        await().atMost(Duration.ofSeconds(5)).until(() -> !isAlive(pid));
    }

    @Test
    public void timeoutAlsoKillsBackgroundChildren() throws Exception {
        File pidFile = new File(tmp.getRoot(), "child");
        Task task = shell("forks", "sleep 30 & echo $! > '" + pidFile.getAbsolutePath() + "'; wait")
                .timeoutSeconds(1L)
                .build();

        ExecutionResult r = executor.execute(task);

        assertThat(r.getKind(), is(ExecutionResult.Kind.TIMED_OUT));
        long pid = Long.parseLong(Files.readString(pidFile.toPath(), StandardCharsets.UTF_8).trim());
        await().atMost(Duration.ofSeconds(5)).until(() -> !isAlive(pid));
    }

    @Test
    public void zeroTimeoutFailsARunningProcessImmediately() {
        Task task = shell("zero", "sleep 5").timeoutSeconds(0L).build();

        long start = System.nanoTime();
        ExecutionResult r = executor.execute(task);

        assertThat(r.getKind(), is(ExecutionResult.Kind.TIMED_OUT));
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), lessThan(5_000L));
    }

    @Test
    public void generousTimeoutLetsFastCommandComplete() {
        ExecutionResult r = executor.execute(shell("fast", "echo done").timeoutSeconds(30L).build());

        assertThat(r.getKind(), is(ExecutionResult.Kind.COMPLETED));
        assertThat(r.getStdout(), is("done\n"));
    }

    @Test
    public void missingBinaryIsSpawnFailure() {
        Task task = Task.builder("ghost", CronSchedule.parse("0 0 0 * * *"), "/definitely/not/here/cmd")
                .webhookUrl(HOOK)
                .build();

        ExecutionResult r = executor.execute(task);

        assertThat(r.getKind(), is(ExecutionResult.Kind.SPAWN_FAILED));
        assertThat(r.getError() != null, is(true));
        assertThat(alerter.getCalls().size(), is(0));
    }

    @Test
    public void environmentTheOsRejectsIsSpawnFailure() {
        Task task = shell("bad_env", "true").env(Map.of("A=B", "v")).webhookUrl(HOOK).build();

        ExecutionResult r = executor.execute(task);

        assertThat(r.getKind(), is(ExecutionResult.Kind.SPAWN_FAILED));
        assertThat(alerter.getCalls().size(), is(0));
    }

    @Test
    public void taskRefusesNullEnvValue() {
        Map<String, String> env = new HashMap<>();
        env.put("K", null);

        NullPointerException e = assertThrows(NullPointerException.class,
                () -> shell("null_env", "true").env(env).build());
        assertThat(e.getMessage(), is("env value for K"));
    }

    @Test
    public void nonZeroExitWithWebhookAlertsExactlyOnce() {
        Task task = shell("alerting", "echo broken >&2; exit 2").webhookUrl(HOOK).build();

        executor.execute(task);

        assertThat(alerter.getCalls().size(), is(1));
        RecordingAlerter.Call call = alerter.getCalls().get(0);
        assertThat(call.webhookUrl, is(HOOK));
        assertThat(call.taskName, is("alerting"));
        assertThat(call.message, containsString("status: 2"));
        assertThat(call.message, containsString("broken"));
    }

    @Test
    public void nonZeroExitWithoutWebhookDoesNotAlert() {
        executor.execute(shell("quiet", "exit 2").build());

        assertThat(alerter.getCalls().size(), is(0));
    }

    @Test
    public void successDoesNotAlert() {
        executor.execute(shell("fine", "true").webhookUrl(HOOK).build());

        assertThat(alerter.getCalls().size(), is(0));
    }

    @Test
    public void timeoutDoesNotAlert() {
        executor.execute(shell("late", "sleep 10").timeoutSeconds(1L).webhookUrl(HOOK).build());

        assertThat(alerter.getCalls().size(), is(0));
    }

    // a killed grandchild may linger as a zombie until init reaps it, which ProcessHandle reports as alive
    private static boolean isAlive(long pid) throws Exception {
        File stat = new File("/proc/" + pid + "/stat");
        if (new File("/proc/self").exists()) {
            if (!stat.exists()) {
                return false;
            }
            String s;
            try {
                s = Files.readString(stat.toPath(), StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return false;
            }
            char state = s.charAt(s.lastIndexOf(')') + 2);
            return state != 'Z' && state != 'X';
        }
        Optional<ProcessHandle> h = ProcessHandle.of(pid);
        return h.isPresent() && h.get().isAlive();
    }
}
