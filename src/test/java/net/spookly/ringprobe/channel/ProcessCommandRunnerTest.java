package net.spookly.ringprobe.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {
    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void capturesOutputAndExitCode() throws Exception {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(5));

        assertFalse(result.timedOut());
        assertEquals(3, result.exitCode());
        assertTrue(result.output().contains("out"));
        assertTrue(result.output().contains("err"));
        assertFalse(result.succeeded());
    }

    @Test
    void killsCommandsPastTheirTimeout() throws Exception {
        long started = System.nanoTime();

        CommandResult result = runner.run(List.of("sleep", "10"), Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertEquals("timed out", result.reason());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 5);
    }
}
