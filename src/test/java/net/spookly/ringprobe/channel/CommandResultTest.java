package net.spookly.ringprobe.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CommandResultTest {
    @Test
    void reasonFoldsOutputToOneLine() {
        CommandResult result = CommandResult.completed(255, "ssh: connect to host\r\nConnection refused\n");

        assertEquals("ssh: connect to host  Connection refused", result.reason());
    }

    @Test
    void reasonFallsBackToExitCode() {
        assertEquals("exit code 2", CommandResult.completed(2, "  ").reason());
    }

    @Test
    void reasonIsTruncated() {
        String reason = CommandResult.completed(1, "x".repeat(1000)).reason();

        assertTrue(reason.endsWith("..."));
        assertEquals(259, reason.length());
    }
}
