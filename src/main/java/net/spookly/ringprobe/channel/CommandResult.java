package net.spookly.ringprobe.channel;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Outcome of one local command run.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CommandResult {
    private static final int MAX_REASON_CHARS = 256;

    private final int exitCode;
    private final String output;
    private final boolean timedOut;

    public static CommandResult completed(int exitCode, String output) {
        return new CommandResult(exitCode, output == null ? "" : output, false);
    }

    public static CommandResult timedOut(String partialOutput) {
        return new CommandResult(-1, partialOutput == null ? "" : partialOutput, true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Short single-line description of a failure, for logs and error details.
     */
    public String reason() {
        if (timedOut) {
            return "timed out";
        }
        String normalized = output.replace('\r', ' ').replace('\n', ' ').strip();
        if (normalized.isEmpty()) {
            return "exit code " + exitCode;
        }
        if (normalized.length() > MAX_REASON_CHARS) {
            normalized = normalized.substring(0, MAX_REASON_CHARS) + "...";
        }
        return normalized;
    }
}
