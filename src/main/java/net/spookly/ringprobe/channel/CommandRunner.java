package net.spookly.ringprobe.channel;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs a local command (an ssh invocation) with a hard time bound.
 */
public interface CommandRunner {
    /**
     * Run the command, killing it when the timeout elapses.
     *
     * @return the exit status and combined stdout/stderr, or a timed-out result
     * @throws IOException when the process cannot be started
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
