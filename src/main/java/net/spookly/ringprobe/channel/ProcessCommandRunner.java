package net.spookly.ringprobe.channel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is drained on a separate thread so a chatty command cannot block on a full pipe. A
 * backgrounded ssh master may keep the pipe open after the foreground process exits, so draining
 * after exit is bounded too.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private static final int MAX_OUTPUT_BYTES = 64 * 1024;
    private static final long DRAIN_AFTER_EXIT_MS = 500;
    private static final long KILL_WAIT_MS = 1_000;

    private final ExecutorService drainers = Executors.newCachedThreadPool(threadFactory());

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command is required");
        }
        ProcessBuilder builder = new ProcessBuilder(new ArrayList<>(command));
        builder.redirectErrorStream(true);
        Process process = builder.start();
        process.getOutputStream().close();
        OutputCollector collector = new OutputCollector(process.getInputStream());
        Future<?> drain = drainers.submit(collector);
        try {
            boolean finished = process.waitFor(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(KILL_WAIT_MS, TimeUnit.MILLISECONDS);
                awaitDrain(drain);
                return CommandResult.timedOut(collector.snapshot());
            }
            awaitDrain(drain);
            return CommandResult.completed(process.exitValue(), collector.snapshot());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private void awaitDrain(Future<?> drain) throws InterruptedException {
        try {
            drain.get(DRAIN_AFTER_EXIT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Output drain still running after process exit, continuing with partial output");
        } catch (ExecutionException e) {
            log.debug("Output drain failed", e.getCause());
        }
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ringprobe-output-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class OutputCollector implements Runnable {
        private final InputStream input;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        private OutputCollector(InputStream input) {
            this.input = input;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[4096];
            try (InputStream in = input) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = MAX_OUTPUT_BYTES - buffer.size();
                        if (room > 0) {
                            buffer.write(chunk, 0, Math.min(room, read));
                        }
                    }
                }
            } catch (IOException e) {
                // Stream closed by process teardown; keep what was read.
                log.trace("Output stream closed", e);
            }
        }

        private String snapshot() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
