package net.spookly.ringprobe.probe;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.ringprobe.channel.ChannelException;
import net.spookly.ringprobe.channel.ChannelManager;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.channel.CommandResult;
import net.spookly.ringprobe.node.VantagePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a ping out across vantage points on a bounded pool.
 *
 * <p>Each point runs as its own task and every failure becomes a failed {@link ProbeResult} for
 * that point. Results land in a slot indexed by input position, so the returned set follows input
 * order whatever the completion order.
 */
public final class ProbeExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProbeExecutor.class);

    private static final int SSH_FAILURE_EXIT = 255;
    private static final long COLLECT_GRACE_MS = 2_000;

    private final ChannelManager channels;
    private final ProbeSettings settings;
    private final ExecutorService pool;

    public ProbeExecutor(ChannelManager channels, ProbeSettings settings) {
        this.channels = Objects.requireNonNull(channels, "channels");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pool = Executors.newFixedThreadPool(Math.max(1, settings.workers()), threadFactory());
    }

    /**
     * Probe {@code target} from every point. No retries.
     *
     * @throws IllegalArgumentException when the target is not a plain host name or IP literal
     */
    public ProbeResultSet probe(String target, List<VantagePoint> points, Duration perPointTimeout) {
        Objects.requireNonNull(target, "target");
        Duration timeout = perPointTimeout == null ? settings.perPointTimeout() : perPointTimeout;
        int size = points.size();
        String command = settings.pingCommand(target);
        ProbeResult[] slots = new ProbeResult[size];
        if (size == 0) {
            return new ProbeResultSet(target, List.of());
        }
        List<Future<ProbeResult>> futures = new ArrayList<>(size);
        long started = System.nanoTime();
        for (VantagePoint point : points) {
            try {
                futures.add(pool.submit(() -> probeOne(point, target, command, timeout)));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        // Points beyond the pool size queue behind earlier ones, so allow one timeout per wave.
        int waves = (size + Math.max(1, settings.workers()) - 1) / Math.max(1, settings.workers());
        long deadline = started + TimeUnit.MILLISECONDS.toNanos(timeout.toMillis() * waves + COLLECT_GRACE_MS);
        boolean interrupted = false;
        for (int i = 0; i < size; i++) {
            VantagePoint point = points.get(i);
            Future<ProbeResult> future = futures.get(i);
            if (future == null) {
                slots[i] = ProbeResult.failed(point, target, ProbeError.CHANNEL_UNAVAILABLE, "probe pool is shut down", 0);
                continue;
            }
            if (interrupted) {
                future.cancel(true);
                slots[i] = ProbeResult.failed(point, target, ProbeError.TIMEOUT, "probe interrupted", elapsedMs(started));
                continue;
            }
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                slots[i] = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                slots[i] = ProbeResult.failed(point, target, ProbeError.TIMEOUT,
                        "no result within " + timeout.toSeconds() + "s", elapsedMs(started));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Probe task for {} failed unexpectedly", point.id(), cause);
                slots[i] = ProbeResult.failed(point, target, ProbeError.CHANNEL_UNAVAILABLE,
                        String.valueOf(cause.getMessage()), elapsedMs(started));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                slots[i] = ProbeResult.failed(point, target, ProbeError.TIMEOUT, "probe interrupted", elapsedMs(started));
            }
        }
        ProbeResultSet resultSet = new ProbeResultSet(target, Arrays.asList(slots));
        log.info("Probe of {} from {} points: {} succeeded in {} ms",
                target, size, resultSet.successCount(), elapsedMs(started));
        return resultSet;
    }

    private ProbeResult probeOne(VantagePoint point, String target, String command, Duration timeout) {
        long started = System.nanoTime();
        ChannelStatus status = channels.status(point.id());
        if (!status.isProbeable()) {
            return ProbeResult.failed(point, target, ProbeError.CHANNEL_UNAVAILABLE,
                    "channel is " + status.name().toLowerCase(Locale.ROOT), 0);
        }
        CommandResult result;
        try {
            result = channels.execute(point.id(), command, timeout);
        } catch (ChannelException e) {
            return ProbeResult.failed(point, target, ProbeError.CHANNEL_UNAVAILABLE, e.getMessage(), elapsedMs(started));
        } catch (IOException e) {
            return ProbeResult.failed(point, target, ProbeError.CHANNEL_UNAVAILABLE,
                    "ssh could not run: " + e.getMessage(), elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed(point, target, ProbeError.TIMEOUT, "probe interrupted", elapsedMs(started));
        }
        ProbeResult probeResult = interpret(point, target, result, elapsedMs(started));
        if (!probeResult.success()) {
            log.debug("Probe of {} from {} failed: {} {}", target, point.id(), probeResult.error(), probeResult.detail());
        }
        return probeResult;
    }

    static ProbeResult interpret(VantagePoint point, String target, CommandResult result, long durationMs) {
        if (result.timedOut()) {
            return ProbeResult.failed(point, target, ProbeError.TIMEOUT, "command timed out", durationMs);
        }
        if (result.exitCode() == SSH_FAILURE_EXIT) {
            return ProbeResult.failed(point, target, ProbeError.CHANNEL_UNAVAILABLE, result.reason(), durationMs);
        }
        PingSummary summary;
        try {
            summary = PingOutputParser.parse(result.output());
        } catch (PingParseException e) {
            if (result.exitCode() != 0) {
                return ProbeResult.failed(point, target, ProbeError.NONZERO_EXIT,
                        "exit " + result.exitCode() + ": " + result.reason(), durationMs);
            }
            return ProbeResult.failed(point, target, ProbeError.UNPARSEABLE_OUTPUT, e.getMessage(), durationMs);
        }
        if (!summary.anyReceived()) {
            return ProbeResult.failed(point, target, ProbeError.NONZERO_EXIT, "no replies from target", summary, durationMs);
        }
        if (result.exitCode() != 0) {
            return ProbeResult.failed(point, target, ProbeError.NONZERO_EXIT, "exit " + result.exitCode(), summary, durationMs);
        }
        return ProbeResult.succeeded(point, target, summary, durationMs);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ringprobe-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
