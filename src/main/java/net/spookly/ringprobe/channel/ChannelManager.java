package net.spookly.ringprobe.channel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one multiplexed SSH channel (an OpenSSH ControlMaster) per vantage point.
 *
 * <p>Channel records are mutated only under their own monitor, and every status transition is
 * published to the {@link ChannelStatusListener} while that monitor is held, so listeners observe
 * transitions for one point in order. Blocking ssh invocations never run while a monitor is held.
 */
public final class ChannelManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    private static final String HEALTH_COMMAND = "true";
    private static final Duration OPEN_GRACE = Duration.ofSeconds(2);
    private static final Duration TEARDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final ChannelSettings settings;
    private final SshCommands commands;
    private final CommandRunner runner;
    private final ChannelStatusListener listener;
    private final Clock clock;
    private final Semaphore openPermits;
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> pendingTeardowns = new ConcurrentHashMap<>();
    private final ExecutorService reaper = Executors.newSingleThreadExecutor(threadFactory());
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ChannelManager(ChannelSettings settings, CommandRunner runner, ChannelStatusListener listener) {
        this(settings, runner, listener, Clock.systemUTC());
    }

    public ChannelManager(ChannelSettings settings,
                          CommandRunner runner,
                          ChannelStatusListener listener,
                          Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.listener = listener == null ? ChannelStatusListener.NOOP : listener;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.commands = new SshCommands(settings);
        this.openPermits = new Semaphore(Math.max(1, settings.maxConcurrentOpens()), true);
    }

    /**
     * Establish the channel for a point. A healthy or already connecting channel is left untouched.
     *
     * @throws ChannelException when the channel is cooling down after a demotion, or the master
     *                          could not be started
     */
    public void open(String pointId, String host) {
        if (closed.get()) {
            throw new ChannelException(ChannelError.UNAVAILABLE, pointId, "Channel manager is closed");
        }
        Channel channel = channels.computeIfAbsent(pointId, id -> new Channel(id, host, commands.controlPath(host)));
        synchronized (channel) {
            ChannelStatus current = channel.status();
            if (current == ChannelStatus.HEALTHY || current == ChannelStatus.CONNECTING) {
                return;
            }
            if (current == ChannelStatus.CLOSED) {
                throw new ChannelException(ChannelError.UNAVAILABLE, pointId, "Channel closed while opening");
            }
            if (channel.coolingDown(clock.instant(), settings.cooldown())) {
                throw new ChannelException(ChannelError.COOLDOWN, pointId,
                        "Channel to " + pointId + " is cooling down after demotion");
            }
            channel.status(ChannelStatus.CONNECTING);
            publish(pointId, ChannelStatus.CONNECTING);
        }
        awaitPendingTeardown(pointId);

        CommandResult result;
        try {
            Path socketDirectory = Path.of(channel.controlPath()).getParent();
            if (socketDirectory != null) {
                Files.createDirectories(socketDirectory);
            }
            openPermits.acquire();
            try {
                result = runner.run(commands.openMaster(channel.host()), settings.connectTimeout().plus(OPEN_GRACE));
            } finally {
                openPermits.release();
            }
        } catch (IOException e) {
            markOpenFailed(channel);
            throw new ChannelException(ChannelError.CONNECT_FAILED, pointId,
                    "Failed to start ssh for " + pointId + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markOpenFailed(channel);
            throw new ChannelException(ChannelError.INTERRUPTED, pointId, "Interrupted while opening " + pointId, e);
        } catch (RuntimeException e) {
            markOpenFailed(channel);
            throw new ChannelException(ChannelError.CONNECT_FAILED, pointId,
                    "Failed to start ssh for " + pointId + ": " + e.getMessage(), e);
        }

        if (result.succeeded()) {
            boolean orphaned;
            synchronized (channel) {
                orphaned = channel.status() == ChannelStatus.CLOSED;
                if (!orphaned) {
                    channel.markHealthy(clock.instant());
                    publish(pointId, ChannelStatus.HEALTHY);
                }
            }
            if (orphaned) {
                teardown(channel);
                return;
            }
            log.debug("Channel to {} is healthy", pointId);
            return;
        }
        markOpenFailed(channel);
        ChannelError error = result.timedOut() || result.reason().contains("timed out")
                ? ChannelError.CONNECT_TIMEOUT
                : ChannelError.CONNECT_FAILED;
        throw new ChannelException(error, pointId, "Failed to open channel to " + pointId + ": " + result.reason());
    }

    /**
     * Check that the master is still alive, then run a trivial command through it, and update the
     * channel's failure accounting.
     *
     * <p>With a dead control socket ssh falls back to a direct connection, so the master is checked
     * before the command runs.
     */
    public HealthOutcome healthCheck(String pointId) {
        Channel channel = channels.get(pointId);
        if (channel == null || channel.status() != ChannelStatus.HEALTHY) {
            return HealthOutcome.UNAVAILABLE;
        }
        CommandResult result = null;
        String failure;
        try {
            CommandResult master = runner.run(commands.check(channel.host()), settings.commandTimeout());
            if (master.succeeded()) {
                result = runner.run(commands.exec(channel.host(), HEALTH_COMMAND), settings.commandTimeout());
                failure = result.succeeded() ? null : result.reason();
            } else {
                failure = "master not running: " + master.reason();
            }
        } catch (IOException e) {
            failure = e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthOutcome.UNAVAILABLE;
        }

        Instant now = clock.instant();
        int failures;
        synchronized (channel) {
            if (channel.status() != ChannelStatus.HEALTHY) {
                return HealthOutcome.UNAVAILABLE;
            }
            if (result != null && result.succeeded()) {
                channel.markHealthy(now);
                return HealthOutcome.HEALTHY;
            }
            failures = channel.recordFailure(now);
            if (failures < settings.failureThreshold()) {
                log.debug("Health check {}/{} failed for {}: {}",
                        failures, settings.failureThreshold(), pointId, failure);
                return HealthOutcome.FAILED;
            }
            channel.demote(now);
            publish(pointId, ChannelStatus.UNHEALTHY);
        }
        log.warn("Channel to {} demoted after {} consecutive failed health checks: {}", pointId, failures, failure);
        scheduleTeardown(channel);
        return HealthOutcome.DEMOTED;
    }

    /**
     * Tear down the channel and forget it. Safe to call for unknown points and more than once.
     */
    public void close(String pointId) {
        Channel channel = channels.remove(pointId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            channel.status(ChannelStatus.CLOSED);
            publish(pointId, ChannelStatus.CLOSED);
        }
        teardown(channel);
        log.debug("Channel to {} closed", pointId);
    }

    /**
     * Current status without blocking; {@link ChannelStatus#UNKNOWN} for points with no channel.
     */
    public ChannelStatus status(String pointId) {
        Channel channel = channels.get(pointId);
        return channel == null ? ChannelStatus.UNKNOWN : channel.status();
    }

    public Map<String, ChannelStatus> statusSummary() {
        Map<String, ChannelStatus> summary = new TreeMap<>();
        for (Channel channel : channels.values()) {
            summary.put(channel.pointId(), channel.status());
        }
        return summary;
    }

    public Optional<ChannelSnapshot> describe(String pointId) {
        Channel channel = channels.get(pointId);
        if (channel == null) {
            return Optional.empty();
        }
        synchronized (channel) {
            return Optional.of(channel.snapshot());
        }
    }

    public List<ChannelSnapshot> snapshots() {
        List<ChannelSnapshot> snapshots = new ArrayList<>();
        for (Channel channel : channels.values()) {
            synchronized (channel) {
                snapshots.add(channel.snapshot());
            }
        }
        snapshots.sort((a, b) -> a.pointId().compareTo(b.pointId()));
        return snapshots;
    }

    /**
     * Run a command on the point through its healthy channel.
     *
     * @throws ChannelException with {@link ChannelError#UNAVAILABLE} when no healthy channel exists
     */
    public CommandResult execute(String pointId, String remoteCommand, Duration timeout)
            throws IOException, InterruptedException {
        Channel channel = channels.get(pointId);
        if (channel == null || !channel.status().isProbeable()) {
            throw new ChannelException(ChannelError.UNAVAILABLE, pointId, "No healthy channel for " + pointId);
        }
        return runner.run(commands.exec(channel.host(), remoteCommand), timeout);
    }

    /**
     * Sweep control sockets left by a previous process.
     *
     * @return hosts with a live master that can be adopted
     */
    public Set<String> recoverControlSockets() {
        try {
            return new ControlSocketSweeper(settings, commands, runner).sweep();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.emptySet();
        }
    }

    /**
     * Register a recovered live master as a healthy channel.
     *
     * @return true when the channel was adopted
     */
    public boolean adopt(String pointId, String host) {
        if (closed.get()) {
            return false;
        }
        Channel channel = channels.computeIfAbsent(pointId, id -> new Channel(id, host, commands.controlPath(host)));
        synchronized (channel) {
            ChannelStatus current = channel.status();
            if (current == ChannelStatus.HEALTHY || current == ChannelStatus.CLOSED) {
                return false;
            }
            channel.markHealthy(clock.instant());
            publish(pointId, ChannelStatus.HEALTHY);
        }
        return true;
    }

    public int size() {
        return channels.size();
    }

    /**
     * Close every channel and stop the reaper.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (String pointId : new ArrayList<>(channels.keySet())) {
            close(pointId);
        }
        reaper.shutdown();
        try {
            if (!reaper.awaitTermination(TEARDOWN_TIMEOUT.toSeconds() * 2, TimeUnit.SECONDS)) {
                reaper.shutdownNow();
            }
        } catch (InterruptedException e) {
            reaper.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void markOpenFailed(Channel channel) {
        synchronized (channel) {
            if (channel.status() == ChannelStatus.CLOSED) {
                return;
            }
            Instant now = clock.instant();
            channel.recordFailure(now);
            channel.demote(now);
            publish(channel.pointId(), ChannelStatus.UNHEALTHY);
        }
    }

    private void scheduleTeardown(Channel channel) {
        try {
            Future<?> pending = reaper.submit(() -> teardown(channel));
            pendingTeardowns.put(channel.pointId(), pending);
        } catch (RejectedExecutionException e) {
            teardown(channel);
        }
    }

    private void awaitPendingTeardown(String pointId) {
        Future<?> pending = pendingTeardowns.remove(pointId);
        if (pending == null) {
            return;
        }
        try {
            pending.get(TEARDOWN_TIMEOUT.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Teardown of {} did not finish cleanly before reopen: {}", pointId, e.toString());
        }
    }

    private void teardown(Channel channel) {
        try {
            CommandResult result = runner.run(commands.exit(channel.host()), TEARDOWN_TIMEOUT);
            if (!result.succeeded()) {
                log.debug("ssh -O exit for {} returned: {}", channel.pointId(), result.reason());
            }
        } catch (IOException e) {
            log.debug("ssh -O exit for {} could not run: {}", channel.pointId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            Files.deleteIfExists(Path.of(channel.controlPath()));
        } catch (IOException e) {
            log.debug("Failed to remove control socket {}: {}", channel.controlPath(), e.getMessage());
        }
    }

    private void publish(String pointId, ChannelStatus status) {
        try {
            listener.onStatus(pointId, status);
        } catch (RuntimeException e) {
            log.warn("Channel status listener failed for {}: {}", pointId, e.getMessage());
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "ringprobe-channel-reaper");
            thread.setDaemon(true);
            return thread;
        };
    }
}
