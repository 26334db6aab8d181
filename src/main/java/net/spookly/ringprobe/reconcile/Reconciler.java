package net.spookly.ringprobe.reconcile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.ringprobe.cache.CacheStore;
import net.spookly.ringprobe.cache.RegistrySnapshot;
import net.spookly.ringprobe.cache.StorageWriteException;
import net.spookly.ringprobe.channel.ChannelError;
import net.spookly.ringprobe.channel.ChannelException;
import net.spookly.ringprobe.channel.ChannelManager;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.channel.HealthOutcome;
import net.spookly.ringprobe.config.RingProbeConfig;
import net.spookly.ringprobe.directory.ContinentLookup;
import net.spookly.ringprobe.directory.DirectoryEntry;
import net.spookly.ringprobe.directory.DirectoryService;
import net.spookly.ringprobe.directory.DirectorySyncException;
import net.spookly.ringprobe.node.NodeRegistry;
import net.spookly.ringprobe.node.RegistryDiff;
import net.spookly.ringprobe.node.VantagePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the registry and the channel table in line with the directory service.
 *
 * <p>Each cycle fetches the candidate list, swaps it into the registry, closes channels of retired
 * points, opens missing or unhealthy channels, health-checks healthy ones and persists a snapshot.
 * When the directory cannot be read, the channel work still runs over the points already known.
 * Cycles run on one scheduler thread; channel work fans out on a dedicated pool so it never
 * competes with probe requests.
 */
public final class Reconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final DirectoryService directory;
    private final ContinentLookup continents;
    private final NodeRegistry registry;
    private final ChannelManager channels;
    private final CacheStore cacheStore;
    private final int intervalSeconds;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> recoveredHosts = new LinkedHashSet<>();
    private volatile ReconcileReport lastCycle;
    private ScheduledFuture<?> scheduledTask;

    public Reconciler(DirectoryService directory,
                      ContinentLookup continents,
                      NodeRegistry registry,
                      ChannelManager channels,
                      CacheStore cacheStore,
                      int intervalSeconds,
                      int workerCount) {
        this(directory, continents, registry, channels, cacheStore, intervalSeconds, workerCount, Clock.systemUTC());
    }

    public Reconciler(DirectoryService directory,
                      ContinentLookup continents,
                      NodeRegistry registry,
                      ChannelManager channels,
                      CacheStore cacheStore,
                      int intervalSeconds,
                      int workerCount,
                      Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.continents = Objects.requireNonNull(continents, "continents");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.channels = Objects.requireNonNull(channels, "channels");
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore");
        this.intervalSeconds = intervalSeconds;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("ringprobe-reconciler"));
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), numberedThreadFactory());
    }

    /**
     * Build a reconciler with interval and pool size from config.
     */
    public static Reconciler fromConfig(RingProbeConfig config,
                                        DirectoryService directory,
                                        ContinentLookup continents,
                                        NodeRegistry registry,
                                        ChannelManager channels,
                                        CacheStore cacheStore) {
        int interval = 300;
        int workerCount = 50;
        if (config.reconcile != null) {
            if (config.reconcile.intervalSeconds != null) {
                interval = config.reconcile.intervalSeconds;
            }
            if (config.reconcile.workers != null) {
                workerCount = config.reconcile.workers;
            }
        }
        return new Reconciler(directory, continents, registry, channels, cacheStore, interval, workerCount);
    }

    /**
     * Restore from the snapshot, then reconcile at a fixed delay.
     */
    public synchronized void start() {
        if (stopped.get() || scheduledTask != null) {
            return;
        }
        scheduler.execute(this::restoreSafely);
        scheduledTask = scheduler.scheduleWithFixedDelay(this::runSafely, 0, Math.max(1, intervalSeconds), TimeUnit.SECONDS);
    }

    /**
     * Stop scheduling cycles and release the pools. Channels are left to their owner.
     */
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    public Optional<ReconcileReport> lastCycle() {
        return Optional.ofNullable(lastCycle);
    }

    /**
     * Serve from the last snapshot until the directory answers, and adopt live masters left by a
     * previous process.
     *
     * @return number of points restored from the snapshot
     */
    public int restore() {
        Set<String> live = channels.recoverControlSockets();
        Optional<RegistrySnapshot> snapshot = cacheStore.load();
        int restored = 0;
        if (snapshot.isPresent() && registry.size() == 0) {
            List<VantagePoint> points = snapshot.get().toPoints();
            registry.replaceAll(points);
            restored = points.size();
            log.info("Restored {} vantage points from snapshot v{}", restored, snapshot.get().version);
        }
        synchronized (recoveredHosts) {
            recoveredHosts.addAll(live);
        }
        adoptRecovered(false);
        return restored;
    }

    /**
     * Run one reconciliation cycle. Concurrent calls are skipped rather than queued.
     */
    public ReconcileReport runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Reconciliation already running, skipping");
            return lastCycle;
        }
        try {
            ReconcileReport report = reconcile();
            lastCycle = report;
            return report;
        } finally {
            running.set(false);
        }
    }

    private ReconcileReport reconcile() {
        Instant startedAt = clock.instant();
        long started = System.nanoTime();
        List<DirectoryEntry> entries;
        try {
            entries = directory.listVantagePoints();
            if (entries.isEmpty() && registry.size() > 0) {
                throw new DirectorySyncException("directory returned no vantage points");
            }
        } catch (DirectorySyncException e) {
            log.warn("Directory sync failed, keeping {} known vantage points: {}", registry.size(), e.getMessage());
            // Known points keep their channels maintained; the registry and snapshot stay as they are.
            adoptRecovered(false);
            ChannelTally tally = maintainChannels();
            ReconcileReport report = ReconcileReport.directoryFailed(startedAt, elapsedMs(started), e.getMessage(),
                    registry.size(), tally.opened.get(), tally.openFailed.get(), tally.checked.get(), tally.demoted.get());
            log.info("Maintained {} known vantage points without directory: {} healthy channels, {} opened, {} demoted",
                    report.nodes(), registry.count(ChannelStatus.HEALTHY), report.opened(), report.demoted());
            return report;
        }

        RegistryDiff diff = registry.replaceAll(toPoints(entries));
        adoptRecovered(true);

        Set<String> retired = new LinkedHashSet<>();
        for (VantagePoint point : diff.removed()) {
            retired.add(point.id());
        }
        for (String channelId : channels.statusSummary().keySet()) {
            if (registry.get(channelId).isEmpty()) {
                retired.add(channelId);
            }
        }
        List<Callable<Void>> closes = new ArrayList<>();
        for (String pointId : retired) {
            closes.add(() -> {
                channels.close(pointId);
                return null;
            });
        }
        runAll(closes);

        ChannelTally tally = maintainChannels();

        boolean persisted = persist();
        int healthy = registry.count(ChannelStatus.HEALTHY);
        ReconcileReport report = new ReconcileReport(
                startedAt,
                elapsedMs(started),
                true,
                null,
                registry.size(),
                diff.added().size(),
                diff.removed().size(),
                tally.opened.get(),
                tally.openFailed.get(),
                tally.checked.get(),
                tally.demoted.get(),
                persisted
        );
        log.info("Reconciled {} vantage points ({} added, {} removed): {} healthy channels, {} opened, {} open failures, {} demoted",
                report.nodes(), report.added(), report.removed(), healthy, report.opened(), report.openFailed(),
                report.demoted());
        return report;
    }

    /**
     * Open missing or unhealthy channels and health-check healthy ones for every registered point.
     */
    private ChannelTally maintainChannels() {
        ChannelTally tally = new ChannelTally();
        List<Callable<Void>> channelWork = new ArrayList<>();
        for (VantagePoint point : registry.list()) {
            channelWork.add(() -> {
                if (channels.status(point.id()) == ChannelStatus.HEALTHY) {
                    HealthOutcome outcome = channels.healthCheck(point.id());
                    tally.checked.incrementAndGet();
                    if (outcome == HealthOutcome.DEMOTED) {
                        tally.demoted.incrementAndGet();
                    }
                    return null;
                }
                try {
                    channels.open(point.id(), point.host());
                    if (channels.status(point.id()) == ChannelStatus.HEALTHY) {
                        tally.opened.incrementAndGet();
                    }
                } catch (ChannelException e) {
                    if (e.error() != ChannelError.COOLDOWN) {
                        tally.openFailed.incrementAndGet();
                        log.debug("Open failed for {}: {}", point.id(), e.getMessage());
                    }
                }
                return null;
            });
        }
        runAll(channelWork);
        return tally;
    }

    private boolean persist() {
        try {
            cacheStore.save(cacheStore.snapshotOf(registry.list()));
            return true;
        } catch (StorageWriteException e) {
            log.error("Failed to persist registry snapshot, continuing without it", e);
            return false;
        }
    }

    private List<VantagePoint> toPoints(List<DirectoryEntry> entries) {
        List<VantagePoint> points = new ArrayList<>(entries.size());
        for (DirectoryEntry entry : entries) {
            points.add(new VantagePoint(
                    entry.id(),
                    entry.host() == null ? entry.id() : entry.host(),
                    entry.asn(),
                    entry.city(),
                    entry.countryCode(),
                    continents.continentFor(entry.countryCode()),
                    entry.company(),
                    ChannelStatus.UNKNOWN
            ));
        }
        return points;
    }

    /**
     * Adopt recovered masters whose host is a known point. With {@code closeUnknown}, masters for
     * hosts that the fresh listing does not contain are shut down.
     */
    private void adoptRecovered(boolean closeUnknown) {
        synchronized (recoveredHosts) {
            if (recoveredHosts.isEmpty()) {
                return;
            }
            List<String> remaining = new ArrayList<>();
            for (String host : recoveredHosts) {
                Optional<VantagePoint> point = findByHost(host);
                if (point.isPresent()) {
                    channels.adopt(point.get().id(), host);
                } else if (closeUnknown) {
                    channels.adopt(host, host);
                    channels.close(host);
                } else {
                    remaining.add(host);
                }
            }
            recoveredHosts.clear();
            recoveredHosts.addAll(remaining);
        }
    }

    private Optional<VantagePoint> findByHost(String host) {
        for (VantagePoint point : registry.list()) {
            if (host.equals(point.host())) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    private void runAll(List<Callable<Void>> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        List<Future<Void>> futures;
        try {
            futures = workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.warn("Reconcile task failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void restoreSafely() {
        try {
            restore();
        } catch (RuntimeException e) {
            log.error("Startup restore failed", e);
        }
    }

    private void runSafely() {
        if (stopped.get()) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Reconciliation cycle failed", e);
        }
    }

    private static final class ChannelTally {
        private final AtomicInteger opened = new AtomicInteger();
        private final AtomicInteger openFailed = new AtomicInteger();
        private final AtomicInteger checked = new AtomicInteger();
        private final AtomicInteger demoted = new AtomicInteger();
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private static ThreadFactory threadFactory(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private static ThreadFactory numberedThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ringprobe-reconcile-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
