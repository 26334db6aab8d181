package net.spookly.ringprobe.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.ringprobe.cache.CacheStore;
import net.spookly.ringprobe.channel.ChannelManager;
import net.spookly.ringprobe.channel.ChannelSettings;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.channel.CommandResult;
import net.spookly.ringprobe.channel.CommandRunner;
import net.spookly.ringprobe.directory.ContinentLookup;
import net.spookly.ringprobe.directory.DirectoryEntry;
import net.spookly.ringprobe.directory.DirectoryService;
import net.spookly.ringprobe.directory.DirectorySyncException;
import net.spookly.ringprobe.node.FilterCriteria;
import net.spookly.ringprobe.node.NodeRegistry;
import net.spookly.ringprobe.node.VantagePoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReconcilerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final StubDirectory directory = new StubDirectory();
    private final StubRunner runner = new StubRunner();
    private final NodeRegistry registry = new NodeRegistry();
    private final List<String> transitions = Collections.synchronizedList(new ArrayList<>());
    private final ContinentLookup continents = new ContinentLookup(Map.of("NL", "Europe", "DE", "Europe", "US", "North America"));
    private ChannelManager channels;
    private Reconciler reconciler;

    @AfterEach
    void tearDown() {
        if (reconciler != null) {
            reconciler.close();
        }
        if (channels != null) {
            channels.close();
        }
    }

    @Test
    void cycleAddsRetainsAndRetiresPoints() {
        newReconciler(tempDir.resolve("node_cache.json"));
        directory.entries = List.of(entry("a01", "NL"), entry("c01", "US"));
        reconciler.runOnce();
        assertEquals(ChannelStatus.HEALTHY, channels.status("a01"));
        assertEquals(ChannelStatus.HEALTHY, channels.status("c01"));
        transitions.clear();

        directory.entries = List.of(entry("a01", "NL"), entry("b01", "DE"));
        ReconcileReport report = reconciler.runOnce();

        assertTrue(report.directorySynced());
        assertEquals(1, report.added());
        assertEquals(1, report.removed());
        assertEquals(1, report.checked());
        assertEquals(1, report.opened());
        assertTrue(report.persisted());
        assertEquals(ChannelStatus.HEALTHY, registry.get("a01").orElseThrow().channelStatus());
        assertEquals(ChannelStatus.HEALTHY, registry.get("b01").orElseThrow().channelStatus());
        assertEquals("Europe", registry.get("b01").orElseThrow().continent());
        assertFalse(registry.get("c01").isPresent());
        assertEquals(ChannelStatus.UNKNOWN, channels.status("c01"));
        assertTrue(transitions.contains("c01:CLOSED"));
        assertTrue(transitions.indexOf("b01:CONNECTING") < transitions.indexOf("b01:HEALTHY"));
        assertFalse(transitions.contains("a01:CONNECTING"));
        assertTrue(runner.healthChecks.contains("a01"));
    }

    @Test
    void failedOpenLeavesPointUnhealthy() {
        newReconciler(tempDir.resolve("node_cache.json"));
        runner.unreachable.add("b01");
        directory.entries = List.of(entry("a01", "NL"), entry("b01", "DE"));

        ReconcileReport report = reconciler.runOnce();

        assertEquals(1, report.opened());
        assertEquals(1, report.openFailed());
        assertEquals(ChannelStatus.UNHEALTHY, registry.get("b01").orElseThrow().channelStatus());

        ReconcileReport next = reconciler.runOnce();
        assertEquals(0, next.openFailed());
        assertEquals(ChannelStatus.UNHEALTHY, channels.status("b01"));
    }

    @Test
    void directoryFailureKeepsKnownPoints() {
        newReconciler(tempDir.resolve("node_cache.json"));
        directory.entries = List.of(entry("a01", "NL"));
        reconciler.runOnce();

        directory.failure = new DirectorySyncException("Request to nodes returned status 502");
        ReconcileReport failed = reconciler.runOnce();

        assertFalse(failed.directorySynced());
        assertEquals(1, failed.nodes());
        assertTrue(registry.get("a01").isPresent());
        assertEquals(ChannelStatus.HEALTHY, channels.status("a01"));
        assertEquals(failed, reconciler.lastCycle().orElseThrow());
    }

    @Test
    void emptyListingIsTreatedAsFailure() {
        newReconciler(tempDir.resolve("node_cache.json"));
        directory.entries = List.of(entry("a01", "NL"));
        reconciler.runOnce();

        directory.entries = List.of();
        ReconcileReport report = reconciler.runOnce();

        assertFalse(report.directorySynced());
        assertEquals(1, registry.size());
    }

    @Test
    void storageFailureDoesNotStopTheCycle() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        newReconciler(blocker.resolve("node_cache.json"));
        directory.entries = List.of(entry("a01", "NL"));

        ReconcileReport report = reconciler.runOnce();

        assertTrue(report.directorySynced());
        assertFalse(report.persisted());
        assertEquals(ChannelStatus.HEALTHY, channels.status("a01"));
    }

    @Test
    void restoreServesSnapshotAndAdoptsLiveMasters() throws IOException {
        Path cachePath = tempDir.resolve("node_cache.json");
        CacheStore seed = new CacheStore(cachePath, CLOCK);
        seed.save(seed.snapshotOf(List.of(
                new VantagePoint("a01", "a01", 1103, "Amsterdam", "NL", "Europe", "SURF", ChannelStatus.HEALTHY),
                new VantagePoint("b01", "b01", 3320, "Berlin", "DE", "Europe", "DTAG", ChannelStatus.HEALTHY)
        )));
        Path controlDir = Files.createDirectories(tempDir.resolve("cm"));
        Files.createFile(controlDir.resolve("ringprobe-a01"));
        Files.createFile(controlDir.resolve("ringprobe-gone01"));
        newReconciler(cachePath);

        int restored = reconciler.restore();

        assertEquals(2, restored);
        assertEquals(2, registry.size());
        assertEquals(ChannelStatus.HEALTHY, channels.status("a01"));
        assertEquals(ChannelStatus.UNKNOWN, registry.get("b01").orElseThrow().channelStatus());
        assertFalse(Files.exists(controlDir.resolve("ringprobe-gone01")));
    }

    @Test
    void restartWithDirectoryDownOpensChannelsForSnapshotPoints() throws IOException {
        Path cachePath = tempDir.resolve("node_cache.json");
        CacheStore seed = new CacheStore(cachePath, CLOCK);
        seed.save(seed.snapshotOf(List.of(
                new VantagePoint("a01", "a01", 1103, "Amsterdam", "NL", "Europe", "SURF", ChannelStatus.HEALTHY),
                new VantagePoint("b01", "b01", 3320, "Berlin", "DE", "Europe", "DTAG", ChannelStatus.HEALTHY)
        )));
        Path snapshotBefore = Files.copy(cachePath, tempDir.resolve("before.json"));
        directory.failure = new DirectorySyncException("Request to nodes failed: Connection refused");
        newReconciler(cachePath);

        reconciler.restore();
        ReconcileReport first = reconciler.runOnce();
        ReconcileReport second = reconciler.runOnce();

        assertFalse(first.directorySynced());
        assertEquals(2, first.opened());
        assertFalse(first.persisted());
        assertEquals(2, second.checked());
        assertEquals(2, registry.filter(FilterCriteria.none()).size());
        assertEquals(ChannelStatus.HEALTHY, channels.status("b01"));
        assertEquals(Files.readString(snapshotBefore), Files.readString(cachePath));
    }

    private void newReconciler(Path cachePath) {
        ChannelSettings settings = new ChannelSettings("rise", null, tempDir.resolve("cm").resolve("ringprobe-%h").toString(),
                Duration.ofSeconds(5), Duration.ofSeconds(5), 10, 3, Duration.ofSeconds(120));
        channels = new ChannelManager(settings, runner, (pointId, status) -> {
            transitions.add(pointId + ":" + status);
            registry.onStatus(pointId, status);
        }, CLOCK);
        reconciler = new Reconciler(directory, continents, registry, channels, new CacheStore(cachePath, CLOCK),
                300, 4, CLOCK);
    }

    private static DirectoryEntry entry(String id, String countryCode) {
        return new DirectoryEntry(id, id, 64500, "City", countryCode, "Example");
    }

    private static final class StubDirectory implements DirectoryService {
        private volatile List<DirectoryEntry> entries = List.of();
        private volatile DirectorySyncException failure;

        @Override
        public List<DirectoryEntry> listVantagePoints() throws DirectorySyncException {
            if (failure != null) {
                throw failure;
            }
            return entries;
        }
    }

    /**
     * Opens succeed unless the host is unreachable. Control checks find a master alive for a01 and for
     * every host opened since.
     */
    private static final class StubRunner implements CommandRunner {
        private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
        private final Set<String> masters = ConcurrentHashMap.newKeySet();
        private final List<String> healthChecks = Collections.synchronizedList(new ArrayList<>());

        private StubRunner() {
            masters.add("a01");
        }

        @Override
        public CommandResult run(List<String> command, Duration timeout) {
            String host = command.get(command.size() - 1);
            if (command.contains("-MNf")) {
                if (unreachable.contains(host)) {
                    return CommandResult.completed(255, "ssh: connect to host " + host + " port 22: No route to host");
                }
                masters.add(host);
                return CommandResult.completed(0, "");
            }
            if (command.contains("-O")) {
                if (command.contains("exit")) {
                    masters.remove(host);
                    return CommandResult.completed(0, "Exit request sent.");
                }
                return masters.contains(host)
                        ? CommandResult.completed(0, "Master running")
                        : CommandResult.completed(255, "Control socket connect: Connection refused");
            }
            healthChecks.add(command.get(command.size() - 2));
            return CommandResult.completed(0, "");
        }
    }
}
