package net.spookly.ringprobe.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import net.spookly.ringprobe.channel.ChannelManager;
import net.spookly.ringprobe.channel.ChannelSettings;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.channel.CommandResult;
import net.spookly.ringprobe.node.FilterCriteria;
import net.spookly.ringprobe.node.FilterField;
import net.spookly.ringprobe.node.NodeRegistry;
import net.spookly.ringprobe.node.VantagePoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProbeServiceTest {
    @TempDir
    Path tempDir;

    private final NodeRegistry registry = new NodeRegistry();
    private ChannelManager channels;
    private ProbeExecutor executor;
    private ProbeService service;

    @BeforeEach
    void setUp() {
        ChannelSettings settings = new ChannelSettings("rise", null, tempDir.resolve("cm-%h").toString(),
                Duration.ofSeconds(5), Duration.ofSeconds(5), 10, 3, Duration.ofSeconds(120));
        channels = new ChannelManager(settings, (command, timeout) -> CommandResult.completed(0, ""), registry);
        executor = new ProbeExecutor(channels, new ProbeSettings(1, 1, 4, Duration.ofSeconds(5)));
        service = new ProbeService(registry, channels, executor);
        registry.replaceAll(List.of(
                point("nl1", "NL"), point("nl2", "NL"), point("nl3", "NL"),
                point("de1", "DE"), point("us1", "US")
        ));
    }

    @AfterEach
    void tearDown() {
        executor.close();
        channels.close();
    }

    @Test
    void resolvesOnlyHealthyMatches() {
        channels.open("nl1", "nl1");
        channels.open("de1", "de1");

        List<VantagePoint> nodes = service.resolveNodes(FilterCriteria.none(), null);

        assertEquals(2, nodes.size());
        assertTrue(nodes.stream().allMatch(point -> point.channelStatus() == ChannelStatus.HEALTHY));
    }

    @Test
    void limitBalancesAcrossRequestedCountries() {
        for (VantagePoint point : registry.list()) {
            channels.open(point.id(), point.host());
        }
        FilterCriteria criteria = FilterCriteria.builder().accept(FilterField.COUNTRY_CODE, "NL", "DE").build();

        List<VantagePoint> nodes = service.resolveNodes(criteria, 2);

        assertEquals(2, nodes.size());
        assertEquals(1, nodes.stream().filter(point -> point.countryCode().equals("DE")).count());
    }

    @Test
    void rejectsNonPositiveLimit() {
        channels.open("nl1", "nl1");
        channels.open("nl2", "nl2");

        assertThrows(IllegalArgumentException.class, () -> service.resolveNodes(FilterCriteria.none(), 0));
    }

    @Test
    void healthNeedsAtLeastOneHealthyChannel() {
        assertFalse(service.healthSummary().healthy());

        channels.open("us1", "us1");

        HealthSummary health = service.healthSummary();
        assertTrue(health.healthy());
        assertEquals(5, health.nodes());
        assertEquals(1, health.healthyChannels());
        assertEquals(Map.of("us1", ChannelStatus.HEALTHY), service.channelStatusSummary());
        assertEquals(List.of("US"), service.distinctFilterValues().get("countrycode"));
    }

    private static VantagePoint point(String id, String countryCode) {
        return new VantagePoint(id, id, 64500, "City", countryCode, "Europe", "Example", ChannelStatus.UNKNOWN);
    }
}
