package net.spookly.ringprobe.node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.ringprobe.channel.ChannelStatus;
import org.junit.jupiter.api.Test;

class NodeRegistryTest {
    private final List<RegistryEvent> events = new ArrayList<>();
    private final NodeRegistry registry = new NodeRegistry(events::add, new Random(7),
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void replaceAllKeepsStatusOfRetainedPoints() {
        registry.replaceAll(List.of(point("a01.ring.nlnog.net", "NL"), point("b01.ring.nlnog.net", "DE")));
        registry.updateStatus("a01.ring.nlnog.net", ChannelStatus.HEALTHY);

        RegistryDiff diff = registry.replaceAll(List.of(
                point("a01.ring.nlnog.net", "NL"),
                point("c01.ring.nlnog.net", "US").withStatus(ChannelStatus.HEALTHY)
        ));

        assertEquals(1, diff.added().size());
        assertEquals(1, diff.retained().size());
        assertEquals("b01.ring.nlnog.net", diff.removed().get(0).id());
        assertEquals(ChannelStatus.HEALTHY, registry.get("a01.ring.nlnog.net").orElseThrow().channelStatus());
        assertEquals(ChannelStatus.UNKNOWN, registry.get("c01.ring.nlnog.net").orElseThrow().channelStatus());
        assertFalse(registry.get("b01.ring.nlnog.net").isPresent());
        assertEquals(2, registry.size());
    }

    @Test
    void replaceAllIgnoresDuplicateIds() {
        RegistryDiff diff = registry.replaceAll(List.of(point("a01", "NL"), point("a01", "DE")));

        assertEquals(1, diff.added().size());
        assertEquals("NL", registry.get("a01").orElseThrow().countryCode());
    }

    @Test
    void emitsEventsForChanges() {
        registry.replaceAll(List.of(point("a01", "NL")));
        registry.updateStatus("a01", ChannelStatus.HEALTHY);
        registry.updateStatus("a01", ChannelStatus.HEALTHY);
        registry.replaceAll(List.of());

        assertEquals(3, events.size());
        assertEquals(RegistryEventType.ADDED, events.get(0).type());
        assertEquals(RegistryEventType.STATUS_CHANGED, events.get(1).type());
        assertEquals(ChannelStatus.UNKNOWN, events.get(1).previousStatus());
        assertEquals(RegistryEventType.REMOVED, events.get(2).type());
        assertEquals(ChannelStatus.HEALTHY, events.get(2).previousStatus());
    }

    @Test
    void updateStatusIgnoresUnknownPoints() {
        assertFalse(registry.updateStatus("ghost", ChannelStatus.HEALTHY));
        assertEquals(0, registry.size());
    }

    @Test
    void filterReturnsOnlyHealthyMatches() {
        registry.replaceAll(List.of(point("a01", "NL"), point("a02", "nl"), point("b01", "DE")));
        registry.updateStatus("a01", ChannelStatus.HEALTHY);
        registry.updateStatus("b01", ChannelStatus.HEALTHY);
        FilterCriteria netherlands = FilterCriteria.builder().accept(FilterField.COUNTRY_CODE, "NL").build();

        List<VantagePoint> healthy = registry.filter(netherlands);
        List<VantagePoint> all = registry.filterAll(netherlands);

        assertEquals(List.of("a01"), ids(healthy));
        assertEquals(List.of("a01", "a02"), ids(all));
        assertEquals(2, registry.count(ChannelStatus.HEALTHY));
    }

    @Test
    void distinctValuesCoverHealthyPoints() {
        registry.replaceAll(List.of(point("a01", "NL"), point("b01", "DE"), point("c01", "US")));
        registry.updateStatus("a01", ChannelStatus.HEALTHY);
        registry.updateStatus("b01", ChannelStatus.HEALTHY);

        Map<FilterField, SortedSet<String>> values = registry.distinctFilterValues();

        assertEquals(List.of("DE", "NL"), new ArrayList<>(values.get(FilterField.COUNTRY_CODE)));
        assertEquals(List.of("a01", "b01"), new ArrayList<>(values.get(FilterField.NODE)));
        assertTrue(values.get(FilterField.CONTINENT).contains("Europe"));
    }

    @Test
    void readersNeverObserveAPartialReplacement() throws Exception {
        List<VantagePoint> first = new ArrayList<>();
        List<VantagePoint> second = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            first.add(point("first" + i, "NL"));
            second.add(point("second" + i, "DE"));
        }
        registry.replaceAll(first);
        AtomicBoolean torn = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService readers = Executors.newFixedThreadPool(4);
        for (int r = 0; r < 4; r++) {
            readers.submit(() -> {
                while (done.getCount() > 0) {
                    List<VantagePoint> seen = registry.list();
                    long firstCount = seen.stream().filter(p -> p.id().startsWith("first")).count();
                    if (seen.size() != 200 || (firstCount != 0 && firstCount != 200)) {
                        torn.set(true);
                    }
                }
            });
        }
        for (int i = 0; i < 200; i++) {
            registry.replaceAll(i % 2 == 0 ? second : first);
        }
        done.countDown();
        readers.shutdown();
        assertTrue(readers.awaitTermination(5, TimeUnit.SECONDS));

        assertFalse(torn.get());
    }

    private static List<String> ids(List<VantagePoint> points) {
        List<String> ids = new ArrayList<>();
        for (VantagePoint point : points) {
            ids.add(point.id());
        }
        return ids;
    }

    private static VantagePoint point(String id, String countryCode) {
        return new VantagePoint(id, id, 1103, "Amsterdam", countryCode, "Europe", "SURF", ChannelStatus.UNKNOWN);
    }
}
