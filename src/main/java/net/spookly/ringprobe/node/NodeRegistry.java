package net.spookly.ringprobe.node;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeSet;

import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.channel.ChannelStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative in-memory set of vantage points.
 *
 * <p>Reads go against an immutable map published through a volatile field and never lock. Writers
 * serialize on one lock, build a modified copy and publish it in a single write, so a reader sees
 * either the set before a replacement or the set after it.
 */
public final class NodeRegistry implements ChannelStatusListener {
    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Object writeLock = new Object();
    private final RegistryEventListener eventListener;
    private final Random random;
    private final Clock clock;
    private volatile Map<String, VantagePoint> points = Collections.emptyMap();

    public NodeRegistry() {
        this(RegistryEventListener.NOOP);
    }

    public NodeRegistry(RegistryEventListener eventListener) {
        this(eventListener, new Random(), Clock.systemUTC());
    }

    /**
     * Create a registry with an explicit random source, for reproducible sampling.
     */
    public NodeRegistry(RegistryEventListener eventListener, Random random, Clock clock) {
        this.eventListener = eventListener == null ? RegistryEventListener.NOOP : eventListener;
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Atomically replace the whole set. Identities already present keep their channel status,
     * new identities start as {@link ChannelStatus#UNKNOWN}.
     */
    public RegistryDiff replaceAll(Collection<VantagePoint> incoming) {
        Objects.requireNonNull(incoming, "incoming");
        synchronized (writeLock) {
            Map<String, VantagePoint> previous = points;
            Map<String, VantagePoint> next = new LinkedHashMap<>();
            List<VantagePoint> added = new ArrayList<>();
            List<VantagePoint> retained = new ArrayList<>();
            for (VantagePoint point : incoming) {
                if (next.containsKey(point.id())) {
                    log.warn("Ignoring duplicate vantage point {}", point.id());
                    continue;
                }
                VantagePoint existing = previous.get(point.id());
                VantagePoint stored;
                if (existing != null) {
                    stored = point.withStatus(existing.channelStatus());
                    retained.add(stored);
                } else {
                    stored = point.withStatus(ChannelStatus.UNKNOWN);
                    added.add(stored);
                }
                next.put(stored.id(), stored);
            }
            List<VantagePoint> removed = new ArrayList<>();
            for (VantagePoint point : previous.values()) {
                if (!next.containsKey(point.id())) {
                    removed.add(point);
                }
            }
            points = Collections.unmodifiableMap(next);

            Instant now = clock.instant();
            for (VantagePoint point : added) {
                emit(RegistryEvent.added(point, now));
            }
            for (VantagePoint point : removed) {
                emit(RegistryEvent.removed(point, now));
            }
            return new RegistryDiff(added, retained, removed);
        }
    }

    /**
     * Set the channel status of one point.
     *
     * @return false when the point is not in the current set
     */
    public boolean updateStatus(String id, ChannelStatus status) {
        Objects.requireNonNull(status, "status");
        synchronized (writeLock) {
            Map<String, VantagePoint> current = points;
            VantagePoint existing = current.get(id);
            if (existing == null) {
                return false;
            }
            if (existing.channelStatus() == status) {
                return true;
            }
            VantagePoint updated = existing.withStatus(status);
            Map<String, VantagePoint> next = new LinkedHashMap<>(current);
            next.put(id, updated);
            points = Collections.unmodifiableMap(next);
            emit(RegistryEvent.statusChanged(updated, existing.channelStatus(), clock.instant()));
            return true;
        }
    }

    @Override
    public void onStatus(String pointId, ChannelStatus status) {
        updateStatus(pointId, status);
    }

    /**
     * Points eligible for probing: healthy and matching every predicate.
     */
    public List<VantagePoint> filter(FilterCriteria criteria) {
        List<VantagePoint> matches = new ArrayList<>();
        for (VantagePoint point : points.values()) {
            if (point.channelStatus().isProbeable() && criteria.matches(point)) {
                matches.add(point);
            }
        }
        return matches;
    }

    /**
     * Points matching every predicate regardless of channel status.
     */
    public List<VantagePoint> filterAll(FilterCriteria criteria) {
        List<VantagePoint> matches = new ArrayList<>();
        for (VantagePoint point : points.values()) {
            if (criteria.matches(point)) {
                matches.add(point);
            }
        }
        return matches;
    }

    /**
     * Limit a filtered set, balancing across the grouping fields when any are given.
     */
    public List<VantagePoint> sample(List<VantagePoint> candidates, int limit, List<FilterField> groupingFields) {
        synchronized (random) {
            return BalancedSampler.sample(candidates, limit, groupingFields, random);
        }
    }

    public List<VantagePoint> list() {
        return new ArrayList<>(points.values());
    }

    public Optional<VantagePoint> get(String id) {
        return Optional.ofNullable(points.get(id));
    }

    public int size() {
        return points.size();
    }

    public int count(ChannelStatus status) {
        int count = 0;
        for (VantagePoint point : points.values()) {
            if (point.channelStatus() == status) {
                count++;
            }
        }
        return count;
    }

    /**
     * Distinct values per filter dimension over the probeable points, for building selection UIs.
     */
    public Map<FilterField, SortedSet<String>> distinctFilterValues() {
        Map<FilterField, SortedSet<String>> values = new EnumMap<>(FilterField.class);
        for (FilterField field : FilterField.values()) {
            values.put(field, new TreeSet<>(String.CASE_INSENSITIVE_ORDER));
        }
        for (VantagePoint point : points.values()) {
            if (!point.channelStatus().isProbeable()) {
                continue;
            }
            for (FilterField field : FilterField.values()) {
                String value = field.valueOf(point);
                if (value != null && !value.isBlank()) {
                    values.get(field).add(value);
                }
            }
        }
        return values;
    }

    private void emit(RegistryEvent event) {
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Failed to emit registry audit event: {}", e.getMessage());
        }
    }
}
