package net.spookly.ringprobe.probe;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

import net.spookly.ringprobe.channel.ChannelManager;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.node.FilterCriteria;
import net.spookly.ringprobe.node.FilterField;
import net.spookly.ringprobe.node.NodeRegistry;
import net.spookly.ringprobe.node.VantagePoint;

/**
 * Operations the HTTP boundary calls: node resolution, probing and status views.
 */
public final class ProbeService {
    private final NodeRegistry registry;
    private final ChannelManager channels;
    private final ProbeExecutor executor;

    public ProbeService(NodeRegistry registry, ChannelManager channels, ProbeExecutor executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.channels = Objects.requireNonNull(channels, "channels");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Healthy points matching the criteria, sampled down to {@code limit} when one is given.
     * Multi-value filter fields balance the sample.
     */
    public List<VantagePoint> resolveNodes(FilterCriteria criteria, Integer limit) {
        FilterCriteria effective = criteria == null ? FilterCriteria.none() : criteria;
        List<VantagePoint> matches = registry.filter(effective);
        if (limit == null || limit >= matches.size()) {
            return matches;
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be greater than 0");
        }
        return registry.sample(matches, limit, effective.multiValueFields());
    }

    public ProbeResultSet runProbe(String target, List<VantagePoint> nodes, Duration perPointTimeout) {
        return executor.probe(target, nodes, perPointTimeout);
    }

    public Map<String, ChannelStatus> channelStatusSummary() {
        return channels.statusSummary();
    }

    /**
     * Distinct values per filter dimension, keyed by query parameter name.
     */
    public Map<String, List<String>> distinctFilterValues() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (Map.Entry<FilterField, SortedSet<String>> entry : registry.distinctFilterValues().entrySet()) {
            values.put(entry.getKey().paramName(), new ArrayList<>(entry.getValue()));
        }
        return values;
    }

    /**
     * Every known point with its channel status, for debug listings.
     */
    public List<VantagePoint> listPoints() {
        return registry.list();
    }

    public HealthSummary healthSummary() {
        Map<String, ChannelStatus> summary = channels.statusSummary();
        int healthy = 0;
        for (ChannelStatus status : summary.values()) {
            if (status == ChannelStatus.HEALTHY) {
                healthy++;
            }
        }
        return new HealthSummary(registry.size(), summary.size(), healthy);
    }
}
