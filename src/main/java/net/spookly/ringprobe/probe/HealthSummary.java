package net.spookly.ringprobe.probe;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Counts behind the health endpoint.
 */
@Value
@Accessors(fluent = true)
public class HealthSummary {
    int nodes;
    int channels;
    int healthyChannels;

    /**
     * Serving makes sense only with at least one node and one healthy channel.
     */
    public boolean healthy() {
        return nodes > 0 && healthyChannels > 0;
    }
}
