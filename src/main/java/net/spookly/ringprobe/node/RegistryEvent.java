package net.spookly.ringprobe.node;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.ringprobe.channel.ChannelStatus;

/**
 * Snapshot of a registry state change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class RegistryEvent {
    RegistryEventType type;
    Instant timestamp;
    String pointId;
    String countryCode;
    Integer asn;
    ChannelStatus previousStatus;
    ChannelStatus status;

    public static RegistryEvent added(VantagePoint point, Instant timestamp) {
        return new RegistryEvent(RegistryEventType.ADDED, timestamp, point.id(), point.countryCode(), point.asn(),
                null, point.channelStatus());
    }

    public static RegistryEvent removed(VantagePoint point, Instant timestamp) {
        return new RegistryEvent(RegistryEventType.REMOVED, timestamp, point.id(), point.countryCode(), point.asn(),
                point.channelStatus(), null);
    }

    public static RegistryEvent statusChanged(VantagePoint point, ChannelStatus previous, Instant timestamp) {
        return new RegistryEvent(RegistryEventType.STATUS_CHANGED, timestamp, point.id(), point.countryCode(),
                point.asn(), previous, point.channelStatus());
    }
}
