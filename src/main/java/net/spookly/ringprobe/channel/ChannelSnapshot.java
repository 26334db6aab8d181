package net.spookly.ringprobe.channel;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Point-in-time copy of a channel record for status surfaces.
 */
@Value
@Accessors(fluent = true)
public class ChannelSnapshot {
    String pointId;
    String host;
    String controlPath;
    ChannelStatus status;
    Instant lastHealthCheck;
    int consecutiveFailures;
    Instant demotedAt;
}
