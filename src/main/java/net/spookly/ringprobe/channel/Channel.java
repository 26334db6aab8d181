package net.spookly.ringprobe.channel;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable per-point channel record. Every field is guarded by the record's monitor.
 */
final class Channel {
    private final String pointId;
    private final String host;
    private final String controlPath;
    private volatile ChannelStatus status = ChannelStatus.UNKNOWN;
    private Instant lastHealthCheck;
    private int consecutiveFailures;
    private Instant demotedAt;

    Channel(String pointId, String host, String controlPath) {
        this.pointId = pointId;
        this.host = host;
        this.controlPath = controlPath;
    }

    String pointId() {
        return pointId;
    }

    String host() {
        return host;
    }

    String controlPath() {
        return controlPath;
    }

    ChannelStatus status() {
        return status;
    }

    void status(ChannelStatus status) {
        this.status = status;
    }

    Instant lastHealthCheck() {
        return lastHealthCheck;
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }

    Instant demotedAt() {
        return demotedAt;
    }

    void markHealthy(Instant now) {
        status = ChannelStatus.HEALTHY;
        consecutiveFailures = 0;
        lastHealthCheck = now;
        demotedAt = null;
    }

    int recordFailure(Instant now) {
        lastHealthCheck = now;
        return ++consecutiveFailures;
    }

    void demote(Instant now) {
        status = ChannelStatus.UNHEALTHY;
        demotedAt = now;
    }

    boolean coolingDown(Instant now, Duration cooldown) {
        return status == ChannelStatus.UNHEALTHY
                && demotedAt != null
                && now.isBefore(demotedAt.plus(cooldown));
    }

    ChannelSnapshot snapshot() {
        return new ChannelSnapshot(pointId, host, controlPath, status, lastHealthCheck, consecutiveFailures, demotedAt);
    }
}
