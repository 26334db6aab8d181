package net.spookly.ringprobe.channel;

/**
 * Lifecycle state of the SSH channel to one vantage point.
 */
public enum ChannelStatus {
    UNKNOWN,
    CONNECTING,
    HEALTHY,
    UNHEALTHY,
    CLOSED;

    /**
     * Only healthy channels carry probe traffic.
     */
    public boolean isProbeable() {
        return this == HEALTHY;
    }
}
