package net.spookly.ringprobe.channel;

/**
 * Receives channel state transitions published by {@link ChannelManager}.
 */
@FunctionalInterface
public interface ChannelStatusListener {
    ChannelStatusListener NOOP = (pointId, status) -> {
    };

    void onStatus(String pointId, ChannelStatus status);
}
