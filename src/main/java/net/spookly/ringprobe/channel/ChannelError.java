package net.spookly.ringprobe.channel;

/**
 * Reasons a channel could not be opened or used.
 */
public enum ChannelError {
    CONNECT_TIMEOUT,
    CONNECT_FAILED,
    COOLDOWN,
    UNAVAILABLE,
    INTERRUPTED
}
