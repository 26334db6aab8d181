package net.spookly.ringprobe.probe;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Packet counts and RTT statistics read from ping output. {@code rtt} is null when nothing was received.
 */
@Value
@Accessors(fluent = true)
public class PingSummary {
    int transmitted;
    int received;
    RttStats rtt;

    public boolean anyReceived() {
        return received > 0;
    }
}
