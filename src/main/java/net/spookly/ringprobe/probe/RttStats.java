package net.spookly.ringprobe.probe;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Round-trip time summary in milliseconds.
 */
@Value
@Accessors(fluent = true)
public class RttStats {
    double min;
    double avg;
    double max;
    double mdev;
}
