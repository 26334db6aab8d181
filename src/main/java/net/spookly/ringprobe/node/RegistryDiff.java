package net.spookly.ringprobe.node;

import java.util.List;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * What a {@link NodeRegistry#replaceAll} call changed.
 */
@Value
@Accessors(fluent = true)
public class RegistryDiff {
    List<VantagePoint> added;
    List<VantagePoint> retained;
    List<VantagePoint> removed;
}
