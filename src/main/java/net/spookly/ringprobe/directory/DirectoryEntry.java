package net.spookly.ringprobe.directory;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * One candidate vantage point as listed by the directory service.
 */
@Value
@Accessors(fluent = true)
public class DirectoryEntry {
    String id;
    String host;
    Integer asn;
    String city;
    String countryCode;
    String company;
}
