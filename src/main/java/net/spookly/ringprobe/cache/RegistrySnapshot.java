package net.spookly.ringprobe.cache;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.node.VantagePoint;

/**
 * Persisted copy of the registry. {@code version} is epoch millis and increases with every write.
 */
@EqualsAndHashCode
@ToString
public final class RegistrySnapshot {
    public long version;
    public List<PointRecord> points;

    public static RegistrySnapshot of(long version, List<VantagePoint> points) {
        RegistrySnapshot snapshot = new RegistrySnapshot();
        snapshot.version = version;
        snapshot.points = new ArrayList<>(points.size());
        for (VantagePoint point : points) {
            snapshot.points.add(PointRecord.from(point));
        }
        return snapshot;
    }

    /**
     * Rebuild vantage points in snapshot order.
     */
    public List<VantagePoint> toPoints() {
        List<VantagePoint> result = new ArrayList<>();
        if (points == null) {
            return result;
        }
        for (PointRecord record : points) {
            result.add(record.toPoint());
        }
        return result;
    }

    @EqualsAndHashCode
    @ToString
    public static final class PointRecord {
        public String id;
        public String host;
        public Integer asn;
        public String city;
        public String countryCode;
        public String continent;
        public String company;
        public ChannelStatus channelStatus;

        static PointRecord from(VantagePoint point) {
            PointRecord record = new PointRecord();
            record.id = point.id();
            record.host = point.host();
            record.asn = point.asn();
            record.city = point.city();
            record.countryCode = point.countryCode();
            record.continent = point.continent();
            record.company = point.company();
            record.channelStatus = point.channelStatus();
            return record;
        }

        VantagePoint toPoint() {
            return new VantagePoint(
                    id,
                    host == null ? id : host,
                    asn,
                    city,
                    countryCode,
                    continent,
                    company,
                    channelStatus == null ? ChannelStatus.UNKNOWN : channelStatus
            );
        }
    }
}
