package net.spookly.ringprobe.node;

import java.util.Objects;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.ringprobe.channel.ChannelStatus;

/**
 * Immutable view of one RING node used as a probe origin.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class VantagePoint {
    private final String id;
    private final String host;
    private final Integer asn;
    private final String city;
    private final String countryCode;
    private final String continent;
    private final String company;
    private final ChannelStatus channelStatus;

    /**
     * First DNS label of the node id, e.g. {@code example01} for {@code example01.ring.nlnog.net}.
     */
    public String shortName() {
        int dot = id.indexOf('.');
        return dot < 0 ? id : id.substring(0, dot);
    }

    public VantagePoint withStatus(ChannelStatus status) {
        Objects.requireNonNull(status, "status");
        if (status == channelStatus) {
            return this;
        }
        return new VantagePoint(id, host, asn, city, countryCode, continent, company, status);
    }

    /**
     * True when every attribute except channel status is equal.
     */
    public boolean sameMetadata(VantagePoint other) {
        return other != null
                && id.equals(other.id)
                && Objects.equals(host, other.host)
                && Objects.equals(asn, other.asn)
                && Objects.equals(city, other.city)
                && Objects.equals(countryCode, other.countryCode)
                && Objects.equals(continent, other.continent)
                && Objects.equals(company, other.company);
    }
}
