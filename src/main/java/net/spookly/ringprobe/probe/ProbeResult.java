package net.spookly.ringprobe.probe;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.ringprobe.node.VantagePoint;

/**
 * Outcome of probing the target from one vantage point. {@code rtt} is present exactly when
 * {@code success} is true.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public final class ProbeResult {
    private final VantagePoint point;
    private final String target;
    private final boolean success;
    private final RttStats rtt;
    private final Integer transmitted;
    private final Integer received;
    private final ProbeError error;
    private final String detail;
    private final long durationMs;

    public static ProbeResult succeeded(VantagePoint point, String target, PingSummary summary, long durationMs) {
        return new ProbeResult(point, target, true, summary.rtt(), summary.transmitted(), summary.received(),
                null, null, durationMs);
    }

    public static ProbeResult failed(VantagePoint point, String target, ProbeError error, String detail, long durationMs) {
        return new ProbeResult(point, target, false, null, null, null, error, detail, durationMs);
    }

    /**
     * A failure for which ping still reported packet counts, e.g. no replies.
     */
    public static ProbeResult failed(VantagePoint point,
                                     String target,
                                     ProbeError error,
                                     String detail,
                                     PingSummary summary,
                                     long durationMs) {
        return new ProbeResult(point, target, false, null, summary.transmitted(), summary.received(),
                error, detail, durationMs);
    }

    public String pointId() {
        return point.id();
    }
}
