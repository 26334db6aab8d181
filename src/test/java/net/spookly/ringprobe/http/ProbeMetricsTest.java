package net.spookly.ringprobe.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.node.VantagePoint;
import net.spookly.ringprobe.probe.PingSummary;
import net.spookly.ringprobe.probe.ProbeError;
import net.spookly.ringprobe.probe.ProbeResult;
import net.spookly.ringprobe.probe.ProbeResultSet;
import net.spookly.ringprobe.probe.RttStats;
import org.junit.jupiter.api.Test;

class ProbeMetricsTest {
    private static final String TARGET = "2001:db8::1";

    @Test
    void failedPointOnlyReportsSuccessGauge() throws Exception {
        VantagePoint ok = point("amsterdam01.ring.nlnog.net", "SURF");
        VantagePoint down = point("tokyo01.ring.nlnog.net", null);
        ProbeResultSet results = new ProbeResultSet(TARGET, List.of(
                ProbeResult.succeeded(ok, TARGET, new PingSummary(10, 9, new RttStats(1.5, 2.0, 3.25, 0.4)), 120),
                ProbeResult.failed(down, TARGET, ProbeError.TIMEOUT, "command timed out", 15_000)
        ));

        String body = new String(ProbeMetrics.render(results), StandardCharsets.UTF_8);

        List<String> success = samples(body, "nlnog_ping_success");
        assertEquals(2, success.size());
        String downSample = find(success, "node=\"tokyo01\"");
        assertTrue(downSample.contains("status=\"timeout\""));
        assertTrue(downSample.contains("company=\"Unknown\""));
        assertTrue(downSample.endsWith(" 0.0") || downSample.endsWith(" 0"));

        List<String> max = samples(body, "nlnog_ping_rtt_max_ms");
        assertEquals(1, max.size());
        assertTrue(max.get(0).contains("node=\"amsterdam01\""));
        assertTrue(max.get(0).contains("target=\"2001:db8::1\""));
    }

    @Test
    void contentTypeIsPrometheusText() {
        assertTrue(ProbeMetrics.contentType().startsWith("text/plain"));
    }

    private static List<String> samples(String body, String metric) {
        List<String> lines = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.startsWith(metric + "{")) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String find(List<String> lines, String fragment) {
        for (String line : lines) {
            if (line.contains(fragment)) {
                return line;
            }
        }
        throw new AssertionError("no line with " + fragment + " in " + lines);
    }

    private static VantagePoint point(String id, String company) {
        return new VantagePoint(id, id, 64500, "City", "NL", "Europe", company, ChannelStatus.HEALTHY);
    }
}
