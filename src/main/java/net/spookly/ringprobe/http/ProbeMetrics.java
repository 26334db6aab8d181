package net.spookly.ringprobe.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;

import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import net.spookly.ringprobe.node.VantagePoint;
import net.spookly.ringprobe.probe.ProbeResult;
import net.spookly.ringprobe.probe.ProbeResultSet;
import net.spookly.ringprobe.probe.RttStats;

/**
 * Renders a probe result set as Prometheus text exposition.
 *
 * <p>Every request gets its own registry, so a scrape only ever carries the points probed for it.
 * RTT gauges are set for successful points only; {@code nlnog_ping_success} is set for all.
 */
final class ProbeMetrics {
    private static final PrometheusTextFormatWriter WRITER = new PrometheusTextFormatWriter(false);
    private static final String[] LABEL_NAMES = {
            "node", "target", "asn", "city", "countrycode", "status", "continent", "company"
    };
    private static final String UNKNOWN = "Unknown";

    private ProbeMetrics() {
    }

    static String contentType() {
        return WRITER.getContentType();
    }

    static byte[] render(ProbeResultSet results) throws IOException {
        PrometheusRegistry registry = new PrometheusRegistry();
        Gauge rttMin = gauge(registry, "nlnog_ping_rtt_min_ms", "Min RTT in ms");
        Gauge rttAvg = gauge(registry, "nlnog_ping_rtt_avg_ms", "Avg RTT in ms");
        Gauge rttMax = gauge(registry, "nlnog_ping_rtt_max_ms", "Max RTT in ms");
        Gauge rttMdev = gauge(registry, "nlnog_ping_rtt_mdev_ms", "Mdev RTT in ms");
        Gauge success = gauge(registry, "nlnog_ping_success", "Ping success (1) or failure (0)");

        for (ProbeResult result : results.results()) {
            String[] labels = labelValues(result);
            success.labelValues(labels).set(result.success() ? 1 : 0);
            RttStats rtt = result.rtt();
            if (result.success() && rtt != null) {
                rttMin.labelValues(labels).set(rtt.min());
                rttAvg.labelValues(labels).set(rtt.avg());
                rttMax.labelValues(labels).set(rtt.max());
                rttMdev.labelValues(labels).set(rtt.mdev());
            }
        }

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        WRITER.write(output, registry.scrape());
        return output.toByteArray();
    }

    /**
     * Status label: {@code ok} for a success, otherwise the lower-case error kind.
     */
    static String statusLabel(ProbeResult result) {
        if (result.success() || result.error() == null) {
            return "ok";
        }
        return result.error().name().toLowerCase(Locale.ROOT);
    }

    private static Gauge gauge(PrometheusRegistry registry, String name, String help) {
        return Gauge.builder()
                .name(name)
                .help(help)
                .labelNames(LABEL_NAMES)
                .register(registry);
    }

    private static String[] labelValues(ProbeResult result) {
        VantagePoint point = result.point();
        return new String[] {
                point.shortName(),
                result.target(),
                orUnknown(point.asn()),
                orUnknown(point.city()),
                orUnknown(point.countryCode()),
                statusLabel(result),
                orUnknown(point.continent()),
                orUnknown(point.company())
        };
    }

    private static String orUnknown(Object value) {
        if (value == null) {
            return UNKNOWN;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? UNKNOWN : text;
    }
}
