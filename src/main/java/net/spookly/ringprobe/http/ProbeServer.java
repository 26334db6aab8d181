package net.spookly.ringprobe.http;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.ringprobe.channel.ChannelStatus;
import net.spookly.ringprobe.config.RingProbeConfig;
import net.spookly.ringprobe.directory.ContinentLookup;
import net.spookly.ringprobe.node.FilterCriteria;
import net.spookly.ringprobe.node.FilterField;
import net.spookly.ringprobe.node.VantagePoint;
import net.spookly.ringprobe.probe.HealthSummary;
import net.spookly.ringprobe.probe.ProbeResult;
import net.spookly.ringprobe.probe.ProbeResultSet;
import net.spookly.ringprobe.probe.ProbeService;
import net.spookly.ringprobe.probe.TargetValidator;
import net.spookly.ringprobe.reconcile.ReconcileReport;
import net.spookly.ringprobe.util.ListenAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP boundary over {@link ProbeService}.
 *
 * <p>{@code /probe} answers in Prometheus text exposition unless {@code format=json} is given;
 * {@code /debug} is plain text and every other endpoint answers with an {@link ApiResponse}.
 */
public final class ProbeServer {
    private static final Logger log = LoggerFactory.getLogger(ProbeServer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String DEFAULT_LISTEN = "0.0.0.0:8000";
    private static final String FORMAT_JSON = "json";
    private static final String NO_NODES = "no matching nodes";
    private static final List<ChannelStatus> DEBUG_ORDER = List.of(
            ChannelStatus.HEALTHY,
            ChannelStatus.CONNECTING,
            ChannelStatus.UNHEALTHY,
            ChannelStatus.UNKNOWN,
            ChannelStatus.CLOSED
    );

    private final ProbeService service;
    private final TargetValidator targetValidator;
    private final Supplier<Optional<ReconcileReport>> lastCycle;
    private final HttpServer server;
    private final ExecutorService executor;

    public ProbeServer(ListenAddress listenAddress,
                       int threads,
                       ProbeService service,
                       TargetValidator targetValidator,
                       Supplier<Optional<ReconcileReport>> lastCycle) {
        this.service = Objects.requireNonNull(service, "service");
        this.targetValidator = Objects.requireNonNull(targetValidator, "targetValidator");
        this.lastCycle = lastCycle == null ? Optional::empty : lastCycle;
        InetSocketAddress socketAddress = listenAddress.toSocketAddress();
        try {
            this.server = HttpServer.create(socketAddress, 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind HTTP listener on " + listenAddress, e);
        }
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads));
        this.server.setExecutor(executor);
        this.server.createContext("/probe", new ProbeHandler());
        this.server.createContext("/api/filter-options", new FilterOptionsHandler());
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/sessions", new SessionsHandler());
        this.server.createContext("/debug", new DebugHandler());
    }

    public static ProbeServer fromConfig(RingProbeConfig config,
                                         ProbeService service,
                                         Supplier<Optional<ReconcileReport>> lastCycle) {
        String listen = DEFAULT_LISTEN;
        int threads = 8;
        if (config.server != null) {
            if (config.server.listen != null && !config.server.listen.isBlank()) {
                listen = config.server.listen;
            }
            if (config.server.threads != null) {
                threads = config.server.threads;
            }
        }
        ListenAddress listenAddress = ListenAddress.parse(listen);
        return new ProbeServer(listenAddress, threads, service, new TargetValidator(), lastCycle);
    }

    public void start() {
        server.start();
        log.info("HTTP listening on {}:{}", server.getAddress().getHostString(), server.getAddress().getPort());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    /**
     * Bound port, useful when listening on port 0.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    private abstract class BaseHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeResponse(exchange, 405, ApiResponse.error("method not allowed"));
                    return;
                }
                handleGet(exchange, parseQueryParams(exchange.getRequestURI()));
            } catch (IllegalArgumentException e) {
                writeResponse(exchange, 400, ApiResponse.error(e.getMessage()));
            } catch (Exception e) {
                log.error("Request {} failed", exchange.getRequestURI().getPath(), e);
                writeResponse(exchange, 500, ApiResponse.error("internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleGet(HttpExchange exchange, Map<String, String> params) throws IOException;
    }

    private final class ProbeHandler extends BaseHandler {
        @Override
        protected void handleGet(HttpExchange exchange, Map<String, String> params) throws IOException {
            boolean json = FORMAT_JSON.equalsIgnoreCase(params.get("format"));
            String target = targetValidator.validate(params.get("target"));
            Integer limit = parseLimit(params.get("limit"));
            FilterCriteria criteria = parseCriteria(params);
            List<VantagePoint> nodes = service.resolveNodes(criteria, limit);
            if (nodes.isEmpty()) {
                if (json) {
                    writeResponse(exchange, 503, ApiResponse.error(NO_NODES));
                } else {
                    writeText(exchange, 503, "text/plain; charset=utf-8",
                            (NO_NODES + ". Channels may still be connecting.\n").getBytes(StandardCharsets.UTF_8));
                }
                return;
            }
            ProbeResultSet results = service.runProbe(target, nodes, null);
            if (!json) {
                writeText(exchange, 200, ProbeMetrics.contentType(), ProbeMetrics.render(results));
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("target", results.target());
            data.put("count", results.size());
            data.put("succeeded", results.successCount());
            List<Map<String, Object>> views = new ArrayList<>(results.size());
            for (ProbeResult result : results.results()) {
                views.add(toView(result));
            }
            data.put("results", views);
            writeResponse(exchange, 200, ApiResponse.ok("ok", data));
        }
    }

    private final class FilterOptionsHandler extends BaseHandler {
        @Override
        protected void handleGet(HttpExchange exchange, Map<String, String> params) throws IOException {
            Map<String, List<String>> values = service.distinctFilterValues();
            Map<String, Object> data = new LinkedHashMap<>(values);
            Map<String, String> countryNames = new TreeMap<>();
            for (String code : values.getOrDefault(FilterField.COUNTRY_CODE.paramName(), List.of())) {
                countryNames.put(code, ContinentLookup.countryName(code));
            }
            data.put("countryNames", countryNames);
            writeResponse(exchange, 200, ApiResponse.ok("ok", data));
        }
    }

    private final class HealthHandler extends BaseHandler {
        @Override
        protected void handleGet(HttpExchange exchange, Map<String, String> params) throws IOException {
            HealthSummary health = service.healthSummary();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("nodes", health.nodes());
            data.put("channels", health.channels());
            data.put("healthyChannels", health.healthyChannels());
            if (health.healthy()) {
                data.put("status", "healthy");
                writeResponse(exchange, 200, ApiResponse.ok("healthy", data));
                return;
            }
            data.put("status", "unhealthy");
            writeResponse(exchange, 503, ApiResponse.error("unhealthy", data));
        }
    }

    private final class SessionsHandler extends BaseHandler {
        @Override
        protected void handleGet(HttpExchange exchange, Map<String, String> params) throws IOException {
            Map<String, ChannelStatus> statuses = service.channelStatusSummary();
            Map<ChannelStatus, Integer> counts = new EnumMap<>(ChannelStatus.class);
            for (ChannelStatus status : ChannelStatus.values()) {
                counts.put(status, 0);
            }
            Map<String, String> channels = new LinkedHashMap<>();
            for (Map.Entry<String, ChannelStatus> entry : statuses.entrySet()) {
                counts.merge(entry.getValue(), 1, Integer::sum);
                channels.put(entry.getKey(), lower(entry.getValue()));
            }
            Map<String, Object> summary = new LinkedHashMap<>();
            for (Map.Entry<ChannelStatus, Integer> entry : counts.entrySet()) {
                summary.put(lower(entry.getKey()), entry.getValue());
            }
            summary.put("total", statuses.size());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("summary", summary);
            data.put("channels", channels);
            data.put("lastCycle", lastCycle.get().map(ProbeServer::reportView).orElse(null));
            writeResponse(exchange, 200, ApiResponse.ok("ok", data));
        }
    }

    private final class DebugHandler extends BaseHandler {
        @Override
        protected void handleGet(HttpExchange exchange, Map<String, String> params) throws IOException {
            Map<ChannelStatus, List<VantagePoint>> grouped = new EnumMap<>(ChannelStatus.class);
            for (VantagePoint point : service.listPoints()) {
                grouped.computeIfAbsent(point.channelStatus(), status -> new ArrayList<>()).add(point);
            }
            StringBuilder text = new StringBuilder();
            for (ChannelStatus status : DEBUG_ORDER) {
                List<VantagePoint> points = grouped.get(status);
                if (points == null) {
                    continue;
                }
                points.sort((a, b) -> a.id().compareTo(b.id()));
                text.append("=== ").append(lower(status)).append(" (").append(points.size()).append(") ===\n");
                for (VantagePoint point : points) {
                    text.append(String.format(Locale.ROOT, "%-30s [%s, %s, %s, ASN %s, %s]%n",
                            point.shortName(),
                            point.company(),
                            point.city(),
                            ContinentLookup.countryName(point.countryCode()),
                            point.asn(),
                            point.continent()));
                }
                text.append('\n');
            }
            writeText(exchange, 200, "text/plain; charset=utf-8", text.toString().getBytes(StandardCharsets.UTF_8));
        }
    }

    private void writeText(HttpExchange exchange, int status, String contentType, byte[] payload) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, payload.length == 0 ? -1 : payload.length);
        if (payload.length > 0) {
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(payload);
            }
        }
    }

    private void writeResponse(HttpExchange exchange, int status, ApiResponse response) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(response);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }

    private static Map<String, Object> toView(ProbeResult result) {
        VantagePoint point = result.point();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("node", point.shortName());
        view.put("id", point.id());
        view.put("asn", point.asn());
        view.put("city", point.city());
        view.put("countrycode", point.countryCode());
        view.put("continent", point.continent());
        view.put("company", point.company());
        view.put("success", result.success());
        view.put("error", result.error() == null ? null : lower(result.error()));
        view.put("detail", result.detail());
        view.put("rttMin", result.rtt() == null ? null : result.rtt().min());
        view.put("rttAvg", result.rtt() == null ? null : result.rtt().avg());
        view.put("rttMax", result.rtt() == null ? null : result.rtt().max());
        view.put("rttMdev", result.rtt() == null ? null : result.rtt().mdev());
        view.put("transmitted", result.transmitted());
        view.put("received", result.received());
        view.put("durationMs", result.durationMs());
        return view;
    }

    private static Map<String, Object> reportView(ReconcileReport report) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("startedAt", report.startedAt().toString());
        view.put("durationMs", report.durationMs());
        view.put("directorySynced", report.directorySynced());
        view.put("error", report.error());
        view.put("nodes", report.nodes());
        view.put("added", report.added());
        view.put("removed", report.removed());
        view.put("opened", report.opened());
        view.put("openFailed", report.openFailed());
        view.put("checked", report.checked());
        view.put("demoted", report.demoted());
        view.put("persisted", report.persisted());
        return view;
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private static Integer parseLimit(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException("limit must be greater than 0");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer");
        }
    }

    private static FilterCriteria parseCriteria(Map<String, String> params) {
        FilterCriteria.Builder builder = FilterCriteria.builder();
        for (FilterField field : FilterField.values()) {
            String raw = params.get(field.paramName());
            if (raw == null || raw.isBlank()) {
                continue;
            }
            builder.accept(field, Arrays.asList(raw.split(",")));
        }
        return builder.build();
    }

    private static Map<String, String> parseQueryParams(URI uri) {
        String raw = uri.getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, String> params = new HashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("=", 2);
            String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            String value = parts.length > 1 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
            params.put(key, value);
        }
        return params;
    }
}
