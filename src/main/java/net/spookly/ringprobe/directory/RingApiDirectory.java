package net.spookly.ringprobe.directory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.ringprobe.config.RingProbeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads active nodes and participants from the NLNOG RING API.
 */
public final class RingApiDirectory implements DirectoryService {
    private static final Logger log = LoggerFactory.getLogger(RingApiDirectory.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String UNKNOWN_COMPANY = "Unknown";

    private final URI nodesUri;
    private final URI participantsUri;
    private final Duration timeout;
    private final boolean requireDualStack;
    private final HttpClient http;

    public RingApiDirectory(URI nodesUri, URI participantsUri, Duration timeout, boolean requireDualStack) {
        this(nodesUri, participantsUri, timeout, requireDualStack,
                HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL).build());
    }

    RingApiDirectory(URI nodesUri,
                     URI participantsUri,
                     Duration timeout,
                     boolean requireDualStack,
                     HttpClient http) {
        this.nodesUri = Objects.requireNonNull(nodesUri, "nodesUri");
        this.participantsUri = participantsUri;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.requireDualStack = requireDualStack;
        this.http = Objects.requireNonNull(http, "http");
    }

    public static RingApiDirectory fromConfig(RingProbeConfig config) {
        RingProbeConfig.DirectoryConfig directory = config.directory;
        if (directory == null || directory.nodesUrl == null) {
            throw new IllegalArgumentException("directory.nodesUrl is required");
        }
        URI participants = directory.participantsUrl == null || directory.participantsUrl.isBlank()
                ? null
                : URI.create(directory.participantsUrl.trim());
        int timeoutSeconds = directory.timeoutSeconds != null ? directory.timeoutSeconds : 10;
        boolean dualStack = directory.requireDualStack == null || directory.requireDualStack;
        return new RingApiDirectory(URI.create(directory.nodesUrl.trim()), participants,
                Duration.ofSeconds(timeoutSeconds), dualStack);
    }

    @Override
    public List<DirectoryEntry> listVantagePoints() throws DirectorySyncException {
        Map<Integer, String> companies = fetchParticipants();
        JsonNode nodes = fetch(nodesUri).path("results").path("nodes");
        if (!nodes.isArray()) {
            throw new DirectorySyncException("Node listing from " + nodesUri + " has no results.nodes array");
        }
        List<DirectoryEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : nodes) {
            String hostname = text(node, "hostname");
            if (hostname == null) {
                skipped++;
                continue;
            }
            if (requireDualStack && !(node.path("alive_ipv4").asBoolean(false) && node.path("alive_ipv6").asBoolean(false))) {
                continue;
            }
            String countryCode = text(node, "countrycode");
            JsonNode participant = node.path("participant");
            String company = participant.canConvertToInt()
                    ? companies.getOrDefault(participant.asInt(), UNKNOWN_COMPANY)
                    : UNKNOWN_COMPANY;
            entries.add(new DirectoryEntry(
                    hostname,
                    hostname,
                    node.path("asn").canConvertToInt() ? node.path("asn").asInt() : null,
                    text(node, "city"),
                    countryCode == null ? null : countryCode.toUpperCase(Locale.ROOT),
                    company
            ));
        }
        if (skipped > 0) {
            log.warn("Skipped {} directory entries without a hostname", skipped);
        }
        log.debug("Directory listed {} usable nodes ({} participants)", entries.size(), companies.size());
        return entries;
    }

    /**
     * Participant id to company name. Failures degrade to an empty map.
     */
    private Map<Integer, String> fetchParticipants() {
        Map<Integer, String> companies = new HashMap<>();
        if (participantsUri == null) {
            return companies;
        }
        JsonNode participants;
        try {
            participants = fetch(participantsUri).path("results").path("participants");
        } catch (DirectorySyncException e) {
            log.warn("Failed to fetch participants: {}", e.getMessage());
            return companies;
        }
        for (JsonNode participant : participants) {
            String company = text(participant, "company");
            if (participant.path("id").canConvertToInt() && company != null) {
                companies.put(participant.path("id").asInt(), company);
            }
        }
        return companies;
    }

    private JsonNode fetch(URI uri) throws DirectorySyncException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DirectorySyncException("Request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DirectorySyncException("Interrupted while requesting " + uri, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new DirectorySyncException("Request to " + uri + " returned status " + response.statusCode());
        }
        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new DirectorySyncException("Invalid JSON from " + uri + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
