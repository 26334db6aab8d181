package net.spookly.ringprobe.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with credentials in directory URLs redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(RingProbeConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        return yaml.dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object directory = data.get("directory");
        if (directory instanceof Map) {
            Map<String, Object> directoryMap = (Map<String, Object>) directory;
            redactUrl(directoryMap, "nodesUrl");
            redactUrl(directoryMap, "participantsUrl");
        }
    }

    private static void redactUrl(Map<String, Object> section, String key) {
        Object value = section.get(key);
        if (!(value instanceof String)) {
            return;
        }
        try {
            URI uri = new URI((String) value);
            if (uri.getRawUserInfo() == null && uri.getRawQuery() == null) {
                return;
            }
            StringBuilder redacted = new StringBuilder();
            redacted.append(uri.getScheme()).append("://");
            if (uri.getRawUserInfo() != null) {
                redacted.append(REDACTED).append('@');
            }
            redacted.append(uri.getHost());
            if (uri.getPort() != -1) {
                redacted.append(':').append(uri.getPort());
            }
            if (uri.getRawPath() != null) {
                redacted.append(uri.getRawPath());
            }
            if (uri.getRawQuery() != null) {
                redacted.append('?').append(REDACTED);
            }
            section.put(key, redacted.toString());
        } catch (URISyntaxException e) {
            section.put(key, REDACTED);
        }
    }
}
