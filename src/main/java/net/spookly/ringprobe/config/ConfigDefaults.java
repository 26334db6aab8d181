package net.spookly.ringprobe.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final String DEFAULT_NODES_URL = "https://api.ring.nlnog.net/1.0/nodes/active";
    public static final String DEFAULT_PARTICIPANTS_URL = "https://api.ring.nlnog.net/1.0/participants";
    public static final String DEFAULT_CONTROL_PATH = "/tmp/ssh-control/ringprobe-%r@%h:%p";

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default ringprobe config.
            # Place the RING SSH private key at %s (mode 600).
            server:
              listen: 0.0.0.0:8000
              threads: 8

            directory:
              nodesUrl: %s
              participantsUrl: %s
              timeoutSeconds: 10
              requireDualStack: true

            ssh:
              username: rise
              keyPath: %s
              controlPath: %s
              connectTimeoutSeconds: 5
              commandTimeoutSeconds: 15
              maxConcurrentOpens: 50
              failureThreshold: 3
              cooldownSeconds: 120

            probe:
              count: 10
              waitSeconds: 5
              workers: 100

            reconcile:
              intervalSeconds: 300
              workers: 50

            cache:
              path: cache/node_cache.json

            logging:
              level: INFO
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml(String keyPath) {
        if (keyPath == null || keyPath.isBlank()) {
            throw new ConfigException("SSH key path is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(
                keyPath,
                DEFAULT_NODES_URL,
                DEFAULT_PARTICIPANTS_URL,
                keyPath,
                DEFAULT_CONTROL_PATH
        );
    }
}
