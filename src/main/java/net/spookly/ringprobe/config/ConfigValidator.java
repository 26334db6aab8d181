package net.spookly.ringprobe.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import ch.qos.logback.classic.Level;
import net.spookly.ringprobe.util.ListenAddress;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(RingProbeConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateServer(config, errors);
        validateDirectory(config, errors);
        validateSsh(config, errors);
        validateProbe(config, errors);
        validateReconcile(config, errors);
        validateCache(config, errors);
        validateLogging(config, errors);

        throwIfErrors(errors);
    }

    private static void validateServer(RingProbeConfig config, List<String> errors) {
        RingProbeConfig.ServerConfig server = config.server;
        if (server == null) {
            return;
        }
        if (!isBlank(server.listen)) {
            try {
                ListenAddress.parse(server.listen);
            } catch (IllegalArgumentException e) {
                errors.add("server.listen is invalid: " + e.getMessage());
            }
        }
        requirePositiveIfSet(errors, server.threads, "server.threads");
    }

    private static void validateDirectory(RingProbeConfig config, List<String> errors) {
        RingProbeConfig.DirectoryConfig directory = config.directory;
        if (directory == null) {
            errors.add("directory section is required");
            return;
        }
        requireHttpUrl(errors, directory.nodesUrl, "directory.nodesUrl");
        if (!isBlank(directory.participantsUrl)) {
            requireHttpUrl(errors, directory.participantsUrl, "directory.participantsUrl");
        }
        requirePositiveIfSet(errors, directory.timeoutSeconds, "directory.timeoutSeconds");
    }

    private static void validateSsh(RingProbeConfig config, List<String> errors) {
        RingProbeConfig.SshConfig ssh = config.ssh;
        if (ssh == null) {
            errors.add("ssh section is required");
            return;
        }
        requireNonBlank(errors, ssh.username, "ssh.username");
        requireNonBlank(errors, ssh.keyPath, "ssh.keyPath");
        if (!isBlank(ssh.keyPath)) {
            validateKeyFile(errors, ssh.keyPath);
        }
        if (!isBlank(ssh.controlPath) && !ssh.controlPath.contains("%h")) {
            errors.add("ssh.controlPath must contain the %h host token");
        }
        requirePositiveIfSet(errors, ssh.connectTimeoutSeconds, "ssh.connectTimeoutSeconds");
        requirePositiveIfSet(errors, ssh.commandTimeoutSeconds, "ssh.commandTimeoutSeconds");
        requirePositiveIfSet(errors, ssh.maxConcurrentOpens, "ssh.maxConcurrentOpens");
        requirePositiveIfSet(errors, ssh.failureThreshold, "ssh.failureThreshold");
        if (ssh.cooldownSeconds != null && ssh.cooldownSeconds < 0) {
            errors.add("ssh.cooldownSeconds must be 0 or greater");
        }
    }

    private static void validateKeyFile(List<String> errors, String keyPath) {
        Path path;
        try {
            path = Path.of(keyPath);
        } catch (InvalidPathException e) {
            errors.add("ssh.keyPath is not a valid path: " + keyPath);
            return;
        }
        if (!Files.exists(path)) {
            errors.add("ssh.keyPath does not exist: " + keyPath);
        } else if (!Files.isRegularFile(path)) {
            errors.add("ssh.keyPath is not a regular file: " + keyPath);
        } else if (!Files.isReadable(path)) {
            errors.add("ssh.keyPath is not readable: " + keyPath);
        }
    }

    private static void validateProbe(RingProbeConfig config, List<String> errors) {
        RingProbeConfig.ProbeConfig probe = config.probe;
        if (probe == null) {
            return;
        }
        requirePositiveIfSet(errors, probe.count, "probe.count");
        requirePositiveIfSet(errors, probe.waitSeconds, "probe.waitSeconds");
        requirePositiveIfSet(errors, probe.workers, "probe.workers");
    }

    private static void validateReconcile(RingProbeConfig config, List<String> errors) {
        RingProbeConfig.ReconcileConfig reconcile = config.reconcile;
        if (reconcile == null) {
            return;
        }
        requirePositiveIfSet(errors, reconcile.intervalSeconds, "reconcile.intervalSeconds");
        requirePositiveIfSet(errors, reconcile.workers, "reconcile.workers");
    }

    private static void validateCache(RingProbeConfig config, List<String> errors) {
        if (config.cache == null) {
            errors.add("cache section is required");
            return;
        }
        requireNonBlank(errors, config.cache.path, "cache.path");
    }

    private static void validateLogging(RingProbeConfig config, List<String> errors) {
        if (config.logging == null || isBlank(config.logging.level)) {
            return;
        }
        Level parsed = Level.toLevel(config.logging.level, null);
        if (parsed == null) {
            errors.add("logging.level must be one of: TRACE, DEBUG, INFO, WARN, ERROR");
        }
    }

    private static void requireHttpUrl(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                errors.add(field + " must be an http or https URL");
            } else if (isBlank(uri.getHost())) {
                errors.add(field + " must include a host");
            }
        } catch (URISyntaxException e) {
            errors.add(field + " is not a valid URL");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositiveIfSet(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
