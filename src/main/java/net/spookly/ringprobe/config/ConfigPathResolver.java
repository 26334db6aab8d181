package net.spookly.ringprobe.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative file path settings against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(RingProbeConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        if (config.ssh != null) {
            config.ssh.keyPath = resolvePath(baseDir, expandHome(config.ssh.keyPath));
            config.ssh.controlPath = expandHome(config.ssh.controlPath);
        }
        if (config.cache != null) {
            config.cache.path = resolvePath(baseDir, expandHome(config.cache.path));
        }
    }

    private static String expandHome(String rawValue) {
        if (rawValue == null || !rawValue.startsWith("~/")) {
            return rawValue;
        }
        return System.getProperty("user.home") + rawValue.substring(1);
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
