package net.spookly.ringprobe.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads the ringprobe YAML file into a {@link RingProbeConfig}.
 *
 * <p>Stages run in order: read YAML, expand {@code env:} and {@code path:} values, bind with unknown
 * keys rejected, resolve relative paths against the config directory, validate. A missing file is
 * replaced by a generated default and the load still fails; the RING SSH key goes in place before the
 * next start.
 */
public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private static final String DEFAULT_KEY_PATH = "ssh/ring_key";

    private ConfigLoader() {
    }

    public static RingProbeConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            Path keyPath = bootstrap(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path
                    + "; place the RING SSH key at " + keyPath + " and start again");
        }
        Path baseDir = path.toAbsolutePath().getParent();
        Object raw = readYaml(path);
        RingProbeConfig config = bind(EnvExpander.expand(raw, baseDir), path);
        ConfigPathResolver.resolve(config, baseDir);
        ConfigValidator.validate(config);
        return config;
    }

    private static Object readYaml(Path path) {
        Object raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        return raw;
    }

    private static RingProbeConfig bind(Object tree, Path path) {
        try {
            return MAPPER.convertValue(tree, RingProbeConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path + location(e), e);
        }
    }

    /**
     * Dotted key of the offending entry, e.g. {@code " (at cache.flavour)"}, or empty when unknown.
     */
    private static String location(IllegalArgumentException e) {
        if (!(e.getCause() instanceof JsonMappingException)) {
            return "";
        }
        StringBuilder key = new StringBuilder();
        for (JsonMappingException.Reference reference : ((JsonMappingException) e.getCause()).getPath()) {
            if (reference.getFieldName() != null) {
                if (key.length() > 0) {
                    key.append('.');
                }
                key.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                key.append('[').append(reference.getIndex()).append(']');
            }
        }
        return key.length() == 0 ? "" : " (at " + key + ")";
    }

    /**
     * Write the default config next to an owner-only key directory.
     *
     * @return where the generated config expects the RING SSH key
     */
    private static Path bootstrap(Path path) {
        Path baseDir = path.toAbsolutePath().getParent();
        Path keyPath = baseDir.resolve(DEFAULT_KEY_PATH).normalize();
        try {
            Files.createDirectories(baseDir);
            Path keyDirectory = keyPath.getParent();
            if (keyDirectory != null && !Files.exists(keyDirectory)) {
                Files.createDirectories(keyDirectory);
                restrictToOwner(keyDirectory);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(DEFAULT_KEY_PATH),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
        return keyPath;
    }

    private static void restrictToOwner(Path directory) throws IOException {
        if (Files.getFileAttributeView(directory, PosixFileAttributeView.class) == null) {
            return;
        }
        Files.setPosixFilePermissions(directory, PosixFilePermissions.fromString("rwx------"));
    }
}
