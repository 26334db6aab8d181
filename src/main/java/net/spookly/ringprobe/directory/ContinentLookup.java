package net.spookly.ringprobe.directory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;

/**
 * Maps ISO 3166-1 alpha-2 country codes to continent names.
 */
public final class ContinentLookup {
    public static final String UNKNOWN = "Unknown";

    private static final String RESOURCE = "continents.yaml";

    private final Map<String, String> continentByCode;

    public ContinentLookup(Map<String, String> continentByCode) {
        this.continentByCode = Map.copyOf(continentByCode);
    }

    /**
     * Load the bundled table.
     */
    public static ContinentLookup fromClasspath() {
        try (InputStream input = ContinentLookup.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            Object raw = new Yaml().load(input);
            if (!(raw instanceof Map)) {
                throw new IllegalStateException(RESOURCE + " must map continents to country code lists");
            }
            Map<String, String> byCode = new HashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                String continent = String.valueOf(entry.getKey());
                if (!(entry.getValue() instanceof List)) {
                    throw new IllegalStateException(RESOURCE + ": " + continent + " must be a list");
                }
                for (Object code : (List<?>) entry.getValue()) {
                    byCode.put(String.valueOf(code).toUpperCase(Locale.ROOT), continent);
                }
            }
            return new ContinentLookup(byCode);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    public String continentFor(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return UNKNOWN;
        }
        return continentByCode.getOrDefault(countryCode.trim().toUpperCase(Locale.ROOT), UNKNOWN);
    }

    /**
     * English short name for a country code, or the code itself when unknown.
     */
    public static String countryName(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return countryCode;
        }
        String code = countryCode.trim().toUpperCase(Locale.ROOT);
        String name = new Locale("", code).getDisplayCountry(Locale.ENGLISH);
        return name == null || name.isEmpty() || name.equalsIgnoreCase(code) ? code : name;
    }
}
