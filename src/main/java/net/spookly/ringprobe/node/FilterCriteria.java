package net.spookly.ringprobe.node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Conjunction of per-field membership predicates. Values compare case-insensitively; an absent
 * field matches everything.
 */
public final class FilterCriteria {
    private static final FilterCriteria NONE = new FilterCriteria(new EnumMap<>(FilterField.class));

    private final Map<FilterField, Set<String>> accepted;

    private FilterCriteria(Map<FilterField, Set<String>> accepted) {
        this.accepted = accepted;
    }

    public static FilterCriteria none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(VantagePoint point) {
        for (Map.Entry<FilterField, Set<String>> entry : accepted.entrySet()) {
            String value = entry.getKey().valueOf(point);
            if (value == null || !entry.getValue().contains(normalize(value))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Fields that accept more than one value. These drive balanced sampling.
     */
    public List<FilterField> multiValueFields() {
        List<FilterField> fields = new ArrayList<>();
        for (Map.Entry<FilterField, Set<String>> entry : accepted.entrySet()) {
            if (entry.getValue().size() > 1) {
                fields.add(entry.getKey());
            }
        }
        return fields;
    }

    public Set<String> values(FilterField field) {
        Set<String> values = accepted.get(field);
        return values == null ? Set.of() : Collections.unmodifiableSet(values);
    }

    public boolean isEmpty() {
        return accepted.isEmpty();
    }

    @Override
    public String toString() {
        return accepted.toString();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<FilterField, Set<String>> accepted = new EnumMap<>(FilterField.class);

        private Builder() {
        }

        /**
         * Add accepted values for a field. Blank values are ignored.
         */
        public Builder accept(FilterField field, Collection<String> values) {
            if (values == null) {
                return this;
            }
            for (String value : values) {
                if (value == null || value.isBlank()) {
                    continue;
                }
                accepted.computeIfAbsent(field, key -> new LinkedHashSet<>()).add(normalize(value));
            }
            return this;
        }

        public Builder accept(FilterField field, String... values) {
            return accept(field, Arrays.asList(values));
        }

        public FilterCriteria build() {
            if (accepted.isEmpty()) {
                return NONE;
            }
            Map<FilterField, Set<String>> copy = new EnumMap<>(FilterField.class);
            for (Map.Entry<FilterField, Set<String>> entry : accepted.entrySet()) {
                copy.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
            }
            return new FilterCriteria(copy);
        }
    }
}
