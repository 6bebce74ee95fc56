package com.modeldoc.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered key/value table with lower-cased keys. Enumeration order is the order in which keys were
 * first added; putting an existing key again replaces its value but keeps its position.
 */
public final class KeyValueTable {
    private final Map<String, String> entries;

    private KeyValueTable(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static KeyValueTable empty() {
        return new KeyValueTable(new LinkedHashMap<>());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String canonicalKey(String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    public String get(String key) {
        return entries.get(canonicalKey(key));
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, String value) {
            entries.put(canonicalKey(key), value);
            return this;
        }

        public KeyValueTable build() {
            return new KeyValueTable(new LinkedHashMap<>(entries));
        }
    }
}
