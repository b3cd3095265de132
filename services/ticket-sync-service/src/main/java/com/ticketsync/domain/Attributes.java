package com.ticketsync.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Free-form structured attributes attached to requests and tickets.
 *
 * <p>Stored as JSON text; see {@code com.ticketsync.repository.AttributesConverters}.
 * Insertion order is preserved so the remote payload keeps the caller's field order.</p>
 */
public final class Attributes {

    private final Map<String, Object> values;

    private Attributes(Map<String, Object> values) {
        this.values = values;
    }

    public static Attributes empty() {
        return new Attributes(new LinkedHashMap<>());
    }

    public static Attributes of(Map<String, ?> values) {
        Attributes attributes = empty();
        if (values != null) {
            values.forEach(attributes::put);
        }
        return attributes;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Attributes put(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        values.put(key, value);
        return this;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Attributes that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
