package com.api.client.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Multi-valued query parameters. A key may carry several values; values keep insertion order.
 *
 * <p>{@link #encode()} sorts keys so the same parameters always produce the same query string,
 * which keeps request signing reproducible.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class QueryParams {

    private final Map<String, List<String>> values = new LinkedHashMap<>();

    public QueryParams() {
    }

    private QueryParams(QueryParams source) {
        source.values.forEach((key, list) -> values.put(key, new ArrayList<>(list)));
    }

    public static QueryParams of(String key, String value) {
        return new QueryParams().add(key, value);
    }

    public static QueryParams of(String key1, String value1, String key2, String value2) {
        return new QueryParams().add(key1, value1).add(key2, value2);
    }

    /**
     * Appends a value to the key, keeping any existing values.
     */
    public QueryParams add(String key, String value) {
        validate(key, value);
        values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Replaces every value of the key with a single value.
     */
    public QueryParams set(String key, String value) {
        validate(key, value);
        List<String> list = new ArrayList<>();
        list.add(value);
        values.put(key, list);
        return this;
    }

    public QueryParams remove(String key) {
        values.remove(key);
        return this;
    }

    /**
     * First value of the key, or {@code null} if it is absent.
     */
    public String getFirst(String key) {
        List<String> list = values.get(key);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public List<String> getAll(String key) {
        List<String> list = values.get(key);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public QueryParams copy() {
        return new QueryParams(this);
    }

    /**
     * Form-encodes the parameters as {@code k1=v1&k1=v2&k2=v3}, keys in sorted order.
     * Returns an empty string when there are no parameters.
     */
    public String encode() {
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : new TreeMap<>(values).entrySet()) {
            String encodedKey = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            for (String value : entry.getValue()) {
                if (query.length() > 0) {
                    query.append('&');
                }
                query.append(encodedKey)
                        .append('=')
                        .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        return query.toString();
    }

    private static void validate(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryParams other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParams" + values;
    }
}
