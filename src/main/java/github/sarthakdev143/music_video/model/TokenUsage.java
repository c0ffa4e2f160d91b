package github.sarthakdev143.music_video.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulated usage per category. Values are numbers (integral values held as {@link Long},
 * fractional ones as {@link Double}), nested maps, or arbitrary scalars.
 */
public final class TokenUsage {

    private final Map<String, Object> values;

    private TokenUsage(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TokenUsage initial() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (TokenCategory category : TokenCategory.values()) {
            values.put(category.key(), 0L);
        }
        return new TokenUsage(values);
    }

    @JsonCreator
    public static TokenUsage of(Map<String, ?> values) {
        if (values == null) {
            return new TokenUsage(new LinkedHashMap<>());
        }
        return new TokenUsage(normalizeMap(values));
    }

    public static Map<String, Object> delta(TokenCategory category, long amount) {
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put(category.key(), amount);
        return delta;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public long get(TokenCategory category) {
        Object value = values.get(category.key());
        return value instanceof Number number ? number.longValue() : 0L;
    }

    public long total() {
        long total = 0L;
        for (Object value : values.values()) {
            if (value instanceof Number number) {
                total += number.longValue();
            }
        }
        return total;
    }

    /**
     * Numbers add, maps merge recursively, anything else overwrites. Null delta values are skipped.
     */
    public TokenUsage merge(Map<String, ?> delta) {
        if (delta == null || delta.isEmpty()) {
            return this;
        }
        return new TokenUsage(mergeMaps(values, normalizeMap(delta)));
    }

    /**
     * Overlays another usage document over this one without accumulating, used to rebuild
     * usage from a snapshot on top of the defaults.
     */
    public TokenUsage overlay(TokenUsage other) {
        if (other == null) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values);
        return new TokenUsage(merged);
    }

    private static Map<String, Object> mergeMaps(Map<String, Object> current, Map<String, Object> delta) {
        Map<String, Object> merged = new LinkedHashMap<>(current);
        for (Map.Entry<String, Object> entry : delta.entrySet()) {
            Object existing = merged.get(entry.getKey());
            Object incoming = entry.getValue();
            if (incoming == null) {
                continue;
            }
            merged.put(entry.getKey(), mergeValue(existing, incoming));
        }
        return merged;
    }

    private static Object mergeValue(Object existing, Object incoming) {
        if (existing instanceof Number current && incoming instanceof Number added) {
            return addNumbers(current, added);
        }
        if (existing instanceof Map<?, ?> currentMap && incoming instanceof Map<?, ?> incomingMap) {
            return Collections.unmodifiableMap(mergeMaps(normalizeMap(currentMap), normalizeMap(incomingMap)));
        }
        return incoming;
    }

    private static Number addNumbers(Number current, Number added) {
        if (current instanceof Long && added instanceof Long) {
            return current.longValue() + added.longValue();
        }
        return normalizeNumber(current.doubleValue() + added.doubleValue());
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            normalized.put(String.valueOf(entry.getKey()), normalizeValue(entry.getValue()));
        }
        return normalized;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(normalizeMap(map));
        }
        return value;
    }

    private static Number normalizeNumber(Number number) {
        double asDouble = number.doubleValue();
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (!Double.isInfinite(asDouble) && asDouble == Math.rint(asDouble) && Math.abs(asDouble) < Long.MAX_VALUE) {
            return (long) asDouble;
        }
        return asDouble;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof TokenUsage that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TokenUsage" + values;
    }
}
