package work.paramerge.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * String-keyed mapping. Insertion order is kept for serialization; equality ignores it.
 */
public record MappingValue(Map<String, ParameterValue> entries) implements ParameterValue {
    public static final MappingValue EMPTY = new MappingValue(Map.of());

    public MappingValue {
        Objects.requireNonNull(entries, "entries");
        var copy = new LinkedHashMap<String, ParameterValue>(entries.size());
        for (var entry : entries.entrySet()) {
            copy.put(
                Objects.requireNonNull(entry.getKey(), "key"),
                Objects.requireNonNull(entry.getValue(), "value for " + entry.getKey())
            );
        }
        entries = Collections.unmodifiableMap(copy);
    }

    public ParameterValue get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keySet() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Object toPlainObject() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (var entry : entries.entrySet()) {
            map.put(entry.getKey(), entry.getValue().toPlainObject());
        }
        return map;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
