package work.paramerge.merge;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.paramerge.value.ParameterValue;

/**
 * A value contributed by one scope and later overridden.
 */
public record ScopeValue(String scopeName, int precedence, ParameterValue value) {
    public ScopeValue {
        Objects.requireNonNull(scopeName, "scopeName");
        Objects.requireNonNull(value, "value");
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scopeName", scopeName);
        map.put("precedence", precedence);
        map.put("value", value.toPlainObject());
        return map;
    }
}
