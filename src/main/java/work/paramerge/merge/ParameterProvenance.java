package work.paramerge.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.paramerge.value.ParameterValue;

/**
 * Ledger entry for one leaf path: the scope that last set it and, newest first, the values it replaced.
 * {@code overriddenValues} is {@code null} when the leaf did not replace anything recorded.
 */
public record ParameterProvenance(
    String scopeName,
    int precedence,
    ParameterValue value,
    List<ScopeValue> overriddenValues
) {
    public ParameterProvenance {
        Objects.requireNonNull(scopeName, "scopeName");
        Objects.requireNonNull(value, "value");
        if (overriddenValues != null) {
            overriddenValues = List.copyOf(overriddenValues);
        }
    }

    public ScopeValue asScopeValue() {
        return new ScopeValue(scopeName, precedence, value);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scopeName", scopeName);
        map.put("precedence", precedence);
        map.put("value", value.toPlainObject());
        if (overriddenValues != null) {
            List<Map<String, Object>> overridden = new ArrayList<>(overriddenValues.size());
            for (ScopeValue entry : overriddenValues) {
                overridden.add(entry.toSerializableMap());
            }
            map.put("overriddenValues", overridden);
        }
        return map;
    }
}
