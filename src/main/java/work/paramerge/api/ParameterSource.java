package work.paramerge.api;

import java.util.Objects;

/**
 * One scope's parameter document (YAML or JSON text) and the precedence used to order and attribute it.
 */
public record ParameterSource(String scopeName, int precedence, String content) {
    public ParameterSource {
        Objects.requireNonNull(scopeName, "scopeName");
        Objects.requireNonNull(content, "content");
    }
}
