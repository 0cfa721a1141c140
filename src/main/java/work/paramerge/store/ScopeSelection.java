package work.paramerge.store;

import java.util.Objects;
import java.util.Optional;

/**
 * A scope tier selected for a merge: its type (e.g. {@code Default}, {@code Environment}, {@code Node}), the
 * optional value within that type (e.g. {@code Production}, a node FQDN) and its precedence.
 */
public record ScopeSelection(String scopeType, Optional<String> scopeValue, int precedence) {
    public ScopeSelection {
        Objects.requireNonNull(scopeType, "scopeType");
        Objects.requireNonNull(scopeValue, "scopeValue");
        if (scopeType.isBlank()) {
            throw new IllegalArgumentException("scopeType must not be blank");
        }
        if (scopeValue.isPresent() && scopeValue.get().isBlank()) {
            throw new IllegalArgumentException("scopeValue must not be blank");
        }
    }

    public static ScopeSelection of(String scopeType, int precedence) {
        return new ScopeSelection(scopeType, Optional.empty(), precedence);
    }

    public static ScopeSelection of(String scopeType, String scopeValue, int precedence) {
        return new ScopeSelection(scopeType, Optional.of(scopeValue), precedence);
    }

    /**
     * Parses {@code Type:precedence} or {@code Type=Value:precedence}.
     */
    public static ScopeSelection parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Scope selection must not be empty");
        }
        String trimmed = raw.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            throw new IllegalArgumentException("Scope selection must look like Type[=Value]:precedence: " + raw);
        }
        int precedence;
        try {
            precedence = Integer.parseInt(trimmed.substring(colon + 1).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid scope precedence in: " + raw);
        }
        String scope = trimmed.substring(0, colon).trim();
        int equals = scope.indexOf('=');
        if (equals < 0) {
            return of(scope, precedence);
        }
        return of(scope.substring(0, equals).trim(), scope.substring(equals + 1).trim(), precedence);
    }

    /**
     * Name used for provenance attribution: {@code Type} or {@code Type/Value}.
     */
    public String scopeName() {
        return scopeValue.map(value -> scopeType + "/" + value).orElse(scopeType);
    }
}
