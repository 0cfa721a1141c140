package work.paramerge.codec;

import java.util.Locale;

/**
 * Output syntax for merged parameter documents.
 */
public enum ParameterFormat {
    YAML,
    JSON;

    public static ParameterFormat from(String value) {
        if (value == null || value.isBlank()) {
            return YAML;
        }
        try {
            return ParameterFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported parameter format: " + value);
        }
    }
}
