package work.paramerge.codec;

/**
 * Raised when a parameter document is neither valid JSON (text starting with <code>{</code>) nor valid YAML.
 */
public final class ParameterFormatException extends RuntimeException {
    private final int sourceIndex;
    private final String scopeName;

    public ParameterFormatException(String message, Throwable cause) {
        this(message, cause, -1, null);
    }

    private ParameterFormatException(String message, Throwable cause, int sourceIndex, String scopeName) {
        super(message, cause);
        this.sourceIndex = sourceIndex;
        this.scopeName = scopeName;
    }

    /**
     * Returns a copy that names the offending input of a merge call.
     */
    public ParameterFormatException forSource(int index, String scope) {
        String prefix = scope == null
            ? "Parameter source #" + index
            : "Parameter source #" + index + " (" + scope + ")";
        return new ParameterFormatException(prefix + ": " + getMessage(), getCause(), index, scope);
    }

    /**
     * Position of the failing document in the caller's input list, or {@code -1} when parsed outside a merge.
     */
    public int sourceIndex() {
        return sourceIndex;
    }

    public String scopeName() {
        return scopeName;
    }
}
