package work.paramerge.api;

import java.util.Objects;
import work.paramerge.codec.ParameterFormat;

/**
 * Immutable options for a merge call.
 *
 * <p>{@code includeComments} is accepted for compatibility with existing callers and has no effect on output.
 */
public record MergeOptions(ParameterFormat outputFormat, boolean includeComments) {
    private static final MergeOptions DEFAULTS = builder().build();

    public MergeOptions {
        Objects.requireNonNull(outputFormat, "outputFormat");
    }

    public static MergeOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ParameterFormat outputFormat = ParameterFormat.YAML;
        private boolean includeComments;

        public Builder outputFormat(ParameterFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder includeComments(boolean includeComments) {
            this.includeComments = includeComments;
            return this;
        }

        public MergeOptions build() {
            return new MergeOptions(outputFormat, includeComments);
        }
    }
}
