package work.paramerge.api;

import java.util.List;

/**
 * Merges parameter documents from several scopes into one.
 */
public interface ParameterMerger {
    /**
     * Merges documents in the given order (first = lowest precedence, last = highest).
     *
     * @param documents YAML or JSON parameter documents
     * @param options merge options, {@code null} for {@link MergeOptions#defaults()}
     * @return the merged document in the requested output format
     * @throws work.paramerge.codec.ParameterFormatException if a document is malformed
     */
    String merge(List<String> documents, MergeOptions options);

    /**
     * Merges scoped documents, ordered by ascending precedence (ties keep input order), and records which scope
     * supplied each leaf value.
     *
     * @param sources scoped parameter documents
     * @param options merge options, {@code null} for {@link MergeOptions#defaults()}
     * @throws work.paramerge.codec.ParameterFormatException if a document is malformed
     */
    MergeResult mergeWithProvenance(List<ParameterSource> sources, MergeOptions options);

    default String merge(List<String> documents) {
        return merge(documents, null);
    }

    default MergeResult mergeWithProvenance(List<ParameterSource> sources) {
        return mergeWithProvenance(sources, null);
    }
}
