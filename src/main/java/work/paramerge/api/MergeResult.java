package work.paramerge.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.paramerge.merge.ParameterProvenance;

/**
 * Merged document text plus the provenance ledger keyed by dot-joined leaf path.
 */
public record MergeResult(String mergedContent, Map<String, ParameterProvenance> provenance) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public MergeResult {
        Objects.requireNonNull(mergedContent, "mergedContent");
        provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
    }

    /**
     * Ledger in its exchange shape: {@code {path: {scopeName, precedence, value, overriddenValues?}}}.
     */
    public Map<String, Object> provenanceToSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        for (var entry : provenance.entrySet()) {
            serializable.put(entry.getKey(), entry.getValue().toSerializableMap());
        }
        return serializable;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("mergedContent", mergedContent);
        serializable.put("provenance", provenanceToSerializableMap());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            throw new IllegalStateException("Unable to serialize merge result: " + ex.getMessage(), ex);
        }
    }
}
