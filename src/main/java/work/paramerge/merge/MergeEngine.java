package work.paramerge.merge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import work.paramerge.value.MappingValue;
import work.paramerge.value.ParameterValue;

/**
 * Deep merge of parameter documents: mappings are unioned key by key, every other value (scalars, nulls,
 * sequences, type mismatches) is replaced wholesale by the later document.
 */
public final class MergeEngine {
    private MergeEngine() {}

    /**
     * Folds the documents left to right; the last document has the highest precedence.
     * The inputs are not modified.
     */
    public static MappingValue fold(List<MappingValue> documents) {
        Objects.requireNonNull(documents, "documents");
        MappingValue merged = MappingValue.EMPTY;
        for (MappingValue document : documents) {
            merged = mergeInto(merged, Objects.requireNonNull(document, "document"));
        }
        return merged;
    }

    static MappingValue mergeInto(MappingValue target, MappingValue source) {
        var result = new LinkedHashMap<String, ParameterValue>(target.entries());
        for (var entry : source.entries().entrySet()) {
            ParameterValue existing = result.get(entry.getKey());
            ParameterValue incoming = entry.getValue();
            if (existing instanceof MappingValue left && incoming instanceof MappingValue right) {
                result.put(entry.getKey(), mergeInto(left, right));
                continue;
            }
            result.put(entry.getKey(), incoming);
        }
        return new MappingValue(result);
    }
}
