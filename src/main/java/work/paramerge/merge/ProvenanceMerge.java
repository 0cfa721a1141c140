package work.paramerge.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.paramerge.value.MappingValue;
import work.paramerge.value.ParameterValue;

/**
 * {@link MergeEngine} fold that also keeps a ledger of which scope set each leaf.
 *
 * <p>Ledger keys are mapping keys joined with {@code "."} from the root. Only leaves (anything that is not a
 * mapping) are recorded, and the first document is the unrecorded baseline. A key that itself contains a dot
 * cannot be told apart from a nesting boundary.
 */
public final class ProvenanceMerge {
    private ProvenanceMerge() {}

    /**
     * A parsed document tagged with the scope it came from.
     */
    public record ScopedDocument(String scopeName, int precedence, MappingValue document) {
        public ScopedDocument {
            Objects.requireNonNull(scopeName, "scopeName");
            Objects.requireNonNull(document, "document");
        }
    }

    public record Outcome(MappingValue merged, Map<String, ParameterProvenance> provenance) {
        public Outcome {
            Objects.requireNonNull(merged, "merged");
            provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        }
    }

    /**
     * Folds the documents in list order. Callers sort by precedence beforehand.
     */
    public static Outcome fold(List<ScopedDocument> documents) {
        Objects.requireNonNull(documents, "documents");
        var ledger = new LinkedHashMap<String, ParameterProvenance>();
        MappingValue merged = MappingValue.EMPTY;
        for (int i = 0; i < documents.size(); i++) {
            var pass = new Pass(Objects.requireNonNull(documents.get(i), "document"), i > 0, ledger);
            merged = pass.mergeInto(merged, pass.source.document(), null);
        }
        return new Outcome(merged, ledger);
    }

    private static final class Pass {
        private final ScopedDocument source;
        private final boolean recording;
        private final Map<String, ParameterProvenance> ledger;

        private Pass(ScopedDocument source, boolean recording, Map<String, ParameterProvenance> ledger) {
            this.source = source;
            this.recording = recording;
            this.ledger = ledger;
        }

        private MappingValue mergeInto(MappingValue target, MappingValue incoming, String parentPath) {
            var result = new LinkedHashMap<String, ParameterValue>(target.entries());
            for (var entry : incoming.entries().entrySet()) {
                String key = entry.getKey();
                String path = parentPath == null ? key : parentPath + "." + key;
                ParameterValue existing = result.get(key);
                ParameterValue value = entry.getValue();

                if (existing == null) {
                    result.put(key, value);
                    recordLeaves(path, value);
                    continue;
                }
                if (existing instanceof MappingValue left && value instanceof MappingValue right) {
                    result.put(key, mergeInto(left, right, path));
                    continue;
                }
                result.put(key, value);
                recordReplacement(path, existing, value);
            }
            return new MappingValue(result);
        }

        private void recordLeaves(String path, ParameterValue value) {
            if (!recording) {
                return;
            }
            if (value instanceof MappingValue mapping) {
                for (var entry : mapping.entries().entrySet()) {
                    recordLeaves(path + "." + entry.getKey(), entry.getValue());
                }
                return;
            }
            ledger.put(path, new ParameterProvenance(source.scopeName(), source.precedence(), value, null));
        }

        private void recordReplacement(String path, ParameterValue previous, ParameterValue value) {
            if (previous.isMapping()) {
                String prefix = path + ".";
                ledger.keySet().removeIf(key -> key.startsWith(prefix));
            }
            if (value.isMapping()) {
                // a leaf turned into a mapping: its history no longer points at a leaf
                ledger.remove(path);
                recordLeaves(path, value);
                return;
            }
            if (!recording) {
                return;
            }
            List<ScopeValue> overridden = new ArrayList<>();
            ParameterProvenance existing = ledger.get(path);
            if (existing != null) {
                overridden.add(existing.asScopeValue());
                if (existing.overriddenValues() != null) {
                    overridden.addAll(existing.overriddenValues());
                }
            }
            ledger.put(path, new ParameterProvenance(
                source.scopeName(),
                source.precedence(),
                value,
                overridden.isEmpty() ? null : overridden
            ));
        }
    }
}
