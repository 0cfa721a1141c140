package work.paramerge.api;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.paramerge.codec.ParameterCodec;
import work.paramerge.codec.ParameterFormatException;
import work.paramerge.merge.MergeEngine;
import work.paramerge.merge.ProvenanceMerge;
import work.paramerge.value.MappingValue;

/**
 * {@link ParameterMerger} backed by {@link ParameterCodec} and {@link MergeEngine}. Stateless and thread-safe.
 */
public final class DefaultParameterMerger implements ParameterMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultParameterMerger.class);

    @Override
    public String merge(List<String> documents, MergeOptions options) {
        Objects.requireNonNull(documents, "documents");
        var effective = options == null ? MergeOptions.defaults() : options;

        var parsed = new ArrayList<MappingValue>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            parsed.add(parse(documents.get(i), i, null));
        }
        var merged = MergeEngine.fold(parsed);
        LOGGER.debug("Merged {} parameter documents into {} top-level keys", parsed.size(), merged.size());
        return ParameterCodec.serialize(merged, effective.outputFormat());
    }

    @Override
    public MergeResult mergeWithProvenance(List<ParameterSource> sources, MergeOptions options) {
        Objects.requireNonNull(sources, "sources");
        var effective = options == null ? MergeOptions.defaults() : options;

        var order = new ArrayList<Integer>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            Objects.requireNonNull(sources.get(i), "source");
            order.add(i);
        }
        order.sort(Comparator.comparingInt(i -> sources.get(i).precedence()));

        var documents = new ArrayList<ProvenanceMerge.ScopedDocument>(order.size());
        for (int index : order) {
            var source = sources.get(index);
            documents.add(new ProvenanceMerge.ScopedDocument(
                source.scopeName(),
                source.precedence(),
                parse(source.content(), index, source.scopeName())
            ));
        }
        var outcome = ProvenanceMerge.fold(documents);
        LOGGER.debug("Merged {} scoped parameter documents; {} leaf paths attributed",
            documents.size(), outcome.provenance().size());
        return new MergeResult(
            ParameterCodec.serialize(outcome.merged(), effective.outputFormat()),
            outcome.provenance()
        );
    }

    private static MappingValue parse(String content, int index, String scopeName) {
        Objects.requireNonNull(content, "document");
        try {
            return ParameterCodec.parse(content);
        } catch (ParameterFormatException ex) {
            throw ex.forSource(index, scopeName);
        }
    }
}
