package work.paramerge.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.paramerge.api.ParameterSource;

/**
 * Reads per-scope parameter documents from a data directory laid out as
 * {@code parameters/<configuration>/<scopeType>[/<scopeValue>]/parameters.yaml}.
 */
public final class ScopedParameterStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScopedParameterStore.class);
    static final String PARAMETERS_DIR = "parameters";
    static final String PARAMETERS_FILE = "parameters.yaml";

    private final Path dataDirectory;

    public ScopedParameterStore(Path dataDirectory) {
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory").toAbsolutePath().normalize();
    }

    /**
     * Location of the parameter file for a configuration and scope; the file may not exist.
     */
    public Path resolve(String configuration, ScopeSelection selection) {
        Objects.requireNonNull(selection, "selection");
        Path path = dataDirectory.resolve(PARAMETERS_DIR).resolve(segment(configuration, "configuration"));
        path = path.resolve(segment(selection.scopeType(), "scopeType"));
        if (selection.scopeValue().isPresent()) {
            path = path.resolve(segment(selection.scopeValue().get(), "scopeValue"));
        }
        return path.resolve(PARAMETERS_FILE);
    }

    public Optional<ParameterSource> load(String configuration, ScopeSelection selection) {
        Path path = resolve(configuration, selection);
        if (!Files.isRegularFile(path)) {
            LOGGER.debug("No parameter file for scope {} at {}", selection.scopeName(), path);
            return Optional.empty();
        }
        try {
            String content = Files.readString(path);
            return Optional.of(new ParameterSource(selection.scopeName(), selection.precedence(), content));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read parameter file: " + path, ex);
        }
    }

    /**
     * Loads every selected scope that has a parameter file, ordered by ascending precedence.
     */
    public List<ParameterSource> loadAll(String configuration, List<ScopeSelection> selections) {
        Objects.requireNonNull(selections, "selections");
        var sources = new ArrayList<ParameterSource>();
        for (ScopeSelection selection : selections) {
            load(configuration, selection).ifPresent(sources::add);
        }
        sources.sort(Comparator.comparingInt(ParameterSource::precedence));
        return sources;
    }

    private static String segment(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.equals(".") || trimmed.equals("..") || trimmed.contains("/") || trimmed.contains("\\")
            || trimmed.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid " + label + " path segment: " + value);
        }
        return trimmed;
    }
}
