package work.paramerge.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.paramerge.api.DefaultParameterMerger;
import work.paramerge.api.MergeOptions;
import work.paramerge.api.MergeResult;
import work.paramerge.api.ParameterMerger;
import work.paramerge.api.ParameterSource;
import work.paramerge.codec.ParameterFormat;
import work.paramerge.store.ScopeSelection;
import work.paramerge.store.ScopedParameterStore;

@CommandLine.Command(
    name = "paramerge",
    description = "Merge YAML/JSON parameter documents from lowest to highest precedence.",
    mixinStandardHelpOptions = true,
    versionProvider = MergeCommand.Version.class,
    showDefaultValues = true
)
final class MergeCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MergeCommand.class);
    private static final String STDIN = "-";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        paramLabel = "FILE",
        arity = "0..*",
        description = "Parameter files merged in the given order (last wins); '-' reads stdin."
    )
    private List<String> files = new ArrayList<>();

    @CommandLine.Option(
        names = {"-s", "--source"},
        paramLabel = "NAME:PRECEDENCE=PATH",
        description = "Scoped parameter file; sources are ordered by ascending precedence."
    )
    private List<String> scopedFiles = new ArrayList<>();

    @CommandLine.Option(
        names = "--scope",
        paramLabel = "TYPE[=VALUE]:PRECEDENCE",
        description = "Scope to load from the data directory (requires --configuration)."
    )
    private List<String> scopes = new ArrayList<>();

    @CommandLine.Option(
        names = "--data-dir",
        description = "Data directory holding parameters/<configuration>/<scope>/parameters.yaml.",
        defaultValue = "data"
    )
    private Path dataDir;

    @CommandLine.Option(
        names = "--configuration",
        description = "Configuration name used with --scope.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configuration;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (yaml|json).",
        defaultValue = "yaml"
    )
    private String format;

    @CommandLine.Option(
        names = "--include-comments",
        description = "Accepted for compatibility; has no effect on output."
    )
    private boolean includeComments;

    @CommandLine.Option(
        names = "--provenance",
        description = "Print {mergedContent, provenance} as JSON instead of the merged document."
    )
    private boolean provenance;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the result to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    private final ParameterMerger merger;

    MergeCommand() {
        this(new DefaultParameterMerger());
    }

    MergeCommand(ParameterMerger merger) {
        this.merger = merger;
    }

    @Override
    public Integer call() throws Exception {
        MergeOptions options = MergeOptions.builder()
            .outputFormat(parseFormat())
            .includeComments(includeComments)
            .build();

        boolean scoped = !scopedFiles.isEmpty() || !scopes.isEmpty();
        if (scoped && !files.isEmpty()) {
            throw usage("Positional files cannot be combined with --source or --scope.");
        }
        if (!scoped && files.isEmpty()) {
            throw usage("At least one parameter file, --source or --scope is required.");
        }
        if (!scopes.isEmpty() && (configuration == null || configuration.isBlank())) {
            throw usage("--scope requires --configuration.");
        }

        List<ParameterSource> sources = scoped ? loadScopedSources() : loadPositionalSources();
        LOGGER.debug("Loaded {} parameter sources", sources.size());

        String rendered;
        if (provenance) {
            MergeResult result = merger.mergeWithProvenance(sources, options);
            rendered = result.toPrettyJson();
        } else {
            List<ParameterSource> ordered = new ArrayList<>(sources);
            ordered.sort(Comparator.comparingInt(ParameterSource::precedence));
            List<String> documents = new ArrayList<>(ordered.size());
            for (ParameterSource source : ordered) {
                documents.add(source.content());
            }
            rendered = merger.merge(documents, options);
        }
        write(rendered);
        return 0;
    }

    private ParameterFormat parseFormat() {
        try {
            return ParameterFormat.from(format);
        } catch (IllegalArgumentException ex) {
            throw usage(ex.getMessage());
        }
    }

    private List<ParameterSource> loadPositionalSources() {
        var sources = new ArrayList<ParameterSource>(files.size());
        for (int i = 0; i < files.size(); i++) {
            String file = files.get(i);
            sources.add(new ParameterSource(file, i, read(file)));
        }
        return sources;
    }

    private List<ParameterSource> loadScopedSources() {
        var sources = new ArrayList<ParameterSource>();
        for (String raw : scopedFiles) {
            sources.add(parseScopedFile(raw));
        }
        if (!scopes.isEmpty()) {
            var selections = new ArrayList<ScopeSelection>(scopes.size());
            for (String raw : scopes) {
                try {
                    selections.add(ScopeSelection.parse(raw));
                } catch (IllegalArgumentException ex) {
                    throw usage(ex.getMessage());
                }
            }
            sources.addAll(new ScopedParameterStore(dataDir).loadAll(configuration, selections));
        }
        return sources;
    }

    private ParameterSource parseScopedFile(String raw) {
        int equals = raw.indexOf('=');
        int colon = equals < 0 ? -1 : raw.lastIndexOf(':', equals);
        if (colon <= 0 || equals == raw.length() - 1) {
            throw usage("--source must look like NAME:PRECEDENCE=PATH: " + raw);
        }
        int precedence;
        try {
            precedence = Integer.parseInt(raw.substring(colon + 1, equals).trim());
        } catch (NumberFormatException ex) {
            throw usage("Invalid precedence in --source " + raw);
        }
        return new ParameterSource(raw.substring(0, colon).trim(), precedence, read(raw.substring(equals + 1).trim()));
    }

    private String read(String file) {
        try {
            if (STDIN.equals(file)) {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read parameter file: " + file, ex);
        }
    }

    private void write(String rendered) throws IOException {
        String text = rendered.endsWith("\n") ? rendered : rendered + System.lineSeparator();
        if (output != null) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text);
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.print(text);
        out.flush();
    }

    private CommandLine.ParameterException usage(String message) {
        return new CommandLine.ParameterException(spec.commandLine(), message);
    }

    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = MergeCommand.class.getPackage().getImplementationVersion();
            return new String[] {
                "paramerge " + (version != null ? version : "development"),
                "Java " + Runtime.version()
            };
        }
    }
}
