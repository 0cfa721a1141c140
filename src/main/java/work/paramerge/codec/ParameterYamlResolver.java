package work.paramerge.codec;

import java.util.regex.Pattern;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Implicit scalar typing shared by the YAML reader and the YAML quoting rules.
 *
 * <p>Numbers and nulls follow YAML 1.1. Booleans are limited to {@code true}/{@code false} and timestamps stay
 * strings, so {@code yes} or {@code 2024-01-31} read back as text.
 */
final class ParameterYamlResolver extends Resolver {
    private static final Pattern BOOLEAN = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");

    static final ParameterYamlResolver INSTANCE = new ParameterYamlResolver();

    @Override
    protected void addImplicitResolvers() {
        addImplicitResolver(Tag.BOOL, BOOLEAN, "tTfF");
        addImplicitResolver(Tag.INT, INT, "-+0123456789");
        addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
        addImplicitResolver(Tag.MERGE, MERGE, "<");
        addImplicitResolver(Tag.NULL, NULL, "~nN\0");
        addImplicitResolver(Tag.NULL, EMPTY, null);
    }

    /**
     * True when a plain (unquoted) scalar with this text would be read as something other than a string.
     */
    boolean readsAsNonString(String text) {
        return !Tag.STR.equals(resolve(NodeId.scalar, text, true));
    }
}
