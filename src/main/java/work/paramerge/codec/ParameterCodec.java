package work.paramerge.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;
import work.paramerge.value.BoolValue;
import work.paramerge.value.FloatValue;
import work.paramerge.value.IntValue;
import work.paramerge.value.MappingValue;
import work.paramerge.value.NullValue;
import work.paramerge.value.ParameterValue;
import work.paramerge.value.SequenceValue;
import work.paramerge.value.StringValue;

/**
 * Converts parameter documents between YAML/JSON text and {@link ParameterValue} trees.
 *
 * <p>JSON is read with Jackson. YAML is read with SnakeYAML so that anchors and aliases resolve to the anchored
 * content; a {@link Yaml} loader is not thread-safe and is therefore created per call. Both formats are written
 * through Jackson generators.
 */
public final class ParameterCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParameterCodec.class);

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .stringQuotingChecker(new ScalarQuotingChecker())
        .build());

    private ParameterCodec() {}

    /**
     * Parses a parameter document. Text starting with <code>{</code> is read as JSON, anything else as YAML.
     * Blank text and documents whose root is not a mapping yield {@link MappingValue#EMPTY}.
     *
     * @throws ParameterFormatException if the text is not well-formed, repeats a mapping key, or holds more than
     *     one YAML document
     */
    public static MappingValue parse(String text) {
        String content = text == null ? "" : text.trim();
        if (content.isEmpty()) {
            return MappingValue.EMPTY;
        }
        return content.startsWith("{") ? parseJson(content) : parseYaml(content);
    }

    public static String serialize(ParameterValue value, ParameterFormat format) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(format, "format");
        var out = new StringWriter();
        try (JsonGenerator generator = switch (format) {
            case JSON -> JSON.createGenerator(out).useDefaultPrettyPrinter();
            case YAML -> YAML.createGenerator(out);
        }) {
            write(generator, value, format);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to serialize parameters as " + format + ": " + ex.getMessage(), ex);
        }
        return out.toString();
    }

    private static MappingValue parseJson(String content) {
        JsonNode root;
        try {
            root = JSON.readTree(content);
        } catch (JsonProcessingException ex) {
            throw new ParameterFormatException("Invalid JSON parameter document: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return MappingValue.EMPTY;
        }
        return toMapping(root);
    }

    private static MappingValue parseYaml(String content) {
        var options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        var yaml = new Yaml(
            new SafeConstructor(options),
            new Representer(new DumperOptions()),
            new DumperOptions(),
            options,
            ParameterYamlResolver.INSTANCE
        );
        Object root;
        try {
            root = yaml.load(content);
        } catch (YAMLException ex) {
            throw new ParameterFormatException("Invalid YAML parameter document: " + ex.getMessage(), ex);
        }
        if (root == null) {
            return MappingValue.EMPTY;
        }
        if (!(root instanceof Map<?, ?> map)) {
            LOGGER.warn("Parameter document root is a {} rather than a mapping; treating it as empty", kindOf(root));
            return MappingValue.EMPTY;
        }
        return toMapping(map, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static MappingValue toMapping(JsonNode node) {
        Map<String, ParameterValue> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            entries.put(field.getKey(), toValue(field.getValue()));
        }
        return new MappingValue(entries);
    }

    private static ParameterValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isObject()) {
            return toMapping(node);
        }
        if (node.isArray()) {
            List<ParameterValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toValue(item));
            }
            return new SequenceValue(items);
        }
        if (node.isBoolean()) {
            return BoolValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            if (node.isIntegralNumber() && node.canConvertToLong()) {
                return IntValue.of(node.longValue());
            }
            return FloatValue.of(node.doubleValue());
        }
        return StringValue.of(node.asText());
    }

    // Aliases hand back the anchored Java object, so a self-referencing anchor shows up as a cycle.
    private static MappingValue toMapping(Map<?, ?> map, Set<Object> open) {
        enter(map, open);
        Map<String, ParameterValue> entries = new LinkedHashMap<>();
        for (var entry : map.entrySet()) {
            String key = keyText(entry.getKey());
            if (entries.put(key, toValue(entry.getValue(), open)) != null) {
                throw new ParameterFormatException("Duplicate mapping key '" + key + "'", null);
            }
        }
        open.remove(map);
        return new MappingValue(entries);
    }

    private static ParameterValue toValue(Object value, Set<Object> open) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof Map<?, ?> map) {
            return toMapping(map, open);
        }
        if (value instanceof List<?> list) {
            enter(list, open);
            List<ParameterValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toValue(item, open));
            }
            open.remove(list);
            return new SequenceValue(items);
        }
        if (value instanceof String string) {
            return StringValue.of(string);
        }
        if (value instanceof Boolean bool) {
            return BoolValue.of(bool);
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? IntValue.of(big.longValue()) : FloatValue.of(big.doubleValue());
        }
        if (value instanceof Integer || value instanceof Long) {
            return IntValue.of(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return FloatValue.of(number.doubleValue());
        }
        throw new ParameterFormatException(
            "Unsupported YAML value of type " + value.getClass().getSimpleName(), null);
    }

    private static void enter(Object container, Set<Object> open) {
        if (!open.add(container)) {
            throw new ParameterFormatException("Recursive YAML alias", null);
        }
    }

    private static String keyText(Object key) {
        if (key instanceof Map<?, ?> || key instanceof List<?>) {
            throw new ParameterFormatException("Mapping keys must be scalars", null);
        }
        return String.valueOf(key);
    }

    private static String kindOf(Object root) {
        if (root instanceof List<?>) {
            return "array";
        }
        if (root instanceof Number) {
            return "number";
        }
        return root.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    private static void write(JsonGenerator generator, ParameterValue value, ParameterFormat format)
        throws IOException {
        if (value instanceof MappingValue mapping) {
            generator.writeStartObject();
            for (var entry : mapping.entries().entrySet()) {
                generator.writeFieldName(entry.getKey());
                write(generator, entry.getValue(), format);
            }
            generator.writeEndObject();
        } else if (value instanceof SequenceValue sequence) {
            generator.writeStartArray();
            for (ParameterValue item : sequence.items()) {
                write(generator, item, format);
            }
            generator.writeEndArray();
        } else if (value instanceof StringValue string) {
            generator.writeString(string.value());
        } else if (value instanceof IntValue integer) {
            if (integer.isInt32()) {
                generator.writeNumber((int) integer.value());
            } else {
                generator.writeNumber(integer.value());
            }
        } else if (value instanceof FloatValue number) {
            writeFloat(generator, number.value(), format);
        } else if (value instanceof BoolValue bool) {
            generator.writeBoolean(bool.value());
        } else {
            generator.writeNull();
        }
    }

    private static void writeFloat(JsonGenerator generator, double value, ParameterFormat format) throws IOException {
        if (Double.isFinite(value)) {
            generator.writeNumber(value);
            return;
        }
        if (format == ParameterFormat.JSON) {
            throw new ParameterFormatException("JSON cannot represent the number " + value, null);
        }
        if (Double.isNaN(value)) {
            generator.writeNumber(".nan");
        } else {
            generator.writeNumber(value > 0 ? ".inf" : "-.inf");
        }
    }

    /**
     * Quotes every string that the YAML reader would otherwise type as a number, boolean or null.
     */
    private static final class ScalarQuotingChecker extends StringQuotingChecker.Default {
        private static final long serialVersionUID = 1L;

        @Override
        public boolean needToQuoteName(String name) {
            return super.needToQuoteName(name) || ParameterYamlResolver.INSTANCE.readsAsNonString(name);
        }

        @Override
        public boolean needToQuoteValue(String value) {
            return super.needToQuoteValue(value) || ParameterYamlResolver.INSTANCE.readsAsNonString(value);
        }
    }
}
