package work.paramerge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.paramerge.codec.ParameterCodec;
import work.paramerge.codec.ParameterFormat;
import work.paramerge.codec.ParameterFormatException;
import work.paramerge.merge.ScopeValue;
import work.paramerge.value.SequenceValue;
import work.paramerge.value.StringValue;

class DefaultParameterMergerTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final MergeOptions JSON_OUTPUT = MergeOptions.builder().outputFormat(ParameterFormat.JSON).build();

    private final ParameterMerger merger = new DefaultParameterMerger();

    @Test
    void laterDocumentOverridesScalars() {
        var result = merger.merge(List.of(
            "server: localhost\nport: 8080\ndatabase: dev",
            "server: production.example.com\ndatabase: production"
        ));

        assertTrue(result.contains("server: production.example.com"), result);
        assertTrue(result.contains("port: 8080"), result);
        assertTrue(result.contains("database: production"), result);
    }

    @Test
    void jsonOutputKeepsPortAsInteger() throws Exception {
        var result = merger.merge(List.of("server: localhost\nport: 8080"), JSON_OUTPUT);

        var tree = JSON.readTree(result);
        assertEquals(2, tree.size());
        assertEquals("localhost", tree.get("server").textValue());
        assertTrue(tree.get("port").isInt());
        assertEquals(8080, tree.get("port").intValue());
    }

    @Test
    void nestedMappingsMergeKeyByKey() {
        var result = merger.merge(List.of(
            "config:\n  keep: original\n  replace: old",
            "config:\n  replace: new\n  add: additional"
        ));

        assertEquals(
            ParameterCodec.parse("config:\n  keep: original\n  replace: new\n  add: additional\n"),
            ParameterCodec.parse(result)
        );
    }

    @Test
    void sequencesAreReplacedWholesale() {
        var result = merger.merge(List.of("servers:\n  - server1\n  - server2", "servers:\n  - server3"));

        assertEquals(SequenceValue.of(StringValue.of("server3")), ParameterCodec.parse(result).get("servers"));
        assertFalse(result.contains("server1"), result);
        assertFalse(result.contains("server2"), result);
    }

    @Test
    void mixesYamlAndJsonInputs() {
        var result = merger.merge(List.of(
            "server:\n  host: localhost\n",
            "{\n  \"server\": {\n    \"port\": 8080\n  }\n}"
        ));

        assertTrue(result.contains("host: localhost"), result);
        assertTrue(result.contains("port: 8080"), result);
    }

    @Test
    void keepsNumberAndBooleanForms() {
        var result = merger.merge(List.of(
            "settings:\n  timeout: 30\n  retries: 3\n  threshold: 0.95\nfeatures:\n  enabled: true\n  debug: false\n"
        ));

        assertTrue(result.contains("timeout: 30"), result);
        assertTrue(result.contains("threshold: 0.95"), result);
        assertTrue(result.contains("enabled: true"), result);
        assertTrue(result.contains("debug: false"), result);
    }

    @Test
    void emptyInputsProduceEmptyDocument() {
        assertEquals("{}", merger.merge(List.of()).trim());
        assertEquals("{}", merger.merge(List.of("", "  ", "\n")).trim());
    }

    @Test
    void nullOptionsDefaultToYaml() {
        var result = merger.merge(List.of("value: test"), null);

        assertTrue(result.contains("value: test"), result);
        assertFalse(result.contains("\"value\""), result);
        assertFalse(result.contains("{"), result);
    }

    @Test
    void includeCommentsDoesNotChangeOutput() {
        var documents = List.of("# a comment\nvalue: test\nnested:\n  key: 1\n");
        var withComments = merger.merge(documents, MergeOptions.builder().includeComments(true).build());

        assertEquals(merger.merge(documents), withComments);
        assertFalse(withComments.contains("#"), withComments);
    }

    @Test
    void nonObjectJsonRootContributesNothing() {
        var result = merger.merge(List.of("a: 1", "[\"x\", \"y\"]"), JSON_OUTPUT);

        assertEquals(ParameterCodec.parse("a: 1"), ParameterCodec.parse(result));
    }

    @Test
    void formatErrorNamesFailingDocument() {
        var ex = assertThrows(ParameterFormatException.class,
            () -> merger.merge(List.of("a: 1", "b: 2", "{\"broken\": ")));

        assertEquals(2, ex.sourceIndex());
        assertNull(ex.scopeName());
        assertTrue(ex.getMessage().startsWith("Parameter source #2"), ex.getMessage());
    }

    @Test
    void provenanceForSingleSourceIsEmpty() {
        var result = merger.mergeWithProvenance(List.of(new ParameterSource("Global", 1, "value: test")));

        assertTrue(result.mergedContent().contains("value: test"));
        assertTrue(result.provenance().isEmpty());
    }

    @Test
    void provenanceForEmptyInputUsesDefaults() {
        var result = merger.mergeWithProvenance(List.of(), null);

        assertEquals("{}", result.mergedContent().trim());
        assertTrue(result.provenance().isEmpty());
    }

    @Test
    void provenanceAttributesOverriddenLeaf() {
        var result = merger.mergeWithProvenance(List.of(
            new ParameterSource("Global", 1, "server:\n  host: localhost\n  port: 8080"),
            new ParameterSource("Production", 2, "server:\n  host: prod.example.com")
        ));

        var host = result.provenance().get("server.host");
        assertEquals("Production", host.scopeName());
        assertEquals(StringValue.of("prod.example.com"), host.value());
        assertNull(host.overriddenValues());
        assertFalse(result.provenance().containsKey("server.port"));
    }

    @Test
    void provenanceChainExcludesBaseline() {
        var result = merger.mergeWithProvenance(List.of(
            new ParameterSource("Global", 1, "value: a"),
            new ParameterSource("Environment", 2, "value: b"),
            new ParameterSource("Node", 3, "value: c")
        ));

        var value = result.provenance().get("value");
        assertEquals("Node", value.scopeName());
        assertEquals(1, value.overriddenValues().size());
        assertEquals("Environment", value.overriddenValues().get(0).scopeName());
    }

    @Test
    void provenanceSortsByPrecedenceAndKeepsTieOrder() {
        var result = merger.mergeWithProvenance(List.of(
            new ParameterSource("Node", 3, "value: node"),
            new ParameterSource("Global", 1, "value: global\nshared: global"),
            new ParameterSource("TeamA", 2, "shared: a"),
            new ParameterSource("TeamB", 2, "shared: b")
        ), JSON_OUTPUT);

        var merged = ParameterCodec.parse(result.mergedContent());
        assertEquals(StringValue.of("node"), merged.get("value"));
        assertEquals(StringValue.of("b"), merged.get("shared"));
        assertEquals("TeamB", result.provenance().get("shared").scopeName());
        assertEquals(List.of(new ScopeValue("TeamA", 2, StringValue.of("a"))),
            result.provenance().get("shared").overriddenValues());
        assertTrue(result.mergedContent().trim().startsWith("{"));
    }

    @Test
    void provenanceFormatErrorNamesScopeAndInputIndex() {
        var ex = assertThrows(ParameterFormatException.class, () -> merger.mergeWithProvenance(List.of(
            new ParameterSource("Node", 3, "value: fine"),
            new ParameterSource("Global", 1, "value: [unclosed")
        )));

        assertEquals(1, ex.sourceIndex());
        assertEquals("Global", ex.scopeName());
    }

    @Test
    void plainMergeDoesNotReorderByPrecedence() {
        var result = merger.merge(List.of("value: high", "value: low"));
        assertTrue(result.contains("value: low"), result);
    }

    @Test
    void resultSerializesLedgerInExchangeShape() throws Exception {
        var result = merger.mergeWithProvenance(List.of(
            new ParameterSource("Global", 1, "server:\n  port: 80"),
            new ParameterSource("Environment", 2, "server:\n  port: 8080"),
            new ParameterSource("Node", 3, "server:\n  port: 9090\n  tags: [a, b]")
        ));

        var tree = JSON.readTree(result.toPrettyJson());
        assertEquals(result.mergedContent(), tree.get("mergedContent").textValue());
        var port = tree.get("provenance").get("server.port");
        assertEquals("Node", port.get("scopeName").textValue());
        assertEquals(3, port.get("precedence").intValue());
        assertEquals(9090, port.get("value").intValue());
        assertEquals("Environment", port.get("overriddenValues").get(0).get("scopeName").textValue());
        var tags = tree.get("provenance").get("server.tags");
        assertFalse(tags.has("overriddenValues"));
        assertEquals(List.of("a", "b"), JSON.convertValue(tags.get("value"), List.class));
        assertEquals(Map.of("scopeName", "Node", "precedence", 3, "value", List.of("a", "b")),
            result.provenanceToSerializableMap().get("server.tags"));
    }
}
