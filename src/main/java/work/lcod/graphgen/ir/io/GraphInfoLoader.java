package work.lcod.graphgen.ir.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.graphgen.ir.DynamicTypeDescriptor;
import work.lcod.graphgen.ir.FieldSpec;
import work.lcod.graphgen.ir.GraphInfo;
import work.lcod.graphgen.ir.NodeSpec;

/**
 * Loads serialized graph descriptions (JSON or YAML, snake_case keys as written by the Python introspector) into
 * {@link GraphInfo}.
 */
public final class GraphInfoLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private GraphInfoLoader() {}

    public static GraphInfo load(Path path) {
        var source = path.toString();
        var mapper = isJson(path) ? JSON_MAPPER : YAML_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return read(mapper.readTree(in), source);
        } catch (JsonProcessingException ex) {
            throw new IrFormatException(source, "malformed content: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new IrFormatException(source, "failed to read graph description", ex);
        }
    }

    /**
     * Parses in-memory content. YAML is a superset of JSON, so either format is accepted.
     */
    public static GraphInfo parse(String content, String source) {
        try {
            return read(YAML_MAPPER.readTree(content), source);
        } catch (JsonProcessingException ex) {
            throw new IrFormatException(source, "malformed content: " + ex.getOriginalMessage(), ex);
        }
    }

    public static GraphInfo read(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new IrFormatException(source, "root must be a mapping");
        }
        var builder = GraphInfo.builder();
        text(root, "name", "graph_name").ifPresent(builder::name);
        builder.entryPoint(text(root, "entry_point", "entryPoint")
            .orElseThrow(() -> new IrFormatException(source, "missing key 'entry_point'")));

        var nodes = first(root, "nodes");
        if (nodes == null || !nodes.isArray()) {
            throw new IrFormatException(source, "key 'nodes' must be a list");
        }
        try {
            for (var node : nodes) {
                builder.node(readNode(node, source));
            }
            readEdges(root, source, builder);
            readConditionalEdges(root, source, builder);
            readFields(root, source, builder);
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new IrFormatException(source, ex.getMessage(), ex);
        }
    }

    /**
     * Serialized form of a graph using the same keys {@link #read} accepts, for {@code inspect} output.
     */
    public static Map<String, Object> toSerializableMap(GraphInfo graph) {
        var out = new LinkedHashMap<String, Object>();
        graph.name().ifPresent(name -> out.put("name", name));
        var nodes = new ArrayList<Map<String, Object>>();
        for (var node : graph.nodes()) {
            var map = new LinkedHashMap<String, Object>();
            map.put("name", node.id());
            if (!node.displayName().equals(node.id())) {
                map.put("display_name", node.displayName());
            }
            node.doc().ifPresent(doc -> map.put("docstring", doc));
            node.sourceLocation().ifPresent(location -> map.put("source_hint", location));
            nodes.add(map);
        }
        out.put("nodes", nodes);
        var edges = new ArrayList<Map<String, Object>>();
        for (var edge : graph.edges()) {
            var map = new LinkedHashMap<String, Object>();
            map.put("from", edge.from());
            map.put("to", edge.to());
            edges.add(map);
        }
        out.put("edges", edges);
        var conditional = new ArrayList<Map<String, Object>>();
        for (var edge : graph.conditionalEdges()) {
            var map = new LinkedHashMap<String, Object>();
            map.put("from", edge.from());
            map.put("condition_func", edge.routerName());
            map.put("branches", edge.mapping());
            conditional.add(map);
        }
        out.put("conditional_edges", conditional);
        var fields = new ArrayList<Map<String, Object>>();
        for (var field : graph.stateSchema().fields()) {
            var map = new LinkedHashMap<String, Object>();
            map.put("name", field.name());
            map.put("type_name", field.dynamicType().describe());
            map.put("is_optional", field.optional());
            field.defaultValue().ifPresent(value -> map.put("default_value", value));
            fields.add(map);
        }
        out.put("state_schema", Map.of("fields", fields));
        out.put("entry_point", graph.entryPoint());
        return out;
    }

    private static NodeSpec readNode(JsonNode node, String source) {
        if (node.isTextual()) {
            return NodeSpec.of(node.asText());
        }
        if (!node.isObject()) {
            throw new IrFormatException(source, "entries of 'nodes' must be names or mappings");
        }
        var id = text(node, "name", "id").orElseThrow(() -> new IrFormatException(source, "node without 'name'"));
        return new NodeSpec(
            id,
            text(node, "display_name", "displayName").orElse(id),
            text(node, "docstring", "doc"),
            text(node, "source_hint", "source_location")
        );
    }

    private static void readEdges(JsonNode root, String source, GraphInfo.Builder builder) {
        var edges = first(root, "edges");
        if (edges == null || edges.isNull()) {
            return;
        }
        if (!edges.isArray()) {
            throw new IrFormatException(source, "key 'edges' must be a list");
        }
        for (var edge : edges) {
            // edges carrying a condition are described again under conditional_edges
            if (text(edge, "condition").isPresent()) {
                continue;
            }
            var from = text(edge, "from", "source").orElseThrow(() -> new IrFormatException(source, "edge without 'from'"));
            var to = text(edge, "to", "target")
                .orElseThrow(() -> new IrFormatException(source, "edge from '" + from + "' without 'to'"));
            builder.edge(from, to);
        }
    }

    private static void readConditionalEdges(JsonNode root, String source, GraphInfo.Builder builder) {
        var conditional = first(root, "conditional_edges", "conditionalEdges");
        if (conditional == null || conditional.isNull()) {
            return;
        }
        if (conditional.isObject()) {
            var entries = conditional.fields();
            while (entries.hasNext()) {
                var entry = entries.next();
                readConditionalEdge(entry.getKey(), entry.getValue(), source, builder);
            }
        } else if (conditional.isArray()) {
            for (var edge : conditional) {
                var from = text(edge, "from", "source")
                    .orElseThrow(() -> new IrFormatException(source, "conditional edge without 'from'"));
                readConditionalEdge(from, edge, source, builder);
            }
        } else {
            throw new IrFormatException(source, "key 'conditional_edges' must be a mapping or a list");
        }
    }

    private static void readConditionalEdge(String from, JsonNode edge, String source, GraphInfo.Builder builder) {
        var router = text(edge, "condition_func", "router")
            .orElseThrow(() -> new IrFormatException(source, "conditional edge from '" + from + "' without 'condition_func'"));
        var branches = first(edge, "branches", "mapping");
        var mapping = new LinkedHashMap<String, String>();
        if (branches != null && branches.isObject()) {
            var entries = branches.fields();
            while (entries.hasNext()) {
                var entry = entries.next();
                if (!entry.getValue().isTextual()) {
                    throw new IrFormatException(source, "branch '" + entry.getKey() + "' from '" + from + "' must name a node");
                }
                mapping.put(entry.getKey(), entry.getValue().asText());
            }
        } else if (branches != null && branches.isArray()) {
            // list form: each label routes to the node of the same name
            for (var target : branches) {
                mapping.put(target.asText(), target.asText());
            }
        } else {
            throw new IrFormatException(source, "conditional edge from '" + from + "' needs 'branches'");
        }
        builder.conditional(from, router, mapping);
    }

    private static void readFields(JsonNode root, String source, GraphInfo.Builder builder) {
        var schema = first(root, "state_schema", "stateSchema");
        if (schema == null || schema.isNull()) {
            return;
        }
        var fields = schema.isArray() ? schema : first(schema, "fields");
        if (fields == null || !fields.isArray()) {
            throw new IrFormatException(source, "key 'state_schema.fields' must be a list");
        }
        for (var field : fields) {
            var name = text(field, "name").orElseThrow(() -> new IrFormatException(source, "state field without 'name'"));
            var type = readType(first(field, "type_name", "type"), source, name);
            var optionalNode = first(field, "is_optional", "optional");
            boolean optional = optionalNode != null && optionalNode.asBoolean(false);
            var spec = new FieldSpec(name, type, optional, scalar(first(field, "default_value", "default")));
            builder.field(spec);
        }
    }

    private static DynamicTypeDescriptor readType(JsonNode node, String source, String field) {
        if (node == null || node.isNull()) {
            return DynamicTypeDescriptor.opaque();
        }
        if (node.isTextual()) {
            return TypeAnnotationParser.parse(node.asText());
        }
        if (!node.isObject()) {
            throw new IrFormatException(source, "type of field '" + field + "' must be an annotation or a mapping");
        }
        var kind = text(node, "kind").orElse("opaque").toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "str", "string", "text" -> DynamicTypeDescriptor.string();
            case "int", "integer" -> DynamicTypeDescriptor.integer();
            case "float", "number" -> DynamicTypeDescriptor.floating();
            case "bool", "boolean" -> DynamicTypeDescriptor.bool();
            case "collection", "list", "sequence" -> DynamicTypeDescriptor.collection(readType(first(node, "element"), source, field));
            case "mapping", "dict" -> DynamicTypeDescriptor.mapping(
                readType(first(node, "key"), source, field),
                readType(first(node, "value"), source, field)
            );
            case "optional" -> DynamicTypeDescriptor.optional(readType(first(node, "inner"), source, field));
            case "opaque", "any" -> DynamicTypeDescriptor.opaque(text(node, "hint").orElse(null));
            default -> throw new IrFormatException(source, "field '" + field + "' has unknown type kind '" + kind + "'");
        };
    }

    private static Optional<Object> scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            return Optional.of(node.asText());
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return Optional.of(node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue());
        }
        if (node.isFloatingPointNumber()) {
            return Optional.of(node.doubleValue());
        }
        return Optional.empty();
    }

    private static JsonNode first(JsonNode node, String... keys) {
        for (var key : keys) {
            if (node.has(key)) {
                return node.get(key);
            }
        }
        return null;
    }

    private static Optional<String> text(JsonNode node, String... keys) {
        var value = first(node, keys);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText()).filter(raw -> !raw.isBlank());
    }

    private static boolean isJson(Path path) {
        var fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
