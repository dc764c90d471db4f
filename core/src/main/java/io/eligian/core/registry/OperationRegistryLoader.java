package io.eligian.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads operation signatures from a YAML registry file into an {@link OperationRegistry}.
 *
 * <p>The document is validated against the bundled JSON Schema ({@value #SCHEMA_RESOURCE}) before
 * any signature is built, so structural mistakes such as a misspelled key or a parameter without
 * a type are reported with the schema's message instead of surfacing later as a wrong
 * validation result.
 *
 * <pre>
 * operations:
 *   - name: selectElement
 *     category: DOM
 *     parameters:
 *       - { name: selector, type: string, required: true }
 *     outputs:
 *       - { name: selectedElement, type: object }
 * </pre>
 */
public final class OperationRegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OperationRegistryLoader.class);

    static final String SCHEMA_RESOURCE = "eligian/operation-registry.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public OperationRegistryLoader() {
        this.schema = SCHEMA_FACTORY.getSchema(readClasspathJson(SCHEMA_RESOURCE));
    }

    /**
     * Loads a registry from a file.
     *
     * @throws RegistryLoadException if the file cannot be read or is invalid
     */
    public OperationRegistry load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, source);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read registry file: " + e.getMessage(), e, source);
        }
    }

    /**
     * Loads a registry from a classpath resource.
     *
     * @throws RegistryLoadException if the resource is missing or invalid
     */
    public OperationRegistry loadResource(String resource) {
        InputStream in = OperationRegistryLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new RegistryLoadException("Registry resource not found on classpath", resource);
        }
        try (in) {
            return load(in, resource);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read registry resource: " + e.getMessage(), e, resource);
        }
    }

    /**
     * Loads a registry from a YAML stream. The stream is not closed.
     *
     * @param in YAML content
     * @param source label used in error messages and logs
     */
    public OperationRegistry load(InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
        if (root == null || root.isMissingNode()) {
            throw new RegistryLoadException("Registry file is empty", source);
        }

        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new RegistryLoadException("Registry does not match schema: " + detail, source);
        }

        OperationRegistry.Builder builder = OperationRegistry.builder();
        Set<String> seen = new HashSet<>();
        for (JsonNode op : root.get("operations")) {
            OperationSignature signature = parseOperation(op, source);
            if (!seen.add(signature.name())) {
                throw new RegistryLoadException("Duplicate operation '" + signature.name() + "'", source);
            }
            builder.add(signature);
        }
        OperationRegistry registry = builder.build();
        LOG.debug("Operation registry loaded: source={}, operations={}", source, registry.size());
        return registry;
    }

    private OperationSignature parseOperation(JsonNode op, String source) {
        String name = op.get("name").asText();
        List<OperationParameter> parameters = new ArrayList<>();
        for (JsonNode p : iterate(op.get("parameters"))) {
            parameters.add(new OperationParameter(
                    p.get("name").asText(),
                    parseType(p, name, source),
                    p.path("required").asBoolean(false),
                    p.path("erased").asBoolean(false),
                    p.has("defaultValue") ? p.get("defaultValue").deepCopy() : null,
                    optionalString(p, "description")));
        }
        requireOrderedParameters(name, parameters, source);

        List<DependencyInfo> dependencies = new ArrayList<>();
        for (JsonNode d : iterate(op.get("dependencies"))) {
            dependencies.add(new DependencyInfo(d.get("name").asText(), parseType(d, name, source)));
        }
        List<OutputInfo> outputs = new ArrayList<>();
        for (JsonNode o : iterate(op.get("outputs"))) {
            outputs.add(new OutputInfo(
                    o.get("name").asText(), parseType(o, name, source), o.path("erased").asBoolean(false)));
        }
        return new OperationSignature(
                name,
                optionalString(op, "description"),
                op.path("category").asText("General"),
                parameters,
                dependencies,
                outputs);
    }

    private TypeTag parseType(JsonNode node, String operation, String source) {
        if (node.has("constants")) {
            List<String> values = new ArrayList<>();
            node.get("constants").forEach(v -> values.add(v.asText()));
            return TypeTag.constants(values);
        }
        JsonNode type = node.path("type");
        List<TypeTag.Kind> kinds = new ArrayList<>();
        try {
            if (type.isArray()) {
                for (JsonNode t : type) {
                    kinds.add(TypeTag.Kind.fromLabel(t.asText()));
                }
            } else if (type.asText().equals("any")) {
                return TypeTag.any();
            } else {
                kinds.add(TypeTag.Kind.fromLabel(type.asText()));
            }
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException(e.getMessage() + " in operation '" + operation + "'", e, source);
        }
        return new TypeTag(kinds, List.of());
    }

    // Optional parameters after a required one would make positional matching ambiguous.
    private void requireOrderedParameters(String operation, List<OperationParameter> parameters, String source) {
        boolean seenOptional = false;
        for (OperationParameter p : parameters) {
            if (!p.required()) {
                seenOptional = true;
            } else if (seenOptional) {
                throw new RegistryLoadException(
                        "Required parameter '" + p.name() + "' of operation '" + operation
                                + "' follows an optional parameter",
                        source);
            }
        }
    }

    private static Iterable<JsonNode> iterate(JsonNode node) {
        return node == null ? List.of() : node;
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode readClasspathJson(String resource) {
        try (InputStream in = OperationRegistryLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RegistryLoadException("Registry schema not found on classpath", resource);
            }
            return JSON_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read registry schema: " + e.getMessage(), e, resource);
        }
    }
}
