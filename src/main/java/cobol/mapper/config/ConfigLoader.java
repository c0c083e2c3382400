package cobol.mapper.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a YAML file and lays it over the built-in defaults.
 * <p>
 * Objects merge key by key; scalars and lists replace the default. Unknown keys and values
 * rejected by the records' constructors are configuration errors.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public MapperConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("configuration file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            final MapperConfig config = load(in);
            log.info("configuration loaded from {}", file);
            return config;
        }
    }

    public MapperConfig load(InputStream in) throws IOException {
        final JsonNode overrides = yaml.readTree(in);
        final ObjectNode merged = yaml.valueToTree(MapperConfig.defaults());

        if (overrides != null && !overrides.isMissingNode() && !overrides.isNull()) {
            if (!overrides.isObject()) {
                throw new IllegalArgumentException("configuration root must be a mapping");
            }
            merge(merged, (ObjectNode) overrides);
        }

        try {
            return yaml.treeToValue(merged, MapperConfig.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid configuration: " + rootMessage(ex), ex);
        }
    }

    static void merge(ObjectNode target, ObjectNode source) {
        final Iterator<Map.Entry<String, JsonNode>> it = source.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final JsonNode current = target.get(e.getKey());
            if (current != null && current.isObject() && e.getValue().isObject()) {
                merge((ObjectNode) current, (ObjectNode) e.getValue());
            } else {
                target.set(e.getKey(), e.getValue());
            }
        }
    }

    // Constructor validation surfaces wrapped; report the innermost reason.
    private static String rootMessage(JsonProcessingException ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t == ex ? ex.getOriginalMessage() : t.getMessage();
    }
}
