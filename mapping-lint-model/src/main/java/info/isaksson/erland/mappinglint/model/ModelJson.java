package info.isaksson.erland.mappinglint.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for mapping snapshots and other documents written by the tool.
 *
 * <p>Writing is deterministic: map entries are ordered by key, properties follow the declared order and
 * output ends with a newline.</p>
 */
public final class ModelJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ModelJson() {}

    public static MappingModel read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, MappingModel.class);
        }
    }

    public static MappingModel readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, MappingModel.class);
    }

    public static void write(MappingModel model, Path path) throws IOException {
        writeValue(model, path);
    }

    public static String toJsonString(MappingModel model) throws IOException {
        return toJsonString((Object) model);
    }

    /** Writes any Jackson-annotated document with the same deterministic settings. */
    public static void writeValue(Object value, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, value);
            out.write('\n');
        }
    }

    public static String toJsonString(Object value) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(value) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        // Snapshots may carry collector-specific extras.
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
