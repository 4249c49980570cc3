package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for {@link ComponentIr}.
 *
 * <p>Writing is deterministic. Lists and maps keep their insertion order because that order is
 * meaningful (source order of properties, elements and style declarations).</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private IrJson() {}

    public static ComponentIr read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ComponentIr.class);
        }
    }

    /** Parse an IR document from a JSON string. */
    public static ComponentIr readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, ComponentIr.class);
    }

    public static void write(ComponentIr ir, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (ir == null) throw new IllegalArgumentException("ir is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, ir);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(ComponentIr ir) throws IOException {
        if (ir == null) throw new IllegalArgumentException("ir is null");
        return MAPPER.writer(PRETTY).writeValueAsString(ir) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
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
