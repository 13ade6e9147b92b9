package info.isaksson.erland.constructtiers.rules;

import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.constructtiers.ir.NodeJson;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for rule sets.
 *
 * <p>Configuration errors found while reading surface as {@link RuleTableException}, not as
 * Jackson mapping errors, so callers see one failure type for a broken rule set.</p>
 */
public final class RuleSetJson {

    private static final ObjectMapper MAPPER = NodeJson.createMapper();
    private static final DefaultPrettyPrinter PRETTY = NodeJson.createPrettyPrinter();

    private RuleSetJson() {}

    public static RuleSetDefinition read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static RuleSetDefinition read(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("in is null");
        try {
            return MAPPER.readValue(in, RuleSetDefinition.class);
        } catch (IOException e) {
            throw unwrap(e);
        }
    }

    public static RuleSetDefinition readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        try {
            return MAPPER.readValue(json, RuleSetDefinition.class);
        } catch (IOException e) {
            throw unwrap(e);
        }
    }

    /** Reads a rule set and builds its table in one step. */
    public static RuleTable loadTable(Path path) throws IOException {
        return read(path).toRuleTable();
    }

    public static void write(RuleSetDefinition rules, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Files.createDirectories(path.toAbsolutePath().normalize().getParent());
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, rules);
            out.write('\n');
        }
    }

    public static String toJsonString(RuleSetDefinition rules) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(rules) + "\n";
    }

    private static IOException unwrap(IOException e) {
        Throwable t = e.getCause();
        while (t != null) {
            if (t instanceof RuleTableException) throw (RuleTableException) t;
            t = t.getCause();
        }
        return e;
    }
}
