package info.isaksson.erland.constructtiers.report;

import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.constructtiers.ir.NodeJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for file reports.
 *
 * <p>Identical reports serialize to identical bytes: properties have a fixed order, map keys
 * are sorted and every list in a report is already deterministic.</p>
 */
public final class ReportJson {

    private static final ObjectMapper MAPPER = NodeJson.createMapper();
    private static final DefaultPrettyPrinter PRETTY = NodeJson.createPrettyPrinter();

    private ReportJson() {}

    public static FileReport read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, FileReport.class);
        }
    }

    public static FileReport readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, FileReport.class);
    }

    public static void write(FileReport report, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Files.createDirectories(path.toAbsolutePath().normalize().getParent());
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, report);
            out.write('\n');
        }
    }

    public static String toJsonString(FileReport report) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(report) + "\n";
    }
}
