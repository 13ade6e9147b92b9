package info.isaksson.erland.constructtiers.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class NodeJsonDeterminismTest {

    @TempDir
    Path tmp;

    @Test
    void readResolvesKindsAndAttributes() throws Exception {
        NodeArena arena = NodeJson.read(golden("trees/comparisons.json"));

        assertEquals("core/comparisons.py", arena.file);
        assertEquals("python", arena.language);
        assertEquals(10, arena.size());
        assertEquals(NodeKind.MODULE, arena.rootNode().kind());

        Node chained = arena.node(7);
        assertEquals(NodeKind.COMPARE, chained.kind());
        assertEquals(3, chained.childCount());
        assertEquals("< <", chained.attribute("ops"));
        assertEquals(Integer.valueOf(41), chained.location.line);
        assertEquals(Integer.valueOf(12), chained.location.endCol);
    }

    @Test
    void writeMatchesGolden() throws Exception {
        Path goldenPath = golden("trees/comparisons.json");
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);
        NodeArena arena = NodeJson.read(goldenPath);

        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = NodeJson.toJsonString(arena);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to golden fixture.");
        assertTrue(rendered.endsWith("\n"));

        Path out1 = tmp.resolve("a/tree.json");
        Path out2 = tmp.resolve("b/tree.json");
        NodeJson.write(arena, out1);
        NodeJson.write(arena, out2);
        assertEquals(Files.readString(out1, StandardCharsets.UTF_8), Files.readString(out2, StandardCharsets.UTF_8),
                "Writing twice must produce identical output.");
        assertEquals(arena, NodeJson.read(out1));
    }

    @Test
    void unknownTagSurvivesRoundTrip() throws Exception {
        NodeArena.Builder b = NodeArena.builder("m.py");
        int walrus = b.add("NamedExpr", null, null);
        b.add(NodeKind.MODULE, walrus);
        NodeArena arena = b.build();

        NodeArena back = NodeJson.readFromString(NodeJson.toJsonString(arena));
        assertEquals(NodeKind.UNKNOWN, back.node(walrus).kind());
        assertEquals("NamedExpr", back.node(walrus).tag);
    }

    @Test
    void invalidTreeIsRejectedOnRead() {
        String json = "{\"file\":\"x.py\",\"root\":0,\"nodes\":[{\"id\":0,\"kind\":\"Module\",\"children\":[0]}]}";
        assertThrows(IOException.class, () -> NodeJson.readFromString(json));
    }

    @Test
    void nullChildIdIsRejectedOnRead() {
        String json = "{\"file\": \"n.py\", \"root\": 1, \"nodes\": ["
                + "{\"id\": 0, \"kind\": \"Pass\", \"children\": []},"
                + "{\"id\": 1, \"kind\": \"Module\", \"children\": [0, null]}]}";
        IOException ex = assertThrows(IOException.class, () -> NodeJson.readFromString(json));
        assertTrue(String.valueOf(ex.getMessage()).contains("null child id"), ex.getMessage());
    }

    private static Path golden(String resourcePath) throws URISyntaxException {
        return Path.of(NodeJsonDeterminismTest.class.getClassLoader().getResource(resourcePath).toURI());
    }
}
