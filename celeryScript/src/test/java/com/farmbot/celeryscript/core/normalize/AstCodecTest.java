package com.farmbot.celeryscript.core.normalize;

import com.farmbot.celeryscript.core.model.AstNode;
import com.farmbot.celeryscript.core.model.Atom;
import com.farmbot.celeryscript.core.model.JsonSupport;
import org.junit.jupiter.api.*;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AstCodecTest {

    private final AstCodec codec = new AstCodec();

    @Test
    void writesCanonicalJson() throws Exception {
        AstNode node = AstNode.builder("move_absolute")
                .arg("speed", 100)
                .arg("location", AstNode.builder("coordinate").arg("x", 1).arg("y", 2).build())
                .arg("mode", Atom.of("fast"))
                .child(AstNode.builder("wait").arg("milliseconds", 500).build())
                .build();

        String json = codec.toJsonString(node);

        String expected = "{\"kind\":\"move_absolute\","
                + "\"args\":{\"speed\":100,"
                + "\"location\":{\"kind\":\"coordinate\",\"args\":{\"x\":1,\"y\":2},\"body\":[]},"
                + "\"mode\":\"fast\"},"
                + "\"body\":[{\"kind\":\"wait\",\"args\":{\"milliseconds\":500},\"body\":[]}]}";
        assertEquals(JsonSupport.MAPPER.readTree(expected), JsonSupport.MAPPER.readTree(json));
        assertTrue(json.startsWith("{\"kind\":"), "kind va primero");
    }

    @Test
    void readsJsonThroughTheNormalizer() {
        AstNode ast = codec.fromJson("{\"kind\":\"sequence\",\"args\":{\"version\":4,"
                + "\"locals\":{\"kind\":\"scope_declaration\",\"args\":{}}},"
                + "\"body\":[{\"kind\":\"read_pin\",\"args\":{\"pin_number\":13}}]}");

        assertEquals("sequence", ast.kind());
        assertEquals(4, ast.arg("version"));
        assertEquals("scope_declaration", assertInstanceOf(AstNode.class, ast.arg("locals")).kind());
        assertEquals(List.of(AstNode.builder("read_pin").arg("pin_number", 13).build()), ast.body());
    }

    @Test
    void roundTripKeepsTheTree() {
        AstNode node = AstNode.builder("if")
                .arg("lhs", "x")
                .arg("rhs", 0)
                .arg("_then", AstNode.builder("nothing").build())
                .build();

        assertEquals(node, codec.fromJson(codec.toJson(node)));
    }

    @Test
    void atomValuesComeBackAsText() {
        AstNode node = AstNode.builder("k").arg("mode", Atom.of("fast")).build();
        assertEquals(Map.of(Atom.of("mode"), "fast"), codec.fromJson(codec.toJson(node)).args());
    }

    @Test
    void jsonStillHasToBeANode() {
        assertThrows(UnrecognizedNodeShapeException.class, () -> codec.fromJson("{\"args\":{}}"));
        assertThrows(MalformedNodeException.class, () -> codec.fromJson("{\"kind\":\"k\",\"body\":{}}"));
        assertThrows(UncheckedIOException.class, () -> codec.fromJson("{\"kind\":"));
        assertThrows(UncheckedIOException.class, () -> codec.fromJson("[1,2]"));
    }
}
