package dumb.normcode.perceive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CodecTest {

    @TempDir
    Path dir;

    private Codec codec;

    @BeforeEach
    void setUp() {
        codec = Norms.codec(new PathMap(dir), dir.resolve("store"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "file_location       | {\"a\": [1, 2]}",
            "file_location       | `\"plain text\"`",
            "prompt_location     | `\"Summarize $input_1\"`",
            "truth_value         | true",
            "memorized_parameter | {\"temperature\": 0.2}",
            "file_locations      | [1, \"two\"]"
    })
    void perceivesWhatItFormats(String tag, String json) throws IOException {
        JsonNode v = Json.the.readTree(json);
        var sign = codec.format(v, tag);
        assertTrue(codec.isSign(sign) || sign.isArray(), sign::toString);
        assertEquals(v, codec.perceive(sign));
    }

    @Test
    void formattingIsDeterministic() {
        var v = TextNode.valueOf("same content");
        assertEquals(codec.format(v, Norms.FILE_LOCATION), codec.format(v, Norms.FILE_LOCATION));
    }

    @Test
    void readsMappedFiles() throws IOException {
        Files.createDirectories(dir.resolve("real"));
        Files.writeString(dir.resolve("real/data.json"), "[1, 2, 3]");
        var mapped = Norms.codec(new PathMap(dir).map("inputs/data.json", "real/data.json"), dir.resolve("store"));
        var sign = TextNode.valueOf(PerceptualSign.of(Norms.FILE_LOCATION, "inputs/data.json").encode());
        assertEquals(Json.the.readTree("[1, 2, 3]"), mapped.perceive(sign));
    }

    @Test
    void perceivesNestedSignsAndLeavesLiteralsAlone() throws IOException {
        Files.writeString(dir.resolve("a.txt"), "hello");
        var v = Json.node();
        v.put("file", PerceptualSign.of(Norms.FILE_LOCATION, "a.txt").encode());
        v.put("flag", PerceptualSign.of(Norms.TRUTH_VALUE, "false").encode());
        v.put("plain", "50% off (today)");
        var p = codec.perceive(v);
        assertEquals("hello", p.get("file").asText());
        assertEquals(BooleanNode.FALSE, p.get("flag"));
        assertEquals("50% off (today)", p.get("plain").asText());
    }

    @Test
    void unknownTagsAndMissingFiles() {
        assertEquals(TextNode.valueOf("x"), codec.perceive(TextNode.valueOf("%{no_such_norm}abc(x)")));
        assertEquals(TextNode.valueOf("raw"), codec.perceive(TextNode.valueOf("%abc(raw)")));
        assertThrows(Codec.PerceptionException.class,
                () -> codec.perceive(TextNode.valueOf(PerceptualSign.of(Norms.FILE_LOCATION, "missing.txt").encode())));
        assertThrows(IllegalArgumentException.class, () -> codec.format(TextNode.valueOf("x"), "no_such_norm"));
    }

    @Test
    void signSyntax() {
        var s = PerceptualSign.parse("%{file_location}7f3(data/x.json)").orElseThrow();
        assertEquals("file_location", s.norm());
        assertEquals("7f3", s.id());
        assertEquals("data/x.json", s.signifier());
        assertEquals("%{file_location}7f3(data/x.json)", s.encode());
        assertEquals(PerceptualSign.of("t", "x").id(), PerceptualSign.of("u", "x").id());
        assertFalse(PerceptualSign.isSign("plain"));
        assertTrue(Norms.truthy(Json.the.valueToTree(new boolean[]{true, true})));
        assertFalse(Norms.truthy(Json.array()));
    }
}
