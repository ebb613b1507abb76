package dumb.normcode.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferenceTest {

    private static JsonNode json(String s) {
        try {
            return Json.the.readTree(s);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(s, e);
        }
    }

    private static Reference ref(String data, String... axes) {
        return Reference.of(List.of(axes), json(data));
    }

    @Test
    void noneAxisIsScalar() {
        var r = Reference.of(List.of("_none_axis"), IntNode.valueOf(3));
        assertTrue(r.isScalar());
        assertEquals(IntNode.valueOf(3), r.data());
        assertEquals(json("[3]"), Reference.of(List.of("i"), IntNode.valueOf(3)).data());
    }

    @Test
    void sharedAxesAlignAndOthersCross() {
        var a = ref("[1, 2]", "i");
        var b = ref("[10, 20]", "i");
        var c = ref("[100, 200, 300]", "j");
        var sum = Reference.crossApply(List.of(a, b, c), args -> IntNode.valueOf(args.stream().mapToInt(JsonNode::asInt).sum()));
        assertEquals(List.of("i", "j"), sum.axes());
        assertEquals(json("[[111, 211, 311], [122, 222, 322]]"), sum.data());
    }

    @Test
    void mismatchedSharedAxisUsesShorter() {
        var r = Reference.crossApply(List.of(ref("[1, 2, 3]", "i"), ref("[5, 6]", "i")),
                args -> IntNode.valueOf(args.get(0).asInt() * args.get(1).asInt()));
        assertEquals(json("[5, 12]"), r.data());
    }

    @Test
    void scalarBroadcasts() {
        var r = Reference.crossApply(List.of(ref("[1, 2]", "i"), Reference.scalar(IntNode.valueOf(10))),
                args -> IntNode.valueOf(args.get(0).asInt() + args.get(1).asInt()));
        assertEquals(json("[11, 12]"), r.data());
        assertEquals(1, r.axes().size());
    }

    @Test
    void collapseMovesAxisIntoLeaves() {
        var r = ref("[[1, 2], [3, 4]]", "i", "j");
        var c = r.collapse(List.of("j"));
        assertEquals(List.of("i"), c.axes());
        assertEquals(json("[[1, 2], [3, 4]]"), c.data());
        var all = r.collapse(List.of("i", "j"));
        assertTrue(all.isScalar());
        assertEquals(json("[[1, 2], [3, 4]]"), all.data());
        assertEquals(r, r.collapse(List.of("k")));
    }

    @Test
    void expandPadsShortLists() {
        var r = ref("[[1, 2], [3]]", "row").expand("col");
        assertEquals(List.of("row", "col"), r.axes());
        assertEquals(json("[[1, 2], [3, null]]"), r.data());
    }

    @Test
    void concatAlongAxis() {
        var r = ref("[1, 2]", "n").concat(Reference.scalar(IntNode.valueOf(3)), "n");
        assertEquals(List.of("n"), r.axes());
        assertEquals(json("[1, 2, 3]"), r.data());
    }

    @Test
    void elementsAndLookup() {
        var r = ref("[[\"a\", \"b\"], [\"c\", \"d\"]]", "i", "j");
        assertEquals(2, r.size("i"));
        assertEquals(1, r.size("k"));
        var rows = r.elements();
        assertEquals(List.of("j"), rows.get(1).axes());
        assertEquals(TextNode.valueOf("d"), r.get(Map.of("i", 1, "j", 1)));
        assertEquals(TextNode.valueOf("c"), r.get(Map.of("i", 1)));
    }

    @Test
    void serializesAsAxesAndData() throws JsonProcessingException {
        var r = ref("[1, 2]", "i");
        var back = Json.the.readValue(Json.compact(r), Reference.class);
        assertEquals(r, back);
        assertEquals("[i] [1,2]", r.toString());
    }
}
