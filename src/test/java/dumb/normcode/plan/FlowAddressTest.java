package dumb.normcode.plan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowAddressTest {

    @Test
    void ordersNumericallyBySegment() {
        var sorted = new TreeSet<FlowAddress>();
        for (var s : List.of("1.10", "1.2", "1", "1.2.1", "2", "1.9.3"))
            sorted.add(FlowAddress.parse(s));
        assertEquals(List.of("1", "1.2", "1.2.1", "1.9.3", "1.10", "2"), sorted.stream().map(FlowAddress::toString).toList());
    }

    @Test
    void hierarchy() {
        var a = FlowAddress.parse("1.2.3");
        assertEquals(3, a.depth());
        assertEquals(FlowAddress.of(1, 2), a.parent());
        assertNull(FlowAddress.of(1).parent());
        assertEquals(FlowAddress.parse("1.2.3.4"), a.child(4));
        assertTrue(a.isDescendantOf(FlowAddress.of(1)));
        assertTrue(a.isDescendantOf(FlowAddress.of(1, 2)));
        assertFalse(a.isDescendantOf(a));
        assertFalse(FlowAddress.parse("1.20").isDescendantOf(FlowAddress.of(1, 2)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1.", ".1", "1..2", "1.a", "0", "1.0.2", "-1"})
    void rejectsMalformed(String s) {
        assertTrue(FlowAddress.tryParse(s).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> FlowAddress.parse(s));
    }
}
