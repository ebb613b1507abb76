package dumb.normcode.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Dotted hierarchical position of a concept or inference in the plan, e.g. {@code 1.2.3}.
 * Ordering is segment-wise numeric, which coincides with top-to-bottom document order.
 */
public record FlowAddress(List<Integer> parts) implements Comparable<FlowAddress> {

    public FlowAddress {
        if (parts == null || parts.isEmpty())
            throw new IllegalArgumentException("Flow address must have at least one segment");
        for (var p : parts)
            if (p == null || p < 1)
                throw new IllegalArgumentException("Flow address segments must be positive: " + parts);
        parts = List.copyOf(parts);
    }

    @JsonCreator
    public static FlowAddress parse(String s) {
        if (s == null || s.isBlank())
            throw new IllegalArgumentException("Empty flow address");
        var segs = s.strip().split("\\.", -1);
        var parts = new ArrayList<Integer>(segs.length);
        for (var seg : segs) {
            if (seg.isEmpty() || !seg.chars().allMatch(Character::isDigit))
                throw new IllegalArgumentException("Malformed flow address: '" + s + "'");
            try {
                parts.add(Integer.parseInt(seg));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed flow address: '" + s + "'", e);
            }
        }
        return new FlowAddress(parts);
    }

    /** Empty when {@code s} is not a well-formed address. */
    public static Optional<FlowAddress> tryParse(String s) {
        if (s == null || !s.strip().matches("[1-9]\\d*(\\.[1-9]\\d*)*")) return Optional.empty();
        return Optional.of(parse(s));
    }

    public static FlowAddress of(int... parts) {
        return new FlowAddress(Arrays.stream(parts).boxed().toList());
    }

    public int depth() {
        return parts.size();
    }

    public FlowAddress parent() {
        return depth() == 1 ? null : new FlowAddress(parts.subList(0, depth() - 1));
    }

    public FlowAddress child(int n) {
        var p = new ArrayList<>(parts);
        p.add(n);
        return new FlowAddress(p);
    }

    /** True if this address is a proper dotted extension of {@code ancestor}. */
    public boolean isDescendantOf(FlowAddress ancestor) {
        return depth() > ancestor.depth() && parts.subList(0, ancestor.depth()).equals(ancestor.parts);
    }

    @Override
    public int compareTo(FlowAddress o) {
        var n = Math.min(depth(), o.depth());
        for (var i = 0; i < n; i++) {
            var c = Integer.compare(parts.get(i), o.parts.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(depth(), o.depth());
    }

    @JsonValue
    @Override
    public String toString() {
        return parts.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
