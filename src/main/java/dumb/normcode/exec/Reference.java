package dumb.normcode.exec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dumb.normcode.Json;
import dumb.normcode.plan.Annotations;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A value laid out along named axes: {@code data} is nested arrays, one level per axis, in axis order.
 * With no axes the reference is a scalar and {@code data} is the value itself.
 * Instances are never mutated after construction.
 */
public final class Reference {

    private final List<String> axes;
    private final JsonNode data;

    private Reference(List<String> axes, JsonNode data) {
        this.axes = axes;
        this.data = data;
    }

    @JsonCreator
    public static Reference of(@JsonProperty("axes") List<String> axes, @JsonProperty("data") JsonNode data) {
        var named = axes == null ? List.<String>of() : axes.stream().filter(a -> !Annotations.NONE_AXIS.equals(a)).toList();
        var d = data == null ? NullNode.getInstance() : data.deepCopy();
        if (!named.isEmpty() && !d.isArray()) {
            var wrapped = Json.array();
            wrapped.add(d);
            d = wrapped;
        }
        return new Reference(named, d);
    }

    public static Reference scalar(JsonNode value) {
        return of(List.of(), value);
    }

    @JsonProperty("axes")
    public List<String> axes() {
        return axes;
    }

    @JsonProperty("data")
    public JsonNode data() {
        return data;
    }

    @JsonIgnore
    public boolean isScalar() {
        return axes.isEmpty();
    }

    public int size(String axis) {
        var i = axes.indexOf(axis);
        if (i < 0) return 1;
        var node = data;
        for (var d = 0; d < i; d++) {
            if (node.isEmpty()) return 0;
            node = node.get(0);
        }
        return node.size();
    }

    /** Elements along the first axis; a scalar is its own single element. */
    public List<Reference> elements() {
        if (isScalar()) return List.of(this);
        var rest = axes.subList(1, axes.size());
        var out = new ArrayList<Reference>(data.size());
        data.forEach(e -> out.add(new Reference(rest, e)));
        return out;
    }

    /** The leaf at the given axis positions; axes not named default to 0. */
    public JsonNode get(Map<String, Integer> at) {
        var node = data;
        for (var a : axes) {
            var i = at.getOrDefault(a, 0);
            node = node.path(i);
            if (node.isMissingNode()) return NullNode.getInstance();
        }
        return node;
    }

    /** Same layout, every leaf transformed. */
    public Reference map(Function<JsonNode, JsonNode> f) {
        return new Reference(axes, mapLeaves(data, axes.size(), f));
    }

    private static JsonNode mapLeaves(JsonNode node, int depth, Function<JsonNode, JsonNode> f) {
        if (depth == 0) {
            var r = f.apply(node);
            return r == null ? NullNode.getInstance() : r;
        }
        var out = Json.array();
        node.forEach(e -> out.add(mapLeaves(e, depth - 1, f)));
        return out;
    }

    /**
     * Moves the named axes into the leaves: each remaining position holds the nested list spanned by the
     * collapsed axes, in their original order. Axes this reference does not have are ignored.
     */
    public Reference collapse(List<String> names) {
        var collapsed = axes.stream().filter(names::contains).toList();
        if (collapsed.isEmpty()) return this;
        var kept = axes.stream().filter(a -> !collapsed.contains(a)).toList();
        var sizes = sizes();
        return new Reference(kept, build(kept, sizes, new HashMap<>(), at -> {
            var inner = new HashMap<>(at);
            return build(collapsed, sizes, inner, this::get);
        }));
    }

    /** Turns list leaves into a new last axis, padding shorter lists with null. */
    public Reference expand(String axis) {
        var width = new int[]{0};
        map(leaf -> {
            width[0] = Math.max(width[0], leaf.isArray() ? leaf.size() : 1);
            return leaf;
        });
        var expanded = map(leaf -> {
            var row = Json.array();
            for (var i = 0; i < width[0]; i++) {
                var e = leaf.isArray() ? leaf.get(i) : (i == 0 ? leaf : null);
                row.add(e == null ? NullNode.getInstance() : e);
            }
            return row;
        });
        var newAxes = new ArrayList<>(axes);
        newAxes.add(axis);
        return new Reference(List.copyOf(newAxes), expanded.data);
    }

    /** Concatenates {@code other} after this reference along {@code axis}; either side lacking the axis counts as one element of it. */
    public Reference concat(Reference other, String axis) {
        var left = along(axis);
        var right = other.along(axis);
        var out = Json.array();
        left.data.forEach(out::add);
        right.data.forEach(out::add);
        var rest = left.axes.size() >= right.axes.size() ? left.axes : right.axes;
        return new Reference(rest, out);
    }

    private Reference along(String axis) {
        if (!axes.isEmpty() && axes.get(0).equals(axis)) return this;
        var wrapped = Json.array();
        wrapped.add(data);
        var newAxes = new ArrayList<String>();
        newAxes.add(axis);
        newAxes.addAll(axes);
        return new Reference(List.copyOf(newAxes), wrapped);
    }

    private Map<String, Integer> sizes() {
        var sizes = new LinkedHashMap<String, Integer>();
        for (var a : axes) sizes.put(a, size(a));
        return sizes;
    }

    /**
     * Applies {@code f} across the references: inputs sharing an axis name are aligned along it, the remaining
     * axes form a cross product. The result carries the union of input axes in order of first appearance.
     */
    public static Reference crossApply(List<Reference> inputs, Function<List<JsonNode>, JsonNode> f) {
        var layout = Layout.of(inputs);
        return tabulate(layout.axes(), layout.sizes(), at -> f.apply(layout.args(inputs, at)));
    }

    /** The joint axes of several references and the aligned size of each. */
    public record Layout(List<String> axes, Map<String, Integer> sizes) {

        public static Layout of(List<Reference> inputs) {
            var union = new ArrayList<String>();
            var sizes = new HashMap<String, Integer>();
            for (var r : inputs) {
                for (var a : r.axes) {
                    if (!union.contains(a)) union.add(a);
                    sizes.merge(a, r.size(a), Math::min);
                }
            }
            return new Layout(List.copyOf(union), Map.copyOf(sizes));
        }

        public List<Map<String, Integer>> positions() {
            return Reference.positions(axes, sizes);
        }

        public List<JsonNode> args(List<Reference> inputs, Map<String, Integer> at) {
            var args = new ArrayList<JsonNode>(inputs.size());
            for (var r : inputs) args.add(r.get(at));
            return args;
        }
    }

    /** Every position of the cross product of the given axes, in row-major order. */
    public static List<Map<String, Integer>> positions(List<String> axes, Map<String, Integer> sizes) {
        var out = new ArrayList<Map<String, Integer>>();
        positions(axes, 0, sizes, new LinkedHashMap<>(), out);
        return out;
    }

    private static void positions(List<String> axes, int depth, Map<String, Integer> sizes, Map<String, Integer> at, List<Map<String, Integer>> out) {
        if (depth == axes.size()) {
            out.add(new LinkedHashMap<>(at));
            return;
        }
        var a = axes.get(depth);
        for (var i = 0; i < sizes.getOrDefault(a, 1); i++) {
            at.put(a, i);
            positions(axes, depth + 1, sizes, at, out);
        }
        at.remove(a);
    }

    private static JsonNode build(List<String> axes, Map<String, Integer> sizes, Map<String, Integer> at, Function<Map<String, Integer>, JsonNode> leaf) {
        return build(axes, 0, sizes, at, leaf);
    }

    private static JsonNode build(List<String> axes, int depth, Map<String, Integer> sizes, Map<String, Integer> at, Function<Map<String, Integer>, JsonNode> leaf) {
        if (depth == axes.size()) {
            var v = leaf.apply(at);
            return v == null ? NullNode.getInstance() : v;
        }
        var a = axes.get(depth);
        var out = Json.array();
        for (var i = 0; i < sizes.getOrDefault(a, 1); i++) {
            at.put(a, i);
            out.add(build(axes, depth + 1, sizes, at, leaf));
        }
        at.remove(a);
        return out;
    }

    /** Builds a reference over the given axes from a value per position. */
    public static Reference tabulate(List<String> axes, Map<String, Integer> sizes, Function<Map<String, Integer>, JsonNode> leaf) {
        return new Reference(List.copyOf(axes), build(axes, sizes, new HashMap<>(), leaf));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Reference r && axes.equals(r.axes) && data.equals(r.data);
    }

    @Override
    public int hashCode() {
        return 31 * axes.hashCode() + data.hashCode();
    }

    @Override
    public String toString() {
        return (axes.isEmpty() ? "" : axes + " ") + Json.compact(data);
    }
}
