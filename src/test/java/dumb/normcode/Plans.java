package dumb.normcode;

import dumb.normcode.plan.Comment;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Builds plan trees for tests without writing the JSON by hand. */
public final class Plans {

    private final List<PlanGroup> groups = new ArrayList<>();

    public static Plans plan() {
        return new Plans();
    }

    public Plans group(Occurrence output, Occurrence function, Occurrence... values) {
        return group(output, function, List.of(values), List.of());
    }

    public Plans group(Occurrence output, Occurrence function, List<Occurrence> values, List<Occurrence> others) {
        groups.add(new PlanGroup(output, function, values, others));
        return this;
    }

    public List<PlanGroup> build() {
        return List.copyOf(groups);
    }

    /** The plan's declared output. */
    public static Occurrence root(String name, String flow, String... comments) {
        return new Occurrence(name, "object", flow, ":<: {" + name + "}", Occurrence.FINAL, null, comments(comments));
    }

    public static Occurrence value(String name, String flow, String... comments) {
        return new Occurrence(name, "object", flow, "<- {" + name + "}", Occurrence.VALUE, null, comments(comments));
    }

    /** A value bound to an explicit input position. */
    public static Occurrence bound(String name, int position, String flow, String... comments) {
        return new Occurrence(name, "object", flow, "<- {" + name + "}<:{" + position + "}>", Occurrence.VALUE, null, comments(comments));
    }

    public static Occurrence context(String name, String type, String flow, String... comments) {
        return new Occurrence(name, type, flow, "<* {" + name + "}", Occurrence.CONTEXT, null, comments(comments));
    }

    public static Occurrence function(String body, String flow, String... comments) {
        return new Occurrence(body, "imperative", flow, "<= " + body, Occurrence.FUNCTION, null, comments(comments));
    }

    /** {@code %{key}: value} annotation text. */
    public static String a(String key, String value) {
        return "| %{" + key + "}: " + value;
    }

    private static List<Comment> comments(String... texts) {
        return Arrays.stream(texts).map(Comment::of).toList();
    }

    /**
     * {@code {x<n>}} computed from {@code {x<n-1>}} by one imperative per step, down to a ground {@code {x0}} holding
     * {@code start}. Each step is nested one level under the one consuming it, so the plan takes n cycles.
     */
    public static List<PlanGroup> chain(int n, int start, String... paradigms) {
        var p = plan();
        var flow = "1";
        for (var i = n; i >= 1; i--) {
            var paradigm = paradigms[Math.min(n - i, paradigms.length - 1)];
            var out = i == n ? root("x" + i, flow) : value("x" + i, flow);
            var input = flow + ".2";
            var in = i == 1 ? value("x0", input, a("value", String.valueOf(start))) : value("x" + (i - 1), input);
            p.group(out, function("::(step " + i + " {x" + (i - 1) + "})", flow + ".1", a("norm_input", paradigm)), in);
            flow = input;
        }
        return p.build();
    }
}
