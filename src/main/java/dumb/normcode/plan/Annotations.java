package dumb.normcode.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Reads the annotation comments attached to plan occurrences:
 * {@code | %{key}: value}, the {@code /: Ground} marker and inline {@code ?{key}: value} hints.
 */
public final class Annotations {

    public static final String NONE_AXIS = "_none_axis";

    private static final Pattern BINDING = Pattern.compile("<:\\{(\\d+)}>");
    private static final String GROUND_MARKER = "/: Ground";

    private Annotations() {
    }

    public static Optional<String> value(List<Comment> comments, String key) {
        var p = Pattern.compile("\\|\\s*%\\{" + Pattern.quote(key) + "}\\s*:\\s*(.*)$", Pattern.DOTALL);
        for (var c : comments) {
            var m = p.matcher(c.text().strip());
            if (m.find()) return Optional.of(m.group(1).strip());
        }
        return Optional.empty();
    }

    public static Optional<String> inline(List<Comment> comments, String key) {
        var p = Pattern.compile("\\?\\{" + Pattern.quote(key) + "}\\s*:\\s*(\\S+)");
        for (var c : comments) {
            var m = p.matcher(c.text());
            if (m.find()) return Optional.of(m.group(1).strip());
        }
        return Optional.empty();
    }

    public static boolean groundMarker(List<Comment> comments) {
        return comments.stream().anyMatch(c -> c.text().contains(GROUND_MARKER));
    }

    /** Explicit input position {@code <:{n}>} declared in a value occurrence's main line. */
    public static OptionalInt binding(String ncMain) {
        var m = BINDING.matcher(ncMain);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /** Parses {@code [a, {b}, c]} into bare names; a blank or missing list yields an empty list. */
    public static List<String> list(String s) {
        if (s == null) return List.of();
        var t = s.strip();
        if (t.startsWith("[") && t.endsWith("]")) t = t.substring(1, t.length() - 1);
        var out = new ArrayList<String>();
        for (var part : splitTopLevel(t, ',')) {
            var n = bare(part);
            if (!n.isEmpty()) out.add(n);
        }
        return out;
    }

    public static List<String> axes(List<Comment> comments) {
        var axes = value(comments, "ref_axes").map(Annotations::list).orElse(List.of());
        return axes.isEmpty() ? List.of(NONE_AXIS) : axes;
    }

    /** Strips one layer of concept brackets: {@code {x}}, {@code <x>}, {@code [x]}. */
    public static String bare(String s) {
        var t = s.strip();
        while (t.length() >= 2 && matching(t.charAt(0), t.charAt(t.length() - 1)))
            t = t.substring(1, t.length() - 1).strip();
        return t;
    }

    private static boolean matching(char open, char close) {
        return (open == '{' && close == '}') || (open == '<' && close == '>') || (open == '[' && close == ']');
    }

    /** Splits on {@code sep} outside any bracket nesting. */
    public static List<String> splitTopLevel(String s, char sep) {
        var out = new ArrayList<String>();
        var depth = 0;
        var cur = new StringBuilder();
        for (var i = 0; i < s.length(); i++) {
            var ch = s.charAt(i);
            if (ch == '{' || ch == '[' || ch == '(' || ch == '<') depth++;
            else if (ch == '}' || ch == ']' || ch == ')' || ch == '>') depth = Math.max(0, depth - 1);
            if (ch == sep && depth == 0) {
                out.add(cur.toString());
                cur.setLength(0);
            } else cur.append(ch);
        }
        if (!cur.isEmpty()) out.add(cur.toString());
        return out;
    }

    /**
     * Content of the first parenthesised or bracketed argument following {@code operator} in {@code body},
     * honouring nesting, e.g. {@code arg("%>", "&[{}] %>[{a}, {b}]")} is {@code "{a}, {b}"}.
     */
    public static Optional<String> arg(String operator, String body) {
        var i = body.indexOf(operator);
        if (i < 0) return Optional.empty();
        var start = i + operator.length();
        while (start < body.length() && body.charAt(start) == ' ') start++;
        if (start >= body.length()) return Optional.empty();
        var open = body.charAt(start);
        char close;
        if (open == '(') close = ')';
        else if (open == '[') close = ']';
        else return Optional.empty();
        var depth = 0;
        for (var j = start; j < body.length(); j++) {
            var ch = body.charAt(j);
            if (ch == open) depth++;
            else if (ch == close && --depth == 0) return Optional.of(body.substring(start + 1, j).strip());
        }
        return Optional.empty();
    }
}
