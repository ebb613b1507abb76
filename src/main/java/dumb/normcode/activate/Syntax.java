package dumb.normcode.activate;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.Json;
import dumb.normcode.activate.wi.WorkingInterpretation.AssigningMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.GroupingMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.TimingMarker;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Occurrence;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads operator syntax out of a function concept's main line. */
public final class Syntax {

    public static final String JUDGEMENT = "::<";
    public static final String IMPERATIVE = "::";
    public static final String GROUP_IN = "&[{}]";
    public static final String GROUP_ACROSS = "&[#]";
    public static final String LOOP = "*.";
    public static final String SOURCES = "%>";
    public static final String TARGET = "%<";
    public static final String AXES = "%:";
    public static final String CREATE_AXIS = "%+";
    public static final String LOOP_INDEX = "%@";

    private static final Pattern LITERAL_NAME = Pattern.compile(":\\s*[\"']([^\"']+)[\"']");
    private static final Pattern ASSERTION = Pattern.compile("<\\s*(ALL|FOR\\s+EACH\\s+\\{([^}]+)})\\s+(True|False)\\s*>", Pattern.CASE_INSENSITIVE);

    private Syntax() {
    }

    /** The sequence type of a function body, from an explicit {@code ?{sequence}} hint or from its operators. */
    public static Optional<SequenceType> sequence(Occurrence function) {
        var hint = Annotations.inline(function.attachedComments(), "sequence");
        if (hint.isPresent()) {
            try {
                return Optional.of(SequenceType.of(hint.get()));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        var body = function.body();
        if (body.isBlank()) return Optional.empty();
        if (body.contains(JUDGEMENT)) return Optional.of(SequenceType.JUDGEMENT);
        if (body.contains(GROUP_IN) || body.contains(GROUP_ACROSS)) return Optional.of(SequenceType.GROUPING);
        if (body.startsWith(LOOP) && body.contains(SOURCES)) return Optional.of(SequenceType.LOOPING);
        if (assigningMarker(function).isPresent()) return Optional.of(SequenceType.ASSIGNING);
        if (timingMarker(body).isPresent()) return Optional.of(SequenceType.TIMING);
        if (body.contains(IMPERATIVE)) return Optional.of(SequenceType.IMPERATIVE);
        return Optional.empty();
    }

    public static Optional<AssigningMarker> assigningMarker(Occurrence function) {
        var op = function.operatorType();
        if (op != null) {
            for (var m : AssigningMarker.values())
                if (m.id().equalsIgnoreCase(op)) return Optional.of(m);
        }
        var body = function.body();
        for (var m : AssigningMarker.values())
            if (body.startsWith(m.symbol)) return Optional.of(m);
        return Optional.empty();
    }

    public static Optional<TimingMarker> timingMarker(String body) {
        for (var m : TimingMarker.values())
            if (body.startsWith(m.symbol)) return Optional.of(m);
        return Optional.empty();
    }

    public static Optional<GroupingMarker> groupingMarker(String body) {
        if (body.contains(GROUP_IN)) return Optional.of(GroupingMarker.IN);
        if (body.contains(GROUP_ACROSS)) return Optional.of(GroupingMarker.ACROSS);
        return Optional.empty();
    }

    /** Literal carried in a concept name, e.g. {@code phase: "one"}. */
    public static Optional<String> literal(String conceptName) {
        var m = LITERAL_NAME.matcher(conceptName);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** Face value of an abstraction {@code $%(value)}, parsed as JSON where possible. */
    public static Optional<JsonNode> faceValue(String body) {
        return Annotations.arg(AssigningMarker.ABSTRACTION.symbol, body).map(Json::parseOrText);
    }

    public static boolean hasAssertion(String body) {
        return ASSERTION.matcher(body).find();
    }

    /** Groups: 1 = quantifier text, 2 = for-each concept (nullable), 3 = True/False. */
    public static Matcher assertion(String body) {
        return ASSERTION.matcher(body);
    }

    public static String slug(String name) {
        var clean = name.replaceAll("[{}\\[\\]<>]", "").strip().toLowerCase();
        clean = clean.replaceAll("\\s+", "-");
        return clean.replaceAll("[^a-z0-9*-]", "");
    }

    public static String displayName(String name, String conceptType) {
        return switch (conceptType == null ? "object" : conceptType) {
            case "proposition" -> "<" + name + ">";
            case "relation" -> "[" + name + "]";
            default -> "{" + name + "}";
        };
    }

    public static String typeMarker(String conceptType) {
        return switch (conceptType == null ? "object" : conceptType) {
            case "proposition" -> "<>";
            case "relation" -> "[]";
            default -> "{}";
        };
    }
}
