package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dumb.normcode.activate.wi.ValueSelector;

/** Extracts the part of a composite value a {@link ValueSelector} names. */
final class Selectors {

    private Selectors() {
    }

    static JsonNode select(JsonNode v, ValueSelector sel) {
        if (v == null) return NullNode.getInstance();
        JsonNode out = v;
        if (sel.index() != null) out = out.isArray() ? out.path(sel.index()) : (sel.index() == 0 ? out : NullNode.getInstance());
        if (sel.key() != null) out = out.path(sel.key());
        return out.isMissingNode() ? NullNode.getInstance() : out;
    }
}
