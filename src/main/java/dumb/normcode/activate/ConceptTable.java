package dumb.normcode.activate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Concept records indexed by id, by natural name (value concepts) and by body (function concepts). */
public class ConceptTable {

    private final Map<String, ConceptRecord> byId = new LinkedHashMap<>();
    private final Map<String, ConceptRecord> values = new LinkedHashMap<>();
    private final Map<String, ConceptRecord> functions = new LinkedHashMap<>();

    public ConceptTable(Collection<ConceptRecord> records) {
        for (var r : records) {
            if (byId.putIfAbsent(r.id(), r) != null)
                throw new IllegalArgumentException("Duplicate concept id " + r.id());
            (r.isFunction() ? functions : values).put(r.naturalName(), r);
        }
    }

    public Optional<ConceptRecord> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public ConceptRecord require(String id) {
        var r = byId.get(id);
        if (r == null) throw new IllegalArgumentException("No concept with id " + id);
        return r;
    }

    public Optional<ConceptRecord> value(String naturalName) {
        return Optional.ofNullable(values.get(naturalName));
    }

    public Optional<ConceptRecord> function(String body) {
        return Optional.ofNullable(functions.get(body));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public List<ConceptRecord> all() {
        return List.copyOf(byId.values());
    }

    public int size() {
        return byId.size();
    }
}
