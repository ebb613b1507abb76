package dumb.normcode;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static dumb.normcode.Log.message;

public class Tools {
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public Tools add(Tool tool) {
        var n = tool.name();
        if (tools.putIfAbsent(n, tool) != null)
            throw new IllegalArgumentException("Tool with name '" + n + "' already registered.");

        message("Registered tool: " + n);
        return this;
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Tool require(String name) {
        return get(name).orElseThrow(() -> new Tool.ToolExecutionException("No tool registered as '" + name + "'"));
    }

    public Collection<Tool> getAll() {
        return tools.values();
    }
}
