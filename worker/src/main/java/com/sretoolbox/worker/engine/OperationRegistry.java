package com.sretoolbox.worker.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operations keyed by name, fixed at worker startup.
 */
public class OperationRegistry {
    private final Map<String, ToolkitOperation> operations = new LinkedHashMap<>();

    public OperationRegistry register(ToolkitOperation operation) {
        if (operations.putIfAbsent(operation.name(), operation) != null) {
            throw new IllegalArgumentException("operation already registered: " + operation.name());
        }
        return this;
    }

    public Optional<ToolkitOperation> find(String name) {
        return Optional.ofNullable(name == null ? null : operations.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(operations.keySet());
    }
}
