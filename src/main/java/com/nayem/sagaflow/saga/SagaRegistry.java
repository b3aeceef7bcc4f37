package com.nayem.sagaflow.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves saga definitions by name. Persisted instances only remember the name, so
 * loading or resuming a saga requires its definition to be registered here.
 */
public class SagaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SagaRegistry.class);

    private final Map<String, SagaDefinition> definitions = new ConcurrentHashMap<>();

    public void register(SagaDefinition definition) {
        register(definition.getName(), definition);
    }

    public void register(String name, SagaDefinition definition) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("definition name must not be blank");
        }
        SagaDefinition previous = definitions.put(name, definition);
        if (previous != null && previous != definition) {
            log.warn("Saga definition {} replaced", name);
        }
    }

    /**
     * @throws SagaDefinitionNotFoundException when nothing is registered under {@code name}
     */
    public SagaDefinition get(String name) {
        SagaDefinition definition = name == null ? null : definitions.get(name);
        if (definition == null) {
            throw new SagaDefinitionNotFoundException(name);
        }
        return definition;
    }

    public Optional<SagaDefinition> find(String name) {
        return Optional.ofNullable(name == null ? null : definitions.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(definitions.keySet());
    }
}
