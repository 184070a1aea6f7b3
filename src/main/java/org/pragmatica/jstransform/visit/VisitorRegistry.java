package org.pragmatica.jstransform.visit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Named visitor factories. The plugin configuration selects a visitor by name.
 */
public final class VisitorRegistry {
    private final Map<String, Supplier<? extends Visitor>> factories;

    private VisitorRegistry(Map<String, Supplier<? extends Visitor>> factories) {
        this.factories = Map.copyOf(factories);
    }

    /**
     * Registry containing only {@link TransformVisitor} under {@link TransformVisitor#NAME}.
     */
    public static VisitorRegistry defaults() {
        return new VisitorRegistry(Map.of(TransformVisitor.NAME, TransformVisitor::new));
    }

    /**
     * Return a registry with one more factory. An existing factory with the same name is replaced.
     */
    public VisitorRegistry with(String name, Supplier<? extends Visitor> factory) {
        var copy = new LinkedHashMap<>(factories);
        copy.put(name, factory);
        return new VisitorRegistry(copy);
    }

    /**
     * Create a fresh visitor registered under {@code name}.
     */
    public Optional<Visitor> create(String name) {
        return Optional.ofNullable(factories.get(name))
                       .map(Supplier::get);
    }

    public Set<String> names() {
        return factories.keySet();
    }
}
