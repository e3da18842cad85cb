package org.irlens.render;

import org.irlens.render.tir.TirPrinters;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping node kinds to printer instances.
 * <p>
 * Provides explicit registration and a generic fallback printer for kinds without a
 * dedicated one, so any schema-conforming tree can be rendered.
 */
public final class NodePrinterRegistry {

    private final Map<String, INodePrinter> byKind = new HashMap<>();
    private final INodePrinter defaultPrinter;

    private NodePrinterRegistry(INodePrinter defaultPrinter) {
        this.defaultPrinter = defaultPrinter;
    }

    /**
     * Registers a printer for a kind, replacing any earlier registration.
     *
     * @param kind The node kind.
     * @param printer The printer handling that kind.
     * @return This registry, for chaining.
     */
    public NodePrinterRegistry register(String kind, INodePrinter printer) {
        byKind.put(kind, printer);
        return this;
    }

    /**
     * @param kind The kind to look up.
     * @return The printer registered for exactly that kind, if any.
     */
    public Optional<INodePrinter> get(String kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    /**
     * @param kind The kind of the node to print.
     * @return A non-null printer: the registered one or the fallback.
     */
    public INodePrinter resolve(String kind) {
        return byKind.getOrDefault(kind, defaultPrinter);
    }

    public INodePrinter defaultPrinter() {
        return defaultPrinter;
    }

    /**
     * Creates a registry with the given fallback printer and no registrations.
     *
     * @param defaultPrinter The printer used for kinds without a registration.
     * @return A new registry.
     */
    public static NodePrinterRegistry initialize(INodePrinter defaultPrinter) {
        return new NodePrinterRegistry(defaultPrinter);
    }

    /**
     * @return A registry with the generic fallback and all built-in TIR printers.
     */
    public static NodePrinterRegistry initializeWithDefaults() {
        NodePrinterRegistry registry = initialize(new GenericCompositePrinter());
        TirPrinters.registerDefaults(registry);
        return registry;
    }
}
