package com.flowmodel.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The library of predefined types and type constraints that every model links to.
 * Installed once per store; later models reuse the existing library element.
 */
public final class PredefinedLibrary {

    private static final Logger log = LoggerFactory.getLogger(PredefinedLibrary.class);

    public static final String LIBRARY_NAME = "$predefined";

    public static final List<String> TYPE_NAMES = List.of(
            "bool", "char", "int", "real",
            "int8", "int16", "int32", "int64",
            "uint8", "uint16", "uint32", "uint64",
            "float32", "float64");

    /** Numeric names that are only predefined in legacy models. */
    public static final Set<String> LEGACY_NAMES = Set.of("int", "real");

    public static final List<String> CONSTRAINT_NAMES = List.of("numeric", "integer", "signed", "unsigned", "float");

    private PredefinedLibrary() {
    }

    /** True if {@code name} is a predefined type or constraint name. */
    public static boolean isPredefinedName(String name) {
        return TYPE_NAMES.contains(name) || CONSTRAINT_NAMES.contains(name);
    }

    /** Root element of the installed library, if any. */
    public static Optional<GraphElement> find(GraphStore store) {
        for (GraphElement root : store.roots()) {
            if (root.getBoolean(ModelRoles.ATTR_PREDEFINED)) return Optional.of(root);
        }
        return Optional.empty();
    }

    /** Returns the library root, installing it in a single batch when absent. */
    public static ElementId ensureInstalled(GraphStore store) {
        Optional<GraphElement> existing = find(store);
        if (existing.isPresent()) return existing.get().getId();
        try (GraphBatch batch = store.openBatch()) {
            ElementId lib = batch.createElement(ElementKind.MODEL,
                    Map.of(ModelRoles.ATTR_NAME, LIBRARY_NAME, ModelRoles.ATTR_PREDEFINED, true), null, null);
            for (String name : TYPE_NAMES) {
                batch.createElement(ElementKind.PREDEFINED_TYPE, Map.of(ModelRoles.ATTR_NAME, name), lib, ModelRoles.TYPES);
            }
            for (String name : CONSTRAINT_NAMES) {
                batch.createElement(ElementKind.TYPE_CONSTRAINT, Map.of(ModelRoles.ATTR_NAME, name), lib, ModelRoles.CONSTRAINTS);
            }
            batch.commit();
            log.info("Installed predefined library with {} types and {} constraints", TYPE_NAMES.size(), CONSTRAINT_NAMES.size());
            return lib;
        }
    }
}
