package com.flowmodel.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates empty models wired to the predefined library.
 */
public final class ModelBootstrap {

    private ModelBootstrap() {
    }

    public static ElementId newModel(GraphStore store, String name) {
        return newModel(store, name, null, null);
    }

    /**
     * Creates a model and links it to the predefined library.
     *
     * @param modelFile   path of the model file, recorded as attribute
     * @param defaultFile default storage unit path used when an element has no explicit owner
     */
    public static ElementId newModel(GraphStore store, String name, String modelFile, String defaultFile) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("model name is required");
        }
        ElementId library = PredefinedLibrary.ensureInstalled(store);
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(ModelRoles.ATTR_NAME, name);
        attrs.put(ModelRoles.ATTR_MODEL_FILE, modelFile);
        attrs.put(ModelRoles.ATTR_DEFAULT_FILE, defaultFile);
        try (GraphBatch batch = store.openBatch()) {
            ElementId model = batch.createElement(ElementKind.MODEL, attrs, null, null);
            batch.link(model, ModelRoles.REF_LIBRARIES, library);
            batch.commit();
            return model;
        }
    }

    /** Adds a storage unit (model file) to {@code model}. */
    public static ElementId addStorageUnit(GraphStore store, ElementId model, String path) {
        return store.createElement(ElementKind.STORAGE_UNIT, Map.of(ModelRoles.ATTR_PATH, path), model, ModelRoles.STORAGE_UNITS);
    }

    /** Adds a library model reference, making its declarations visible from {@code model}. */
    public static void addLibrary(GraphStore store, ElementId model, ElementId library) {
        store.link(model, ModelRoles.REF_LIBRARIES, library);
    }
}
