package com.flowmodel.session;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.ModelRegistry;
import com.flowmodel.graph.NamedElement;
import com.flowmodel.graph.PredefinedLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name caches for the currently declared model: name → type, name → constraint and path → element.
 * <p>
 * {@link #declare(ElementId)} walks the model and its libraries once through the {@link ModelRegistry};
 * declaring another model drops the previous caches first. Creations made after the declaration are
 * added with {@link #record(NamedElement)}.
 */
public final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ModelRegistry modelRegistry;
    private final boolean legacyNumericTypes;

    private ElementId currentModel;
    private final Map<String, ElementId> types = new LinkedHashMap<>();
    private final Map<String, ElementId> constraints = new LinkedHashMap<>();
    private final Map<String, NamedElement> elements = new LinkedHashMap<>();

    public SessionRegistry(ModelRegistry modelRegistry) {
        this(modelRegistry, true);
    }

    /**
     * @param legacyNumericTypes when false, {@code int} and {@code real} are not predefined names
     */
    public SessionRegistry(ModelRegistry modelRegistry, boolean legacyNumericTypes) {
        this.modelRegistry = Objects.requireNonNull(modelRegistry, "modelRegistry");
        this.legacyNumericTypes = legacyNumericTypes;
    }

    /**
     * Makes {@code model} the current model. Same model again: no-op. Different model: invalidates
     * then repopulates.
     */
    public void declare(ElementId model) {
        Objects.requireNonNull(model, "model");
        if (model.equals(currentModel)) {
            log.debug("Model {} already declared", model);
            return;
        }
        if (currentModel != null) {
            invalidate();
        }
        for (NamedElement named : modelRegistry.allNamedElements(model)) {
            cache(named);
        }
        currentModel = model;
        log.info("Declared model {}: {} types, {} constraints, {} named elements",
                model, types.size(), constraints.size(), elements.size());
    }

    /** Clears every cache; lookups fail until the next {@link #declare(ElementId)}. */
    public void invalidate() {
        if (currentModel != null) {
            log.info("Invalidated session registry for model {}", currentModel);
        }
        currentModel = null;
        types.clear();
        constraints.clear();
        elements.clear();
    }

    public Optional<ElementId> currentModel() {
        return Optional.ofNullable(currentModel);
    }

    /** The declared model; throws {@link IllegalStateException} when none. */
    public ElementId requireModel() {
        ensureDeclared();
        return currentModel;
    }

    /** Element by path, predefined types included. */
    public ElementId lookup(String name) {
        return findElement(name).map(NamedElement::id).orElseThrow(() -> new UnknownNameException(name, "name"));
    }

    public ElementId lookupType(String name) {
        return findType(name).orElseThrow(() -> new UnknownNameException(name, "type"));
    }

    public ElementId lookupConstraint(String name) {
        ensureDeclared();
        ElementId id = name == null ? null : constraints.get(name);
        if (id == null) {
            throw new UnknownNameException(name, "type constraint");
        }
        return id;
    }

    public Optional<ElementId> findType(String name) {
        ensureDeclared();
        if (name == null) return Optional.empty();
        return Optional.ofNullable(types.get(name));
    }

    public Optional<NamedElement> findElement(String name) {
        ensureDeclared();
        if (name == null) return Optional.empty();
        return Optional.ofNullable(elements.get(name));
    }

    /** Adds an element created in the declared model. */
    public void record(NamedElement named) {
        ensureDeclared();
        cache(named);
        log.debug("Recorded {} {} as {}", named.kind(), named.id(), named.path());
    }

    /** Read-only view of the path → element cache. */
    public Map<String, NamedElement> elements() {
        ensureDeclared();
        return Collections.unmodifiableMap(elements);
    }

    private void cache(NamedElement named) {
        if (!legacyNumericTypes && named.kind() == ElementKind.PREDEFINED_TYPE
                && PredefinedLibrary.LEGACY_NAMES.contains(named.path())) {
            return;
        }
        elements.putIfAbsent(named.path(), named);
        if (named.kind().isType()) {
            types.putIfAbsent(named.path(), named.id());
        } else if (named.kind() == ElementKind.TYPE_CONSTRAINT) {
            constraints.putIfAbsent(named.path(), named.id());
        }
    }

    private void ensureDeclared() {
        if (currentModel == null) {
            throw new IllegalStateException("No model declared in session registry");
        }
    }
}
