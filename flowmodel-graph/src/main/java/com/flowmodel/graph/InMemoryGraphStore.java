package com.flowmodel.graph;

import com.flowmodel.graph.snapshot.GraphSnapshot;
import com.flowmodel.graph.snapshot.ElementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single-threaded in-memory {@link GraphStore}. Identities are drawn from a monotonically
 * increasing counter as they are issued and are never handed out twice, not even after a discarded
 * batch. Snapshots record the counter as of the last commit, so a discarded batch leaves the
 * snapshot unchanged.
 */
public final class InMemoryGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final Map<ElementId, GraphElement> elements = new LinkedHashMap<>();
    private final Map<ElementId, PresentationEntry> presentations = new LinkedHashMap<>();
    private final Map<ElementId, ElementId> presentationByElement = new HashMap<>();
    private long nextId = 1;
    private long committedNextId = 1;
    private StagedBatch openBatch;

    @Override
    public ElementId createElement(ElementKind kind, Map<String, Object> attributes, ElementId container, String role) {
        try (GraphBatch batch = openBatch()) {
            ElementId id = batch.createElement(kind, attributes, container, role);
            batch.commit();
            return id;
        }
    }

    @Override
    public void link(ElementId source, String referenceName, ElementId target) {
        try (GraphBatch batch = openBatch()) {
            batch.link(source, referenceName, target);
            batch.commit();
        }
    }

    @Override
    public ElementId createPresentation(ElementId element, ElementId diagram, String kind,
                                        Point position, Size size, Map<String, Object> attributes) {
        try (GraphBatch batch = openBatch()) {
            ElementId id = batch.createPresentation(element, diagram, kind, position, size, attributes);
            batch.commit();
            return id;
        }
    }

    @Override
    public GraphBatch openBatch() {
        if (openBatch != null) {
            throw new IllegalStateException("A batch is already open on this store");
        }
        openBatch = new StagedBatch();
        return openBatch;
    }

    @Override
    public Optional<GraphElement> find(ElementId id) {
        return Optional.ofNullable(id == null ? null : elements.get(id));
    }

    @Override
    public GraphElement get(ElementId id) {
        GraphElement element = id == null ? null : elements.get(id);
        if (element == null) {
            throw new GraphStoreException("get", "no element " + id);
        }
        return element;
    }

    @Override
    public boolean contains(ElementId id) {
        return id != null && elements.containsKey(id);
    }

    @Override
    public List<GraphElement> children(ElementId container, String role) {
        GraphElement parent = elements.get(container);
        if (parent == null) return List.of();
        List<GraphElement> result = new ArrayList<>();
        for (ElementId childId : parent.getChildren()) {
            GraphElement child = elements.get(childId);
            if (child != null && role.equals(child.getRole())) {
                result.add(child);
            }
        }
        return result;
    }

    @Override
    public List<GraphElement> roots() {
        List<GraphElement> result = new ArrayList<>();
        for (GraphElement e : elements.values()) {
            if (e.getContainer() == null) result.add(e);
        }
        return result;
    }

    @Override
    public Collection<GraphElement> elements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    @Override
    public int elementCount() {
        return elements.size();
    }

    @Override
    public List<PresentationEntry> presentations(ElementId diagram) {
        List<PresentationEntry> result = new ArrayList<>();
        for (PresentationEntry p : presentations.values()) {
            if (p.diagram().equals(diagram)) result.add(p);
        }
        return result;
    }

    @Override
    public Optional<PresentationEntry> presentationOf(ElementId element) {
        ElementId pid = presentationByElement.get(element);
        return Optional.ofNullable(pid == null ? null : presentations.get(pid));
    }

    @Override
    public int presentationCount() {
        return presentations.size();
    }

    @Override
    public GraphSnapshot snapshot() {
        List<ElementRecord> records = new ArrayList<>();
        for (GraphElement e : elements.values()) {
            records.add(new ElementRecord(e.getId(), e.getKind(), e.getContainer(), e.getRole(),
                    e.getAttributes(), e.getChildren(), e.getReferences()));
        }
        return new GraphSnapshot(committedNextId, records, new ArrayList<>(presentations.values()));
    }

    /**
     * Rebuilds a store from a snapshot, keeping every identity. The snapshot is replayed in its
     * recorded order; children lists are taken from the records rather than recomputed.
     */
    public static InMemoryGraphStore fromSnapshot(GraphSnapshot snapshot) {
        InMemoryGraphStore store = new InMemoryGraphStore();
        long maxId = 0;
        for (ElementRecord r : snapshot.elements()) {
            GraphElement e = new GraphElement(r.id(), r.kind(), r.container(), r.role(), r.attributes());
            r.children().forEach(e::addChild);
            r.references().forEach((name, targets) -> targets.forEach(t -> e.addReference(name, t)));
            store.elements.put(e.getId(), e);
            maxId = Math.max(maxId, r.id().value());
        }
        for (PresentationEntry p : snapshot.presentations()) {
            store.presentations.put(p.id(), p);
            store.presentationByElement.put(p.element(), p.id());
            maxId = Math.max(maxId, p.id().value());
        }
        store.nextId = Math.max(snapshot.nextId(), maxId + 1);
        store.committedNextId = store.nextId;
        log.debug("Restored graph store: {} elements, {} presentations", store.elements.size(), store.presentations.size());
        return store;
    }

    static Map<String, Object> checkedAttributes(String operation, Map<String, Object> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (attributes == null) return result;
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (value == null) continue;
            if (!isSupportedValue(value)) {
                throw new GraphStoreException(operation,
                        "unsupported value for attribute '" + entry.getKey() + "': " + value.getClass().getSimpleName());
            }
            result.put(entry.getKey(), value instanceof List<?> list ? List.copyOf(list) : value);
        }
        return result;
    }

    private static boolean isSupportedValue(Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Integer) return true;
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item == null || item instanceof List<?> || !isSupportedValue(item)) return false;
            }
            return true;
        }
        return false;
    }

    private interface StagedOp {
    }

    private record StagedCreate(ElementId id, ElementKind kind, Map<String, Object> attributes,
                                ElementId container, String role) implements StagedOp {
    }

    private record StagedLink(ElementId source, String name, ElementId target) implements StagedOp {
    }

    private record StagedPresentation(PresentationEntry entry) implements StagedOp {
    }

    private final class StagedBatch implements GraphBatch {

        private final List<StagedOp> ops = new ArrayList<>();
        private final Map<ElementId, ElementKind> stagedKinds = new HashMap<>();
        private final Set<ElementId> stagedPresented = new HashSet<>();
        private boolean open = true;

        @Override
        public ElementId createElement(ElementKind kind, Map<String, Object> attributes, ElementId container, String role) {
            ensureOpen();
            if (kind == null || kind == ElementKind.UNKNOWN) {
                throw new GraphStoreException("createElement", "element kind is required");
            }
            if (container == null) {
                if (kind != ElementKind.MODEL) {
                    throw new GraphStoreException("createElement", kind + " requires a container");
                }
            } else {
                if (!exists(container)) {
                    throw new GraphStoreException("createElement", "unknown container " + container);
                }
                if (role == null || role.isBlank()) {
                    throw new GraphStoreException("createElement", "containment role is required for " + kind);
                }
            }
            Map<String, Object> checked = checkedAttributes("createElement", attributes);
            ElementId id = new ElementId(nextId++);
            ops.add(new StagedCreate(id, kind, checked, container, container == null ? null : role));
            stagedKinds.put(id, kind);
            return id;
        }

        @Override
        public void link(ElementId source, String referenceName, ElementId target) {
            ensureOpen();
            if (referenceName == null || referenceName.isBlank()) {
                throw new GraphStoreException("link", "reference name is required");
            }
            if (!exists(source)) {
                throw new GraphStoreException("link", "unknown source " + source);
            }
            if (!exists(target)) {
                throw new GraphStoreException("link", "dangling target " + target + " for '" + referenceName + "'");
            }
            ops.add(new StagedLink(source, referenceName, target));
        }

        @Override
        public ElementId createPresentation(ElementId element, ElementId diagram, String kind,
                                            Point position, Size size, Map<String, Object> attributes) {
            ensureOpen();
            if (!exists(element)) {
                throw new GraphStoreException("createPresentation", "element " + element + " does not exist");
            }
            if (!exists(diagram) || !kindOf(diagram).isDiagram()) {
                throw new GraphStoreException("createPresentation", diagram + " is not a diagram");
            }
            if (presentationByElement.containsKey(element) || stagedPresented.contains(element)) {
                throw new GraphStoreException("createPresentation", "element " + element + " is already presented");
            }
            ElementId id = new ElementId(nextId++);
            PresentationEntry entry = new PresentationEntry(id, element, diagram, kind, position, size,
                    checkedAttributes("createPresentation", attributes));
            ops.add(new StagedPresentation(entry));
            stagedPresented.add(element);
            return id;
        }

        @Override
        public ElementKind kindOf(ElementId id) {
            GraphElement committed = id == null ? null : elements.get(id);
            if (committed != null) return committed.getKind();
            ElementKind staged = id == null ? null : stagedKinds.get(id);
            if (staged == null) {
                throw new GraphStoreException("kindOf", "no element " + id);
            }
            return staged;
        }

        @Override
        public int stagedCount() {
            return ops.size();
        }

        @Override
        public void commit() {
            ensureOpen();
            int created = 0;
            int linked = 0;
            int presented = 0;
            for (StagedOp op : ops) {
                if (op instanceof StagedCreate c) {
                    GraphElement element = new GraphElement(c.id(), c.kind(), c.container(), c.role(), c.attributes());
                    elements.put(c.id(), element);
                    if (c.container() != null) {
                        elements.get(c.container()).addChild(c.id());
                    }
                    created++;
                } else if (op instanceof StagedLink l) {
                    elements.get(l.source()).addReference(l.name(), l.target());
                    linked++;
                } else if (op instanceof StagedPresentation p) {
                    presentations.put(p.entry().id(), p.entry());
                    presentationByElement.put(p.entry().element(), p.entry().id());
                    presented++;
                }
            }
            committedNextId = nextId;
            finish();
            log.debug("Committed batch: {} elements, {} links, {} presentations", created, linked, presented);
        }

        @Override
        public void close() {
            if (open) {
                log.debug("Discarding uncommitted batch of {} primitives", ops.size());
                finish();
            }
        }

        private void finish() {
            open = false;
            ops.clear();
            stagedKinds.clear();
            stagedPresented.clear();
            openBatch = null;
        }

        private boolean exists(ElementId id) {
            return id != null && (elements.containsKey(id) || stagedKinds.containsKey(id));
        }

        private void ensureOpen() {
            if (!open) {
                throw new IllegalStateException("Batch is already committed or closed");
            }
        }
    }
}
