package com.flowmodel.materializer;

import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphBatch;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.GraphStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pending elements, cross-references and presentation entries of one materialization.
 * <p>
 * Elements are planned post-order: an element is created with {@link #newElement} once its
 * content is planned, and given its container later with {@link #attach}. {@link #commit()}
 * writes everything inside one store batch: containers before their content, then references,
 * then presentation entries. A refused write discards the batch.
 */
public final class CreationPlan {

    private static final Logger log = LoggerFactory.getLogger(CreationPlan.class);

    private final GraphStore store;
    private final List<Pending> pending = new ArrayList<>();
    private final List<Attachment> attachments = new ArrayList<>();
    private final List<PendingLink> links = new ArrayList<>();
    private final List<PendingPresentation> presentations = new ArrayList<>();
    private final Map<String, PlanRef> tags = new LinkedHashMap<>();
    private boolean committed;

    public CreationPlan(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Plans an element whose container is assigned later. */
    public PlanRef newElement(ElementKind kind, Map<String, Object> attributes) {
        ensureOpen();
        Objects.requireNonNull(kind, "kind");
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (v != null) attrs.put(k, v);
            });
        }
        pending.add(new Pending(kind, attrs));
        return PlanRef.planned(pending.size() - 1);
    }

    public void attach(PlanRef child, PlanRef container, String role) {
        ensureOpen();
        if (!child.isPlanned()) {
            throw new IllegalArgumentException("Existing element " + child + " cannot be moved");
        }
        Pending p = pending(child);
        if (p.attached) {
            throw new IllegalStateException(child + " is already attached");
        }
        if (container.isPlanned()) pending(container);
        p.attached = true;
        attachments.add(new Attachment(child, container, role));
    }

    public PlanRef create(ElementKind kind, Map<String, Object> attributes, PlanRef container, String role) {
        PlanRef ref = newElement(kind, attributes);
        attach(ref, container, role);
        return ref;
    }

    public void setAttribute(PlanRef ref, String key, Object value) {
        ensureOpen();
        if (value != null) pending(ref).attributes.put(key, value);
    }

    public Object getAttribute(PlanRef ref, String key) {
        return ref.isPlanned() ? pending(ref).attributes.get(key) : store.get(ref.existing()).getAttribute(key);
    }

    public void link(PlanRef source, String referenceName, PlanRef target) {
        ensureOpen();
        links.add(new PendingLink(source, referenceName, target));
    }

    public void present(PlanRef element, PlanRef diagram, String kind, Box box, Map<String, Object> attributes) {
        ensureOpen();
        presentations.add(new PendingPresentation(element, diagram, kind, box, attributes));
    }

    /** Names a handle so callers can find it in the result. */
    public void tag(String key, PlanRef ref) {
        tags.put(key, ref);
    }

    public ElementKind kindOf(PlanRef ref) {
        return ref.isPlanned() ? pending(ref).kind : store.get(ref.existing()).getKind();
    }

    /** Planned children of {@code container} under {@code role}, in attach order. */
    public List<PlanRef> plannedChildren(PlanRef container, String role) {
        List<PlanRef> result = new ArrayList<>();
        for (Attachment a : attachments) {
            if (a.container.equals(container) && a.role.equals(role)) result.add(a.child);
        }
        return result;
    }

    public int plannedCount() {
        return pending.size();
    }

    Map<String, PlanRef> tags() {
        return Collections.unmodifiableMap(tags);
    }

    /**
     * Writes the plan. Store refusals are raised as {@link MaterializationException} after the batch
     * is discarded.
     */
    public CommitResult commit() {
        ensureOpen();
        List<Attachment> order = creationOrder();
        ElementId[] ids = new ElementId[pending.size()];
        List<ElementId> created = new ArrayList<>(order.size());
        try (GraphBatch batch = store.openBatch()) {
            for (Attachment a : order) {
                Pending p = pending.get(a.child.index());
                ElementId container = a.container.isPlanned() ? ids[a.container.index()] : a.container.existing();
                ElementId id = batch.createElement(p.kind, p.attributes, container, a.role);
                ids[a.child.index()] = id;
                created.add(id);
            }
            for (PendingLink l : links) {
                batch.link(resolve(ids, l.source), l.name, resolve(ids, l.target));
            }
            for (PendingPresentation p : presentations) {
                batch.createPresentation(resolve(ids, p.element), resolve(ids, p.diagram), p.kind,
                        p.box.position(), p.box.size(), p.attributes);
            }
            batch.commit();
        } catch (GraphStoreException e) {
            throw new MaterializationException("Graph store refused the plan: " + e.getMessage(), e);
        }
        committed = true;
        log.debug("Committed plan: {} elements, {} references, {} presentations",
                created.size(), links.size(), presentations.size());
        return new CommitResult(ids, created);
    }

    private List<Attachment> creationOrder() {
        Map<PlanRef, List<Attachment>> byContainer = new LinkedHashMap<>();
        List<Attachment> roots = new ArrayList<>();
        for (Attachment a : attachments) {
            if (a.container.isPlanned()) {
                byContainer.computeIfAbsent(a.container, k -> new ArrayList<>()).add(a);
            } else {
                roots.add(a);
            }
        }
        List<Attachment> order = new ArrayList<>(pending.size());
        for (Attachment root : roots) {
            visit(root, byContainer, order);
        }
        if (order.size() != pending.size()) {
            throw new IllegalStateException((pending.size() - order.size())
                    + " planned element(s) are not reachable from an existing container");
        }
        return order;
    }

    private void visit(Attachment a, Map<PlanRef, List<Attachment>> byContainer, List<Attachment> order) {
        order.add(a);
        for (Attachment child : byContainer.getOrDefault(a.child, List.of())) {
            visit(child, byContainer, order);
        }
    }

    private static ElementId resolve(ElementId[] ids, PlanRef ref) {
        return ref.isPlanned() ? ids[ref.index()] : ref.existing();
    }

    private Pending pending(PlanRef ref) {
        if (!ref.isPlanned() || ref.index() < 0 || ref.index() >= pending.size()) {
            throw new IllegalArgumentException(ref + " is not planned here");
        }
        return pending.get(ref.index());
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Plan already committed");
        }
    }

    private static final class Pending {
        private final ElementKind kind;
        private final Map<String, Object> attributes;
        private boolean attached;

        Pending(ElementKind kind, Map<String, Object> attributes) {
            this.kind = kind;
            this.attributes = attributes;
        }
    }

    private record Attachment(PlanRef child, PlanRef container, String role) {
    }

    private record PendingLink(PlanRef source, String name, PlanRef target) {
    }

    private record PendingPresentation(PlanRef element, PlanRef diagram, String kind, Box box,
                                       Map<String, Object> attributes) {
    }
}
