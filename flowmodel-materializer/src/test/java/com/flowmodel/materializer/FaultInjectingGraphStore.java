package com.flowmodel.materializer;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphBatch;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.GraphStoreException;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.PresentationEntry;
import com.flowmodel.graph.Size;
import com.flowmodel.graph.snapshot.GraphSnapshot;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Store decorator whose batches refuse the n-th staged primitive. */
final class FaultInjectingGraphStore implements GraphStore {

    private final GraphStore delegate;
    private int failAt = -1;

    FaultInjectingGraphStore(GraphStore delegate) {
        this.delegate = delegate;
    }

    /** Makes the next batch fail on its {@code n}-th primitive (1-based); -1 disables. */
    void failAt(int n) {
        this.failAt = n;
    }

    @Override
    public ElementId createElement(ElementKind kind, Map<String, Object> attributes, ElementId container, String role) {
        return delegate.createElement(kind, attributes, container, role);
    }

    @Override
    public void link(ElementId source, String referenceName, ElementId target) {
        delegate.link(source, referenceName, target);
    }

    @Override
    public ElementId createPresentation(ElementId element, ElementId diagram, String kind, Point position, Size size,
                                        Map<String, Object> attributes) {
        return delegate.createPresentation(element, diagram, kind, position, size, attributes);
    }

    @Override
    public GraphBatch openBatch() {
        GraphBatch batch = delegate.openBatch();
        int limit = failAt;
        failAt = -1;
        return new GraphBatch() {
            private int count;

            private void tick(String op) {
                if (limit > 0 && ++count >= limit) {
                    throw new GraphStoreException(op, "injected fault at primitive " + count);
                }
            }

            @Override
            public ElementId createElement(ElementKind kind, Map<String, Object> attributes, ElementId container, String role) {
                tick("createElement");
                return batch.createElement(kind, attributes, container, role);
            }

            @Override
            public void link(ElementId source, String referenceName, ElementId target) {
                tick("link");
                batch.link(source, referenceName, target);
            }

            @Override
            public ElementId createPresentation(ElementId element, ElementId diagram, String kind, Point position,
                                                Size size, Map<String, Object> attributes) {
                tick("createPresentation");
                return batch.createPresentation(element, diagram, kind, position, size, attributes);
            }

            @Override
            public ElementKind kindOf(ElementId id) {
                return batch.kindOf(id);
            }

            @Override
            public int stagedCount() {
                return batch.stagedCount();
            }

            @Override
            public void commit() {
                batch.commit();
            }

            @Override
            public void close() {
                batch.close();
            }
        };
    }

    @Override
    public Optional<GraphElement> find(ElementId id) {
        return delegate.find(id);
    }

    @Override
    public GraphElement get(ElementId id) {
        return delegate.get(id);
    }

    @Override
    public boolean contains(ElementId id) {
        return delegate.contains(id);
    }

    @Override
    public List<GraphElement> children(ElementId container, String role) {
        return delegate.children(container, role);
    }

    @Override
    public List<GraphElement> roots() {
        return delegate.roots();
    }

    @Override
    public Collection<GraphElement> elements() {
        return delegate.elements();
    }

    @Override
    public int elementCount() {
        return delegate.elementCount();
    }

    @Override
    public List<PresentationEntry> presentations(ElementId diagram) {
        return delegate.presentations(diagram);
    }

    @Override
    public Optional<PresentationEntry> presentationOf(ElementId element) {
        return delegate.presentationOf(element);
    }

    @Override
    public int presentationCount() {
        return delegate.presentationCount();
    }

    @Override
    public GraphSnapshot snapshot() {
        return delegate.snapshot();
    }
}
