package com.flowmodel.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryGraphStoreTest {

    @Test
    void createElement_assignsDistinctIdsAndRecordsContainment() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = store.createElement(ElementKind.MODEL, Map.of("name", "M"), null, null);
        ElementId a = store.createElement(ElementKind.CONSTANT, Map.of("name", "A"), model, ModelRoles.CONSTANTS);
        ElementId b = store.createElement(ElementKind.SENSOR, Map.of("name", "B"), model, ModelRoles.SENSORS);

        assertEquals(3, store.elementCount());
        assertEquals(List.of(a, b), store.get(model).getChildren());
        assertEquals(1, store.children(model, ModelRoles.CONSTANTS).size());
        assertEquals("A", store.get(a).getName());
        assertEquals(model, store.get(b).getContainer());
    }

    @Test
    void createElement_rejectsUnknownContainer() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        GraphStoreException ex = assertThrows(GraphStoreException.class,
                () -> store.createElement(ElementKind.CONSTANT, Map.of(), ElementId.of(42), ModelRoles.CONSTANTS));
        assertEquals("createElement", ex.getOperation());
        assertEquals(0, store.elementCount());
    }

    @Test
    void createElement_rejectsUnsupportedAttributeValue() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        assertThrows(GraphStoreException.class,
                () -> store.createElement(ElementKind.MODEL, Map.of("weight", 1.5d), null, null));
    }

    @Test
    void link_rejectsDanglingTarget() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = store.createElement(ElementKind.MODEL, Map.of(), null, null);
        assertThrows(GraphStoreException.class, () -> store.link(model, "type", ElementId.of(99)));
        assertTrue(store.get(model).getReferences("type").isEmpty());
    }

    @Test
    void createPresentation_requiresDiagramAndSinglePresentation() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = store.createElement(ElementKind.MODEL, Map.of(), null, null);
        ElementId op = store.createElement(ElementKind.OPERATOR, Map.of("name", "Op"), model, ModelRoles.OPERATORS);
        ElementId diagram = store.createElement(ElementKind.NET_DIAGRAM, Map.of("name", "main"), op, ModelRoles.DIAGRAMS);
        ElementId local = store.createElement(ElementKind.LOCAL_VARIABLE, Map.of("name", "x"), op, ModelRoles.LOCALS);

        assertThrows(GraphStoreException.class,
                () -> store.createPresentation(local, op, "Local", Point.ORIGIN, Size.EMPTY, Map.of()));
        ElementId entry = store.createPresentation(local, diagram, "Local", new Point(10, 20), new Size(100, 50), Map.of());
        assertThrows(GraphStoreException.class,
                () -> store.createPresentation(local, diagram, "Local", Point.ORIGIN, Size.EMPTY, Map.of()));

        assertEquals(entry, store.presentationOf(local).orElseThrow().id());
        assertEquals(1, store.presentations(diagram).size());
    }

    @Test
    void batch_commitAppliesStagedPrimitivesInOrder() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = store.createElement(ElementKind.MODEL, Map.of(), null, null);
        ElementId type;
        ElementId field;
        try (GraphBatch batch = store.openBatch()) {
            type = batch.createElement(ElementKind.NAMED_TYPE, Map.of("name", "Point"), model, ModelRoles.TYPES);
            ElementId struct = batch.createElement(ElementKind.STRUCTURE, Map.of(), type, ModelRoles.DEFINITION);
            field = batch.createElement(ElementKind.COMPOSITE_ELEMENT, Map.of("name", "x"), struct, ModelRoles.ELEMENTS);
            batch.link(field, ModelRoles.REF_TYPE, model);
            assertEquals(ElementKind.STRUCTURE, batch.kindOf(struct));
            assertFalse(store.contains(type));
            batch.commit();
        }
        assertTrue(store.contains(type));
        assertEquals(model, store.get(field).getReference(ModelRoles.REF_TYPE));
        assertEquals(4, store.elementCount());
    }

    @Test
    void batch_closeWithoutCommitLeavesStoreUntouched() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = store.createElement(ElementKind.MODEL, Map.of("name", "M"), null, null);
        var before = store.snapshot();

        ElementId discarded;
        try (GraphBatch batch = store.openBatch()) {
            discarded = batch.createElement(ElementKind.CONSTANT, Map.of("name", "C"), model, ModelRoles.CONSTANTS);
            batch.link(model, "extra", discarded);
        }

        assertEquals(before, store.snapshot());
        ElementId next = store.createElement(ElementKind.CONSTANT, Map.of("name", "D"), model, ModelRoles.CONSTANTS);
        assertNotEquals(discarded, next);
        assertEquals(3L, next.value());
        assertFalse(store.contains(discarded));
    }

    @Test
    void openBatch_rejectsSecondOpenBatch() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        try (GraphBatch ignored = store.openBatch()) {
            assertThrows(IllegalStateException.class, store::openBatch);
        }
        store.openBatch().close();
    }
}
