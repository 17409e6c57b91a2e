package com.flowmodel.materializer;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.InMemoryGraphStore;
import com.flowmodel.graph.ModelBootstrap;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.snapshot.GraphSnapshots;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CreationPlanTest {

    @Test
    void commit_createsContainersBeforeContent() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = ModelBootstrap.newModel(store, "M");
        CreationPlan plan = new CreationPlan(store);

        PlanRef x = plan.newElement(ElementKind.COMPOSITE_ELEMENT, Map.of(ModelRoles.ATTR_NAME, "x"));
        PlanRef y = plan.newElement(ElementKind.COMPOSITE_ELEMENT, Map.of(ModelRoles.ATTR_NAME, "y"));
        PlanRef structure = plan.newElement(ElementKind.STRUCTURE, Map.of());
        plan.attach(x, structure, ModelRoles.ELEMENTS);
        plan.attach(y, structure, ModelRoles.ELEMENTS);
        PlanRef type = plan.create(ElementKind.NAMED_TYPE, Map.of(ModelRoles.ATTR_NAME, "P"), PlanRef.existing(model), ModelRoles.TYPES);
        plan.attach(structure, type, ModelRoles.DEFINITION);
        plan.link(type, ModelRoles.REF_TYPE, structure);
        CommitResult result = plan.commit();

        List<ElementId> created = result.created();
        assertEquals(List.of(result.id(type), result.id(structure), result.id(x), result.id(y)), created);
        assertEquals(List.of("x", "y"), store.children(result.id(structure), ModelRoles.ELEMENTS).stream()
                .map(e -> e.getName()).toList());
        assertEquals(result.id(structure), store.get(result.id(type)).getReference(ModelRoles.REF_TYPE));
    }

    @Test
    void commit_rejectsUnattachedElementsBeforeWriting() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ModelBootstrap.newModel(store, "M");
        String before = GraphSnapshots.toJson(store);
        CreationPlan plan = new CreationPlan(store);
        plan.newElement(ElementKind.CONST_VALUE, Map.of(ModelRoles.ATTR_VALUE, "1"));

        assertThrows(IllegalStateException.class, plan::commit);
        assertEquals(before, GraphSnapshots.toJson(store));
    }

    @Test
    void commit_wrapsStoreRefusal() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ElementId model = ModelBootstrap.newModel(store, "M");
        int before = store.elementCount();
        CreationPlan plan = new CreationPlan(store);
        PlanRef k = plan.create(ElementKind.CONSTANT, Map.of(ModelRoles.ATTR_NAME, "K"), PlanRef.existing(model), ModelRoles.CONSTANTS);
        plan.link(k, ModelRoles.REF_TYPE, PlanRef.existing(ElementId.of(9999)));

        MaterializationException ex = assertThrows(MaterializationException.class, plan::commit);

        assertTrue(ex.getMessage().contains("dangling"));
        assertEquals(before, store.elementCount());
    }

    @Test
    void attach_isOncePerElement() {
        CreationPlan plan = new CreationPlan(new InMemoryGraphStore());
        PlanRef a = plan.newElement(ElementKind.LABEL, Map.of());
        PlanRef b = plan.newElement(ElementKind.EXPR_ID, Map.of());
        plan.attach(a, b, ModelRoles.LABEL);

        assertThrows(IllegalStateException.class, () -> plan.attach(a, b, ModelRoles.LABEL));
        assertThrows(IllegalArgumentException.class,
                () -> plan.attach(PlanRef.existing(ElementId.of(1)), b, ModelRoles.LABEL));
    }
}
