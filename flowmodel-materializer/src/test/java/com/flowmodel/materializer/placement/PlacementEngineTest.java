package com.flowmodel.materializer.placement;

import com.flowmodel.config.LayoutDefaults;
import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.PlanRef;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementEngineTest {

    private final PlacementEngine engine = new PlacementEngine(LayoutDefaults.BUILT_IN);

    private static PlanRef ref(long id) {
        return PlanRef.existing(ElementId.of(id));
    }

    @Test
    void placeInDiagram_fillsGridByOrdinal() {
        List<Box> placed = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            placed.add(engine.placeInDiagram(placed, engine.equationSize()));
        }

        assertEquals(Box.of(500, 500, 3000, 1500), placed.get(0));
        assertEquals(Box.of(4500, 500, 3000, 1500), placed.get(1));
        assertEquals(Box.of(500, 2800, 3000, 1500), placed.get(4));
        for (int i = 0; i < placed.size(); i++) {
            for (int j = i + 1; j < placed.size(); j++) {
                assertFalse(placed.get(i).overlaps(placed.get(j)), i + " overlaps " + j);
            }
        }
    }

    @Test
    void placeInDiagram_movesBelowOccupiedCell() {
        List<Box> existing = List.of(Box.of(4500, 500, 3000, 1500));

        Box box = engine.placeInDiagram(existing, engine.equationSize());

        assertEquals(Box.of(4500, 2800, 3000, 1500), box);
    }

    @Test
    void placeInDiagram_isDeterministic() {
        List<Box> existing = List.of(Box.of(500, 500, 3000, 1500), Box.of(4500, 500, 100, 100));

        assertEquals(engine.placeInDiagram(existing, new Size(10, 10)), engine.placeInDiagram(existing, new Size(10, 10)));
    }

    @Test
    void placeState_insideMachine() {
        Box machine = Box.of(1000, 1000, 20000, 20000);

        assertEquals(Box.of(1500, 1500, 4000, 2500), engine.placeState(machine, List.of()));
        assertEquals(Box.of(6500, 1500, 4000, 2500), engine.placeState(machine, List.of(Box.of(1500, 1500, 4000, 2500))));
    }

    @Test
    void layoutIf_columnsByDepthAndStackedActions() {
        ActionShape a1 = new ActionShape(ref(11), ref(21), null, null, true);
        ActionShape a2 = new ActionShape(ref(12), ref(22), null, null, true);
        ActionShape a3 = new ActionShape(ref(13), ref(23), null, null, false);
        DecisionShape inner = new DecisionShape(ref(2), a2, a3, null, null);
        DecisionShape root = new DecisionShape(ref(1), a1, inner, null, null);

        IfLayout layout = engine.layoutIf(new Point(0, 0), root);

        assertEquals(List.of(ref(1), ref(11), ref(2), ref(12), ref(13)), new ArrayList<>(layout.boxes().keySet()));
        assertEquals(Box.of(500, 500, 400, 400), layout.boxes().get(ref(1)));
        assertEquals(Box.of(3300, 500, 3000, 1500), layout.boxes().get(ref(11)));
        assertEquals(Box.of(1900, 2800, 400, 400), layout.boxes().get(ref(2)));
        assertEquals(Box.of(3300, 5100, 3000, 1500), layout.boxes().get(ref(13)));
        assertEquals(Box.of(0, 0, 6800, 7100), layout.block());
    }

    @Test
    void layoutIf_callerGeometryWins() {
        ActionShape then = new ActionShape(ref(11), ref(21), new Point(42, 43), new Size(7, 8), true);
        ActionShape otherwise = new ActionShape(ref(12), ref(22), null, null, true);
        DecisionShape root = new DecisionShape(ref(1), then, otherwise, new Point(1, 2), null);

        IfLayout layout = engine.layoutIf(new Point(0, 0), root);

        assertEquals(Box.of(1, 2, 400, 400), layout.boxes().get(ref(1)));
        assertEquals(Box.of(42, 43, 7, 8), layout.boxes().get(ref(11)));
        assertEquals(Box.of(1900, 2800, 3000, 1500), layout.boxes().get(ref(12)));
    }

    @Test
    void layoutWhen_labelsFollowTheirActions() {
        WhenShape first = new WhenShape(ref(1), ref(11), null, null, true, null);
        WhenShape second = new WhenShape(ref(2), ref(12), new Point(9000, 9000), null, true, 700);

        WhenLayout layout = engine.layoutWhen(new Point(0, 0), List.of(first, second));

        assertEquals(Box.of(500, 500, 3000, 1500), layout.actions().get(ref(11)));
        assertEquals(Box.of(800, 800, 1000, 500), layout.labels().get(ref(1)));
        assertEquals(Box.of(9000, 9000, 3000, 1500), layout.actions().get(ref(12)));
        assertEquals(Box.of(800, 9300, 700, 500), layout.labels().get(ref(2)));
        assertEquals(Box.of(0, 0, 12500, 11000), layout.block());
    }

    @Test
    void layoutWhen_defaultBranchesAreDisjointOrderedAndRepeatable() {
        List<WhenShape> branches = new ArrayList<>();
        for (int k = 0; k < 5; k++) {
            branches.add(new WhenShape(ref(k + 1), ref(k + 11), null, null, true, null));
        }

        WhenLayout layout = engine.layoutWhen(new Point(200, 300), branches);

        List<Box> actions = new ArrayList<>(layout.actions().values());
        List<Box> labels = new ArrayList<>(layout.labels().values());
        assertEquals(5, actions.size());
        assertPairwiseDisjoint(actions);
        assertPairwiseDisjoint(labels);
        assertTopsIncrease(actions);
        for (int k = 0; k < 5; k++) {
            assertTrue(actions.get(k).contains(labels.get(k)), "label " + k + " outside its action");
            assertTrue(layout.block().contains(actions.get(k)), "action " + k + " outside the block");
        }
        assertEquals(layout, engine.layoutWhen(new Point(200, 300), branches));
    }

    @Test
    void layoutIf_nestedDefaultTreeIsDisjointOrderedAndRepeatable() {
        ActionShape a1 = new ActionShape(ref(11), ref(21), null, null, true);
        ActionShape a2 = new ActionShape(ref(12), ref(22), null, null, true);
        ActionShape a3 = new ActionShape(ref(13), ref(23), null, null, true);
        ActionShape a4 = new ActionShape(ref(14), ref(24), null, null, true);
        ActionShape a5 = new ActionShape(ref(15), ref(25), null, null, true);
        DecisionShape deepest = new DecisionShape(ref(3), a3, a4, null, null);
        DecisionShape middle = new DecisionShape(ref(2), a2, deepest, null, null);
        DecisionShape root = new DecisionShape(ref(1), a1, new DecisionShape(ref(4), middle, a5, null, null), null, null);

        IfLayout layout = engine.layoutIf(new Point(100, 100), root);

        List<Box> all = new ArrayList<>(layout.boxes().values());
        assertEquals(9, all.size());
        assertPairwiseDisjoint(all);
        List<Box> actions = new ArrayList<>();
        for (PlanRef action : List.of(ref(11), ref(12), ref(13), ref(14), ref(15))) {
            actions.add(layout.boxes().get(action));
        }
        assertTopsIncrease(actions);
        for (Box box : all) {
            assertTrue(layout.block().contains(box), box + " outside the block");
        }
        assertEquals(layout, engine.layoutIf(new Point(100, 100), root));
    }

    private static void assertPairwiseDisjoint(List<Box> boxes) {
        for (int i = 0; i < boxes.size(); i++) {
            for (int j = i + 1; j < boxes.size(); j++) {
                assertFalse(boxes.get(i).overlaps(boxes.get(j)), boxes.get(i) + " overlaps " + boxes.get(j));
            }
        }
    }

    private static void assertTopsIncrease(List<Box> boxes) {
        for (int i = 1; i < boxes.size(); i++) {
            assertTrue(boxes.get(i - 1).top() < boxes.get(i).top(), "box " + i + " is not below box " + (i - 1));
        }
    }
}
