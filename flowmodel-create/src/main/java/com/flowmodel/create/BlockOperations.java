package com.flowmodel.create;

import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.CreationPlan;
import com.flowmodel.materializer.PlanRef;
import com.flowmodel.materializer.TreeExpander;
import com.flowmodel.materializer.placement.BranchShape;
import com.flowmodel.materializer.placement.DecisionShape;
import com.flowmodel.materializer.placement.IfLayout;
import com.flowmodel.materializer.placement.WhenLayout;
import com.flowmodel.materializer.placement.WhenShape;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.TreeInput;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * If and when blocks. In a net diagram the block and every decision, action and branch label get
 * a presentation entry laid out by the placement engine; the block itself is moved to the next
 * free cell of the diagram unless a position is given.
 */
final class BlockOperations {

    private final EditContext ctx;

    BlockOperations(EditContext ctx) {
        this.ctx = ctx;
    }

    ElementId addIfBlock(ElementId dataDef, String name, TreeNode ifTree, ElementId diagram, Point position, Size size) {
        ctx.requireDataDef(dataDef);
        EditContext.requireName(name, "if block");
        GraphElement diagramElement = ctx.optionalDiagram(diagram);
        List<TreeInput> inputs = List.of(TreeInput.of(ifTree, Slot.BRANCH));
        return ctx.materialize(ctx.validate(dataDef, inputs), (plan, expander) -> {
            BranchShape shape = expander.branch(inputs.get(0).ref());
            PlanRef block = plan.create(ElementKind.IF_BLOCK, Map.of(ModelRoles.ATTR_NAME, name),
                    PlanRef.existing(dataDef), ModelRoles.FLOWS);
            plan.attach(TreeExpander.rootOf(shape), block, ModelRoles.IF_NODE);
            if (diagramElement != null) {
                if (ctx.isTextDiagram(diagramElement)) {
                    ctx.presentAsText(plan, block, diagram);
                } else {
                    presentIf(plan, block, shape, diagram, position, size);
                }
            }
            return block;
        }).root();
    }

    ElementId addWhenBlock(ElementId dataDef, String name, Object when, List<TreeNode> branches,
                           ElementId diagram, Point position, Size size) {
        ctx.requireDataDef(dataDef);
        EditContext.requireName(name, "when block");
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("when block " + name + " needs at least one branch");
        }
        GraphElement diagramElement = ctx.optionalDiagram(diagram);
        List<TreeInput> inputs = new ArrayList<>();
        inputs.add(TreeInput.of(when, Slot.FLOW));
        for (TreeNode branch : branches) inputs.add(TreeInput.of(branch, Slot.BRANCH));
        return ctx.materialize(ctx.validate(dataDef, inputs), (plan, expander) -> {
            PlanRef selector = expander.expression(inputs.get(0).ref());
            List<WhenShape> shapes = new ArrayList<>();
            for (TreeInput input : inputs.subList(1, inputs.size())) {
                shapes.add(expander.whenBranch(input.ref()));
            }
            PlanRef block = plan.create(ElementKind.WHEN_BLOCK, Map.of(ModelRoles.ATTR_NAME, name),
                    PlanRef.existing(dataDef), ModelRoles.FLOWS);
            plan.attach(selector, block, ModelRoles.CONDITION);
            for (WhenShape shape : shapes) plan.attach(shape.branch(), block, ModelRoles.WHEN_BRANCHES);
            if (diagramElement != null) {
                if (ctx.isTextDiagram(diagramElement)) {
                    ctx.presentAsText(plan, block, diagram);
                } else {
                    presentWhen(plan, block, shapes, diagram, position, size);
                }
            }
            return block;
        }).root();
    }

    private void presentIf(CreationPlan plan, PlanRef block, BranchShape shape, ElementId diagram, Point position, Size size) {
        Point origin = position != null ? position
                : ctx.flowBox(diagram, null, size, ctx.placement().layoutIf(Point.ORIGIN, shape).block().size()).position();
        IfLayout layout = ctx.placement().layoutIf(origin, shape);
        PlanRef target = PlanRef.existing(diagram);
        plan.present(block, target, PresentationKinds.IF_BLOCK, blockBox(layout.block(), size), Map.of());
        Map<PlanRef, Integer> labelWidths = new HashMap<>();
        collectLabelWidths(shape, labelWidths);
        layout.boxes().forEach((ref, box) -> {
            String kind = plan.kindOf(ref) == ElementKind.IF_NODE ? PresentationKinds.IF_NODE : PresentationKinds.IF_ACTION;
            Integer labelWidth = labelWidths.get(ref);
            plan.present(ref, target, kind, box,
                    labelWidth != null ? Map.<String, Object>of(ModelRoles.ATTR_LABEL_WIDTH, labelWidth) : Map.<String, Object>of());
        });
    }

    private static void collectLabelWidths(BranchShape shape, Map<PlanRef, Integer> labelWidths) {
        if (shape instanceof DecisionShape decision) {
            if (decision.labelWidth() != null) labelWidths.put(decision.node(), decision.labelWidth());
            collectLabelWidths(decision.thenBranch(), labelWidths);
            collectLabelWidths(decision.elseBranch(), labelWidths);
        }
    }

    private void presentWhen(CreationPlan plan, PlanRef block, List<WhenShape> shapes, ElementId diagram,
                             Point position, Size size) {
        Point origin = position != null ? position
                : ctx.flowBox(diagram, null, size, ctx.placement().layoutWhen(Point.ORIGIN, shapes).block().size()).position();
        WhenLayout layout = ctx.placement().layoutWhen(origin, shapes);
        PlanRef target = PlanRef.existing(diagram);
        plan.present(block, target, PresentationKinds.WHEN_BLOCK, blockBox(layout.block(), size), Map.of());
        for (WhenShape shape : shapes) {
            plan.present(shape.branch(), target, PresentationKinds.WHEN_LABEL, layout.labels().get(shape.branch()), Map.of());
            plan.present(shape.action(), target, PresentationKinds.WHEN_ACTION, layout.actions().get(shape.action()), Map.of());
        }
    }

    private static Box blockBox(Box computed, Size size) {
        return size != null ? new Box(computed.position(), size) : computed;
    }
}
