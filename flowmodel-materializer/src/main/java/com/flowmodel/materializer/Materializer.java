package com.flowmodel.materializer;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.FlowModelException;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.tree.validate.TreeInput;
import com.flowmodel.tree.validate.ValidatedTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns validated trees into graph elements in one all-or-nothing step. The trees are
 * MATERIALIZING while the plan is built and committed, then MATERIALIZED; on any failure they are
 * FAILED and the store is left as it was.
 */
public final class Materializer {

    private static final Logger log = LoggerFactory.getLogger(Materializer.class);

    private final GraphStore store;

    public Materializer(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** Materializes every input under {@code container}, in input order. */
    public MaterializationResult materialize(ValidatedTrees trees, ElementId container, String role) {
        List<PlanRef> roots = new ArrayList<>();
        return materialize(trees, (plan, expander) -> {
            PlanRef parent = PlanRef.existing(container);
            for (TreeInput input : trees.getInputs()) {
                PlanRef root = expander.expand(input);
                if (root.isPlanned()) plan.attach(root, parent, role);
                roots.add(root);
            }
            return roots.isEmpty() ? parent : roots.get(0);
        }, roots);
    }

    public MaterializationResult materialize(ValidatedTrees trees, PlanBuilder builder) {
        return materialize(trees, builder, null);
    }

    private MaterializationResult materialize(ValidatedTrees trees, PlanBuilder builder, List<PlanRef> roots) {
        CreationPlan plan = new CreationPlan(store);
        TreeExpander expander = new TreeExpander(plan, trees);
        try {
            trees.markMaterializing();
            PlanRef root = builder.build(plan, expander);
            CommitResult commit = plan.commit();
            trees.markMaterialized();
            log.info("Materialized {} tree node(s) into {} element(s) under {}",
                    trees.getNodes().size(), commit.created().size(), trees.getAnchor());
            return new MaterializationResult(commit, root, roots != null ? roots : List.of(root),
                    expander.nodeRefs(), plan.tags());
        } catch (FlowModelException e) {
            trees.markFailed();
            throw e;
        } catch (RuntimeException e) {
            trees.markFailed();
            throw new MaterializationException("Materialization aborted: " + e.getMessage(), e);
        }
    }
}
