package com.flowmodel.materializer;

import com.flowmodel.graph.ElementId;
import com.flowmodel.tree.node.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Handles of a committed materialization. */
public final class MaterializationResult {

    private final CommitResult commit;
    private final PlanRef root;
    private final List<PlanRef> roots;
    private final Map<TreeNode, PlanRef> nodes;
    private final Map<String, PlanRef> tags;

    MaterializationResult(CommitResult commit, PlanRef root, List<PlanRef> roots,
                          Map<TreeNode, PlanRef> nodes, Map<String, PlanRef> tags) {
        this.commit = commit;
        this.root = root;
        this.roots = List.copyOf(roots);
        this.nodes = nodes;
        this.tags = tags;
    }

    /** Root of the declaration; an existing element when the tree collapsed into a reference. */
    public ElementId root() {
        return commit.id(root);
    }

    public List<ElementId> roots() {
        List<ElementId> result = new ArrayList<>(roots.size());
        for (PlanRef r : roots) result.add(commit.id(r));
        return result;
    }

    /** Every created element, containers before their content. */
    public List<ElementId> created() {
        return commit.created();
    }

    public ElementId id(PlanRef ref) {
        return commit.id(ref);
    }

    /** Element a tree node became. */
    public ElementId elementOf(TreeNode node) {
        PlanRef ref = nodes.get(node);
        if (ref == null) {
            throw new IllegalArgumentException(node.describe() + " was not part of this materialization");
        }
        return commit.id(ref);
    }

    public Optional<ElementId> tagged(String key) {
        PlanRef ref = tags.get(key);
        return ref == null ? Optional.empty() : Optional.of(commit.id(ref));
    }

    /** Tagged handles whose key starts with {@code prefix}, in tagging order. */
    public List<ElementId> taggedWithPrefix(String prefix) {
        List<ElementId> result = new ArrayList<>();
        tags.forEach((k, v) -> {
            if (k.startsWith(prefix)) result.add(commit.id(v));
        });
        return result;
    }
}
