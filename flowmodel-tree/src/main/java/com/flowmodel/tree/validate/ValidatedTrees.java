package com.flowmodel.tree.validate;

import com.flowmodel.graph.ElementId;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.node.TreeState;
import com.flowmodel.tree.ref.Slot;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful validation: the inputs, the anchor they were checked against, every
 * tree node reached (pre-order) and the element each name resolved to.
 * <p>
 * Lifecycle transitions apply to every node at once, so a nested tree never outlives its root in
 * another state.
 */
public final class ValidatedTrees {

    private final ElementId anchor;
    private final List<TreeInput> inputs;
    private final List<TreeNode> nodes;
    private final Map<String, ElementId> names;

    ValidatedTrees(ElementId anchor, List<TreeInput> inputs, List<TreeNode> nodes, Map<String, ElementId> names) {
        this.anchor = anchor;
        this.inputs = List.copyOf(inputs);
        this.nodes = List.copyOf(nodes);
        this.names = Map.copyOf(names);
    }

    static String key(Slot slot, String name) {
        return (slot == Slot.TYPE ? "type:" : "element:") + name;
    }

    public ElementId getAnchor() {
        return anchor;
    }

    public List<TreeInput> getInputs() {
        return inputs;
    }

    public TreeInput getInput(int index) {
        return inputs.get(index);
    }

    public List<TreeNode> getNodes() {
        return nodes;
    }

    /** Element a name resolved to in {@code slot}. */
    public ElementId resolved(Slot slot, String name) {
        ElementId id = names.get(key(slot, name));
        if (id == null) {
            throw new IllegalStateException("Name '" + name + "' was not resolved during validation");
        }
        return id;
    }

    /** Flips every node to MATERIALIZING, or none if one of them left VALIDATED since validation. */
    public void markMaterializing() {
        for (TreeNode node : nodes) {
            if (node.getState() != TreeState.VALIDATED) {
                throw new IllegalStateException(node.describe() + " is no longer VALIDATED (" + node.getState() + ")");
            }
        }
        nodes.forEach(TreeNode::markMaterializing);
    }

    public void markMaterialized() {
        nodes.forEach(TreeNode::markMaterialized);
    }

    /** Fails every node that was not materialized elsewhere. */
    public void markFailed() {
        for (TreeNode node : nodes) {
            if (node.getState() != TreeState.MATERIALIZED) node.markFailed();
        }
    }
}
