package com.flowmodel.tree.node;

import com.flowmodel.tree.ref.ExtendedRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unlinked precursor of one or more graph elements. Built bottom-up through the composition
 * operations; immutable apart from its {@link TreeState}. A node belongs to exactly one parent and
 * one materialization: the validator rejects a node seen twice or already consumed.
 * <p>
 * Composite fields keep their given order, repeated names included, so the validator can report
 * duplicates.
 */
public final class TreeNode {

    public static final String ATTR_LABEL = "label";

    private final Construct construct;
    private final ExtendedRef value;
    private final List<ExtendedRef> operands;
    private final List<Field> fields;
    private final Map<String, Object> attributes;
    private TreeState state = TreeState.UNVALIDATED;

    private TreeNode(Construct construct, ExtendedRef value, List<ExtendedRef> operands,
                     List<Field> fields, Map<String, Object> attributes) {
        this.construct = Objects.requireNonNull(construct, "construct");
        this.value = value;
        this.operands = operands != null ? List.copyOf(operands) : List.of();
        this.fields = fields != null ? List.copyOf(fields) : List.of();
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (v != null) attrs.put(k, v);
            });
        }
        this.attributes = Collections.unmodifiableMap(attrs);
    }

    public static TreeNode leaf(Construct construct, ExtendedRef value, Map<String, Object> attributes) {
        requireType(construct, NodeType.LEAF);
        return new TreeNode(construct, Objects.requireNonNull(value, "value"), null, null, attributes);
    }

    public static TreeNode operator(Construct construct, List<ExtendedRef> operands, Map<String, Object> attributes) {
        requireType(construct, NodeType.OPERATOR);
        return new TreeNode(construct, null, operands, null, attributes);
    }

    public static TreeNode composite(Construct construct, List<ExtendedRef> operands, List<Field> fields,
                                     Map<String, Object> attributes) {
        requireType(construct, NodeType.COMPOSITE);
        return new TreeNode(construct, null, operands, fields, attributes);
    }

    private static void requireType(Construct construct, NodeType type) {
        if (construct.getNodeType() != type) {
            throw new IllegalArgumentException(construct + " is not a " + type + " construct");
        }
    }

    public Construct getConstruct() {
        return construct;
    }

    public TreeDomain getDomain() {
        return construct.getDomain();
    }

    public NodeType getNodeType() {
        return construct.getNodeType();
    }

    /** Wrapped value of a leaf; null for other node types. */
    public ExtendedRef getValue() {
        return value;
    }

    public List<ExtendedRef> getOperands() {
        return operands;
    }

    public List<Field> getFields() {
        return fields;
    }

    /** Values given for {@code name}, in order. */
    public List<ExtendedRef> getFieldValues(String name) {
        List<ExtendedRef> result = new ArrayList<>();
        for (Field f : fields) {
            if (f.name().equals(name)) result.add(f.value());
        }
        return result;
    }

    /** First value given for {@code name}, or null. */
    public ExtendedRef getField(String name) {
        for (Field f : fields) {
            if (f.name().equals(name)) return f.value();
        }
        return null;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public String getLabel() {
        return (String) attributes.get(ATTR_LABEL);
    }

    public TreeState getState() {
        return state;
    }

    public boolean isConsumed() {
        return state.isConsumed();
    }

    /** Claims the node for one validation; a node already claimed or consumed is refused. */
    public void markValidated() {
        transition(TreeState.UNVALIDATED, TreeState.VALIDATED);
    }

    public void markMaterializing() {
        transition(TreeState.VALIDATED, TreeState.MATERIALIZING);
    }

    public void markMaterialized() {
        transition(TreeState.MATERIALIZING, TreeState.MATERIALIZED);
    }

    public void markFailed() {
        if (state == TreeState.MATERIALIZED) {
            throw new IllegalStateException(describe() + " is already materialized");
        }
        state = TreeState.FAILED;
    }

    private void transition(TreeState from, TreeState to) {
        if (state != from) {
            throw new IllegalStateException(describe() + " must be " + from + " to become " + to + " but is " + state);
        }
        state = to;
    }

    public String describe() {
        String label = getLabel();
        return construct + (label != null ? "[" + label + "]" : "") + " node";
    }

    @Override
    public String toString() {
        return describe() + " (" + state + ")";
    }
}
