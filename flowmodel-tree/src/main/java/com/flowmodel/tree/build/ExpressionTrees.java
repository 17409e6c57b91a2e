package com.flowmodel.tree.build;

import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.HigherOrder;
import com.flowmodel.tree.node.NodeType;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeDomain;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.ExtendedRef;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.ValidationRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Composition operations for expression trees. Flow arguments accept typed Java values, existing
 * variables or constants, and nested expression trees; strings are rejected in flow positions
 * because their meaning would have to be guessed.
 */
public final class ExpressionTrees {

    private ExpressionTrees() {
    }

    /** A flow value as its own node, so that it can carry a label. */
    public static TreeNode value(Object flow) {
        return TreeNode.leaf(Construct.EXPR_LEAF, ExtendedRefResolver.resolve(flow, Slot.FLOW), Map.of());
    }

    public static TreeNode labelled(Object flow, String label) {
        Shapes.requireIdentifier(Construct.EXPR_LEAF, label, "label");
        return TreeNode.leaf(Construct.EXPR_LEAF, ExtendedRefResolver.resolve(flow, Slot.FLOW),
                Map.of(TreeAttributes.LABEL, label));
    }

    /**
     * Applies an expression operator to positional operands. Each operand is resolved against the
     * slot the operator declares for its position.
     */
    public static TreeNode apply(Construct op, List<?> operands) {
        if (op.getDomain() != TreeDomain.EXPRESSION || op.getNodeType() != NodeType.OPERATOR) {
            throw new IllegalArgumentException(op + " is not an expression operator");
        }
        if (operands == null || !op.acceptsArity(operands.size())) {
            int n = operands == null ? 0 : operands.size();
            throw Shapes.fail(op, ValidationRule.ARITY, "expects " + op.describeArity() + " operands, got " + n);
        }
        return TreeNode.operator(op, resolvePositional(op, operands), Map.of());
    }

    public static TreeNode unary(Construct op, Object operand) {
        return apply(op, List.of(operand));
    }

    public static TreeNode binary(Construct op, Object left, Object right) {
        return apply(op, List.of(left, right));
    }

    public static TreeNode nary(Construct op, List<?> operands) {
        return apply(op, operands);
    }

    public static TreeNode nary(Construct op, Object... operands) {
        return apply(op, Arrays.asList(operands));
    }

    /** {@code if condition then (t1, ...) else (e1, ...)}; both lists non-empty and of equal length. */
    public static TreeNode ifThenElse(Object condition, List<?> thenFlows, List<?> elseFlows) {
        Shapes.requireSameLength(Construct.IF, thenFlows, "then", elseFlows, "else");
        List<Field> fields = new ArrayList<>();
        fields.add(new Field("condition", ExtendedRefResolver.resolve(condition, Slot.BOOL)));
        addAll(fields, "then", thenFlows, Slot.FLOW);
        addAll(fields, "else", elseFlows, Slot.FLOW);
        return TreeNode.composite(Construct.IF, List.of(), fields, Map.of());
    }

    public static TreeNode ifThenElse(Object condition, Object thenFlow, Object elseFlow) {
        return ifThenElse(condition, List.of(thenFlow), List.of(elseFlow));
    }

    /**
     * {@code case selector of | p1: v1 | ... | _: default}. Patterns are booleans, integers,
     * characters or enumeration values; {@code defaultValue} may be null.
     */
    public static TreeNode caseOf(Object selector, List<? extends Map.Entry<?, ?>> cases, Object defaultValue) {
        Shapes.requireNotEmpty(Construct.CASE, cases, "cases");
        List<Field> fields = new ArrayList<>();
        fields.add(new Field("selector", ExtendedRefResolver.resolve(selector, Slot.FLOW)));
        for (Map.Entry<?, ?> c : cases) {
            fields.add(new Field("pattern", ExtendedRefResolver.resolve(c.getKey(), Slot.PATTERN)));
            fields.add(new Field("value", ExtendedRefResolver.resolve(c.getValue(), Slot.FLOW)));
        }
        if (defaultValue != null) {
            fields.add(new Field("default", ExtendedRefResolver.resolve(defaultValue, Slot.FLOW)));
        }
        return TreeNode.composite(Construct.CASE, List.of(), fields, Map.of());
    }

    public static TreeNode make(Object type, List<?> flows) {
        List<Object> operands = new ArrayList<>();
        operands.add(type);
        if (flows != null) operands.addAll(flows);
        return apply(Construct.MAKE, operands);
    }

    public static TreeNode flatten(Object type, Object flow) {
        return apply(Construct.FLATTEN, List.of(type, flow));
    }

    public static TreeNode cast(Object flow, Object type) {
        return apply(Construct.NUMERIC_CAST, List.of(flow, type));
    }

    public static TreeNode scalarToVector(Object flow, Object size) {
        return apply(Construct.SCALAR_TO_VECTOR, List.of(flow, size));
    }

    public static TreeNode dataArray(List<?> items) {
        Shapes.requireNotEmpty(Construct.DATA_ARRAY, items, "array items");
        return apply(Construct.DATA_ARRAY, items);
    }

    /** Anonymous structure value {@code {l1: v1, l2: v2}}. */
    public static TreeNode dataStruct(List<NamedValue> fields) {
        return TreeNode.composite(Construct.DATA_STRUCT, List.of(), labelledFields(Construct.DATA_STRUCT, fields), Map.of());
    }

    /**
     * Structure value of a known structure type. Field names are checked against the type during
     * validation: every field of the type must be given once.
     */
    public static TreeNode structValue(Object type, List<NamedValue> fields) {
        return TreeNode.composite(Construct.STRUCT_VALUE, List.of(ExtendedRefResolver.resolve(type, Slot.TYPE)),
                labelledFields(Construct.STRUCT_VALUE, fields), Map.of());
    }

    /** Static projection {@code flow.l1[2]...}; path items are field labels or non-negative indices. */
    public static TreeNode prj(Object flow, List<?> path) {
        return TreeNode.operator(Construct.PRJ, List.of(ExtendedRefResolver.resolve(flow, Slot.FLOW)),
                Map.of(TreeAttributes.PATH, projectionPath(Construct.PRJ, path)));
    }

    /** Dynamic projection {@code (array.[i1][i2] default d)}. */
    public static TreeNode prjDyn(Object array, List<?> indices, Object defaultValue) {
        Shapes.requireNotEmpty(Construct.PRJ_DYN, indices, "indices");
        List<Object> operands = new ArrayList<>();
        operands.add(array);
        operands.addAll(indices);
        operands.add(defaultValue);
        return apply(Construct.PRJ_DYN, operands);
    }

    /** {@code (flow with path = value)}. */
    public static TreeNode changeIth(Object flow, List<?> path, Object value) {
        return TreeNode.operator(Construct.CHANGE_ITH,
                List.of(ExtendedRefResolver.resolve(flow, Slot.FLOW), ExtendedRefResolver.resolve(value, Slot.FLOW)),
                Map.of(TreeAttributes.PATH, projectionPath(Construct.CHANGE_ITH, path)));
    }

    public static TreeNode pre(List<?> flows) {
        Shapes.requireNotEmpty(Construct.PRE, flows, "flows");
        return apply(Construct.PRE, flows);
    }

    /** {@code (i1, ...) -> (f1, ...)}. */
    public static TreeNode init(List<?> flows, List<?> inits) {
        Shapes.requireSameLength(Construct.INIT, flows, "flows", inits, "inits");
        List<Field> fields = new ArrayList<>();
        addAll(fields, "flow", flows, Slot.FLOW);
        addAll(fields, "init", inits, Slot.FLOW);
        return TreeNode.composite(Construct.INIT, List.of(), fields, Map.of());
    }

    /** {@code fby(f1, ...; delay; i1, ...)}. */
    public static TreeNode fby(List<?> flows, Object delay, List<?> inits) {
        Shapes.requireSameLength(Construct.FBY, flows, "flows", inits, "inits");
        List<Field> fields = new ArrayList<>();
        addAll(fields, "flow", flows, Slot.FLOW);
        fields.add(new Field("delay", ExtendedRefResolver.resolve(delay, Slot.INT)));
        addAll(fields, "init", inits, Slot.FLOW);
        return TreeNode.composite(Construct.FBY, List.of(), fields, Map.of());
    }

    public static TreeNode times(Object count, Object flow) {
        return apply(Construct.TIMES, List.of(count, flow));
    }

    public static TreeNode slice(Object flow, Object from, Object to) {
        return apply(Construct.SLICE, List.of(flow, from, to));
    }

    public static TreeNode concat(List<?> flows) {
        return apply(Construct.CONCAT, flows);
    }

    public static TreeNode reverse(Object flow) {
        return apply(Construct.REVERSE, List.of(flow));
    }

    public static TreeNode transpose(Object flow, Object dimension1, Object dimension2) {
        return apply(Construct.TRANSPOSE, List.of(flow, dimension1, dimension2));
    }

    public static TreeNode call(Object operator, List<?> arguments) {
        return call(operator, List.of(), arguments, List.of());
    }

    /**
     * Call of a user operator. {@code instParameters} are the static {@code <<...>>} parameters;
     * modifiers wrap the operator outermost first, e.g. {@code (map <<4>> Op)}.
     */
    public static TreeNode call(Object operator, List<?> instParameters, List<?> arguments, List<Modifier> modifiers) {
        List<Field> fields = new ArrayList<>();
        addAll(fields, "instParameter", instParameters, Slot.FLOW);
        addAll(fields, "argument", arguments, Slot.FLOW);
        List<String> codes = new ArrayList<>();
        if (modifiers != null) {
            for (Modifier m : modifiers) {
                List<Slot> slots = m.kind().getParameters();
                if (m.parameters().size() != slots.size()) {
                    throw Shapes.fail(Construct.CALL, ValidationRule.ARITY, m.kind().getCode() + " expects "
                            + slots.size() + " parameters, got " + m.parameters().size());
                }
                for (int i = 0; i < slots.size(); i++) {
                    fields.add(new Field("modifierParameter", ExtendedRefResolver.resolve(m.parameters().get(i), slots.get(i))));
                }
                codes.add(m.kind().getCode());
            }
        }
        return TreeNode.composite(Construct.CALL, List.of(ExtendedRefResolver.resolve(operator, Slot.OPERATOR)),
                fields, codes.isEmpty() ? Map.of() : Map.of(TreeAttributes.MODIFIERS, List.copyOf(codes)));
    }

    /** Modifier codes recorded on a call node, outermost first. */
    public static List<HigherOrder> modifiersOf(TreeNode call) {
        Object codes = call.getAttribute(TreeAttributes.MODIFIERS);
        List<HigherOrder> result = new ArrayList<>();
        if (codes instanceof List<?> list) {
            for (Object c : list) result.add(HigherOrder.fromCode((String) c));
        }
        return result;
    }

    private static List<ExtendedRef> resolvePositional(Construct op, List<?> operands) {
        List<ExtendedRef> result = new ArrayList<>(operands.size());
        for (int i = 0; i < operands.size(); i++) {
            result.add(ExtendedRefResolver.resolve(operands.get(i), op.slotAt(i)));
        }
        return result;
    }

    private static void addAll(List<Field> fields, String name, List<?> values, Slot slot) {
        if (values == null) return;
        for (Object v : values) {
            fields.add(new Field(name, ExtendedRefResolver.resolve(v, slot)));
        }
    }

    private static List<Field> labelledFields(Construct construct, List<NamedValue> values) {
        Shapes.requireNotEmpty(construct, values, "fields");
        List<Field> fields = new ArrayList<>(values.size());
        for (NamedValue v : values) {
            Shapes.requireIdentifier(construct, v.name(), "field label");
            fields.add(new Field(v.name(), ExtendedRefResolver.resolve(v.value(), Slot.FLOW)));
        }
        return fields;
    }

    private static List<String> projectionPath(Construct construct, List<?> path) {
        Shapes.requireNotEmpty(construct, path, "projection path");
        List<String> result = new ArrayList<>(path.size());
        for (Object item : path) {
            if (item instanceof Integer index && index >= 0) {
                result.add(index.toString());
            } else if (item instanceof String label && ExtendedRefResolver.isIdentifier(label)) {
                result.add(label);
            } else {
                throw Shapes.fail(construct, ValidationRule.SHAPE, "invalid projection path item: " + item);
            }
        }
        return result;
    }
}
