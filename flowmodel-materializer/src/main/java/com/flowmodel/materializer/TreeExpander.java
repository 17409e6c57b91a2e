package com.flowmodel.materializer;

import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.placement.ActionShape;
import com.flowmodel.materializer.placement.BranchShape;
import com.flowmodel.materializer.placement.DecisionShape;
import com.flowmodel.materializer.placement.WhenShape;
import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.FieldSpec;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.ElementRef;
import com.flowmodel.tree.ref.ExtendedRef;
import com.flowmodel.tree.ref.Literal;
import com.flowmodel.tree.ref.LiteralRef;
import com.flowmodel.tree.ref.PredefinedNameRef;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.ref.TreeRef;
import com.flowmodel.tree.validate.TreeInput;
import com.flowmodel.tree.validate.ValidatedTrees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands validated trees into a {@link CreationPlan}, strictly post-order: every nested tree is
 * fully planned before the element that owns or references it. Returned handles are unattached;
 * the caller gives the root its container.
 * <p>
 * A type given by name or handle collapses into a reference to the existing element; an
 * anonymous type is owned by the object it types.
 */
public final class TreeExpander {

    private final CreationPlan plan;
    private final ValidatedTrees trees;
    private final Map<TreeNode, PlanRef> nodes = new IdentityHashMap<>();

    public TreeExpander(CreationPlan plan, ValidatedTrees trees) {
        this.plan = plan;
        this.trees = trees;
    }

    public CreationPlan getPlan() {
        return plan;
    }

    public ValidatedTrees getTrees() {
        return trees;
    }

    /** Expands a top-level input according to its slot. */
    public PlanRef expand(TreeInput input) {
        return switch (input.slot()) {
            case TYPE -> type(input.ref());
            case TRANSITION -> transition(input.ref());
            case BRANCH -> rootOf(branch(input.ref()));
            default -> expression(input.ref());
        };
    }

    Map<TreeNode, PlanRef> nodeRefs() {
        return Collections.unmodifiableMap(nodes);
    }

    // types

    public PlanRef type(ExtendedRef ref) {
        if (ref instanceof ElementRef e) return PlanRef.existing(e.id());
        if (ref instanceof PredefinedNameRef n) return PlanRef.existing(trees.resolved(Slot.TYPE, n.name()));
        if (ref instanceof TreeRef t) return typeNode(t.node());
        throw new IllegalArgumentException("Not a type: " + ref.describe());
    }

    /** Types {@code owner}: links the type and, when it is anonymous, owns it under {@code ownedRole}. */
    public void bindType(PlanRef owner, PlanRef type, String ownedRole) {
        if (type.isPlanned()) {
            plan.attach(type, owner, ownedRole);
        }
        plan.link(owner, ModelRoles.REF_TYPE, type);
    }

    public void typeObject(PlanRef owner, ExtendedRef type, String ownedRole) {
        bindType(owner, type(type), ownedRole);
    }

    private PlanRef typeNode(TreeNode node) {
        PlanRef result = switch (node.getConstruct()) {
            case TYPE_LEAF -> type(node.getValue());
            case SIZED -> {
                PlanRef size = expression(node.getOperands().get(0));
                PlanRef sized = plan.newElement(ElementKind.SIZED_TYPE,
                        attribute(ModelRoles.ATTR_SIGNED, node.getAttribute(TreeAttributes.SIGNED)));
                plan.attach(size, sized, ModelRoles.SIZE);
                yield sized;
            }
            case TABLE -> {
                PlanRef elementType = type(node.getOperands().get(0));
                List<PlanRef> dimensions = new ArrayList<>();
                for (ExtendedRef d : node.getOperands().subList(1, node.getOperands().size())) {
                    dimensions.add(expression(d));
                }
                PlanRef table = plan.newElement(ElementKind.TABLE, Map.of());
                bindType(table, elementType, ModelRoles.BUILD_TYPE);
                for (PlanRef d : dimensions) plan.attach(d, table, ModelRoles.SIZE);
                yield table;
            }
            case STRUCTURE -> {
                List<PlanRef> fields = new ArrayList<>();
                for (Field f : node.getFields()) {
                    PlanRef fieldType = type(f.value());
                    PlanRef field = plan.newElement(ElementKind.COMPOSITE_ELEMENT, Map.of(ModelRoles.ATTR_NAME, f.name()));
                    bindType(field, fieldType, ModelRoles.BUILD_TYPE);
                    fields.add(field);
                }
                PlanRef structure = plan.newElement(ElementKind.STRUCTURE, Map.of());
                for (PlanRef f : fields) plan.attach(f, structure, ModelRoles.ELEMENTS);
                yield structure;
            }
            default -> throw new IllegalArgumentException(node.describe() + " is not a type tree");
        };
        nodes.put(node, result);
        return result;
    }

    // expressions

    public PlanRef expression(ExtendedRef ref) {
        if (ref instanceof LiteralRef lit) return literal(lit.literal());
        if (ref instanceof ElementRef e) return reference(PlanRef.existing(e.id()));
        if (ref instanceof PredefinedNameRef n) return reference(PlanRef.existing(trees.resolved(Slot.FLOW, n.name())));
        if (ref instanceof TreeRef t) return expressionNode(t.node());
        throw new IllegalArgumentException("Not an expression: " + ref.describe());
    }

    private PlanRef literal(Literal literal) {
        if (!literal.array()) {
            return constValue(literal, literal.text());
        }
        List<PlanRef> items = new ArrayList<>();
        for (String v : literal.values()) items.add(constValue(literal, v));
        PlanRef call = plan.newElement(ElementKind.EXPR_CALL, Map.of(ModelRoles.ATTR_PREDEF_OPER, Construct.DATA_ARRAY.getCode()));
        for (PlanRef item : items) plan.attach(item, call, ModelRoles.CALL_PARAMETERS);
        return call;
    }

    private PlanRef constValue(Literal literal, String text) {
        return plan.newElement(ElementKind.CONST_VALUE,
                Map.of(ModelRoles.ATTR_KIND, literal.kind().name(), ModelRoles.ATTR_VALUE, text));
    }

    private PlanRef reference(PlanRef target) {
        PlanRef id = plan.newElement(ElementKind.EXPR_ID, Map.of());
        plan.link(id, ModelRoles.REF_REFERENCE, target);
        return id;
    }

    private PlanRef expressionType(ExtendedRef ref) {
        PlanRef type = type(ref);
        PlanRef holder = plan.newElement(ElementKind.EXPR_TYPE, Map.of());
        bindType(holder, type, ModelRoles.BUILD_TYPE);
        return holder;
    }

    private PlanRef expressionNode(TreeNode node) {
        Construct c = node.getConstruct();
        PlanRef result;
        if (c == Construct.EXPR_LEAF) {
            result = expression(node.getValue());
        } else if (c == Construct.CALL) {
            result = call(node);
        } else if (c.isOpen()) {
            List<PlanRef> params = new ArrayList<>();
            if (c == Construct.STRUCT_VALUE) params.add(expressionType(node.getOperands().get(0)));
            for (Field f : node.getFields()) {
                PlanRef value = expression(f.value());
                label(value, f.name());
                params.add(value);
            }
            result = callOf(c, params, ModelRoles.CALL_PARAMETERS);
        } else if (c.getFields().isEmpty()) {
            List<PlanRef> params = new ArrayList<>();
            List<ExtendedRef> operands = node.getOperands();
            for (int i = 0; i < operands.size(); i++) {
                params.add(c.slotAt(i) == Slot.TYPE ? expressionType(operands.get(i)) : expression(operands.get(i)));
            }
            result = callOf(c, params, ModelRoles.CALL_PARAMETERS);
            if (node.getAttribute(TreeAttributes.PATH) != null) {
                plan.setAttribute(result, ModelRoles.ATTR_PATH, node.getAttribute(TreeAttributes.PATH));
            }
        } else {
            List<PlanRef> params = new ArrayList<>();
            for (FieldSpec spec : c.getFields()) {
                for (ExtendedRef v : node.getFieldValues(spec.name())) params.add(expression(v));
            }
            result = callOf(c, params, ModelRoles.CALL_PARAMETERS);
        }
        if (node.getLabel() != null) {
            label(result, node.getLabel());
        }
        nodes.put(node, result);
        return result;
    }

    private PlanRef call(TreeNode node) {
        List<PlanRef> inst = expressions(node.getFieldValues("instParameter"));
        List<PlanRef> args = expressions(node.getFieldValues("argument"));
        List<PlanRef> modifierParams = expressions(node.getFieldValues("modifierParameter"));
        ExtendedRef operator = node.getOperands().get(0);
        PlanRef target = operator instanceof ElementRef e ? PlanRef.existing(e.id())
                : PlanRef.existing(trees.resolved(Slot.OPERATOR, ((PredefinedNameRef) operator).name()));
        PlanRef call = plan.newElement(ElementKind.EXPR_CALL,
                attribute(ModelRoles.ATTR_MODIFIERS, node.getAttribute(TreeAttributes.MODIFIERS)));
        plan.link(call, ModelRoles.REF_OPERATOR, target);
        for (PlanRef p : inst) plan.attach(p, call, ModelRoles.INST_PARAMETERS);
        for (PlanRef p : args) plan.attach(p, call, ModelRoles.CALL_PARAMETERS);
        for (PlanRef p : modifierParams) plan.attach(p, call, ModelRoles.MODIFIER_PARAMETERS);
        return call;
    }

    private List<PlanRef> expressions(List<ExtendedRef> refs) {
        List<PlanRef> result = new ArrayList<>(refs.size());
        for (ExtendedRef r : refs) result.add(expression(r));
        return result;
    }

    private PlanRef callOf(Construct c, List<PlanRef> params, String role) {
        PlanRef call = plan.newElement(ElementKind.EXPR_CALL, Map.of(ModelRoles.ATTR_PREDEF_OPER, c.getCode()));
        for (PlanRef p : params) plan.attach(p, call, role);
        return call;
    }

    private void label(PlanRef expression, String name) {
        plan.create(ElementKind.LABEL, Map.of(ModelRoles.ATTR_NAME, name), expression, ModelRoles.LABEL);
    }

    // transitions

    public PlanRef transition(ExtendedRef ref) {
        return transitionNode(((TreeRef) ref).node(), false);
    }

    private PlanRef transitionNode(TreeNode node, boolean forked) {
        ExtendedRef trigger = node.getField("trigger");
        PlanRef condition = trigger != null ? expression(trigger) : null;
        ElementKind kind = forked ? ElementKind.FORKED_TRANSITION : ElementKind.MAIN_TRANSITION;
        Map<String, Object> attrs = new HashMap<>();
        attrs.put(ModelRoles.ATTR_PRIORITY, node.getAttribute(TreeAttributes.PRIORITY));
        attrs.put(ModelRoles.ATTR_GEOMETRY, node.getAttribute(TreeAttributes.GEOMETRY));
        PlanRef transition;
        if (node.getConstruct() == Construct.TO_STATE) {
            attrs.put(ModelRoles.ATTR_RESET, node.getAttribute(TreeAttributes.RESET));
            ExtendedRef target = node.getField("target");
            PlanRef state = target instanceof ElementRef e ? PlanRef.existing(e.id())
                    : PlanRef.existing(trees.resolved(Slot.STATE, ((PredefinedNameRef) target).name()));
            transition = plan.newElement(kind, attrs);
            plan.link(transition, ModelRoles.REF_TARGET, state);
        } else {
            List<PlanRef> forks = new ArrayList<>();
            for (ExtendedRef f : node.getFieldValues("fork")) {
                forks.add(transitionNode(((TreeRef) f).node(), true));
            }
            transition = plan.newElement(kind, attrs);
            for (PlanRef f : forks) plan.attach(f, transition, ModelRoles.FORKED);
        }
        if (condition != null) plan.attach(condition, transition, ModelRoles.CONDITION);
        nodes.put(node, transition);
        return transition;
    }

    // control-block branches

    public BranchShape branch(ExtendedRef ref) {
        TreeNode node = ((TreeRef) ref).node();
        if (node.getConstruct() == Construct.IF_ACTION) {
            PlanRef action = plan.newElement(ElementKind.ACTION, Map.of());
            PlanRef ifAction = plan.newElement(ElementKind.IF_ACTION,
                    attribute(ModelRoles.ATTR_DISPLAY, node.getAttribute(TreeAttributes.DISPLAY)));
            plan.attach(action, ifAction, ModelRoles.ACTION);
            nodes.put(node, ifAction);
            return new ActionShape(ifAction, action, (Point) node.getAttribute(TreeAttributes.POSITION),
                    (Size) node.getAttribute(TreeAttributes.SIZE), Boolean.TRUE.equals(node.getAttribute(TreeAttributes.DISPLAY)));
        }
        if (node.getConstruct() != Construct.IF_TREE) {
            throw new IllegalArgumentException(node.describe() + " is not an if branch");
        }
        PlanRef condition = expression(node.getField("condition"));
        BranchShape thenShape = branch(node.getField("then"));
        BranchShape elseShape = branch(node.getField("else"));
        PlanRef ifNode = plan.newElement(ElementKind.IF_NODE, Map.of());
        plan.attach(condition, ifNode, ModelRoles.CONDITION);
        plan.attach(rootOf(thenShape), ifNode, ModelRoles.THEN);
        plan.attach(rootOf(elseShape), ifNode, ModelRoles.ELSE);
        nodes.put(node, ifNode);
        return new DecisionShape(ifNode, thenShape, elseShape, (Point) node.getAttribute(TreeAttributes.POSITION),
                (Integer) node.getAttribute(TreeAttributes.LABEL_WIDTH));
    }

    public WhenShape whenBranch(ExtendedRef ref) {
        TreeNode node = ((TreeRef) ref).node();
        if (node.getConstruct() != Construct.WHEN_BRANCH) {
            throw new IllegalArgumentException(node.describe() + " is not a when branch");
        }
        PlanRef pattern = expression(node.getOperands().get(0));
        PlanRef action = plan.newElement(ElementKind.ACTION, Map.of());
        PlanRef branch = plan.newElement(ElementKind.WHEN_BRANCH,
                attribute(ModelRoles.ATTR_DISPLAY, node.getAttribute(TreeAttributes.DISPLAY)));
        plan.attach(pattern, branch, ModelRoles.PATTERN);
        plan.attach(action, branch, ModelRoles.ACTION);
        nodes.put(node, branch);
        return new WhenShape(branch, action, (Point) node.getAttribute(TreeAttributes.POSITION),
                (Size) node.getAttribute(TreeAttributes.SIZE), Boolean.TRUE.equals(node.getAttribute(TreeAttributes.DISPLAY)),
                (Integer) node.getAttribute(TreeAttributes.LABEL_WIDTH));
    }

    /** Single-entry attribute map that tolerates a null value. */
    private static Map<String, Object> attribute(String key, Object value) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put(key, value);
        return attrs;
    }

    public static PlanRef rootOf(BranchShape shape) {
        if (shape instanceof DecisionShape d) return d.node();
        return ((ActionShape) shape).ifAction();
    }
}
