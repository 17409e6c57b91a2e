package com.flowmodel.tree.node;

import com.flowmodel.tree.ref.Slot;

import java.util.List;

import static com.flowmodel.tree.node.FieldSpec.optional;
import static com.flowmodel.tree.node.FieldSpec.optionalList;
import static com.flowmodel.tree.node.FieldSpec.required;
import static com.flowmodel.tree.node.FieldSpec.requiredList;

/**
 * Every node shape a tree can hold. Operators declare their operand slots (leading slots, then a
 * variadic slot) and arity bounds; composites declare a closed field schema, or an open one where
 * any identifier names a field of {@link #getOpenSlot()}.
 * <p>
 * {@link #getCode()} is recorded on materialized expression calls.
 */
public enum Construct {

    // types
    TYPE_LEAF(TreeDomain.TYPE, NodeType.LEAF, "type", 0, 0, null),
    SIZED(TreeDomain.TYPE, NodeType.OPERATOR, "sized", 1, 1, null, Slot.INT),
    TABLE(TreeDomain.TYPE, NodeType.OPERATOR, "table", 2, -1, Slot.INT, Slot.TYPE),
    STRUCTURE(TreeDomain.TYPE, "structure", Slot.TYPE, List.of()),

    // expressions
    EXPR_LEAF(TreeDomain.EXPRESSION, NodeType.LEAF, "value", 0, 0, null),
    NEG(TreeDomain.EXPRESSION, NodeType.OPERATOR, "-", 1, 1, null, Slot.FLOW),
    POS(TreeDomain.EXPRESSION, NodeType.OPERATOR, "+", 1, 1, null, Slot.FLOW),
    NOT(TreeDomain.EXPRESSION, NodeType.OPERATOR, "not", 1, 1, null, Slot.FLOW),
    TO_INT(TreeDomain.EXPRESSION, NodeType.OPERATOR, "int", 1, 1, null, Slot.FLOW),
    TO_REAL(TreeDomain.EXPRESSION, NodeType.OPERATOR, "real", 1, 1, null, Slot.FLOW),
    LNOT(TreeDomain.EXPRESSION, NodeType.OPERATOR, "lnot", 1, 1, null, Slot.FLOW),
    MINUS(TreeDomain.EXPRESSION, NodeType.OPERATOR, "-", 2, 2, null, Slot.FLOW, Slot.FLOW),
    DIV(TreeDomain.EXPRESSION, NodeType.OPERATOR, "/", 2, 2, null, Slot.FLOW, Slot.FLOW),
    INT_DIV(TreeDomain.EXPRESSION, NodeType.OPERATOR, ":", 2, 2, null, Slot.FLOW, Slot.FLOW),
    MOD(TreeDomain.EXPRESSION, NodeType.OPERATOR, "%", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LT(TreeDomain.EXPRESSION, NodeType.OPERATOR, "<", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LE(TreeDomain.EXPRESSION, NodeType.OPERATOR, "<=", 2, 2, null, Slot.FLOW, Slot.FLOW),
    GT(TreeDomain.EXPRESSION, NodeType.OPERATOR, ">", 2, 2, null, Slot.FLOW, Slot.FLOW),
    GE(TreeDomain.EXPRESSION, NodeType.OPERATOR, ">=", 2, 2, null, Slot.FLOW, Slot.FLOW),
    EQ(TreeDomain.EXPRESSION, NodeType.OPERATOR, "=", 2, 2, null, Slot.FLOW, Slot.FLOW),
    NEQ(TreeDomain.EXPRESSION, NodeType.OPERATOR, "<>", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LAND(TreeDomain.EXPRESSION, NodeType.OPERATOR, "land", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LOR(TreeDomain.EXPRESSION, NodeType.OPERATOR, "lor", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LXOR(TreeDomain.EXPRESSION, NodeType.OPERATOR, "lxor", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LSL(TreeDomain.EXPRESSION, NodeType.OPERATOR, "<<", 2, 2, null, Slot.FLOW, Slot.FLOW),
    LSR(TreeDomain.EXPRESSION, NodeType.OPERATOR, ">>", 2, 2, null, Slot.FLOW, Slot.FLOW),
    AND(TreeDomain.EXPRESSION, NodeType.OPERATOR, "&", 2, -1, Slot.FLOW),
    OR(TreeDomain.EXPRESSION, NodeType.OPERATOR, "|", 2, -1, Slot.FLOW),
    XOR(TreeDomain.EXPRESSION, NodeType.OPERATOR, "^", 2, -1, Slot.FLOW),
    SHARP(TreeDomain.EXPRESSION, NodeType.OPERATOR, "#", 2, -1, Slot.FLOW),
    PLUS(TreeDomain.EXPRESSION, NodeType.OPERATOR, "+", 2, -1, Slot.FLOW),
    MULT(TreeDomain.EXPRESSION, NodeType.OPERATOR, "*", 2, -1, Slot.FLOW),
    MAKE(TreeDomain.EXPRESSION, NodeType.OPERATOR, "make", 2, -1, Slot.FLOW, Slot.TYPE),
    FLATTEN(TreeDomain.EXPRESSION, NodeType.OPERATOR, "flatten", 2, 2, null, Slot.TYPE, Slot.FLOW),
    NUMERIC_CAST(TreeDomain.EXPRESSION, NodeType.OPERATOR, "cast", 2, 2, null, Slot.FLOW, Slot.TYPE),
    SCALAR_TO_VECTOR(TreeDomain.EXPRESSION, NodeType.OPERATOR, "scalarToVector", 2, 2, null, Slot.FLOW, Slot.INT),
    DATA_ARRAY(TreeDomain.EXPRESSION, NodeType.OPERATOR, "dataArray", 1, -1, Slot.FLOW),
    PRJ(TreeDomain.EXPRESSION, NodeType.OPERATOR, "prj", 1, 1, null, Slot.FLOW),
    PRJ_DYN(TreeDomain.EXPRESSION, NodeType.OPERATOR, "prjDyn", 3, -1, Slot.FLOW),
    CHANGE_ITH(TreeDomain.EXPRESSION, NodeType.OPERATOR, "changeIth", 2, 2, null, Slot.FLOW, Slot.FLOW),
    TIMES(TreeDomain.EXPRESSION, NodeType.OPERATOR, "times", 2, 2, null, Slot.INT, Slot.FLOW),
    SLICE(TreeDomain.EXPRESSION, NodeType.OPERATOR, "slice", 3, 3, null, Slot.FLOW, Slot.INT, Slot.INT),
    CONCAT(TreeDomain.EXPRESSION, NodeType.OPERATOR, "concat", 2, -1, Slot.FLOW),
    REVERSE(TreeDomain.EXPRESSION, NodeType.OPERATOR, "reverse", 1, 1, null, Slot.FLOW),
    TRANSPOSE(TreeDomain.EXPRESSION, NodeType.OPERATOR, "transpose", 3, 3, null, Slot.FLOW, Slot.INT, Slot.INT),
    PRE(TreeDomain.EXPRESSION, NodeType.OPERATOR, "pre", 1, -1, Slot.FLOW),
    IF(TreeDomain.EXPRESSION, "if", null, List.of(),
            required("condition", Slot.BOOL), requiredList("then", Slot.FLOW), requiredList("else", Slot.FLOW)),
    CASE(TreeDomain.EXPRESSION, "case", null, List.of(),
            required("selector", Slot.FLOW), requiredList("pattern", Slot.PATTERN),
            requiredList("value", Slot.FLOW), optional("default", Slot.FLOW)),
    INIT(TreeDomain.EXPRESSION, "init", null, List.of(),
            requiredList("flow", Slot.FLOW), requiredList("init", Slot.FLOW)),
    FBY(TreeDomain.EXPRESSION, "fby", null, List.of(),
            requiredList("flow", Slot.FLOW), required("delay", Slot.INT), requiredList("init", Slot.FLOW)),
    DATA_STRUCT(TreeDomain.EXPRESSION, "dataStruct", Slot.FLOW, List.of()),
    STRUCT_VALUE(TreeDomain.EXPRESSION, "structValue", Slot.FLOW, List.of(Slot.TYPE)),
    CALL(TreeDomain.EXPRESSION, "call", null, List.of(Slot.OPERATOR),
            optionalList("instParameter", Slot.FLOW), optionalList("argument", Slot.FLOW),
            optionalList("modifierParameter", Slot.FLOW)),

    // transitions
    TO_STATE(TreeDomain.TRANSITION, "toState", null, List.of(),
            optional("trigger", Slot.BOOL), required("target", Slot.STATE)),
    FORK(TreeDomain.TRANSITION, "fork", null, List.of(),
            optional("trigger", Slot.BOOL), requiredList("fork", Slot.TRANSITION)),

    // control-block branches
    IF_TREE(TreeDomain.BRANCH, "ifTree", null, List.of(),
            required("condition", Slot.BOOL), required("then", Slot.BRANCH), required("else", Slot.BRANCH)),
    IF_ACTION(TreeDomain.BRANCH, NodeType.OPERATOR, "ifAction", 0, 0, null),
    WHEN_BRANCH(TreeDomain.BRANCH, NodeType.OPERATOR, "whenBranch", 1, 1, null, Slot.PATTERN);

    private final TreeDomain domain;
    private final NodeType nodeType;
    private final String code;
    private final int minOperands;
    private final int maxOperands;
    private final List<Slot> leading;
    private final Slot variadic;
    private final List<FieldSpec> fields;
    private final Slot openSlot;

    Construct(TreeDomain domain, NodeType nodeType, String code, int min, int max, Slot variadic, Slot... leading) {
        this.domain = domain;
        this.nodeType = nodeType;
        this.code = code;
        this.minOperands = min;
        this.maxOperands = max;
        this.leading = List.of(leading);
        this.variadic = variadic;
        this.fields = List.of();
        this.openSlot = null;
    }

    Construct(TreeDomain domain, String code, Slot openSlot, List<Slot> leading, FieldSpec... fields) {
        this.domain = domain;
        this.nodeType = NodeType.COMPOSITE;
        this.code = code;
        this.minOperands = leading.size();
        this.maxOperands = leading.size();
        this.leading = leading;
        this.variadic = null;
        this.fields = List.of(fields);
        this.openSlot = openSlot;
    }

    public TreeDomain getDomain() {
        return domain;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public String getCode() {
        return code;
    }

    /** Slot of the operand at {@code index}: a leading slot, else the variadic slot. */
    public Slot slotAt(int index) {
        if (index < leading.size()) return leading.get(index);
        return variadic != null ? variadic : leading.get(leading.size() - 1);
    }

    public boolean acceptsArity(int count) {
        return count >= minOperands && (maxOperands < 0 || count <= maxOperands);
    }

    public String describeArity() {
        if (maxOperands < 0) return "at least " + minOperands;
        if (minOperands == maxOperands) return "exactly " + minOperands;
        return minOperands + " to " + maxOperands;
    }

    /** True if any identifier may name a field. */
    public boolean isOpen() {
        return openSlot != null;
    }

    public Slot getOpenSlot() {
        return openSlot;
    }

    public List<FieldSpec> getFields() {
        return fields;
    }

    public FieldSpec fieldSpec(String name) {
        for (FieldSpec f : fields) {
            if (f.name().equals(name)) return f;
        }
        return null;
    }
}
