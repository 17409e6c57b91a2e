package com.flowmodel.tree.validate;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.NamedElement;
import com.flowmodel.session.SessionRegistry;
import com.flowmodel.session.UnknownNameException;
import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.FieldSpec;
import com.flowmodel.tree.node.HigherOrder;
import com.flowmodel.tree.node.NodeType;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeDomain;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.node.TreeState;
import com.flowmodel.tree.ref.ElementRef;
import com.flowmodel.tree.ref.ExtendedRef;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.ref.LiteralRef;
import com.flowmodel.tree.ref.PredefinedNameRef;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.ref.TreeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only pre-order check of trees against their materialization context. The first violation
 * is raised as a {@link ValidationException} naming the node and the rule; on success every node
 * becomes VALIDATED and the name resolutions are returned for the materializer.
 * <p>
 * All inputs of one call share the single-owner check: a node instance reachable twice, inside
 * one tree or across two, is rejected, and so is a node still held by an earlier validation.
 */
public final class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private final GraphStore store;
    private final SessionRegistry session;

    public StructuralValidator(GraphStore store, SessionRegistry session) {
        this.store = store;
        this.session = session;
    }

    public ValidatedTrees validate(ElementId anchor, TreeInput input) {
        return validate(anchor, List.of(input));
    }

    public ValidatedTrees validate(ElementId anchor, List<TreeInput> inputs) {
        checkContext(anchor, inputs);
        Walk walk = new Walk();
        for (int i = 0; i < inputs.size(); i++) {
            TreeInput input = inputs.get(i);
            walk.ref(input.ref(), input.slot(), inputs.size() == 1 ? "$" : "$[" + i + "]");
        }
        for (TreeNode node : walk.nodes) {
            node.markValidated();
        }
        log.debug("Validated {} input(s), {} node(s) against {}", inputs.size(), walk.nodes.size(), anchor);
        return new ValidatedTrees(anchor, inputs, walk.nodes, walk.names);
    }

    private void checkContext(ElementId anchor, List<TreeInput> inputs) {
        if (anchor == null || !store.contains(anchor)) {
            throw new ValidationException("context", ValidationRule.CONTEXT, "target container " + anchor + " does not exist");
        }
        ElementKind kind = store.get(anchor).getKind();
        for (TreeInput input : inputs) {
            if (!(input.ref() instanceof TreeRef tree)) continue;
            TreeDomain domain = tree.node().getDomain();
            if (domain == TreeDomain.TRANSITION && kind != ElementKind.STATE) {
                throw new ValidationException("context", ValidationRule.CONTEXT,
                        "a transition must start from a state, not " + kind);
            }
            if (domain == TreeDomain.BRANCH && !kind.isDataDef()) {
                throw new ValidationException("context", ValidationRule.CONTEXT,
                        "a control block belongs to an operator, state or action, not " + kind);
            }
        }
    }

    /** State of one validation call. */
    private final class Walk {

        private final Set<TreeNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<TreeNode> nodes = new ArrayList<>();
        private final Map<String, ElementId> names = new HashMap<>();

        void ref(ExtendedRef ref, Slot slot, String path) {
            if (ref instanceof TreeRef tree) {
                node(tree.node(), slot, path);
            } else if (ref instanceof LiteralRef lit) {
                if (!slot.acceptsLiteral(lit.literal())) {
                    throw new ValidationException(path + " " + ref.describe(), ValidationRule.LITERAL_KIND,
                            "literal " + lit.literal() + " is not accepted in a " + slot + " position");
                }
            } else if (ref instanceof ElementRef element) {
                element(element.id(), slot, path + " " + ref.describe());
            } else if (ref instanceof PredefinedNameRef name) {
                name(name.name(), slot, path + " " + ref.describe());
            } else {
                throw new ValidationException(path, ValidationRule.SHAPE, "unsupported reference " + ref);
            }
        }

        private void node(TreeNode node, Slot slot, String path) {
            String where = path + " " + node.describe();
            if (node.isConsumed()) {
                throw new ValidationException(where, ValidationRule.NOT_CONSUMED,
                        "tree was already materialized or failed (" + node.getState() + ")");
            }
            if (node.getState() == TreeState.VALIDATED) {
                throw new ValidationException(where, ValidationRule.SINGLE_OWNER,
                        "the tree instance is already claimed by another validation");
            }
            if (!seen.add(node)) {
                throw new ValidationException(where, ValidationRule.SINGLE_OWNER,
                        "the same tree instance is used more than once");
            }
            if (!slot.acceptsDomain(node.getDomain())) {
                throw new ValidationException(where, ValidationRule.DOMAIN,
                        node.getDomain() + " tree is not accepted in a " + slot + " position");
            }
            nodes.add(node);
            Construct c = node.getConstruct();
            if (node.getNodeType() == NodeType.LEAF) {
                ref(node.getValue(), slot, path + ".value");
                return;
            }
            if (!c.acceptsArity(node.getOperands().size())) {
                throw new ValidationException(where, ValidationRule.ARITY,
                        c + " expects " + c.describeArity() + " operands, got " + node.getOperands().size());
            }
            if (node.getNodeType() == NodeType.COMPOSITE) {
                checkFields(node, where);
            }
            List<ExtendedRef> operands = node.getOperands();
            for (int i = 0; i < operands.size(); i++) {
                ref(operands.get(i), c.slotAt(i), path + "[" + i + "]");
            }
            walkFields(node, path);
        }

        private void checkFields(TreeNode node, String where) {
            Construct c = node.getConstruct();
            List<Field> fields = node.getFields();
            if (c.isOpen()) {
                if (fields.isEmpty()) {
                    throw new ValidationException(where, ValidationRule.COMPOSITE_NOT_EMPTY, c + " needs at least one field");
                }
                if (c == Construct.STRUCT_VALUE) {
                    checkAgainstStructure(node, where);
                }
                Set<String> names = new HashSet<>();
                for (Field f : fields) {
                    if (!names.add(f.name())) {
                        throw new ValidationException(where, ValidationRule.DUPLICATE_FIELD, "field '" + f.name() + "' given twice");
                    }
                    if (!ExtendedRefResolver.isIdentifier(f.name())) {
                        throw new ValidationException(where, ValidationRule.UNKNOWN_FIELD, "'" + f.name() + "' is not a field name");
                    }
                }
                return;
            }
            for (FieldSpec spec : c.getFields()) {
                if (spec.mandatory() && node.getField(spec.name()) == null) {
                    throw new ValidationException(where, ValidationRule.MANDATORY_FIELD, "missing field '" + spec.name() + "'");
                }
            }
            Set<String> given = new HashSet<>();
            for (Field f : fields) {
                FieldSpec spec = c.fieldSpec(f.name());
                if (spec != null && !spec.repeated() && !given.add(f.name())) {
                    throw new ValidationException(where, ValidationRule.DUPLICATE_FIELD, "field '" + f.name() + "' given twice");
                }
            }
            for (Field f : fields) {
                if (c.fieldSpec(f.name()) == null) {
                    throw new ValidationException(where, ValidationRule.UNKNOWN_FIELD, c + " has no field '" + f.name() + "'");
                }
            }
            switch (c) {
                case IF -> sameLength(node, where, "then", "else");
                case CASE -> sameLength(node, where, "pattern", "value");
                case INIT, FBY -> sameLength(node, where, "flow", "init");
                case CALL -> checkCall(node, where);
                default -> {
                }
            }
        }

        private void sameLength(TreeNode node, String where, String a, String b) {
            int na = node.getFieldValues(a).size();
            int nb = node.getFieldValues(b).size();
            if (na != nb) {
                throw new ValidationException(where, ValidationRule.SHAPE,
                        a + " and " + b + " must have the same length (" + na + " vs " + nb + ")");
            }
        }

        private void checkCall(TreeNode node, String where) {
            int expected = 0;
            for (HigherOrder h : modifiers(node, where)) {
                expected += h.getParameters().size();
            }
            int given = node.getFieldValues("modifierParameter").size();
            if (given != expected) {
                throw new ValidationException(where, ValidationRule.ARITY,
                        "modifiers expect " + expected + " parameters, got " + given);
            }
            calledOperator(node.getOperands().get(0)).ifPresent(op -> {
                int inputs = store.children(op, ModelRoles.INPUTS).size();
                int arguments = node.getFieldValues("argument").size();
                if (inputs != arguments) {
                    throw new ValidationException(where, ValidationRule.ARITY,
                            "operator " + store.get(op).getName() + " has " + inputs + " inputs, got " + arguments + " arguments");
                }
            });
        }

        private Optional<ElementId> calledOperator(ExtendedRef ref) {
            if (ref instanceof ElementRef e && store.contains(e.id())
                    && store.get(e.id()).getKind() == ElementKind.OPERATOR) {
                return Optional.of(e.id());
            }
            if (ref instanceof PredefinedNameRef n) {
                return session.findElement(n.name())
                        .filter(named -> named.kind() == ElementKind.OPERATOR)
                        .map(NamedElement::id);
            }
            return Optional.empty();
        }

        private List<HigherOrder> modifiers(TreeNode node, String where) {
            Object codes = node.getAttribute(TreeAttributes.MODIFIERS);
            List<HigherOrder> result = new ArrayList<>();
            if (codes == null) return result;
            if (!(codes instanceof List<?> list)) {
                throw new ValidationException(where, ValidationRule.SHAPE, "modifiers must be a list of codes");
            }
            for (Object code : list) {
                try {
                    result.add(HigherOrder.fromCode(String.valueOf(code)));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException(where, ValidationRule.SHAPE, e.getMessage(), e);
                }
            }
            return result;
        }

        private void walkFields(TreeNode node, String path) {
            Construct c = node.getConstruct();
            List<Slot> modifierSlots = new ArrayList<>();
            if (c == Construct.CALL) {
                for (HigherOrder h : modifiers(node, path)) modifierSlots.addAll(h.getParameters());
            }
            Map<String, Integer> counters = new HashMap<>();
            for (Field f : node.getFields()) {
                int index = counters.merge(f.name(), 1, Integer::sum) - 1;
                Slot slot;
                if (c.isOpen()) {
                    slot = c.getOpenSlot();
                } else if (c == Construct.CALL && f.name().equals("modifierParameter")) {
                    slot = modifierSlots.get(index);
                } else {
                    slot = c.fieldSpec(f.name()).slot();
                }
                FieldSpec spec = c.fieldSpec(f.name());
                boolean indexed = spec != null && spec.repeated();
                ref(f.value(), slot, path + "." + f.name() + (indexed ? "[" + index + "]" : ""));
            }
        }

        private void checkAgainstStructure(TreeNode node, String where) {
            List<String> expected = structureFields(node.getOperands().get(0), 0);
            if (expected == null) {
                throw new ValidationException(where, ValidationRule.SHAPE,
                        node.getOperands().get(0).describe() + " is not a structure type");
            }
            Set<String> given = new LinkedHashSet<>();
            for (Field f : node.getFields()) given.add(f.name());
            for (String name : expected) {
                if (!given.contains(name)) {
                    throw new ValidationException(where, ValidationRule.MANDATORY_FIELD, "missing field '" + name + "'");
                }
            }
            Set<String> seenNames = new HashSet<>();
            for (Field f : node.getFields()) {
                if (!seenNames.add(f.name())) {
                    throw new ValidationException(where, ValidationRule.DUPLICATE_FIELD, "field '" + f.name() + "' given twice");
                }
                if (!expected.contains(f.name())) {
                    throw new ValidationException(where, ValidationRule.UNKNOWN_FIELD, "structure has no field '" + f.name() + "'");
                }
            }
        }

        /** Field names of the structure a type reference denotes, or null when it is no structure. */
        private List<String> structureFields(ExtendedRef type, int depth) {
            if (depth > 16) return null;
            if (type instanceof TreeRef tree) {
                TreeNode n = tree.node();
                if (n.getConstruct() == Construct.STRUCTURE) {
                    List<String> names = new ArrayList<>();
                    for (Field f : n.getFields()) names.add(f.name());
                    return names;
                }
                return n.getConstruct() == Construct.TYPE_LEAF ? structureFields(n.getValue(), depth + 1) : null;
            }
            ElementId id = null;
            if (type instanceof ElementRef e) {
                id = e.id();
            } else if (type instanceof PredefinedNameRef n) {
                id = session.findType(n.name()).orElse(null);
            }
            return id == null || !store.contains(id) ? null : elementStructureFields(store.get(id), depth);
        }

        private List<String> elementStructureFields(GraphElement type, int depth) {
            if (type.getKind() == ElementKind.STRUCTURE) {
                List<String> names = new ArrayList<>();
                for (GraphElement f : store.children(type.getId(), ModelRoles.ELEMENTS)) names.add(f.getName());
                return names;
            }
            ElementId target = type.getReference(ModelRoles.REF_TYPE);
            if (type.getKind() == ElementKind.NAMED_TYPE && target != null && store.contains(target) && depth < 16) {
                return elementStructureFields(store.get(target), depth + 1);
            }
            return null;
        }

        private void element(ElementId id, Slot slot, String where) {
            Optional<GraphElement> element = store.find(id);
            if (element.isEmpty()) {
                throw new ValidationException(where, ValidationRule.ELEMENT_RESOLVES, "element " + id + " does not exist");
            }
            ElementKind kind = element.get().getKind();
            if (!slot.acceptsElement(kind)) {
                throw new ValidationException(where, ValidationRule.ELEMENT_KIND,
                        kind + " element is not accepted in a " + slot + " position");
            }
        }

        private void name(String name, Slot slot, String where) {
            ElementId id;
            ElementKind kind;
            try {
                if (slot == Slot.TYPE) {
                    id = session.lookupType(name);
                    kind = store.get(id).getKind();
                } else {
                    NamedElement named = session.findElement(name)
                            .orElseThrow(() -> new UnknownNameException(name, "name"));
                    id = named.id();
                    kind = named.kind();
                }
            } catch (UnknownNameException e) {
                throw new ValidationException(where, ValidationRule.NAME_RESOLVES, e.getMessage(), e);
            }
            if (!slot.acceptsElement(kind)) {
                throw new ValidationException(where, ValidationRule.ELEMENT_KIND,
                        "'" + name + "' is a " + kind + ", not accepted in a " + slot + " position");
            }
            names.put(ValidatedTrees.key(slot, name), id);
        }
    }
}
