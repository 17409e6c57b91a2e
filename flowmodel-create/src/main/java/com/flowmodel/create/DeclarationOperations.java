package com.flowmodel.create;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.materializer.CreationPlan;
import com.flowmodel.materializer.MaterializationResult;
import com.flowmodel.materializer.PlanBuilder;
import com.flowmodel.materializer.PlanRef;
import com.flowmodel.materializer.ownership.OwnerDecision;
import com.flowmodel.tree.build.NamedValue;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.TreeInput;
import com.flowmodel.tree.validate.ValidatedTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level declarations and operator interfaces. A declaration made directly in the model is
 * owned by the storage unit the ownership resolver chooses; packages and operators inside a
 * package get their own unit only when a path is given.
 */
final class DeclarationOperations {

    private static final Logger log = LoggerFactory.getLogger(DeclarationOperations.class);

    private final EditContext ctx;

    DeclarationOperations(EditContext ctx) {
        this.ctx = ctx;
    }

    ElementId createPackage(ElementId owner, String name, String path) {
        EditContext.requireName(name, "package");
        OwnerDecision decision = owner(owner, name, path, true);
        ElementId pkg = declare(owner, name, decision, List.of(), (plan, expander) ->
                plan.create(ElementKind.PACKAGE, Map.of(ModelRoles.ATTR_NAME, name), PlanRef.existing(owner), ModelRoles.PACKAGES));
        log.debug("Created package {} as {}", name, pkg);
        return pkg;
    }

    ElementId createNamedType(ElementId owner, String name, Object definition, String path) {
        EditContext.requireName(name, "type");
        OwnerDecision decision = owner(owner, name, path, false);
        List<TreeInput> inputs = List.of(TreeInput.of(definition, Slot.TYPE));
        return declare(owner, name, decision, inputs, (plan, expander) -> {
            PlanRef type = expander.type(inputs.get(0).ref());
            PlanRef named = plan.create(ElementKind.NAMED_TYPE, Map.of(ModelRoles.ATTR_NAME, name),
                    PlanRef.existing(owner), ModelRoles.TYPES);
            expander.bindType(named, type, ModelRoles.DEFINITION);
            return named;
        });
    }

    ElementId createImportedType(ElementId owner, String name, String path) {
        EditContext.requireName(name, "type");
        OwnerDecision decision = owner(owner, name, path, false);
        return declare(owner, name, decision, List.of(), (plan, expander) ->
                plan.create(ElementKind.NAMED_TYPE, Map.of(ModelRoles.ATTR_NAME, name, ModelRoles.ATTR_IMPORTED, true),
                        PlanRef.existing(owner), ModelRoles.TYPES));
    }

    ElementId createEnumeration(ElementId owner, String name, List<String> values, String path) {
        EditContext.requireName(name, "type");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("enumeration " + name + " needs at least one value");
        }
        values.forEach(v -> EditContext.requireName(v, "enumeration value"));
        OwnerDecision decision = owner(owner, name, path, false);
        ElementId type = declare(owner, name, decision, List.of(), (plan, expander) -> {
            PlanRef enumeration = plan.newElement(ElementKind.ENUMERATION, Map.of());
            planValues(plan, enumeration, values);
            PlanRef named = plan.create(ElementKind.NAMED_TYPE, Map.of(ModelRoles.ATTR_NAME, name),
                    PlanRef.existing(owner), ModelRoles.TYPES);
            expander.bindType(named, enumeration, ModelRoles.DEFINITION);
            return named;
        });
        recordValues(owner, type);
        return type;
    }

    /** Appends values to the enumeration defined by {@code type}. */
    List<ElementId> addEnumerationValues(ElementId type, List<String> values) {
        GraphElement named = ctx.require(type, "type", ElementKind.NAMED_TYPE);
        ElementId enumeration = named.getReference(ModelRoles.REF_TYPE);
        if (enumeration == null || ctx.store().get(enumeration).getKind() != ElementKind.ENUMERATION) {
            throw new IllegalArgumentException(named.getName() + " is not an enumeration");
        }
        values.forEach(v -> EditContext.requireName(v, "enumeration value"));
        MaterializationResult result = ctx.materialize(ctx.validate(type, List.of()), (plan, expander) -> {
            List<PlanRef> created = planValues(plan, PlanRef.existing(enumeration), values);
            for (int i = 0; i < created.size(); i++) plan.tag("value:" + i, created.get(i));
            return PlanRef.existing(enumeration);
        });
        List<ElementId> ids = result.taggedWithPrefix("value:");
        for (ElementId id : ids) {
            ctx.record(named.getContainer(), ctx.store().get(id).getName(), id);
        }
        return ids;
    }

    ElementId createConstant(ElementId owner, String name, Object type, Object value, String path) {
        EditContext.requireName(name, "constant");
        OwnerDecision decision = owner(owner, name, path, false);
        List<TreeInput> inputs = List.of(TreeInput.of(type, Slot.TYPE), TreeInput.of(value, Slot.FLOW));
        return declare(owner, name, decision, inputs, (plan, expander) -> {
            PlanRef typeRef = expander.type(inputs.get(0).ref());
            PlanRef valueRef = expander.expression(inputs.get(1).ref());
            PlanRef constant = plan.create(ElementKind.CONSTANT, Map.of(ModelRoles.ATTR_NAME, name),
                    PlanRef.existing(owner), ModelRoles.CONSTANTS);
            expander.bindType(constant, typeRef, ModelRoles.BUILD_TYPE);
            plan.attach(valueRef, constant, ModelRoles.VALUE);
            return constant;
        });
    }

    ElementId createImportedConstant(ElementId owner, String name, Object type, String path) {
        return typedDeclaration(owner, name, type, path, ElementKind.CONSTANT, ModelRoles.CONSTANTS, true);
    }

    ElementId createSensor(ElementId owner, String name, Object type, String path) {
        return typedDeclaration(owner, name, type, path, ElementKind.SENSOR, ModelRoles.SENSORS, false);
    }

    /** Creates an operator; graphical and textual operators get an initial diagram named after them. */
    ElementId createOperator(ElementId owner, String name, OperatorKind kind, boolean state, String path) {
        EditContext.requireName(name, "operator");
        OwnerDecision decision = owner(owner, name, path, true);
        return declare(owner, name, decision, List.of(), (plan, expander) -> {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put(ModelRoles.ATTR_NAME, name);
            attrs.put(ModelRoles.ATTR_STATE, state);
            attrs.put(ModelRoles.ATTR_IMPORTED, kind == OperatorKind.IMPORTED);
            PlanRef operator = plan.create(ElementKind.OPERATOR, attrs, PlanRef.existing(owner), ModelRoles.OPERATORS);
            if (kind != OperatorKind.IMPORTED) {
                ElementKind diagram = kind == OperatorKind.GRAPHICAL ? ElementKind.NET_DIAGRAM : ElementKind.TEXT_DIAGRAM;
                plan.create(diagram, Map.of(ModelRoles.ATTR_NAME, name), operator, ModelRoles.DIAGRAMS);
            }
            return operator;
        });
    }

    List<ElementId> addOperatorInputs(ElementId operator, List<NamedValue> ios) {
        return addInterface(operator, ModelRoles.INPUTS, ios);
    }

    List<ElementId> addOperatorOutputs(ElementId operator, List<NamedValue> ios) {
        return addInterface(operator, ModelRoles.OUTPUTS, ios);
    }

    List<ElementId> addOperatorHidden(ElementId operator, List<NamedValue> ios) {
        return addInterface(operator, ModelRoles.HIDDENS, ios);
    }

    /**
     * Adds interface variables. A type spelled {@code 'T} is a type variable of the operator,
     * shared by every variable using the same spelling.
     */
    private List<ElementId> addInterface(ElementId operator, String role, List<NamedValue> ios) {
        ctx.require(operator, "operator", ElementKind.OPERATOR);
        List<TreeInput> perVariable = new ArrayList<>();
        List<TreeInput> inputs = new ArrayList<>();
        for (NamedValue io : ios) {
            EditContext.requireName(io.name(), "interface variable");
            TreeInput input = isTypeVariable(io.value()) ? null : TreeInput.of(io.value(), Slot.TYPE);
            perVariable.add(input);
            if (input != null) inputs.add(input);
        }
        ValidatedTrees trees = ctx.validate(operator, inputs);
        MaterializationResult result = ctx.materialize(trees, (plan, expander) -> {
            PlanRef owner = PlanRef.existing(operator);
            Map<String, PlanRef> typeVariables = new HashMap<>();
            for (int i = 0; i < ios.size(); i++) {
                NamedValue io = ios.get(i);
                TreeInput input = perVariable.get(i);
                PlanRef type = input != null ? expander.type(input.ref())
                        : typeVariable(plan, operator, (String) io.value(), typeVariables);
                PlanRef variable = plan.create(ElementKind.LOCAL_VARIABLE, Map.of(ModelRoles.ATTR_NAME, io.name()), owner, role);
                if (input != null) {
                    expander.bindType(variable, type, ModelRoles.BUILD_TYPE);
                } else {
                    plan.link(variable, ModelRoles.REF_TYPE, type);
                }
                plan.tag("io:" + i, variable);
            }
            return owner;
        });
        log.debug("Added {} {} to operator {}", ios.size(), role, operator);
        return result.taggedWithPrefix("io:");
    }

    private static boolean isTypeVariable(Object type) {
        return type instanceof String s && s.startsWith("'");
    }

    private PlanRef typeVariable(CreationPlan plan, ElementId operator, String name, Map<String, PlanRef> planned) {
        for (GraphElement existing : ctx.store().children(operator, ModelRoles.TYPEVARS)) {
            if (name.equals(existing.getName())) return PlanRef.existing(existing.getId());
        }
        return planned.computeIfAbsent(name, n -> plan.create(ElementKind.TYPE_VARIABLE,
                Map.of(ModelRoles.ATTR_NAME, n), PlanRef.existing(operator), ModelRoles.TYPEVARS));
    }

    private ElementId typedDeclaration(ElementId owner, String name, Object type, String path,
                                       ElementKind kind, String role, boolean imported) {
        EditContext.requireName(name, kind.name().toLowerCase());
        OwnerDecision decision = owner(owner, name, path, false);
        List<TreeInput> inputs = List.of(TreeInput.of(type, Slot.TYPE));
        return declare(owner, name, decision, inputs, (plan, expander) -> {
            PlanRef typeRef = expander.type(inputs.get(0).ref());
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put(ModelRoles.ATTR_NAME, name);
            if (imported) attrs.put(ModelRoles.ATTR_IMPORTED, true);
            PlanRef element = plan.create(kind, attrs, PlanRef.existing(owner), role);
            expander.bindType(element, typeRef, ModelRoles.BUILD_TYPE);
            return element;
        });
    }

    private List<PlanRef> planValues(CreationPlan plan, PlanRef enumeration, List<String> values) {
        List<PlanRef> created = new ArrayList<>(values.size());
        for (String value : values) {
            created.add(plan.create(ElementKind.ENUM_VALUE, Map.of(ModelRoles.ATTR_NAME, value), enumeration, ModelRoles.VALUES));
        }
        return created;
    }

    private void recordValues(ElementId owner, ElementId type) {
        ElementId enumeration = ctx.store().get(type).getReference(ModelRoles.REF_TYPE);
        for (GraphElement value : ctx.store().children(enumeration, ModelRoles.VALUES)) {
            ctx.record(owner, value.getName(), value.getId());
        }
    }

    /** Storage unit decision, or null when the declaration lives in its package's unit. */
    private OwnerDecision owner(ElementId owner, String name, String path, boolean storageElement) {
        GraphElement container = ctx.require(owner, "owner", ElementKind.MODEL, ElementKind.PACKAGE);
        boolean explicit = path != null && !path.isBlank();
        if (container.getKind() == ElementKind.MODEL || (storageElement && explicit)) {
            return ctx.ownership().resolve(owner, name, path);
        }
        return null;
    }

    /** Validates, plans the declaration with its storage unit, commits and records its name. */
    private ElementId declare(ElementId owner, String name, OwnerDecision decision, List<TreeInput> inputs,
                              PlanBuilder body) {
        ValidatedTrees trees = ctx.validate(owner, inputs);
        MaterializationResult result = ctx.materialize(trees, (plan, expander) -> {
            PlanRef element = body.build(plan, expander);
            if (decision != null) {
                plan.link(element, ModelRoles.REF_STORAGE_UNIT, decision.apply(plan));
            }
            return element;
        });
        ElementId id = result.root();
        ctx.record(owner, name, id);
        log.info("Declared {} {} in {}", ctx.store().get(id).getKind(), ctx.pathOf(owner, name), owner);
        return id;
    }
}
