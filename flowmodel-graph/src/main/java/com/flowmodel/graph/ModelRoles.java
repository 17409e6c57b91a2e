package com.flowmodel.graph;

/**
 * Containment roles, reference names and attribute keys shared by every component that reads or
 * writes the model graph.
 */
public final class ModelRoles {

    // containment roles
    public static final String STORAGE_UNITS = "storageUnits";
    public static final String PACKAGES = "packages";
    public static final String TYPES = "types";
    public static final String CONSTRAINTS = "constraints";
    public static final String CONSTANTS = "constants";
    public static final String SENSORS = "sensors";
    public static final String OPERATORS = "operators";
    public static final String DEFINITION = "definition";
    public static final String BUILD_TYPE = "buildType";
    public static final String SIZE = "size";
    public static final String ELEMENTS = "elements";
    public static final String VALUES = "values";
    public static final String VALUE = "value";
    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String HIDDENS = "hiddens";
    public static final String LOCALS = "locals";
    public static final String INTERNALS = "internals";
    public static final String TYPEVARS = "typevars";
    public static final String SIGNALS = "signals";
    public static final String DIAGRAMS = "diagrams";
    public static final String FLOWS = "flows";
    public static final String RIGHT = "right";
    public static final String EXPRESSION = "expression";
    public static final String DEFAULT = "default";
    public static final String LAST = "last";
    public static final String CALL_PARAMETERS = "parameters";
    public static final String INST_PARAMETERS = "instParameters";
    public static final String MODIFIER_PARAMETERS = "modifierParameters";
    public static final String LABEL = "label";
    public static final String STATES = "states";
    public static final String OUTGOINGS = "outgoings";
    public static final String FORKED = "forkedTransitions";
    public static final String CONDITION = "condition";
    public static final String IF_NODE = "ifNode";
    public static final String THEN = "then";
    public static final String ELSE = "else";
    public static final String WHEN_BRANCHES = "whenBranches";
    public static final String PATTERN = "pattern";
    public static final String ACTION = "action";

    // references
    public static final String REF_TYPE = "type";
    public static final String REF_REFERENCE = "reference";
    public static final String REF_OPERATOR = "operator";
    public static final String REF_TARGET = "target";
    public static final String REF_LEFTS = "lefts";
    public static final String REF_STORAGE_UNIT = "storageUnit";
    public static final String REF_LIBRARIES = "libraries";

    // attributes
    public static final String ATTR_NAME = "name";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_PREDEFINED = "predefined";
    public static final String ATTR_IMPORTED = "imported";
    public static final String ATTR_DEFAULT_FILE = "defaultFile";
    public static final String ATTR_MODEL_FILE = "modelFile";
    public static final String ATTR_PATH = "path";
    public static final String ATTR_KIND = "kind";
    public static final String ATTR_PREDEF_OPER = "predefOpr";
    public static final String ATTR_INITIAL = "initial";
    public static final String ATTR_FINAL = "final";
    public static final String ATTR_PRIORITY = "priority";
    public static final String ATTR_STATE = "state";
    public static final String ATTR_PROBE = "probe";
    public static final String ATTR_SIGNED = "signed";
    public static final String ATTR_RESET = "reset";
    public static final String ATTR_GEOMETRY = "geometry";
    public static final String ATTR_MODIFIERS = "modifiers";
    public static final String ATTR_DISPLAY = "display";
    public static final String ATTR_LABEL_WIDTH = "labelWidth";
    public static final String ATTR_TERMINATOR = "terminator";

    private ModelRoles() {
    }
}
