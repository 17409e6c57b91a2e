package com.flowmodel.tree.node;

/** Attribute keys carried by tree nodes next to their children. */
public final class TreeAttributes {

    public static final String LABEL = TreeNode.ATTR_LABEL;
    /** Projection path of prj and changeIth: field labels and decimal indices. */
    public static final String PATH = "path";
    /** Higher-order modifier codes of a call, outermost first. */
    public static final String MODIFIERS = "modifiers";
    public static final String SIGNED = "signed";
    public static final String RESET = "reset";
    public static final String PRIORITY = "priority";
    public static final String GEOMETRY = "geometry";
    public static final String POSITION = "position";
    public static final String SIZE = "size";
    public static final String DISPLAY = "display";
    public static final String LABEL_WIDTH = "labelWidth";

    private TreeAttributes() {
    }
}
