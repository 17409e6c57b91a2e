package com.flowmodel.tree.node;

import com.flowmodel.tree.ref.Slot;

/**
 * Field of a closed composite schema.
 *
 * @param repeated whether the field may be given several times (ordered)
 */
public record FieldSpec(String name, Slot slot, boolean mandatory, boolean repeated) {

    public static FieldSpec required(String name, Slot slot) {
        return new FieldSpec(name, slot, true, false);
    }

    public static FieldSpec optional(String name, Slot slot) {
        return new FieldSpec(name, slot, false, false);
    }

    public static FieldSpec requiredList(String name, Slot slot) {
        return new FieldSpec(name, slot, true, true);
    }

    public static FieldSpec optionalList(String name, Slot slot) {
        return new FieldSpec(name, slot, false, true);
    }
}
