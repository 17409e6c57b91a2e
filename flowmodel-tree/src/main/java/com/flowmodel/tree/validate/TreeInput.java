package com.flowmodel.tree.validate;

import com.flowmodel.tree.ref.ExtendedRef;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.ref.Slot;

import java.util.Objects;

/** One value handed to the validator together with the slot it will fill. */
public record TreeInput(ExtendedRef ref, Slot slot) {

    public TreeInput {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(slot, "slot");
    }

    /** Resolves a raw caller value for {@code slot}. */
    public static TreeInput of(Object value, Slot slot) {
        return new TreeInput(ExtendedRefResolver.resolve(value, slot), slot);
    }
}
