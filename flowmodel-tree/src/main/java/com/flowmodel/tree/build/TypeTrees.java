package com.flowmodel.tree.build;

import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.ExtendedRef;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.ref.LiteralRef;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.ValidationRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Composition operations for type trees. Type arguments accept predefined names, type paths,
 * existing type elements and nested type trees.
 */
public final class TypeTrees {

    private static final Set<Long> SIZES = Set.of(8L, 16L, 32L, 64L);

    private TypeTrees() {
    }

    /** Type used as is; lets a type position carry a tree of its own. */
    public static TreeNode alias(Object type) {
        return TreeNode.leaf(Construct.TYPE_LEAF, ExtendedRefResolver.resolve(type, Slot.TYPE), Map.of());
    }

    /** {@code signed<<size>>} or {@code unsigned<<size>>}. A literal size must be 8, 16, 32 or 64. */
    public static TreeNode sized(boolean signed, Object size) {
        ExtendedRef ref = ExtendedRefResolver.resolve(size, Slot.INT);
        if (ref instanceof LiteralRef lit && !lit.literal().array() && !SIZES.contains(lit.literal().intValue())) {
            throw Shapes.fail(Construct.SIZED, ValidationRule.SHAPE, "size must be one of 8, 16, 32, 64: " + size);
        }
        return TreeNode.operator(Construct.SIZED, List.of(ref), Map.of(TreeAttributes.SIGNED, signed));
    }

    /** {@code elementType ^ d1 ^ d2 ...}; dimensions are integer values, constants or expressions. */
    public static TreeNode table(List<?> dimensions, Object elementType) {
        Shapes.requireNotEmpty(Construct.TABLE, dimensions, "dimensions");
        List<ExtendedRef> operands = new ArrayList<>();
        operands.add(ExtendedRefResolver.resolve(elementType, Slot.TYPE));
        operands.addAll(ExtendedRefResolver.resolveAll(dimensions, Slot.INT));
        return TreeNode.operator(Construct.TABLE, operands, Map.of());
    }

    public static TreeNode table(Object elementType, Object dimension) {
        return table(List.of(dimension), elementType);
    }

    /** Structure with fields in the given order. */
    public static TreeNode structure(List<NamedValue> fields) {
        Shapes.requireNotEmpty(Construct.STRUCTURE, fields, "structure fields");
        List<Field> result = new ArrayList<>(fields.size());
        for (NamedValue f : fields) {
            Shapes.requireIdentifier(Construct.STRUCTURE, f.name(), "field name");
            result.add(new Field(f.name(), ExtendedRefResolver.resolve(f.value(), Slot.TYPE)));
        }
        return TreeNode.composite(Construct.STRUCTURE, List.of(), result, Map.of());
    }

    public static TreeNode structure(NamedValue... fields) {
        return structure(Arrays.asList(fields));
    }
}
