package com.flowmodel.tree.build;

import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.validate.ValidationException;
import com.flowmodel.tree.validate.ValidationRule;

import java.util.Collection;

/** Construction-time shape checks shared by the composition operations. */
final class Shapes {

    private Shapes() {
    }

    static ValidationException fail(Construct construct, ValidationRule rule, String message) {
        return new ValidationException(construct + " node", rule, message);
    }

    static void requireNotEmpty(Construct construct, Collection<?> values, String what) {
        if (values == null || values.isEmpty()) {
            ValidationRule rule = construct.isOpen() ? ValidationRule.COMPOSITE_NOT_EMPTY : ValidationRule.SHAPE;
            throw fail(construct, rule, what + " must not be empty");
        }
    }

    static void requireSameLength(Construct construct, Collection<?> a, String aName, Collection<?> b, String bName) {
        requireNotEmpty(construct, a, aName);
        requireNotEmpty(construct, b, bName);
        if (a.size() != b.size()) {
            throw fail(construct, ValidationRule.SHAPE,
                    aName + " and " + bName + " must have the same length (" + a.size() + " vs " + b.size() + ")");
        }
    }

    static void requireIdentifier(Construct construct, String name, String what) {
        if (!ExtendedRefResolver.isIdentifier(name)) {
            throw fail(construct, ValidationRule.SHAPE, what + " '" + name + "' is not an identifier");
        }
    }
}
