package com.flowmodel.tree.ref;

import com.flowmodel.graph.ElementId;
import com.flowmodel.tree.node.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes raw caller values into {@link ExtendedRef}s. Pure: never touches the graph store or
 * the session registry; names are only checked for spelling here and resolved by the validator.
 * <p>
 * Literal parsing is directed by the slot: {@code "42"} is an integer in an INT slot, a real in a
 * REAL slot and an error in a BOOL slot. Java values carry their own kind and must agree with a
 * kind-specific slot, except that integers widen to reals.
 */
public final class ExtendedRefResolver {

    private static final Pattern INT_LITERAL = Pattern.compile("[+-]?(0x[0-9A-Fa-f]+|0b[01]+|\\d+)(_(i|ui)(8|16|32|64))?");
    private static final Pattern REAL_LITERAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?(_f(32|64))?");
    private static final Pattern CHAR_LITERAL = Pattern.compile("'.'");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*");

    private ExtendedRefResolver() {
    }

    public static ExtendedRef resolve(Object value, Slot slot) {
        if (value == null) {
            throw new ResolutionException(null, slot, "illegal empty tree");
        }
        if (value instanceof ExtendedRef ref) {
            return ref;
        }
        if (value instanceof TreeNode node) {
            return new TreeRef(node);
        }
        if (value instanceof ElementId id) {
            return new ElementRef(id);
        }
        if (value instanceof List<?> list) {
            return resolveArray(list, slot);
        }
        if (value instanceof String s && slot.acceptsName()) {
            return resolveName(s, slot);
        }
        return new LiteralRef(scalar(value, slot));
    }

    public static List<ExtendedRef> resolveAll(List<?> values, Slot slot) {
        if (values == null) {
            throw new ResolutionException(null, slot, "illegal empty tree");
        }
        List<ExtendedRef> result = new ArrayList<>(values.size());
        for (Object v : values) {
            result.add(resolve(v, slot));
        }
        return result;
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static boolean isPath(String name) {
        return name != null && PATH.matcher(name).matches();
    }

    private static ExtendedRef resolveName(String token, Slot slot) {
        String t = token.trim();
        if (t.isEmpty()) {
            throw new ResolutionException(token, slot, "illegal empty tree");
        }
        if (slot == Slot.TYPE && t.startsWith("'")) {
            throw new ResolutionException(token, slot, "illegal polymorphic type outside an operator interface");
        }
        if (slot == Slot.PATTERN) {
            if (t.equals("true") || t.equals("false")) return new LiteralRef(Literal.scalar(LiteralKind.BOOL, t));
            if (INT_LITERAL.matcher(t).matches()) return new LiteralRef(Literal.scalar(LiteralKind.INT, t));
            if (CHAR_LITERAL.matcher(t).matches()) return new LiteralRef(Literal.scalar(LiteralKind.CHAR, t));
        }
        if (!isPath(t)) {
            throw new ResolutionException(token, slot, "not a valid name");
        }
        return new PredefinedNameRef(t);
    }

    private static ExtendedRef resolveArray(List<?> list, Slot slot) {
        if (list.isEmpty()) {
            throw new ResolutionException(list, slot, "illegal empty tree");
        }
        if (!(slot == Slot.FLOW || slot.literalKind() != null)) {
            throw new ResolutionException(list, slot, "arrays are only accepted in value positions");
        }
        LiteralKind kind = null;
        List<String> values = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item == null || item instanceof List<?> || item instanceof ExtendedRef
                    || item instanceof TreeNode || item instanceof ElementId) {
                throw new ResolutionException(list, slot, "array items must be scalar values");
            }
            Literal literal = scalar(item, slot);
            if (kind == null) {
                kind = literal.kind();
            } else if (kind != literal.kind()) {
                throw new ResolutionException(list, slot, "array mixes " + kind + " and " + literal.kind() + " values");
            }
            values.add(literal.text());
        }
        return new LiteralRef(Literal.array(kind, values));
    }

    private static Literal scalar(Object value, Slot slot) {
        if (value instanceof String s) {
            return parse(s, slot);
        }
        LiteralKind kind = javaKind(value, slot);
        LiteralKind expected = slot.literalKind();
        if (slot == Slot.FLOW || slot == Slot.PATTERN) {
            if (slot == Slot.PATTERN && kind == LiteralKind.REAL) {
                throw new ResolutionException(value, slot, "real values cannot be matched");
            }
            return Literal.scalar(kind, spell(value, kind));
        }
        if (expected == null) {
            throw new ResolutionException(value, slot, "a literal is not accepted here");
        }
        if (expected == kind) {
            return Literal.scalar(kind, spell(value, kind));
        }
        if (expected == LiteralKind.REAL && kind == LiteralKind.INT) {
            return Literal.scalar(LiteralKind.REAL, ((Number) value).longValue() + ".0");
        }
        throw new ResolutionException(value, slot, "expected a " + expected + " value, got " + kind);
    }

    private static LiteralKind javaKind(Object value, Slot slot) {
        if (value instanceof Boolean) return LiteralKind.BOOL;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return LiteralKind.INT;
        }
        if (value instanceof Double || value instanceof Float) return LiteralKind.REAL;
        if (value instanceof Character) return LiteralKind.CHAR;
        throw new ResolutionException(value, slot, "unsupported value type " + value.getClass().getSimpleName());
    }

    private static String spell(Object value, LiteralKind kind) {
        return switch (kind) {
            case BOOL, INT -> value.toString();
            case REAL -> {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new ResolutionException(value, Slot.REAL, "not a finite number");
                }
                yield Double.toString(d);
            }
            case CHAR -> "'" + value + "'";
        };
    }

    private static Literal parse(String token, Slot slot) {
        String t = token.trim();
        if (t.isEmpty()) {
            throw new ResolutionException(token, slot, "illegal empty tree");
        }
        return switch (slot) {
            case BOOL -> {
                if (t.equals("true") || t.equals("false")) yield Literal.scalar(LiteralKind.BOOL, t);
                throw new ResolutionException(token, slot, "not a boolean spelling");
            }
            case INT -> {
                if (INT_LITERAL.matcher(t).matches()) yield Literal.scalar(LiteralKind.INT, t);
                throw new ResolutionException(token, slot, "not an integer spelling");
            }
            case REAL -> {
                if (REAL_LITERAL.matcher(t).matches()) yield Literal.scalar(LiteralKind.REAL, t);
                throw new ResolutionException(token, slot, "not a real spelling");
            }
            case CHAR -> {
                if (CHAR_LITERAL.matcher(t).matches()) yield Literal.scalar(LiteralKind.CHAR, t);
                throw new ResolutionException(token, slot, "not a character spelling");
            }
            case FLOW -> throw new ResolutionException(token, slot,
                    "a string is ambiguous in a flow position; pass a typed value, an element or a tree");
            default -> throw new ResolutionException(token, slot, "a string is not accepted here");
        };
    }
}
