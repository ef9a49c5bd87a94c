package cosynth.types;

import cosynth.ast.expr.BinaryExpr;

public final class TypeUtil {
    private TypeUtil() {}

    /** Type of a runtime binary expression. Only as precise as lowering needs. */
    public static Type binaryResult(BinaryExpr.Operator op, Type l, Type r) {
        if (op.isComparison() || op.isLogical()) return PrimitiveType.BOOL;
        if (l instanceof VectorType lv && r instanceof VectorType rv) {
            return lv.width() >= rv.width() ? lv : rv;
        }
        if (l instanceof VectorType) return l;
        if (r instanceof VectorType) return r;
        return l == PrimitiveType.INTEGER ? r : l;
    }

    /** Smallest unsigned type able to number {@code states} states. */
    public static Type stateType(int states) {
        int bits = 1;
        while ((1L << bits) < states) bits++;
        return new VectorType(VectorType.Kind.UNSIGNED, bits);
    }
}
