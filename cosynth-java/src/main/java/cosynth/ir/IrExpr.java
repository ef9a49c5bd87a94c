package cosynth.ir;

import cosynth.ast.expr.BinaryExpr;
import cosynth.ast.expr.UnaryExpr;
import cosynth.model.ConstantValue;
import cosynth.model.StorageObject;

/**
 * Runtime expression after normalization. Only storage references and the
 * constants folded into them remain.
 */
public sealed interface IrExpr
        permits IrExpr.Const, IrExpr.Ref, IrExpr.Binary, IrExpr.Unary, IrExpr.Index {

    IrExpr ALWAYS = new Const(ConstantValue.BoolValue.TRUE);

    record Const(ConstantValue value) implements IrExpr {}

    record Ref(StorageObject target) implements IrExpr {}

    record Binary(BinaryExpr.Operator op, IrExpr left, IrExpr right) implements IrExpr {}

    record Unary(UnaryExpr.Operator op, IrExpr operand) implements IrExpr {}

    /** Constant bit select. */
    record Index(IrExpr target, int index) implements IrExpr {}

    static boolean isConstTrue(IrExpr e) {
        return e instanceof Const c && c.value() instanceof ConstantValue.BoolValue b && b.value();
    }

    static boolean isConstFalse(IrExpr e) {
        return e instanceof Const c && c.value() instanceof ConstantValue.BoolValue b && !b.value();
    }

    static IrExpr not(IrExpr e) {
        if (isConstTrue(e)) return new Const(ConstantValue.BoolValue.FALSE);
        if (isConstFalse(e)) return ALWAYS;
        if (e instanceof Unary u && u.op() == UnaryExpr.Operator.NOT) return u.operand();
        return new Unary(UnaryExpr.Operator.NOT, e);
    }

    static IrExpr and(IrExpr l, IrExpr r) {
        if (isConstTrue(l)) return r;
        if (isConstTrue(r)) return l;
        return new Binary(BinaryExpr.Operator.AND, l, r);
    }
}
