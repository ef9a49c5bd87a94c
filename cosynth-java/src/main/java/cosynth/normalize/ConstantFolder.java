package cosynth.normalize;

import com.google.common.collect.ImmutableList;
import cosynth.ast.expr.BinaryExpr;
import cosynth.ast.expr.UnaryExpr;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.model.ConstantValue;
import cosynth.model.ConstantValue.BoolValue;
import cosynth.model.ConstantValue.IntValue;
import cosynth.model.ConstantValue.ListValue;
import cosynth.model.ConstantValue.StringValue;
import cosynth.model.Value;

/**
 * Compile-time arithmetic over constant values.
 */
public final class ConstantFolder {
    private ConstantFolder() {}

    public static boolean truthy(ConstantValue v) {
        if (v instanceof BoolValue b) return b.value();
        if (v instanceof IntValue i) return i.value() != 0;
        if (v instanceof ListValue l) return l.size() > 0;
        if (v instanceof StringValue s) return !s.value().isEmpty();
        if (v instanceof ConstantValue.DictValue d) return !d.entries().isEmpty();
        if (v instanceof ConstantValue.NoneValue) return false;
        return true;
    }

    public static ConstantValue unary(UnaryExpr.Operator op, ConstantValue v, Location at) {
        switch (op) {
            case NOT:
                return BoolValue.of(!truthy(v));
            case NEG:
                long n = asLong(v, op.symbol(), at);
                if (n == Long.MIN_VALUE) throw unsupported(at, "Constant overflow in -(" + n + ")");
                return ConstantValue.of(-n);
            case INV:
                if (v instanceof BoolValue b) return BoolValue.of(!b.value());
                return ConstantValue.of(~asLong(v, op.symbol(), at));
            default:
                throw new IllegalStateException("Unknown unary operator " + op);
        }
    }

    public static ConstantValue binary(BinaryExpr.Operator op, ConstantValue l, ConstantValue r, Location at) {
        if (op == BinaryExpr.Operator.EQ) return BoolValue.of(l.equals(r));
        if (op == BinaryExpr.Operator.NE) return BoolValue.of(!l.equals(r));
        if (op == BinaryExpr.Operator.AND) return BoolValue.of(truthy(l) && truthy(r));
        if (op == BinaryExpr.Operator.OR) return BoolValue.of(truthy(l) || truthy(r));

        if (op == BinaryExpr.Operator.ADD) {
            if (l instanceof StringValue ls && r instanceof StringValue rs) {
                return new StringValue(ls.value() + rs.value());
            }
            if (l instanceof ListValue ll && r instanceof ListValue rl) {
                return new ListValue(ImmutableList.<Value>builder().addAll(ll.elements()).addAll(rl.elements()).build());
            }
        }

        if (l instanceof BoolValue lb && r instanceof BoolValue rb) {
            switch (op) {
                case BIT_AND: return BoolValue.of(lb.value() & rb.value());
                case BIT_OR: return BoolValue.of(lb.value() | rb.value());
                case BIT_XOR: return BoolValue.of(lb.value() ^ rb.value());
                default: break;
            }
        }

        long a = asLong(l, op.symbol(), at);
        long b = asLong(r, op.symbol(), at);
        try {
            return arithmetic(op, a, b, at);
        } catch (ArithmeticException e) {
            throw unsupported(at, "Constant overflow in " + a + " " + op.symbol() + " " + b);
        }
    }

    private static ConstantValue arithmetic(BinaryExpr.Operator op, long a, long b, Location at) {
        switch (op) {
            case ADD: return ConstantValue.of(Math.addExact(a, b));
            case SUB: return ConstantValue.of(Math.subtractExact(a, b));
            case MUL: return ConstantValue.of(Math.multiplyExact(a, b));
            case DIV:
                if (b == 0) throw unsupported(at, "Division by zero");
                if (a == Long.MIN_VALUE && b == -1) throw new ArithmeticException("long overflow");
                return ConstantValue.of(Math.floorDiv(a, b));
            case MOD:
                if (b == 0) throw unsupported(at, "Division by zero");
                return ConstantValue.of(Math.floorMod(a, b));
            case SHL: {
                long shifted = a << shiftCount(b);
                if (shifted >> b != a) throw new ArithmeticException("long overflow");
                return ConstantValue.of(shifted);
            }
            case SHR: return ConstantValue.of(a >> shiftCount(b));
            case BIT_AND: return ConstantValue.of(a & b);
            case BIT_OR: return ConstantValue.of(a | b);
            case BIT_XOR: return ConstantValue.of(a ^ b);
            case LT: return BoolValue.of(a < b);
            case GT: return BoolValue.of(a > b);
            case LE: return BoolValue.of(a <= b);
            case GE: return BoolValue.of(a >= b);
            default:
                throw new IllegalStateException("Unknown binary operator " + op);
        }
    }

    /** Counts outside 0..63 have no meaning on 64-bit constants. */
    private static int shiftCount(long b) {
        if (b < 0 || b > 63) throw new ArithmeticException("shift count " + b);
        return (int) b;
    }

    /** Booleans count as 0 and 1 in arithmetic. */
    static long asLong(ConstantValue v, String op, Location at) {
        if (v instanceof IntValue i) return i.value();
        if (v instanceof BoolValue b) return b.value() ? 1 : 0;
        throw unsupported(at, "Operator '" + op + "' is not applicable to " + v);
    }

    private static CompileException unsupported(Location at, String message) {
        return new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, message);
    }
}
