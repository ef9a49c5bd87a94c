package cosynth.ir;

import cosynth.model.ConstantValue;

import java.util.List;

/**
 * Human readable rendering of IR, used by diagnostics, logging and the
 * reference text backend.
 */
public final class IrPrinter {
    private IrPrinter() {}

    public static String print(IrExpr e) {
        if (e instanceof IrExpr.Const c) {
            if (c.value() instanceof ConstantValue.BoolValue b) return b.value() ? "true" : "false";
            return c.value().toString();
        }
        if (e instanceof IrExpr.Ref r) return r.target().name();
        if (e instanceof IrExpr.Binary b) {
            return "(" + print(b.left()) + " " + b.op().symbol() + " " + print(b.right()) + ")";
        }
        if (e instanceof IrExpr.Unary u) return u.op().symbol() + print(u.operand());
        if (e instanceof IrExpr.Index i) return print(i.target()) + "[" + i.index() + "]";
        throw new IllegalStateException("Unknown expression: " + e);
    }

    public static String print(List<IrStmt> stmts) {
        StringBuilder sb = new StringBuilder();
        print(stmts, 0, sb);
        return sb.toString();
    }

    private static void print(List<IrStmt> stmts, int indent, StringBuilder sb) {
        for (IrStmt s : stmts) {
            sb.append("  ".repeat(indent));
            if (s instanceof IrStmt.Assign a) {
                sb.append(a.target().name()).append(' ').append(a.mode().symbol()).append(' ')
                        .append(print(a.value())).append('\n');
            } else if (s instanceof IrStmt.If i) {
                sb.append("if ").append(print(i.condition())).append(" {\n");
                print(i.thenBranch(), indent + 1, sb);
                if (!i.elseBranch().isEmpty()) {
                    sb.append("  ".repeat(indent)).append("} else {\n");
                    print(i.elseBranch(), indent + 1, sb);
                }
                sb.append("  ".repeat(indent)).append("}\n");
            } else if (s instanceof IrStmt.While w) {
                sb.append("while ").append(print(w.condition())).append(" {\n");
                print(w.body(), indent + 1, sb);
                sb.append("  ".repeat(indent)).append("}\n");
            } else if (s instanceof IrStmt.Break) {
                sb.append("break\n");
            } else if (s instanceof IrStmt.Continue) {
                sb.append("continue\n");
            } else if (s instanceof IrStmt.Await a) {
                sb.append("await ").append(print(a.condition())).append('\n');
            } else if (s instanceof IrStmt.Assert a) {
                sb.append("assert ").append(print(a.condition()));
                if (a.message() != null) sb.append(", \"").append(a.message()).append('"');
                sb.append('\n');
            } else if (s instanceof IrStmt.Goto g) {
                sb.append("goto S").append(g.target()).append('\n');
            }
        }
    }
}
