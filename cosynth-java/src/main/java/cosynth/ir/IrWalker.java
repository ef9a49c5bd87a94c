package cosynth.ir;

import cosynth.model.StorageObject;

import java.util.List;
import java.util.function.Consumer;

public final class IrWalker {
    private IrWalker() {}

    /** Every storage object read by {@code e}, in evaluation order. */
    public static void reads(IrExpr e, Consumer<StorageObject> sink) {
        if (e instanceof IrExpr.Ref r) {
            sink.accept(r.target());
        } else if (e instanceof IrExpr.Binary b) {
            reads(b.left(), sink);
            reads(b.right(), sink);
        } else if (e instanceof IrExpr.Unary u) {
            reads(u.operand(), sink);
        } else if (e instanceof IrExpr.Index i) {
            reads(i.target(), sink);
        }
    }

    /** Visits every statement, nested ones included, in pre-order. */
    public static void statements(List<IrStmt> stmts, Consumer<IrStmt> sink) {
        for (IrStmt s : stmts) {
            sink.accept(s);
            if (s instanceof IrStmt.If i) {
                statements(i.thenBranch(), sink);
                statements(i.elseBranch(), sink);
            } else if (s instanceof IrStmt.While w) {
                statements(w.body(), sink);
            }
        }
    }

    public static boolean containsSuspension(List<IrStmt> stmts) {
        boolean[] found = {false};
        statements(stmts, s -> {
            if (s instanceof IrStmt.While || s instanceof IrStmt.Await) found[0] = true;
        });
        return found[0];
    }
}
