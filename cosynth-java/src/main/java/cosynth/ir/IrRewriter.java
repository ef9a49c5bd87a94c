package cosynth.ir;

import com.google.common.collect.ImmutableList;
import cosynth.model.StorageObject;

import java.util.List;
import java.util.Map;

/**
 * Substitutes storage objects throughout statement trees. Nodes without a
 * substituted reference are returned as-is.
 */
public final class IrRewriter {
    private final Map<? extends StorageObject, ? extends StorageObject> substitution;

    public IrRewriter(Map<? extends StorageObject, ? extends StorageObject> substitution) {
        this.substitution = substitution;
    }

    public List<IrStmt> rewrite(List<IrStmt> stmts) {
        if (substitution.isEmpty()) return stmts;
        ImmutableList.Builder<IrStmt> out = ImmutableList.builder();
        for (IrStmt s : stmts) out.add(rewrite(s));
        return out.build();
    }

    public IrStmt rewrite(IrStmt s) {
        if (s instanceof IrStmt.Assign a) {
            return new IrStmt.Assign(map(a.target()), rewrite(a.value()), a.mode(), a.loc());
        }
        if (s instanceof IrStmt.If i) {
            return new IrStmt.If(rewrite(i.condition()), rewrite(i.thenBranch()), rewrite(i.elseBranch()), i.loc());
        }
        if (s instanceof IrStmt.While w) {
            return new IrStmt.While(rewrite(w.condition()), rewrite(w.body()), w.loc());
        }
        if (s instanceof IrStmt.Await a) {
            return new IrStmt.Await(rewrite(a.condition()), a.loc());
        }
        if (s instanceof IrStmt.Assert a) {
            return new IrStmt.Assert(rewrite(a.condition()), a.message(), a.loc());
        }
        return s;
    }

    public IrExpr rewrite(IrExpr e) {
        if (e instanceof IrExpr.Ref r) {
            StorageObject mapped = map(r.target());
            return mapped == r.target() ? e : new IrExpr.Ref(mapped);
        }
        if (e instanceof IrExpr.Binary b) {
            return new IrExpr.Binary(b.op(), rewrite(b.left()), rewrite(b.right()));
        }
        if (e instanceof IrExpr.Unary u) {
            return new IrExpr.Unary(u.op(), rewrite(u.operand()));
        }
        if (e instanceof IrExpr.Index i) {
            return new IrExpr.Index(rewrite(i.target()), i.index());
        }
        return e;
    }

    private StorageObject map(StorageObject o) {
        StorageObject mapped = substitution.get(o);
        return mapped == null ? o : mapped;
    }
}
