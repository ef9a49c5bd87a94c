package cosynth.model;

import cosynth.diag.Location;
import cosynth.ir.IrExpr;
import cosynth.types.Type;

/**
 * Value of an expression over storage. Anonymous temporaries are folded into
 * the expressions that consume them; a temporary bound by {@code let} is
 * materialized once under a unique name and read by reference afterwards.
 */
public final class Temporary extends StorageObject {
    private final IrExpr expr;
    private String name;

    public Temporary(IrExpr expr, Type type, Location createdAt) {
        super(type, null, createdAt);
        this.expr = expr;
    }

    public IrExpr expr() {
        return expr;
    }

    public boolean isMaterialized() {
        return name != null;
    }

    public void materialize(String uniqueName) {
        if (name != null) throw new IllegalStateException("Temporary already materialized as " + name);
        this.name = uniqueName;
    }

    @Override
    public String name() {
        return name == null ? "<anonymous>" : name;
    }
}
