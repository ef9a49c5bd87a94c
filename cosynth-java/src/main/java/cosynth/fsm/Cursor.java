package cosynth.fsm;

import cosynth.ir.IrStmt;

import java.util.List;

/**
 * A position in the normalized IR: a statement list, an index into it and
 * the chain of enclosing positions. Lists are compared by identity, so two
 * cursors are equal exactly when they name the same statement occurrence.
 */
final class Cursor {
    enum Kind { ROOT, BRANCH, LOOP }

    private final List<IrStmt> list;
    private final int index;
    private final Kind kind;
    private final Cursor parent;     // position of the enclosing If or While

    private Cursor(List<IrStmt> list, int index, Kind kind, Cursor parent) {
        this.list = list;
        this.index = index;
        this.kind = kind;
        this.parent = parent;
    }

    static Cursor root(List<IrStmt> list) {
        return new Cursor(list, 0, Kind.ROOT, null);
    }

    boolean atEnd() {
        return index >= list.size();
    }

    IrStmt current() {
        return list.get(index);
    }

    Kind kind() {
        return kind;
    }

    Cursor parent() {
        return parent;
    }

    Cursor next() {
        return new Cursor(list, index + 1, kind, parent);
    }

    Cursor enterBranch(List<IrStmt> branch) {
        return new Cursor(branch, 0, Kind.BRANCH, this);
    }

    /** First statement of the body of the While at this position. */
    Cursor enterLoop() {
        return new Cursor(((IrStmt.While) current()).body(), 0, Kind.LOOP, this);
    }

    /** Position of the innermost enclosing While. */
    Cursor enclosingLoop() {
        for (Cursor c = this; c != null; c = c.parent) {
            if (c.kind == Kind.LOOP) return c.parent;
        }
        throw new IllegalStateException("Loop control outside a loop");
    }

    /**
     * The position execution actually continues at: the end of a branch
     * continues after its If, the end of a loop body at the loop head.
     */
    Cursor canonical() {
        Cursor c = this;
        while (c.atEnd()) {
            switch (c.kind) {
                case BRANCH -> c = c.parent.next();
                case LOOP -> c = c.parent;
                case ROOT -> throw new IllegalStateException("Fell off the end of the root body");
            }
        }
        return c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cursor c)) return false;
        if (list != c.list || index != c.index || kind != c.kind) return false;
        return parent == null ? c.parent == null : parent.equals(c.parent);
    }

    @Override
    public int hashCode() {
        int h = System.identityHashCode(list) * 31 + index;
        h = h * 31 + kind.hashCode();
        return parent == null ? h : h * 31 + parent.hashCode();
    }

    @Override
    public String toString() {
        return (parent == null ? "" : parent + "/") + kind.name().toLowerCase() + ":" + index;
    }
}
