package cosynth.sema;

import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Scope {
    private final Scope parent;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope parent() {
        return parent;
    }

    public void define(Binding b) {
        Binding previous = bindings.get(b.name());
        if (previous != null) {
            throw new CompileException(ErrorKind.REDEFINITION, b.loc(),
                    "'" + b.name() + "' is already defined in this scope (at " + previous.loc() + ")");
        }
        bindings.put(b.name(), b);
    }

    public Binding getLocal(String name) {
        return bindings.get(name);
    }

    public Binding lookup(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Binding b = s.bindings.get(name);
            if (b != null) return b;
        }
        return null;
    }
}
