package cosynth.sema;

import com.google.common.collect.ImmutableList;
import cosynth.model.AssignMode;
import cosynth.model.Signal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Design-wide state shared by every context: the design scope, its storage,
 * the committed assignment modes and the committed contexts.
 */
public final class DesignRegistry {
    private final String entity;
    private final Scope builtins = new Scope(null);
    private final Scope design = new Scope(builtins);

    private final List<Signal> ports = new ArrayList<>();
    private final List<Signal> signals = new ArrayList<>();
    private final Map<Signal, AssignMode> modes = new HashMap<>();
    private final List<ContextRecord> committed = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    public DesignRegistry(String entity) {
        this.entity = entity;
    }

    public String entity() {
        return entity;
    }

    /** Holds the builtins; the design scope shadows it. */
    public Scope builtinScope() {
        return builtins;
    }

    public Scope designScope() {
        return design;
    }

    public void addPort(Signal port) {
        ports.add(port);
        reserve(port.name());
    }

    public void addSignal(Signal signal) {
        signals.add(signal);
        reserve(signal.name());
    }

    public List<Signal> ports() {
        return ImmutableList.copyOf(ports);
    }

    /** Internal signals in declaration order, signal-array elements included. */
    public List<Signal> signals() {
        return ImmutableList.copyOf(signals);
    }

    public void reserve(String name) {
        names.add(name);
    }

    /** A design-wide unique name derived from {@code base}. */
    public String allocateName(String base) {
        if (names.add(base)) return base;
        for (int i = 1; ; i++) {
            String candidate = base + "_" + i;
            if (names.add(candidate)) return candidate;
        }
    }

    AssignMode committedMode(Signal s) {
        return modes.get(s);
    }

    void commit(ContextRecord ctx) {
        modes.putAll(ctx.drivers());
        committed.add(ctx);
    }

    public List<ContextRecord> committedContexts() {
        return ImmutableList.copyOf(committed);
    }
}
