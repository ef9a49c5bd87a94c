package cosynth.sema;

import cosynth.model.AssignMode;
import cosynth.model.ContextKind;
import cosynth.model.Signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * What one context does to shared storage: the signals it drives, their
 * assignment modes and the output ports it reads. Kept apart from the design
 * registry until the context compiles successfully.
 */
public final class ContextRecord {
    private final String name;
    private final ContextKind kind;
    private final boolean clocked;

    private final Map<Signal, AssignMode> drivers = new LinkedHashMap<>();
    private final Set<Signal> outputReads = new LinkedHashSet<>();

    public ContextRecord(String name, ContextKind kind, boolean clocked) {
        this.name = name;
        this.kind = kind;
        this.clocked = clocked;
    }

    public String name() {
        return name;
    }

    public ContextKind kind() {
        return kind;
    }

    public boolean isSequential() {
        return kind == ContextKind.SEQUENTIAL;
    }

    /** Suspension needs a clock. */
    public boolean canSuspend() {
        return isSequential() && clocked;
    }

    void recordDriver(Signal s, AssignMode mode) {
        drivers.put(s, mode);
    }

    AssignMode modeOf(Signal s) {
        return drivers.get(s);
    }

    void recordOutputRead(Signal port) {
        outputReads.add(port);
    }

    /** Driven signals with their assignment mode, in first-assignment order. */
    public Map<Signal, AssignMode> drivers() {
        return Collections.unmodifiableMap(drivers);
    }

    public Set<Signal> outputReads() {
        return Collections.unmodifiableSet(outputReads);
    }

    @Override
    public String toString() {
        return name;
    }
}
