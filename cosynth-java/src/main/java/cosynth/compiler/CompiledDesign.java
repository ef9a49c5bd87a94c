package cosynth.compiler;

import com.google.common.collect.ImmutableMap;
import cosynth.backend.CompiledContext;
import cosynth.diag.Diagnostics;
import cosynth.fsm.StateGraph;
import cosynth.ir.IrStmt;

import java.util.List;
import java.util.Map;

/**
 * Result of compiling one design. Only contexts that compiled successfully
 * are present; the others are reported in {@link #diagnostics()}.
 */
public final class CompiledDesign {
    private final String entity;
    private final Map<String, CompiledContext> contexts;
    private final Diagnostics diagnostics;

    CompiledDesign(String entity, List<CompiledContext> contexts, Diagnostics diagnostics) {
        this.entity = entity;
        ImmutableMap.Builder<String, CompiledContext> byName = ImmutableMap.builder();
        for (CompiledContext c : contexts) byName.put(c.name(), c);
        this.contexts = byName.build();
        this.diagnostics = diagnostics;
    }

    public String entity() {
        return entity;
    }

    public Map<String, CompiledContext> contexts() {
        return contexts;
    }

    public boolean succeeded(String context) {
        return contexts.containsKey(context);
    }

    /** Normalized IR of a successful context. */
    public List<IrStmt> ir(String context) {
        return require(context).normalized().body();
    }

    /** State graph of a successful sequential context. */
    public StateGraph stateGraph(String context) {
        StateGraph g = require(context).graph();
        if (g == null) throw new IllegalArgumentException("'" + context + "' is not a sequential context");
        return g;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }

    private CompiledContext require(String context) {
        CompiledContext c = contexts.get(context);
        if (c == null) throw new IllegalArgumentException("No compiled context '" + context + "'");
        return c;
    }
}
