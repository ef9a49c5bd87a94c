package cosynth.backend;

import cosynth.fsm.StateGraph;
import cosynth.model.ContextKind;
import cosynth.normalize.NormalizedContext;
import cosynth.sema.ContextRecord;

/**
 * A context that passed every per-context check and is ready to lower.
 *
 * @param graph null for concurrent contexts
 */
public record CompiledContext(NormalizedContext normalized, StateGraph graph, ContextRecord record) {

    public String name() {
        return normalized.name();
    }

    public ContextKind kind() {
        return normalized.kind();
    }

    public boolean isSequential() {
        return kind() == ContextKind.SEQUENTIAL;
    }
}
