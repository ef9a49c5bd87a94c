package cosynth.backend;

import cosynth.ir.IrExpr;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.Reset;
import cosynth.model.Signal;
import cosynth.model.StorageObject;

import java.util.List;

/**
 * Receiver of a lowered design. Nested structure is passed as callbacks that
 * emit the enclosed statements when run.
 */
public interface TargetBackend {

    void emitEntityBoundary(String entity, List<Signal> ports);

    void emitDeclaration(StorageObject object);

    void emitConcurrentBlock(String id, Runnable body);

    /**
     * @param clock null for an unclocked process
     * @param reset null when the process has no reset
     */
    void emitProcess(String id, Clock clock, Reset reset, ProcessBody body);

    void emitAssignment(StorageObject target, IrExpr value, AssignMode mode);

    /** @param otherwise null when there is no else branch */
    void emitConditional(IrExpr condition, Runnable then, Runnable otherwise);

    /** Arms are matched first-to-last on the value of {@code state}. */
    void emitStateSelector(Signal state, List<StateArm> arms);

    void emitAssertion(IrExpr condition, String message);
}
