package cosynth.backend;

import cosynth.ir.IrExpr;
import cosynth.ir.IrPrinter;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.Reset;
import cosynth.model.Signal;
import cosynth.model.StorageObject;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Flattens every backend call into one line. */
final class RecordingBackend implements TargetBackend {
    final List<String> calls = new ArrayList<>();

    @Override
    public void emitEntityBoundary(String entity, List<Signal> ports) {
        calls.add("entity " + entity + names(ports));
    }

    @Override
    public void emitDeclaration(StorageObject object) {
        calls.add("declare " + object.name() + " : " + object.type());
    }

    @Override
    public void emitConcurrentBlock(String id, Runnable body) {
        calls.add("block " + id + " {");
        body.run();
        calls.add("}");
    }

    @Override
    public void emitProcess(String id, Clock clock, Reset reset, ProcessBody body) {
        calls.add("process " + id
                + " clock=" + (clock == null ? "none" : clock.signal().name())
                + " reset=" + (reset == null ? "none" : reset.signal().name()) + " {");
        calls.add("locals" + names(body.locals()));
        if (body.reset() != null) {
            calls.add("reset {");
            body.reset().run();
            calls.add("}");
        }
        calls.add("body {");
        body.body().run();
        calls.add("}");
        calls.add("}");
    }

    @Override
    public void emitAssignment(StorageObject target, IrExpr value, AssignMode mode) {
        calls.add(target.name() + " " + mode.symbol() + " " + IrPrinter.print(value));
    }

    @Override
    public void emitConditional(IrExpr condition, Runnable then, Runnable otherwise) {
        calls.add("if " + IrPrinter.print(condition) + " {");
        then.run();
        if (otherwise != null) {
            calls.add("} else {");
            otherwise.run();
        }
        calls.add("}");
    }

    @Override
    public void emitStateSelector(Signal state, List<StateArm> arms) {
        calls.add("case " + state.name() + " {");
        for (StateArm arm : arms) {
            calls.add("when " + arm.state());
            arm.body().run();
        }
        calls.add("}");
    }

    @Override
    public void emitAssertion(IrExpr condition, String message) {
        calls.add("assert " + IrPrinter.print(condition) + (message == null ? "" : " \"" + message + "\""));
    }

    private static String names(List<? extends StorageObject> objects) {
        return objects.stream().map(StorageObject::name).collect(Collectors.joining(", ", "(", ")"));
    }
}
