package cosynth.backend;

import cosynth.ir.IrRewriter;
import cosynth.model.Signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Output ports cannot be read back, so every output port that is read gets a
 * buffer signal. All references to the port go to the buffer, and the port is
 * driven from the buffer by a generated concurrent assignment.
 */
final class PortBuffering {
    private final Map<Signal, Signal> buffers;

    private PortBuffering(Map<Signal, Signal> buffers) {
        this.buffers = buffers;
    }

    static PortBuffering plan(List<CompiledContext> contexts, UnaryOperator<String> names, String suffix) {
        Map<Signal, Signal> buffers = new LinkedHashMap<>();
        for (CompiledContext ctx : contexts) {
            for (Signal port : ctx.record().outputReads()) {
                buffers.computeIfAbsent(port,
                        p -> Signal.generated(names.apply(p.name() + suffix), p.type(), p.defaultValue()));
            }
        }
        return new PortBuffering(buffers);
    }

    /** Port to buffer, in first-read order. */
    Map<Signal, Signal> buffers() {
        return Collections.unmodifiableMap(buffers);
    }

    Signal map(Signal s) {
        Signal buffer = buffers.get(s);
        return buffer == null ? s : buffer;
    }

    IrRewriter rewriter() {
        return new IrRewriter(buffers);
    }
}
