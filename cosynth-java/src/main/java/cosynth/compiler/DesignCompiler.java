package cosynth.compiler;

import com.google.common.flogger.GoogleLogger;
import cosynth.ast.DesignUnit;
import cosynth.ast.decl.ContextDecl;
import cosynth.backend.BackendLowering;
import cosynth.backend.CompiledContext;
import cosynth.backend.TargetBackend;
import cosynth.backend.TemporaryLifetimeCheck;
import cosynth.diag.CompileException;
import cosynth.diag.Diagnostic;
import cosynth.diag.Diagnostics;
import cosynth.diag.ErrorKind;
import cosynth.fsm.StateGraph;
import cosynth.fsm.StateMachineSynthesizer;
import cosynth.lexer.Lexer;
import cosynth.model.ContextKind;
import cosynth.model.Signal;
import cosynth.normalize.ControlFlowNormalizer;
import cosynth.normalize.DesignElaborator;
import cosynth.normalize.NormalizedContext;
import cosynth.parser.Parser;
import cosynth.sema.ContextRecord;
import cosynth.sema.DesignRegistry;
import cosynth.sema.ObjectModelResolver;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles a design context by context. A context that fails is reported and
 * left out; the remaining contexts are still checked and lowered.
 */
public final class DesignCompiler {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final Configuration config;

    public DesignCompiler(Configuration config) {
        this.config = config;
    }

    public DesignCompiler() {
        this(Configuration.defaults());
    }

    /** Reads design source text. */
    public static DesignUnit parse(String source, String name) {
        return new Parser(new Lexer(source).tokenize()).parseDesign(name);
    }

    public CompiledDesign compile(DesignUnit unit) {
        return compile(unit, null);
    }

    /**
     * @param backend receives the lowered design; null to stop after analysis
     */
    public CompiledDesign compile(DesignUnit unit, TargetBackend backend) {
        logger.atInfo().log("compiling design %s (%d contexts)", unit.name(), unit.contexts().size());
        Diagnostics diagnostics = new Diagnostics();
        DesignRegistry registry = new DesignRegistry(unit.name());
        ObjectModelResolver resolver = new ObjectModelResolver(registry);
        ControlFlowNormalizer normalizer = new ControlFlowNormalizer(registry, resolver, config);

        try {
            new DesignElaborator(registry, resolver, normalizer).elaborate(unit);
        } catch (CompileException e) {
            // no context can be compiled without the design scope
            diagnostics.error(null, e);
            return new CompiledDesign(unit.name(), List.of(), diagnostics);
        }

        StateMachineSynthesizer synthesizer = new StateMachineSynthesizer(config);
        TemporaryLifetimeCheck lifetimes = new TemporaryLifetimeCheck(config.get(CompilerSettings.strictTemporaries));
        Set<String> names = new HashSet<>();
        List<CompiledContext> compiled = new ArrayList<>();

        for (ContextDecl decl : unit.contexts()) {
            ContextRecord record = new ContextRecord(decl.name(), decl.kind(), decl.clock() != null);
            try {
                if (!names.add(decl.name())) {
                    throw new CompileException(ErrorKind.REDEFINITION, decl.loc(),
                            "Context '" + decl.name() + "' is already defined");
                }
                NormalizedContext n = normalizer.normalize(decl, record);
                StateGraph graph = null;
                List<Diagnostic> warnings = List.of();
                if (n.kind() == ContextKind.SEQUENTIAL) {
                    graph = synthesizer.synthesize(n.name(), n.body(), n.loc());
                    resolver.revalidate(record, graph.bodies());
                    warnings = lifetimes.check(n, graph);
                }
                resolver.commit(record);
                warnings.forEach(diagnostics::report);
                compiled.add(new CompiledContext(n, graph, record));
                logger.atFine().log("context %s compiled (%s)", decl.name(),
                        graph == null ? "concurrent" : graph.size() + " states");
            } catch (CompileException e) {
                diagnostics.error(decl.name(), e);
            }
        }

        Set<String> conflicting = checkDrivers(unit, resolver, diagnostics);
        compiled.removeIf(c -> conflicting.contains(c.name()));

        if (backend != null) {
            new BackendLowering(backend, config).lower(registry, compiled);
        }
        logger.atInfo().log("design %s: %d of %d contexts compiled, %d errors", unit.name(),
                compiled.size(), unit.contexts().size(), diagnostics.errors().size());
        return new CompiledDesign(unit.name(), compiled, diagnostics);
    }

    /** Every context driving a signal that another context drives fails. */
    private static Set<String> checkDrivers(DesignUnit unit, ObjectModelResolver resolver, Diagnostics diagnostics) {
        Set<String> failed = new HashSet<>();
        Map<Signal, Collection<String>> conflicts = resolver.driverConflicts();
        for (Map.Entry<Signal, Collection<String>> e : conflicts.entrySet()) {
            Signal s = e.getKey();
            List<String> involved = unit.contexts().stream()
                    .map(ContextDecl::name)
                    .filter(e.getValue()::contains)
                    .distinct()
                    .collect(Collectors.toList());
            for (String ctx : involved) {
                diagnostics.error(ctx, new CompileException(ErrorKind.MULTIPLE_DRIVER, s.declaredAt(),
                        "Signal '" + s.name() + "' is driven by contexts " + involved));
                failed.add(ctx);
            }
        }
        return failed;
    }
}
