package cosynth.sema;

import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.ir.IrExpr;
import cosynth.ir.IrStmt;
import cosynth.model.AssignMode;
import cosynth.model.ConstantValue;
import cosynth.model.ContextKind;
import cosynth.model.PortDirection;
import cosynth.model.Signal;
import cosynth.model.StorageObject;
import cosynth.model.Temporary;
import cosynth.model.Variable;
import cosynth.types.PrimitiveType;
import cosynth.types.VectorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ObjectModelResolverTest {
    private static final Location AT = new Location(1, 1);

    private DesignRegistry registry;
    private ObjectModelResolver resolver;

    private final Signal in = Signal.port("go", PortDirection.IN, PrimitiveType.BIT, null, AT);
    private final Signal out = Signal.port("led", PortDirection.OUT, PrimitiveType.BIT, ConstantValue.of(0), AT);
    private final Signal pulse = Signal.internal("pulse", PrimitiveType.BIT, ConstantValue.of(0), AT);
    private final Signal bare = Signal.internal("bare", new VectorType(VectorType.Kind.UNSIGNED, 4), null, AT);

    @BeforeEach
    void setUp() {
        registry = new DesignRegistry("top");
        resolver = new ObjectModelResolver(registry);
    }

    private static ContextRecord sequential(String name) {
        return new ContextRecord(name, ContextKind.SEQUENTIAL, true);
    }

    private static ContextRecord concurrent(String name) {
        return new ContextRecord(name, ContextKind.CONCURRENT, false);
    }

    private static ErrorKind failure(Runnable r) {
        return assertThrows(CompileException.class, r::run).kind();
    }

    private static IrStmt.Assign assign(StorageObject target, AssignMode mode) {
        return new IrStmt.Assign(target, new IrExpr.Const(ConstantValue.of(1)), mode, AT);
    }

    @Test
    void classify_storage_and_constants() {
        assertEquals(BindingKind.PORT, ObjectModelResolver.classify(in));
        assertEquals(BindingKind.SIGNAL, ObjectModelResolver.classify(pulse));
        assertEquals(BindingKind.VARIABLE, ObjectModelResolver.classify(
                new Variable("n", PrimitiveType.BIT, null, "s", AT)));
        assertEquals(BindingKind.TEMPORARY, ObjectModelResolver.classify(
                new Temporary(new IrExpr.Ref(in), PrimitiveType.BIT, AT)));
        assertEquals(BindingKind.CONSTANT, ObjectModelResolver.classify(ConstantValue.of(3)));
    }

    @Test
    void redefinition_in_same_scope_fails_but_shadowing_is_allowed() {
        var table = new SymbolTable(registry.designScope());
        resolver.bind(table, "x", ConstantValue.of(1), AT);
        var e = assertThrows(CompileException.class, () -> resolver.bind(table, "x", ConstantValue.of(2), new Location(2, 3)));
        assertEquals(ErrorKind.REDEFINITION, e.kind());
        assertTrue(e.getMessage().contains("1:1"), e.getMessage());

        table.push();
        resolver.bind(table, "x", ConstantValue.of(2), AT);
        assertEquals(ConstantValue.of(2), table.lookup("x").value());
        table.pop();
        assertEquals(ConstantValue.of(1), table.lookup("x").value());
    }

    @Test
    void design_scope_shadows_builtins() {
        resolver.bind(registry.builtinScope(), "len", ConstantValue.of(0), AT);
        resolver.bind(registry.designScope(), "len", ConstantValue.of(7), AT);
        assertEquals(ConstantValue.of(7), registry.designScope().lookup("len").value());
    }

    @Test
    void signals_accept_next_and_push_but_not_value() {
        var s = sequential("s");
        resolver.checkAssignment(s, out, AssignMode.NEXT, AT);
        resolver.checkAssignment(s, pulse, AssignMode.PUSH, AT);
        assertEquals(Map.of(out, AssignMode.NEXT, pulse, AssignMode.PUSH), s.drivers());
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE, failure(() -> resolver.checkAssignment(s, bare, AssignMode.VALUE, AT)));
    }

    @Test
    void input_ports_cannot_be_written() {
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(sequential("s"), in, AssignMode.NEXT, AT)));
    }

    @Test
    void push_needs_sequential_context_and_default() {
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(concurrent("c"), pulse, AssignMode.PUSH, AT)));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(sequential("s"), bare, AssignMode.PUSH, AT)));
    }

    @Test
    void variables_need_value_mode_in_sequential_context() {
        var v = new Variable("n", PrimitiveType.BIT, null, "s", AT);
        resolver.checkAssignment(sequential("s"), v, AssignMode.VALUE, AT);
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(sequential("s"), v, AssignMode.NEXT, AT)));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(concurrent("c"), v, AssignMode.VALUE, AT)));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkVariableDeclaration(concurrent("c"), "n", AT)));
    }

    @Test
    void constants_and_temporaries_are_not_assignable() {
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(sequential("s"), ConstantValue.of(1), AssignMode.NEXT, AT)));
        var t = new Temporary(new IrExpr.Ref(in), PrimitiveType.BIT, AT);
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(sequential("s"), t, AssignMode.VALUE, AT)));
    }

    @Test
    void mixed_modes_in_one_context_fail() {
        var s = sequential("s");
        resolver.checkAssignment(s, pulse, AssignMode.NEXT, AT);
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(s, pulse, AssignMode.PUSH, AT)));
    }

    @Test
    void mixed_modes_across_committed_contexts_fail() {
        var a = sequential("a");
        resolver.checkAssignment(a, pulse, AssignMode.PUSH, AT);
        resolver.commit(a);
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE,
                failure(() -> resolver.checkAssignment(sequential("b"), pulse, AssignMode.NEXT, AT)));
    }

    @Test
    void uncommitted_context_leaves_no_trace() {
        var failed = sequential("failed");
        resolver.checkAssignment(failed, pulse, AssignMode.PUSH, AT);
        // never committed: another context may pick a different mode
        var b = sequential("b");
        resolver.checkAssignment(b, pulse, AssignMode.NEXT, AT);
        resolver.commit(b);
        assertTrue(resolver.driverConflicts().isEmpty());
        assertEquals(List.of(b), registry.committedContexts());
    }

    @Test
    void driver_conflicts_list_every_committed_driver() {
        var a = concurrent("a");
        var b = concurrent("b");
        resolver.checkAssignment(a, out, AssignMode.NEXT, AT);
        resolver.checkAssignment(b, out, AssignMode.NEXT, AT);
        resolver.checkAssignment(b, bare, AssignMode.NEXT, AT);
        resolver.commit(a);
        resolver.commit(b);

        var conflicts = resolver.driverConflicts();
        assertEquals(Set.of(out), conflicts.keySet());
        assertEquals(Set.of("a", "b"), Set.copyOf(conflicts.get(out)));
    }

    @Test
    void only_output_port_reads_are_recorded() {
        var s = sequential("s");
        resolver.recordRead(s, in);
        resolver.recordRead(s, pulse);
        resolver.recordRead(s, out);
        assertEquals(Set.of(out), s.outputReads());
    }

    @Test
    void revalidate_checks_duplicated_state_code() {
        var s = sequential("s");
        resolver.checkAssignment(s, pulse, AssignMode.PUSH, AT);
        var ok = List.<IrStmt>of(assign(pulse, AssignMode.PUSH), new IrStmt.Goto(0));
        resolver.revalidate(s, List.of(ok, ok));

        var bad = List.<IrStmt>of(new IrStmt.If(new IrExpr.Ref(in),
                List.of(assign(pulse, AssignMode.NEXT)), List.of(), AT));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE, failure(() -> resolver.revalidate(s, List.of(bad))));
    }

    @Test
    void revalidate_exempts_named_temporaries_and_rejects_leftover_control() {
        var s = sequential("s");
        var t = new Temporary(new IrExpr.Ref(in), PrimitiveType.BIT, AT);
        t.materialize(registry.allocateName("t"));
        resolver.revalidate(s, List.of(List.of(assign(t, AssignMode.VALUE))));

        assertThrows(IllegalStateException.class,
                () -> resolver.revalidate(s, List.of(List.of(new IrStmt.Await(new IrExpr.Ref(in), AT)))));
    }

    @Test
    void allocated_names_are_unique_design_wide() {
        registry.reserve("count");
        assertEquals("count_1", registry.allocateName("count"));
        assertEquals("count_2", registry.allocateName("count"));
        assertEquals("fresh", registry.allocateName("fresh"));
    }
}
