package cosynth.fsm;

import cosynth.compiler.CompiledDesign;
import cosynth.compiler.DesignCompiler;
import cosynth.diag.ErrorKind;
import cosynth.ir.IrExpr;
import cosynth.ir.IrPrinter;
import cosynth.ir.IrStmt;
import cosynth.ir.IrWalker;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class StateMachineSynthesizerTest {

    private static final String PORTS = """
            port in clk : bit;
            port in go : bit;
            port in flag : bit;
            port in done : bit;
            port out a : bit = 0;
            port out b : bit = 0;
            """;

    private static CompiledDesign compile(DesignCompiler compiler, String body) {
        return compiler.compile(DesignCompiler.parse(PORTS + "sequential m (clock clk) {\n" + body + "\n}", "top"));
    }

    private static StateGraph graph(String body) {
        var d = compile(new DesignCompiler(), body);
        assertFalse(d.hasErrors(), () -> d.diagnostics().all().toString());
        return d.stateGraph("m");
    }

    private static String state(StateGraph g, int id) {
        return IrPrinter.print(g.state(id).body());
    }

    private static List<String> transitionsFrom(StateGraph g, int id) {
        return g.transitionsFrom(id).stream()
                .map(t -> IrPrinter.print(t.guard()) + " -> " + t.to())
                .collect(Collectors.toList());
    }

    private static ErrorKind error(DesignCompiler compiler, String body) {
        var d = compile(compiler, body);
        assertTrue(d.hasErrors(), "expected a compile error");
        return d.diagnostics().errors().get(0).kind();
    }

    private static void assertWellFormed(StateGraph g) {
        for (int i = 0; i < g.size(); i++) {
            assertEquals(i, g.state(i).id(), "states are numbered densely from 0");
        }
        for (Transition t : g.transitions()) {
            assertTrue(t.to() >= 0 && t.to() < g.size(), "dangling transition " + t);
        }
        for (State s : g.states()) {
            IrWalker.statements(s.body(), st -> assertFalse(
                    st instanceof IrStmt.While || st instanceof IrStmt.Await
                            || st instanceof IrStmt.Break || st instanceof IrStmt.Continue,
                    "control statement left in state " + s.id()));
        }
    }

    @Test
    void body_without_suspension_is_one_state_looping_on_itself() {
        var g = graph("a <<= go;");
        assertTrue(g.isSingleState());
        assertEquals("a <<= go\ngoto S0\n", state(g, 0));
        assertEquals(List.of(new Transition(0, IrExpr.ALWAYS, 0)), g.transitions());
    }

    @Test
    void await_advances_one_state_and_waits_in_another() {
        var g = graph("""
                a <<= 1;
                await go;
                b <<= 1;
                """);
        assertEquals(3, g.size());
        assertWellFormed(g);
        assertEquals("""
                a <<= 1
                if go {
                  goto S1
                } else {
                  goto S2
                }
                """, state(g, 0));
        // the body restarts right after it completes
        assertEquals("""
                b <<= 1
                a <<= 1
                if go {
                  goto S1
                } else {
                  goto S2
                }
                """, state(g, 1));
        assertTrue(g.state(2).waiting());
        assertEquals("if go {\n  goto S1\n}\n", state(g, 2));
        assertEquals(List.of("go -> 1", "!go -> 2"), transitionsFrom(g, 0));
        assertEquals(List.of("go -> 1"), transitionsFrom(g, 2));
    }

    @Test
    void await_of_true_still_costs_one_cycle() {
        var g = graph("""
                a <<= 1;
                await true;
                b <<= 1;
                """);
        assertEquals(2, g.size());
        assertEquals("a <<= 1\ngoto S1\n", state(g, 0));
        assertEquals("b <<= 1\na <<= 1\ngoto S1\n", state(g, 1));
    }

    @Test
    void await_of_false_holds_forever() {
        var g = graph("""
                a <<= 1;
                await false;
                """);
        assertEquals(2, g.size());
        assertEquals("a <<= 1\ngoto S1\n", state(g, 0));
        assertTrue(g.state(1).body().isEmpty());
        assertTrue(g.transitionsFrom(1).isEmpty());
    }

    @Test
    void each_loop_iteration_costs_a_cycle() {
        var g = graph("while (go) { a <<= 1; }");
        assertEquals(2, g.size());
        assertEquals("goto S1\n", state(g, 0));
        assertEquals("""
                if go {
                  a <<= 1
                  goto S1
                } else {
                  goto S1
                }
                """, state(g, 1));
    }

    @Test
    void break_runs_the_code_after_the_loop_without_retesting() {
        var g = graph("""
                while (go) {
                    a <<= 1;
                    if (flag) { break; }
                }
                b <<= 1;
                await done;
                """);
        assertEquals(3, g.size());
        assertWellFormed(g);
        assertEquals("""
                if go {
                  a <<= 1
                  if flag {
                    b <<= 1
                    if done {
                      goto S0
                    } else {
                      goto S2
                    }
                  } else {
                    goto S1
                  }
                } else {
                  b <<= 1
                  if done {
                    goto S0
                  } else {
                    goto S2
                  }
                }
                """, state(g, 1));
    }

    @Test
    void continue_duplicates_the_loop_head_at_the_continue_site() {
        var g = graph("""
                while (go) {
                    a <<= 1;
                    await done;
                    if (flag) { continue; }
                    b <<= 1;
                }
                """);
        assertEquals(4, g.size());
        assertWellFormed(g);
        assertEquals("""
                if go {
                  a <<= 1
                  if done {
                    goto S2
                  } else {
                    goto S3
                  }
                } else {
                  goto S1
                }
                """, state(g, 1));
        assertEquals("""
                if flag {
                  if go {
                    a <<= 1
                    if done {
                      goto S2
                    } else {
                      goto S3
                    }
                  } else {
                    goto S1
                  }
                } else {
                  b <<= 1
                  if go {
                    a <<= 1
                    if done {
                      goto S2
                    } else {
                      goto S3
                    }
                  } else {
                    goto S1
                  }
                }
                """, state(g, 2));
        assertEquals("if done {\n  goto S2\n}\n", state(g, 3));
    }

    @Test
    void continue_without_a_transition_is_unbounded() {
        assertEquals(ErrorKind.UNBOUNDED_DUPLICATION, error(new DesignCompiler(), """
                while (go) {
                    if (flag) { continue; }
                    a <<= 1;
                }
                """));
    }

    @Test
    void state_limit_follows_configuration() {
        String body = """
                await go;
                await done;
                await flag;
                """;
        var roomy = compile(new DesignCompiler(), body);
        assertFalse(roomy.hasErrors());
        assertEquals(6, roomy.stateGraph("m").size());

        var tight = new DesignCompiler(new Configuration().set(CompilerSettings.maxStates, 4));
        assertEquals(ErrorKind.UNBOUNDED_DUPLICATION, error(tight, body));
    }

    @Test
    void nested_loops_and_branches_stay_well_formed() {
        var g = graph("""
                for (i in range(2)) {
                    while (go) {
                        if (flag) { a <<= 1; await done; } else { b <<= 1; }
                        if (done) { break; }
                    }
                }
                await !go;
                """);
        assertWellFormed(g);
        List<Integer> reachable = new ArrayList<>();
        reachable.add(0);
        for (int k = 0; k < reachable.size(); k++) {
            for (Transition t : g.transitionsFrom(reachable.get(k))) {
                if (!reachable.contains(t.to())) reachable.add(t.to());
            }
        }
        assertEquals(g.size(), reachable.size(), "every state is reachable from the initial one");
    }
}
