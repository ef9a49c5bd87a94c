package cosynth.compiler;

import cosynth.backend.TextBackend;
import cosynth.diag.Diagnostic;
import cosynth.diag.ErrorKind;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DesignCompilerTest {

    private static final String PORTS = """
            port in clk : bit;
            port in go : bit;
            port in flag : bit;
            port in done : bit;
            port out a : bit = 0;
            port out b : bit = 0;
            signal pulse : bit = 0;
            """;

    private static CompiledDesign compile(String src) {
        return new DesignCompiler().compile(DesignCompiler.parse(PORTS + src, "top"));
    }

    private static List<String> failedContexts(CompiledDesign d) {
        return d.diagnostics().errors().stream().map(Diagnostic::context).collect(Collectors.toList());
    }

    @Test
    void every_context_driving_a_shared_signal_fails() {
        var d = compile("""
                concurrent one { a <<= go; }
                sequential two (clock clk) { a <<= flag; }
                concurrent three { b <<= done; }
                """);
        assertEquals(List.of("one", "two"), failedContexts(d));
        for (Diagnostic e : d.diagnostics().errors()) {
            assertEquals(ErrorKind.MULTIPLE_DRIVER, e.kind());
            assertTrue(e.message().contains("'a'"), e.message());
        }
        assertFalse(d.succeeded("one"));
        assertFalse(d.succeeded("two"));
        assertTrue(d.succeeded("three"));
    }

    @Test
    void failing_context_is_isolated() {
        var d = compile("""
                concurrent broken { a <<= missing; }
                sequential fine (clock clk) { b <<= go; await done; b <<= 0; }
                """);
        assertEquals(List.of("broken"), failedContexts(d));
        assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, d.diagnostics().errors().get(0).kind());
        assertEquals(3, d.stateGraph("fine").size());
    }

    @Test
    void driver_of_failed_context_does_not_conflict() {
        // 'broken' fails before it is committed, so 'fine' is the only driver of a
        var d = compile("""
                concurrent broken { a <<= go; b <<= missing; }
                concurrent fine { a <<= flag; }
                """);
        assertEquals(List.of("broken"), failedContexts(d));
        assertTrue(d.succeeded("fine"));
    }

    @Test
    void design_level_error_stops_before_any_context() {
        var d = new DesignCompiler().compile(DesignCompiler.parse("""
                port in go : bit;
                signal go : bit;
                concurrent c { }
                """, "top"));
        assertEquals(1, d.diagnostics().errors().size());
        Diagnostic e = d.diagnostics().errors().get(0);
        assertEquals(ErrorKind.REDEFINITION, e.kind());
        assertNull(e.context());
        assertTrue(d.contexts().isEmpty());
    }

    @Test
    void context_names_are_unique() {
        var d = compile("""
                concurrent c { a <<= go; }
                concurrent c { b <<= go; }
                """);
        assertEquals(List.of("c"), failedContexts(d));
        assertEquals(ErrorKind.REDEFINITION, d.diagnostics().errors().get(0).kind());
    }

    @Test
    void push_and_next_on_one_signal_across_contexts() {
        var d = compile("""
                sequential first (clock clk) { if (go) { pulse ^= 1; } }
                sequential second (clock clk) { pulse <<= flag; }
                """);
        assertEquals(List.of("second"), failedContexts(d));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_MODE, d.diagnostics().errors().get(0).kind());
        assertTrue(d.succeeded("first"));
    }

    @Test
    void temporary_read_in_a_later_state_is_a_warning() {
        String src = """
                sequential m (clock clk) {
                    let t = go & flag;
                    await done;
                    a <<= t;
                }
                """;
        var d = compile(src);
        assertFalse(d.hasErrors(), () -> d.diagnostics().all().toString());
        assertEquals(1, d.diagnostics().warnings().size());
        Diagnostic w = d.diagnostics().warnings().get(0);
        assertEquals(ErrorKind.TEMPORARY_ACROSS_STATES, w.kind());
        assertEquals("m", w.context());
        assertTrue(w.message().contains("'t'") && w.message().contains("[1]"), w.message());
    }

    @Test
    void temporary_read_in_a_later_state_fails_when_strict() {
        var strict = new DesignCompiler(new Configuration().set(CompilerSettings.strictTemporaries, true));
        var d = strict.compile(DesignCompiler.parse(PORTS + """
                sequential m (clock clk) {
                    let t = go & flag;
                    await done;
                    a <<= t;
                }
                """, "top"));
        assertEquals(List.of("m"), failedContexts(d));
        assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, d.diagnostics().errors().get(0).kind());
    }

    @Test
    void temporary_used_where_computed_gives_no_warning() {
        var d = compile("""
                sequential m (clock clk) {
                    await done;
                    let t = go & flag;
                    a <<= t;
                }
                """);
        assertFalse(d.hasErrors());
        assertTrue(d.diagnostics().warnings().isEmpty(), () -> d.diagnostics().warnings().toString());
    }

    @Test
    void compiles_a_complete_design_to_text() {
        TextBackend backend = new TextBackend();
        var d = new DesignCompiler().compile(DesignCompiler.parse("""
                const SETTLE = 2;
                port in clk : bit;
                port in rst : bit;
                port in start : bit;
                port out count : unsigned<4> = 0;
                port out busy : bit = 0;

                fn bump(x, step = 1) { return x + step; }

                async fn settle(cycles) {
                    for (i in range(cycles)) { await true; }
                }

                sequential counter (clock clk, reset rst async low) {
                    await start;
                    busy <<= 1;
                    count <<= bump(count);
                    await settle(SETTLE);
                    busy <<= 0;
                }

                concurrent watch {
                    assert(!(busy & start), "start while busy");
                }
                """, "top"), backend);
        assertFalse(d.hasErrors(), () -> d.diagnostics().all().toString());
        String text = backend.text();
        assertTrue(text.contains("entity top is"), text);
        assertTrue(text.contains("count : out unsigned(3 downto 0) := 0;"), text);
        assertTrue(text.contains("signal busy_buf : bit := '0';"), text);
        assertTrue(text.contains("counter : process (clk, rst)"), text);
        assertTrue(text.contains("case counter_state is"), text);
        assertTrue(text.contains("count_buf <= (count_buf + 1);"), text);
        assertTrue(text.contains("assert not (busy_buf and start) report \"start while busy\" severity error;"), text);
        assertTrue(text.strip().endsWith("end architecture cosynth;"), text);
    }
}
