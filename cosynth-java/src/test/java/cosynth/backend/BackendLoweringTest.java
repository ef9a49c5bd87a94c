package cosynth.backend;

import cosynth.compiler.CompiledDesign;
import cosynth.compiler.DesignCompiler;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BackendLoweringTest {

    private static List<String> lower(String src) {
        return lower(new DesignCompiler(), src);
    }

    private static List<String> lower(DesignCompiler compiler, String src) {
        RecordingBackend backend = new RecordingBackend();
        CompiledDesign d = compiler.compile(DesignCompiler.parse(src, "top"), backend);
        assertFalse(d.hasErrors(), () -> d.diagnostics().all().toString());
        return backend.calls;
    }

    @Test
    void push_defaults_are_assigned_first_in_every_process() {
        assertEquals(List.of(
                "entity top(clk, go, pulse)",
                "process m clock=clk reset=none {",
                "locals()",
                "body {",
                "pulse ^= 0",
                "if go {",
                "pulse ^= 1",
                "}",
                "}",
                "}"
        ), lower("""
                port in clk : bit;
                port in go : bit;
                port out pulse : bit = 0;
                sequential m (clock clk) {
                    if (go) { pulse ^= 1; }
                }
                """));
    }

    @Test
    void concurrent_context_becomes_a_block_after_declarations() {
        assertEquals(List.of(
                "entity top(x, z, y)",
                "declare t : bit",
                "declare s : bit",
                "block logic {",
                "t <<= (x & z)",
                "s <<= (x | z)",
                "y <<= (t ^ s)",
                "assert x \"x must hold\"",
                "}"
        ), lower("""
                port in x : bit;
                port in z : bit;
                port out y : bit;
                signal t : bit;
                concurrent logic {
                    t <<= x & z;
                    let s = x | z;
                    y <<= t ^ s;
                    assert(x, "x must hold");
                }
                """));
    }

    @Test
    void output_port_read_gets_one_buffer_and_one_driver() {
        var calls = lower("""
                port in clk : bit;
                port out count : unsigned<4> = 0;
                port out mirror : unsigned<4>;
                sequential m (clock clk) { count <<= count + 1; }
                concurrent k { mirror <<= count; }
                """);
        assertEquals(List.of(
                "entity top(clk, count, mirror)",
                "declare count_buf : unsigned<4>",
                "block k {",
                "mirror <<= count_buf",
                "}",
                "block count_buf_driver {",
                "count <<= count_buf",
                "}",
                "process m clock=clk reset=none {",
                "locals()",
                "body {",
                "count_buf <<= (count_buf + 1)",
                "}",
                "}"
        ), calls);
        assertEquals(1, Collections.frequency(calls, "declare count_buf : unsigned<4>"));
    }

    @Test
    void buffer_suffix_follows_configuration() {
        var compiler = new DesignCompiler(new Configuration().set(CompilerSettings.bufferSuffix, "_q"));
        var calls = lower(compiler, """
                port in clk : bit;
                port out count : unsigned<4> = 0;
                sequential m (clock clk) { count <<= count + 1; }
                """);
        assertTrue(calls.contains("declare count_q : unsigned<4>"), calls::toString);
        assertTrue(calls.contains("count <<= count_q"), calls::toString);
    }

    @Test
    void multi_state_process_selects_on_its_state_register() {
        assertEquals(List.of(
                "entity top(clk, rst, go, led)",
                "declare m_state : unsigned<2>",
                "process m clock=clk reset=rst {",
                "locals(n)",
                "reset {",
                "led <<= 0",
                "n @= 2",
                "m_state <<= 0",
                "}",
                "body {",
                "case m_state {",
                "when 0",
                "led <<= 1",
                "if go {",
                "m_state <<= 1",
                "} else {",
                "m_state <<= 2",
                "}",
                "when 1",
                "n @= (n + 1)",
                "led <<= 0",
                "led <<= 1",
                "if go {",
                "m_state <<= 1",
                "} else {",
                "m_state <<= 2",
                "}",
                "when 2",
                "if go {",
                "m_state <<= 1",
                "}",
                "}",
                "}",
                "}"
        ), lower("""
                port in clk : bit;
                port in rst : bit;
                port in go : bit;
                port out led : bit = 0;
                sequential m (clock clk, reset rst async low) {
                    var n : unsigned<4> = 2;
                    led <<= 1;
                    await go;
                    n @= n + 1;
                    led <<= 0;
                }
                """));
    }

    @Test
    void reset_uses_each_drivers_own_mode() {
        var calls = lower("""
                port in clk : bit;
                port in rst : bit;
                port in go : bit;
                port out pulse : bit = 0;
                port out level : bit = 1;
                sequential m (clock clk, reset rst) {
                    if (go) { pulse ^= 1; level <<= 0; }
                }
                """);
        int reset = calls.indexOf("reset {");
        int body = calls.indexOf("body {");
        assertEquals(List.of("reset {", "pulse ^= 0", "level <<= 1", "}"), calls.subList(reset, body));
        assertEquals("pulse ^= 0", calls.get(body + 1));
    }

    @Test
    void sequential_temporaries_are_process_locals() {
        var calls = lower("""
                port in clk : bit;
                port in go : bit;
                port in flag : bit;
                port out led : bit = 0;
                sequential m (clock clk) { let t = go & flag; led <<= t; }
                """);
        assertTrue(calls.contains("locals(t)"), calls::toString);
        assertFalse(calls.stream().anyMatch(c -> c.startsWith("declare t")), calls::toString);
    }

    @Test
    void single_state_processes_come_before_state_machines() {
        var calls = lower("""
                port in clk : bit;
                port in go : bit;
                port out a : bit = 0;
                port out b : bit = 0;
                sequential fsm (clock clk) { a <<= 1; await go; a <<= 0; }
                sequential simple (clock clk) { b <<= go; }
                """);
        int simple = calls.indexOf("process simple clock=clk reset=none {");
        int fsm = calls.indexOf("process fsm clock=clk reset=none {");
        assertTrue(simple >= 0 && fsm > simple, calls::toString);
        // the single-state process never mentions a state register
        assertFalse(calls.contains("declare simple_state : unsigned<1>"));
        assertTrue(calls.contains("declare fsm_state : unsigned<2>"), calls::toString);
    }

    @Test
    void failed_context_does_not_stop_the_others() {
        RecordingBackend backend = new RecordingBackend();
        var d = new DesignCompiler().compile(DesignCompiler.parse("""
                port in x : bit;
                port out y : bit;
                port out z : bit;
                concurrent bad { z <<= nowhere; }
                concurrent good { y <<= x; }
                """, "top"), backend);
        assertTrue(d.hasErrors());
        assertFalse(d.succeeded("bad"));
        assertTrue(d.succeeded("good"));
        assertEquals(List.of("entity top(x, y, z)", "block good {", "y <<= x", "}"), backend.calls);
    }
}
