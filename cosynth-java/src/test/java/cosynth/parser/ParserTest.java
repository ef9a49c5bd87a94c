package cosynth.parser;

import cosynth.ast.DesignUnit;
import cosynth.ast.decl.ContextDecl;
import cosynth.ast.decl.FunctionDecl;
import cosynth.ast.expr.*;
import cosynth.ast.stmt.*;
import cosynth.ast.type.PrimitiveTypeRef;
import cosynth.ast.type.VectorTypeRef;
import cosynth.diag.SyntaxException;
import cosynth.lexer.Lexer;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.ContextKind;
import cosynth.model.PortDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static DesignUnit parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseDesign("top");
    }

    private static Expr constExpr(String expr) {
        return parse("const X = " + expr + ";").constants().get(0).value();
    }

    private static List<Stmt> body(String stmts) {
        var d = parse("sequential s (clock clk) {\n" + stmts + "\n}");
        return d.contexts().get(0).body().statements();
    }

    private static VarExpr v(String name) {
        return new VarExpr(name);
    }

    @Test
    void parse_ports_signals_and_constants() {
        var d = parse("""
            port in clk : bit;
            port out count : unsigned<8> = 0;
            port inout bus : bitvector<4>;
            signal regs : signed<16>[4] = 0;
            signal busy : bool;
            const WIDTH = 0x10;
            """);
        assertEquals("top", d.name());
        assertEquals(3, d.ports().size());
        assertEquals(PortDirection.IN, d.ports().get(0).direction());
        assertEquals(new PrimitiveTypeRef("bit"), d.ports().get(0).type());
        assertNull(d.ports().get(0).defaultValue());
        assertEquals(PortDirection.OUT, d.ports().get(1).direction());
        assertEquals(new VectorTypeRef("unsigned", 8), d.ports().get(1).type());
        assertEquals(new IntLiteral(0), d.ports().get(1).defaultValue());
        assertEquals(PortDirection.INOUT, d.ports().get(2).direction());

        assertEquals(4, d.signals().get(0).count());
        assertEquals(new VectorTypeRef("signed", 16), d.signals().get(0).type());
        assertNull(d.signals().get(1).count());

        assertEquals(new IntLiteral(16), d.constants().get(0).value());
    }

    @Test
    void parse_function_parameters() {
        var d = parse("""
            fn f(a, b = 2, *rest, **kw) { return a; }
            async fn wait_for(s) { await s; }
            """);
        FunctionDecl f = d.functions().get(0);
        assertFalse(f.coroutine());
        assertEquals(List.of(
                new FunctionDecl.Param("a", FunctionDecl.ParamKind.POSITIONAL, null),
                new FunctionDecl.Param("b", FunctionDecl.ParamKind.POSITIONAL, new IntLiteral(2)),
                new FunctionDecl.Param("rest", FunctionDecl.ParamKind.REST, null),
                new FunctionDecl.Param("kw", FunctionDecl.ParamKind.KEYWORD_REST, null)
        ), f.params());
        assertTrue(d.functions().get(1).coroutine());
        assertInstanceOf(AwaitStmt.class, d.functions().get(1).body().statements().get(0));
    }

    @Test
    void parse_context_options() {
        var d = parse("""
            concurrent glue { }
            sequential a (clock clk falling freq 100, reset rst sync high) { }
            sequential b (reset r async low, clock c) { }
            sequential c { }
            """);
        ContextDecl glue = d.contexts().get(0);
        assertEquals(ContextKind.CONCURRENT, glue.kind());
        assertNull(glue.clock());

        ContextDecl a = d.contexts().get(1);
        assertEquals(ContextKind.SEQUENTIAL, a.kind());
        assertEquals(new ContextDecl.ClockSpec("clk", Clock.Edge.FALLING, 100L), a.clock());
        assertEquals(new ContextDecl.ResetSpec("rst", false, false), a.reset());

        ContextDecl b = d.contexts().get(2);
        assertEquals(new ContextDecl.ResetSpec("r", true, true), b.reset());
        assertEquals(new ContextDecl.ClockSpec("c", Clock.Edge.RISING, null), b.clock());

        assertNull(d.contexts().get(3).clock());
        assertNull(d.contexts().get(3).reset());
    }

    @Test
    void parse_assignment_modes_and_bindings() {
        var stmts = body("""
            a <<= 1;
            p ^= 1;
            let t = a + 1;
            var n : unsigned<4> = 3;
            n @= n + 1;
            regs[2] <<= t;
            """);
        assertEquals(AssignMode.NEXT, ((AssignStmt) stmts.get(0)).mode());
        assertEquals(AssignMode.PUSH, ((AssignStmt) stmts.get(1)).mode());
        assertEquals("t", ((LetStmt) stmts.get(2)).name());
        var n = (VarDeclStmt) stmts.get(3);
        assertEquals(new VectorTypeRef("unsigned", 4), n.type());
        assertEquals(new IntLiteral(3), n.initializer());
        assertEquals(AssignMode.VALUE, ((AssignStmt) stmts.get(4)).mode());
        assertEquals(new IndexExpr(v("regs"), new IntLiteral(2)), ((AssignStmt) stmts.get(5)).target());
    }

    @Test
    void parse_else_if_folds_into_else_block() {
        var stmts = body("""
            if (a) { x <<= 1; } else if (b) { x <<= 2; } else { x <<= 3; }
            """);
        var outer = (IfStmt) stmts.get(0);
        assertEquals(v("a"), outer.condition());
        var nested = (IfStmt) outer.elseBlock().statements().get(0);
        assertEquals(v("b"), nested.condition());
        assertNotNull(nested.elseBlock());
    }

    @Test
    void parse_loops_and_control() {
        var stmts = body("""
            for (i, x in enumerate(xs)) { if (x) { break; } } else { y <<= 0; }
            while (go) { await done; continue; }
            """);
        var f = (ForStmt) stmts.get(0);
        assertEquals(List.of("i", "x"), f.names());
        assertInstanceOf(CallExpr.class, f.iterable());
        assertNotNull(f.elseBlock());

        var w = (WhileStmt) stmts.get(1);
        assertEquals(v("go"), w.condition());
        assertInstanceOf(AwaitStmt.class, w.body().statements().get(0));
        assertInstanceOf(ContinueStmt.class, w.body().statements().get(1));
    }

    @Test
    void parse_assert_with_and_without_message() {
        var stmts = body("""
            assert(x < 4, "out of range");
            assert(y);
            """);
        assertEquals("out of range", ((AssertStmt) stmts.get(0)).message());
        assertNull(((AssertStmt) stmts.get(1)).message());
    }

    @Test
    void parse_arithmetic_precedence() {
        assertEquals(new BinaryExpr(v("a"), BinaryExpr.Operator.ADD,
                        new BinaryExpr(v("b"), BinaryExpr.Operator.MUL, v("c"))),
                constExpr("a + b * c"));
        assertEquals(new BinaryExpr(new BinaryExpr(v("a"), BinaryExpr.Operator.SUB, v("b")),
                        BinaryExpr.Operator.SUB, v("c")),
                constExpr("a - b - c"));
    }

    @Test
    void parse_bitwise_and_logical_precedence() {
        assertEquals(new BinaryExpr(v("a"), BinaryExpr.Operator.BIT_OR,
                        new BinaryExpr(v("b"), BinaryExpr.Operator.BIT_XOR,
                                new BinaryExpr(v("c"), BinaryExpr.Operator.BIT_AND, v("d")))),
                constExpr("a | b ^ c & d"));
        assertEquals(new BinaryExpr(v("a"), BinaryExpr.Operator.OR,
                        new BinaryExpr(v("b"), BinaryExpr.Operator.AND, v("c"))),
                constExpr("a || b && c"));
        // comparisons bind tighter than bitwise operators
        assertEquals(new BinaryExpr(
                        new BinaryExpr(v("x"), BinaryExpr.Operator.EQ, new IntLiteral(1)),
                        BinaryExpr.Operator.BIT_AND, v("y")),
                constExpr("x == 1 & y"));
    }

    @Test
    void parse_unary_and_postfix() {
        assertEquals(new UnaryExpr(UnaryExpr.Operator.NOT, new IndexExpr(v("a"), new IntLiteral(0))),
                constExpr("!a[0]"));
        assertEquals(new UnaryExpr(UnaryExpr.Operator.NEG, new UnaryExpr(UnaryExpr.Operator.INV, v("x"))),
                constExpr("-~x"));
        assertEquals(new IndexExpr(new ListExpr(List.of(v("a"), v("b"))), v("i")), constExpr("[a, b][i]"));
    }

    @Test
    void parse_range_and_literals() {
        assertEquals(new RangeExpr(new IntLiteral(0), new BinaryExpr(v("N"), BinaryExpr.Operator.SUB, new IntLiteral(1))),
                constExpr("0...N - 1"));
        assertEquals(new IntLiteral(5), constExpr("0b101"));
        assertEquals(new StringLiteral("hi"), constExpr("\"hi\""));
        assertEquals(new BoolLiteral(false), constExpr("false"));
        assertEquals(new ListExpr(List.of()), constExpr("[]"));
    }

    @Test
    void parse_call_argument_kinds() {
        var call = (CallExpr) constExpr("f(1, k = 2, *xs, **kw)");
        assertEquals(v("f"), call.callee());
        assertEquals(List.of(
                CallExpr.Argument.positional(new IntLiteral(1)),
                CallExpr.Argument.keyword("k", new IntLiteral(2)),
                new CallExpr.Argument(CallExpr.ArgKind.SPREAD, null, v("xs")),
                new CallExpr.Argument(CallExpr.ArgKind.KEYWORD_SPREAD, null, v("kw"))
        ), call.args());
    }

    @Test
    void parse_missing_semicolon_reports_position() {
        var e = assertThrows(SyntaxException.class, () -> parse("const A = 1\nconst B = 2;"));
        assertTrue(e.getMessage().startsWith("[2:1]"), e.getMessage());
    }

    @Test
    void parse_plain_equals_assignment_suggests_let() {
        var e = assertThrows(SyntaxException.class, () -> body("x = 1;"));
        assertTrue(e.getMessage().contains("Use 'let'"), e.getMessage());
    }

    @Test
    void parse_rejects_invalid_assignment_target() {
        assertThrows(SyntaxException.class, () -> body("a + b <<= 1;"));
    }

    @Test
    void parse_rejects_unknown_type_and_bad_width() {
        assertThrows(SyntaxException.class, () -> parse("signal s : float;"));
        assertThrows(SyntaxException.class, () -> parse("signal s : unsigned<0>;"));
    }

    @Test
    void parse_rejects_unknown_port_direction_and_context_option() {
        assertThrows(SyntaxException.class, () -> parse("port sideways p : bit;"));
        assertThrows(SyntaxException.class, () -> parse("sequential s (clock c, clock d) { }"));
        assertThrows(SyntaxException.class, () -> parse("sequential s (enable e) { }"));
    }

    @Test
    void parse_rejects_statement_at_top_level() {
        assertThrows(SyntaxException.class, () -> parse("a <<= 1;"));
    }
}
