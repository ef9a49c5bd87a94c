package cosynth.parser;

import cosynth.ast.DesignUnit;
import cosynth.ast.decl.ConstDecl;
import cosynth.ast.decl.ContextDecl;
import cosynth.ast.decl.FunctionDecl;
import cosynth.ast.decl.PortDecl;
import cosynth.ast.decl.SignalDecl;
import cosynth.ast.expr.*;
import cosynth.ast.stmt.*;
import cosynth.ast.type.PrimitiveTypeRef;
import cosynth.ast.type.TypeRef;
import cosynth.ast.type.VectorTypeRef;
import cosynth.diag.Location;
import cosynth.diag.SyntaxException;
import cosynth.lexer.Token;
import cosynth.lexer.TokenType;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.ContextKind;
import cosynth.model.PortDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent reader for design sources. Produces the statement tree the
 * compiler consumes; no semantic checks happen here.
 */
public final class Parser {
    private static final Set<String> PRIMITIVE_TYPES = Set.of("bit", "bool", "int");
    private static final Set<String> VECTOR_TYPES = Set.of("unsigned", "signed", "bitvector");

    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public DesignUnit parseDesign() {
        return parseDesign("top");
    }

    public DesignUnit parseDesign(String name) {
        List<PortDecl> ports = new ArrayList<>();
        List<SignalDecl> signals = new ArrayList<>();
        List<ConstDecl> constants = new ArrayList<>();
        List<FunctionDecl> functions = new ArrayList<>();
        List<ContextDecl> contexts = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (match(TokenType.PORT)) ports.add(parsePortDecl());
            else if (match(TokenType.SIGNAL)) signals.add(parseSignalDecl());
            else if (match(TokenType.CONST)) constants.add(parseConstDecl());
            else if (check(TokenType.FN) || check(TokenType.ASYNC)) functions.add(parseFunctionDecl());
            else if (match(TokenType.CONCURRENT)) contexts.add(parseConcurrent());
            else if (match(TokenType.SEQUENTIAL)) contexts.add(parseSequential());
            else throw error(peek(), "Expected 'port', 'signal', 'const', 'fn', 'concurrent' or 'sequential' at top-level");
        }
        consume(TokenType.EOF, "Expected EOF");
        return new DesignUnit(name, ports, signals, constants, functions, contexts);
    }

    // ---------- declarations ----------
    private PortDecl parsePortDecl() {
        Location at = loc(previous());
        PortDirection direction;
        if (match(TokenType.IN)) {
            direction = PortDirection.IN;
        } else {
            Token d = consume(TokenType.IDENTIFIER, "Expected port direction 'in', 'out' or 'inout'");
            direction = switch (d.lexeme()) {
                case "out" -> PortDirection.OUT;
                case "inout" -> PortDirection.INOUT;
                default -> throw error(d, "Expected port direction 'in', 'out' or 'inout'");
            };
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected port name");
        consume(TokenType.COLON, "Expected ':' after port name");
        TypeRef type = parseTypeRef();
        Expr init = match(TokenType.ASSIGN) ? parseExpr() : null;
        consume(TokenType.SEMICOLON, "Expected ';' after port declaration");
        return new PortDecl(name.lexeme(), direction, type, init, at);
    }

    private SignalDecl parseSignalDecl() {
        Location at = loc(previous());
        Token name = consume(TokenType.IDENTIFIER, "Expected signal name");
        consume(TokenType.COLON, "Expected ':' after signal name");
        TypeRef type = parseTypeRef();

        // array suffix: [N]
        Integer count = null;
        if (match(TokenType.LBRACKET)) {
            count = (int) parseIntLiteral(consume(TokenType.INT_LITERAL, "Expected signal array size"));
            consume(TokenType.RBRACKET, "Expected ']'");
        }
        Expr init = match(TokenType.ASSIGN) ? parseExpr() : null;
        consume(TokenType.SEMICOLON, "Expected ';' after signal declaration");
        return new SignalDecl(name.lexeme(), type, count, init, at);
    }

    private ConstDecl parseConstDecl() {
        Location at = loc(previous());
        Token name = consume(TokenType.IDENTIFIER, "Expected constant name");
        consume(TokenType.ASSIGN, "Expected '=' after constant name");
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after constant declaration");
        return new ConstDecl(name.lexeme(), value, at);
    }

    private FunctionDecl parseFunctionDecl() {
        Location at = loc(peek());
        boolean coroutine = match(TokenType.ASYNC);
        consume(TokenType.FN, "Expected 'fn'");
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");

        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<FunctionDecl.Param> params = parseParamsOpt();
        consume(TokenType.RPAREN, "Expected ')' after parameters");

        BlockStmt body = parseBlock();
        return new FunctionDecl(name.lexeme(), params, body, coroutine, at);
    }

    private List<FunctionDecl.Param> parseParamsOpt() {
        if (check(TokenType.RPAREN)) return List.of();
        List<FunctionDecl.Param> ps = new ArrayList<>();
        do {
            if (match(TokenType.STAR)) {
                Token n = consume(TokenType.IDENTIFIER, "Expected parameter name after '*'");
                ps.add(new FunctionDecl.Param(n.lexeme(), FunctionDecl.ParamKind.REST, null));
            } else if (match(TokenType.DOUBLE_STAR)) {
                Token n = consume(TokenType.IDENTIFIER, "Expected parameter name after '**'");
                ps.add(new FunctionDecl.Param(n.lexeme(), FunctionDecl.ParamKind.KEYWORD_REST, null));
            } else {
                Token n = consume(TokenType.IDENTIFIER, "Expected parameter name");
                Expr def = match(TokenType.ASSIGN) ? parseExpr() : null;
                ps.add(new FunctionDecl.Param(n.lexeme(), FunctionDecl.ParamKind.POSITIONAL, def));
            }
        } while (match(TokenType.COMMA));
        return ps;
    }

    private ContextDecl parseConcurrent() {
        Location at = loc(previous());
        Token name = consume(TokenType.IDENTIFIER, "Expected context name");
        BlockStmt body = parseBlock();
        return new ContextDecl(name.lexeme(), ContextKind.CONCURRENT, null, null, body, at);
    }

    private ContextDecl parseSequential() {
        Location at = loc(previous());
        Token name = consume(TokenType.IDENTIFIER, "Expected context name");

        ContextDecl.ClockSpec clock = null;
        ContextDecl.ResetSpec reset = null;
        if (match(TokenType.LPAREN)) {
            do {
                Token opt = consume(TokenType.IDENTIFIER, "Expected 'clock' or 'reset'");
                switch (opt.lexeme()) {
                    case "clock" -> {
                        if (clock != null) throw error(opt, "Duplicate clock");
                        clock = parseClockSpec();
                    }
                    case "reset" -> {
                        if (reset != null) throw error(opt, "Duplicate reset");
                        reset = parseResetSpec();
                    }
                    default -> throw error(opt, "Expected 'clock' or 'reset'");
                }
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "Expected ')' after context options");
        }

        BlockStmt body = parseBlock();
        return new ContextDecl(name.lexeme(), ContextKind.SEQUENTIAL, clock, reset, body, at);
    }

    private ContextDecl.ClockSpec parseClockSpec() {
        Token sig = consume(TokenType.IDENTIFIER, "Expected clock signal name");
        Clock.Edge edge = Clock.Edge.RISING;
        Long frequency = null;
        while (check(TokenType.IDENTIFIER)) {
            Token w = peek();
            switch (w.lexeme()) {
                case "rising" -> edge = Clock.Edge.RISING;
                case "falling" -> edge = Clock.Edge.FALLING;
                case "both" -> edge = Clock.Edge.BOTH;
                case "freq" -> {
                    advance();
                    frequency = parseIntLiteral(consume(TokenType.INT_LITERAL, "Expected frequency in Hz"));
                    continue;
                }
                default -> throw error(w, "Unknown clock option");
            }
            advance();
        }
        return new ContextDecl.ClockSpec(sig.lexeme(), edge, frequency);
    }

    private ContextDecl.ResetSpec parseResetSpec() {
        Token sig = consume(TokenType.IDENTIFIER, "Expected reset signal name");
        boolean async = false;
        boolean activeLow = false;
        while (true) {
            if (match(TokenType.ASYNC)) {
                async = true;
                continue;
            }
            if (!check(TokenType.IDENTIFIER)) break;
            Token w = advance();
            switch (w.lexeme()) {
                case "sync" -> async = false;
                case "high" -> activeLow = false;
                case "low" -> activeLow = true;
                default -> throw error(w, "Unknown reset option");
            }
        }
        return new ContextDecl.ResetSpec(sig.lexeme(), async, activeLow);
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        Location at = loc(peek());
        consume(TokenType.LBRACE, "Expected '{'");
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            stmts.add(parseStmt());
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new BlockStmt(stmts, at);
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();

        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.WHILE)) return parseWhile();
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.RETURN)) return parseReturn();
        if (match(TokenType.LET)) return parseLet();
        if (match(TokenType.VAR)) return parseVarDecl();
        if (match(TokenType.ASSERT)) return parseAssert();

        if (match(TokenType.BREAK)) {
            Location at = loc(previous());
            consume(TokenType.SEMICOLON, "Expected ';' after break");
            return new BreakStmt(at);
        }
        if (match(TokenType.CONTINUE)) {
            Location at = loc(previous());
            consume(TokenType.SEMICOLON, "Expected ';' after continue");
            return new ContinueStmt(at);
        }
        if (match(TokenType.AWAIT)) {
            Location at = loc(previous());
            Expr awaited = parseExpr();
            consume(TokenType.SEMICOLON, "Expected ';' after await");
            return new AwaitStmt(awaited, at);
        }

        // assignment or expr stmt
        Location at = loc(peek());
        Expr e = parseExpr();
        AssignMode mode = null;
        if (match(TokenType.NEXT_ASSIGN)) mode = AssignMode.NEXT;
        else if (match(TokenType.PUSH_ASSIGN)) mode = AssignMode.PUSH;
        else if (match(TokenType.VALUE_ASSIGN)) mode = AssignMode.VALUE;

        if (mode != null) {
            if (!(e instanceof VarExpr || e instanceof IndexExpr)) {
                throw error(previous(), "Invalid assignment target");
            }
            Expr value = parseExpr();
            consume(TokenType.SEMICOLON, "Expected ';' after assignment");
            return new AssignStmt(e, mode, value, at);
        }
        if (check(TokenType.ASSIGN)) {
            throw error(peek(), "Use 'let' to bind a name, or '<<=', '^=', '@=' to assign storage");
        }
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExprStmt(e, at);
    }

    private LetStmt parseLet() {
        Location at = loc(previous());
        Token name = consume(TokenType.IDENTIFIER, "Expected name after 'let'");
        consume(TokenType.ASSIGN, "Expected '=' after let name");
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after let");
        return new LetStmt(name.lexeme(), value, at);
    }

    private VarDeclStmt parseVarDecl() {
        Location at = loc(previous());
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.COLON, "Expected ':' after variable name");
        TypeRef type = parseTypeRef();

        Expr init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpr();
        }
        consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        return new VarDeclStmt(name.lexeme(), type, init, at);
    }

    private AssertStmt parseAssert() {
        Location at = loc(previous());
        consume(TokenType.LPAREN, "Expected '(' after assert");
        Expr cond = parseExpr();
        String message = null;
        if (match(TokenType.COMMA)) {
            message = consume(TokenType.STRING_LITERAL, "Expected assertion message").lexeme();
        }
        consume(TokenType.RPAREN, "Expected ')'");
        consume(TokenType.SEMICOLON, "Expected ';' after assert");
        return new AssertStmt(cond, message, at);
    }

    private IfStmt parseIf() {
        Location at = loc(previous());
        consume(TokenType.LPAREN, "Expected '(' after if");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        BlockStmt thenB = parseBlock();

        BlockStmt elseB = null;
        if (match(TokenType.ELSE)) {
            // else-if is folded into else { if (...) { ... } }
            if (check(TokenType.IF)) {
                Location elseAt = loc(peek());
                advance();
                Stmt nested = parseIf();
                elseB = new BlockStmt(List.of(nested), elseAt);
            } else {
                elseB = parseBlock();
            }
        }
        return new IfStmt(cond, thenB, elseB, at);
    }

    private WhileStmt parseWhile() {
        Location at = loc(previous());
        consume(TokenType.LPAREN, "Expected '(' after while");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        BlockStmt body = parseBlock();
        return new WhileStmt(cond, body, at);
    }

    private ForStmt parseFor() {
        Location at = loc(previous());
        consume(TokenType.LPAREN, "Expected '(' after for");

        List<String> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expected loop variable").lexeme());
        } while (match(TokenType.COMMA));
        consume(TokenType.IN, "Expected 'in'");
        Expr iterable = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        BlockStmt body = parseBlock();

        BlockStmt fallback = match(TokenType.ELSE) ? parseBlock() : null;
        return new ForStmt(names, iterable, body, fallback, at);
    }

    private ReturnStmt parseReturn() {
        Location at = loc(previous());
        if (check(TokenType.SEMICOLON)) {
            advance();
            return new ReturnStmt(null, at);
        }
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(value, at);
    }

    // ---------- types ----------
    private TypeRef parseTypeRef() {
        Token n = consume(TokenType.IDENTIFIER, "Expected type name");
        if (PRIMITIVE_TYPES.contains(n.lexeme())) return new PrimitiveTypeRef(n.lexeme());
        if (VECTOR_TYPES.contains(n.lexeme())) {
            consume(TokenType.LT, "Expected '<' after " + n.lexeme());
            long width = parseIntLiteral(consume(TokenType.INT_LITERAL, "Expected vector width"));
            consume(TokenType.GT, "Expected '>' after vector width");
            if (width <= 0) throw error(n, "Vector width must be positive");
            return new VectorTypeRef(n.lexeme(), (int) width);
        }
        throw error(n, "Unknown type");
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() {
        Expr e = parseOr();
        if (match(TokenType.RANGE)) {
            Expr to = parseOr();
            return new RangeExpr(e, to);
        }
        return e;
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseBitOr();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseBitOr();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseBitOr() {
        Expr e = parseBitXor();
        while (match(TokenType.PIPE)) {
            Token op = previous();
            Expr r = parseBitXor();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseBitXor() {
        Expr e = parseBitAnd();
        while (match(TokenType.CARET)) {
            Token op = previous();
            Expr r = parseBitAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseBitAnd() {
        Expr e = parseCompare();
        while (match(TokenType.AMP)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseShift();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseShift();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseShift() {
        Expr e = parseAdd();
        while (match(TokenType.SHL, TokenType.SHR)) {
            Token op = previous();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) {
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary());
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary());
        }
        if (match(TokenType.TILDE)) {
            return new UnaryExpr(UnaryExpr.Operator.INV, parseUnary());
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                List<CallExpr.Argument> args = new ArrayList<>();
                if (!check(TokenType.RPAREN)) {
                    do { args.add(parseArgument()); } while (match(TokenType.COMMA));
                }
                consume(TokenType.RPAREN, "Expected ')'");
                e = new CallExpr(e, args);
                continue;
            }
            if (match(TokenType.LBRACKET)) {
                Expr idx = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']'");
                e = new IndexExpr(e, idx);
                continue;
            }
            break;
        }
        return e;
    }

    private CallExpr.Argument parseArgument() {
        if (match(TokenType.STAR)) {
            return new CallExpr.Argument(CallExpr.ArgKind.SPREAD, null, parseExpr());
        }
        if (match(TokenType.DOUBLE_STAR)) {
            return new CallExpr.Argument(CallExpr.ArgKind.KEYWORD_SPREAD, null, parseExpr());
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            String name = advance().lexeme();
            advance(); // '='
            return CallExpr.Argument.keyword(name, parseExpr());
        }
        return CallExpr.Argument.positional(parseExpr());
    }

    private Expr parseListLiteral() {
        consume(TokenType.LBRACKET, "Expected '['");
        List<Expr> elems = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elems.add(parseExpr());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACKET, "Expected ']'");
        return new ListExpr(elems);
    }

    private Expr parsePrimary() {
        if (check(TokenType.LBRACKET)) {
            return parseListLiteral();
        }
        if (match(TokenType.INT_LITERAL)) return new IntLiteral(parseIntLiteral(previous()));
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(previous().lexeme());
        if (match(TokenType.BOOL_LITERAL)) return new BoolLiteral("true".equals(previous().lexeme()));
        if (match(TokenType.IDENTIFIER)) return new VarExpr(previous().lexeme());
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        throw error(peek(), "Expected expression");
    }

    // ---------- helpers ----------
    private long parseIntLiteral(Token t) {
        String text = t.lexeme();
        try {
            if (text.startsWith("0x")) return Long.parseLong(text.substring(2), 16);
            if (text.startsWith("0b")) return Long.parseLong(text.substring(2), 2);
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error(t, "Malformed integer literal");
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private static Location loc(Token t) {
        return new Location(t.line(), t.column());
    }

    private SyntaxException error(Token at, String msg) {
        return new SyntaxException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case SHL -> BinaryExpr.Operator.SHL;
            case SHR -> BinaryExpr.Operator.SHR;

            case AMP   -> BinaryExpr.Operator.BIT_AND;
            case PIPE  -> BinaryExpr.Operator.BIT_OR;
            case CARET -> BinaryExpr.Operator.BIT_XOR;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }

}
