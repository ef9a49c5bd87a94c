package cosynth.lexer;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("port", TokenType.PORT),
            Map.entry("signal", TokenType.SIGNAL),
            Map.entry("const", TokenType.CONST),
            Map.entry("fn", TokenType.FN),
            Map.entry("async", TokenType.ASYNC),
            Map.entry("concurrent", TokenType.CONCURRENT),
            Map.entry("sequential", TokenType.SEQUENTIAL),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("assert", TokenType.ASSERT),
            Map.entry("await", TokenType.AWAIT),
            Map.entry("let", TokenType.LET),
            Map.entry("var", TokenType.VAR),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '+' -> add(TokenType.PLUS, "+", startLine, startCol);
                case '-' -> add(TokenType.MINUS, "-", startLine, startCol);
                case '%' -> add(TokenType.PERCENT, "%", startLine, startCol);
                case '~' -> add(TokenType.TILDE, "~", startLine, startCol);

                case '*' -> {
                    boolean dbl = match('*');
                    add(dbl ? TokenType.DOUBLE_STAR : TokenType.STAR, dbl ? "**" : "*", startLine, startCol);
                }

                case '=' -> {
                    boolean eq = match('=');
                    add(eq ? TokenType.EQ : TokenType.ASSIGN, eq ? "==" : "=", startLine, startCol);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NEQ : TokenType.NOT, neq ? "!=" : "!", startLine, startCol);
                }

                case '<' -> {
                    if (match('<')) {
                        boolean next = match('=');
                        add(next ? TokenType.NEXT_ASSIGN : TokenType.SHL, next ? "<<=" : "<<", startLine, startCol);
                    } else {
                        boolean le = match('=');
                        add(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", startLine, startCol);
                    }
                }

                case '>' -> {
                    if (match('>')) {
                        add(TokenType.SHR, ">>", startLine, startCol);
                    } else {
                        boolean ge = match('=');
                        add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
                    }
                }

                case '^' -> {
                    boolean push = match('=');
                    add(push ? TokenType.PUSH_ASSIGN : TokenType.CARET, push ? "^=" : "^", startLine, startCol);
                }

                case '@' -> {
                    if (match('=')) add(TokenType.VALUE_ASSIGN, "@=", startLine, startCol);
                    else error("Unexpected '@'");
                }

                case '&' -> {
                    boolean and = match('&');
                    add(and ? TokenType.AND : TokenType.AMP, and ? "&&" : "&", startLine, startCol);
                }

                case '|' -> {
                    boolean or = match('|');
                    add(or ? TokenType.OR : TokenType.PIPE, or ? "||" : "|", startLine, startCol);
                }

                case '/' -> {
                    if (match('/')) {
                        skipComment();
                    } else {
                        add(TokenType.SLASH, "/", startLine, startCol);
                    }
                }

                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ':' -> add(TokenType.COLON, ":", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);

                case '.' -> {
                    if (peek() == '.' && peekNext() == '.') {
                        advance();
                        advance();
                        add(TokenType.RANGE, "...", startLine, startCol);
                    } else {
                        add(TokenType.DOT, ".", startLine, startCol);
                    }
                }

                case '"' -> stringLiteral(startLine, startCol);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else error("Unexpected character: " + c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        // 0x.. / 0b.. keep their prefix, the parser decodes the radix
        boolean hex = false;
        if (first == '0' && (peek() == 'x' || peek() == 'b')) {
            hex = peek() == 'x';
            sb.append(advance());
            if (!isHexDigit(peek())) error("Malformed number literal: " + sb);
        }

        while (!isAtEnd() && ((hex ? isHexDigit(peek()) : isDigit(peek())) || peek() == '_')) {
            char c = advance();
            if (c != '_') sb.append(c);
        }

        add(TokenType.INT_LITERAL, sb.toString(), line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line, col);
    }

    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') error("Unterminated string");
            sb.append(c);
        }

        if (isAtEnd()) error("Unterminated string");

        advance(); // closing "
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String message) {
        throw new LexerException("[" + line + ":" + col + "] " + message);
    }
}
