package cosynth.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    STRING_LITERAL,
    BOOL_LITERAL,

    // declarations
    PORT,
    SIGNAL,
    CONST,
    FN,
    ASYNC,
    CONCURRENT,
    SEQUENTIAL,

    // statements
    IF,
    ELSE,
    WHILE,
    FOR,
    IN,
    BREAK,
    CONTINUE,
    RETURN,
    ASSERT,
    AWAIT,
    LET,
    VAR,

    // operators
    PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, PERCENT,
    ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    SHL, SHR,
    AMP, PIPE, CARET, TILDE,
    AND, OR, NOT,

    // assignment modes
    NEXT_ASSIGN,   // <<=
    PUSH_ASSIGN,   // ^=
    VALUE_ASSIGN,  // @=

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, SEMICOLON, COMMA,
    DOT, RANGE,

    EOF
}
