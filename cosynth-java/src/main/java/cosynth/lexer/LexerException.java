package cosynth.lexer;

import cosynth.diag.SyntaxException;

public class LexerException extends SyntaxException {
    public LexerException(String message) {
        super(message);
    }
}
