package cosynth.diag;

/**
 * Malformed design source. Messages carry a {@code [line:col]} prefix.
 */
public class SyntaxException extends RuntimeException {
    public SyntaxException(String message) {
        super(message);
    }
}
