package cosynth.diag;

/**
 * Fatal error of one context's compilation. Thrown by any pass, caught once per
 * context by the orchestrator.
 */
public class CompileException extends RuntimeException {
    private final ErrorKind kind;
    private final Location location;

    public CompileException(ErrorKind kind, Location location, String message) {
        super(message);
        this.kind = kind;
        this.location = location == null ? Location.UNKNOWN : location;
    }

    public ErrorKind kind() {
        return kind;
    }

    public Location location() {
        return location;
    }

    @Override
    public String toString() {
        return "[" + location + "] " + kind + ": " + getMessage();
    }
}
