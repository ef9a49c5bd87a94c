package cosynth.diag;

public record Diagnostic(
        Severity severity,
        ErrorKind kind,
        String context,      // null for design-level diagnostics
        Location location,
        String message
) {
    public enum Severity { WARNING, ERROR }

    public static Diagnostic error(String context, CompileException e) {
        return new Diagnostic(Severity.ERROR, e.kind(), context, e.location(), e.getMessage());
    }

    public static Diagnostic warning(ErrorKind kind, String context, Location location, String message) {
        return new Diagnostic(Severity.WARNING, kind, context, location, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String where = context == null ? "" : " in '" + context + "'";
        return "[" + location + "] " + severity.name().toLowerCase() + where + ": " + kind + ": " + message;
    }
}
