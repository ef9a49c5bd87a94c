package cosynth.diag;

public enum ErrorKind {
    REDEFINITION("RedefinitionError"),
    INVALID_ASSIGNMENT_MODE("InvalidAssignmentModeError"),
    MULTIPLE_DRIVER("MultipleDriverError"),
    UNSUPPORTED_CONSTRUCT("UnsupportedConstructError"),
    UNBOUNDED_RECURSION("UnboundedRecursionError"),
    INVALID_SUSPENSION_CONTEXT("InvalidSuspensionContextError"),
    UNBOUNDED_DUPLICATION("UnboundedDuplicationError"),
    COMPILE_TIME_ASSERTION("CompileTimeAssertionError"),

    // warning only, never thrown unless strict-temporaries is on
    TEMPORARY_ACROSS_STATES("TemporaryAcrossStates");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
