package cosynth.diag;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Warnings and errors collected over one compilation, in report order.
 */
public final class Diagnostics {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(Diagnostic d) {
        if (d.isError()) {
            logger.atFine().log("%s", d);
        } else {
            logger.atWarning().log("%s", d);
        }
        entries.add(d);
    }

    public void error(String context, CompileException e) {
        report(Diagnostic.error(context, e));
    }

    public void warning(ErrorKind kind, String context, Location location, String message) {
        report(Diagnostic.warning(kind, context, location, message));
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return entries.stream().filter(Diagnostic::isError).collect(ImmutableList.toImmutableList());
    }

    public List<Diagnostic> warnings() {
        return entries.stream().filter(d -> !d.isError()).collect(ImmutableList.toImmutableList());
    }

    public List<Diagnostic> all() {
        return ImmutableList.copyOf(entries);
    }

    /** All entries ordered by source position, for printing. */
    public List<Diagnostic> sorted() {
        List<Diagnostic> copy = new ArrayList<>(entries);
        copy.sort(Comparator.comparing(Diagnostic::location));
        return copy;
    }
}
