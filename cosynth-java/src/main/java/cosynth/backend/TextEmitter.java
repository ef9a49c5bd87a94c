package cosynth.backend;

import java.io.PrintWriter;
import java.io.Writer;

/**
 * Line-oriented writer with an indentation level.
 */
public class TextEmitter {
    private final PrintWriter writer;
    private int indentation;
    private int lines;

    public TextEmitter(Writer out) {
        this.writer = new PrintWriter(out);
    }

    public void increaseIndentation() {
        indentation++;
    }

    public void decreaseIndentation() {
        if (indentation == 0) throw new IllegalStateException("Indentation below zero");
        indentation--;
    }

    public void emit(String format, Object... values) {
        if (!format.isEmpty()) {
            int indentation = this.indentation;
            while (indentation > 0) {
                writer.print("  ");
                indentation--;
            }
            writer.printf(format, values);
        }
        writer.println();
        lines++;
    }

    public void emitNewLine() {
        emit("");
    }

    public void emitBlockComment(String text) {
        emit("-- --------------------------------------------------------------------------");
        emit("-- %s", text);
        emit("-- --------------------------------------------------------------------------");
    }

    /** Number of lines written so far. */
    public int lines() {
        return lines;
    }

    public void flush() {
        writer.flush();
    }
}
