package cosynth.diag;

/**
 * Source position supplied by the front end. Opaque to the passes: they only
 * carry it from the statement tree into diagnostics.
 */
public record Location(int line, int column) implements Comparable<Location> {

    public static final Location UNKNOWN = new Location(0, 0);

    @Override
    public int compareTo(Location o) {
        int c = Integer.compare(line, o.line);
        return c != 0 ? c : Integer.compare(column, o.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
