package info.isaksson.erland.reacttoangular.syntax;

import java.util.Objects;

/**
 * Half-open character range {@code [start, end)} into the parsed source, plus the 1-based
 * line/column of {@code start}.
 */
public final class SourceRange {

    public static final SourceRange NONE = new SourceRange(0, 0, 0, 0);

    public final int start;
    public final int end;
    public final int line;
    public final int column;

    public SourceRange(int start, int end, int line, int column) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    /** Covering range from the start of {@code first} to the end of {@code last}. */
    public static SourceRange span(SourceRange first, SourceRange last) {
        if (first == null || !first.isKnown()) return last == null ? NONE : last;
        if (last == null || !last.isKnown()) return first;
        return new SourceRange(first.start, Math.max(first.end, last.end), first.line, first.column);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange that = (SourceRange) o;
        return start == that.start && end == that.end && line == that.line && column == that.column;
    }

    @Override public int hashCode() {
        return Objects.hash(start, end, line, column);
    }

    @Override public String toString() {
        return line + ":" + column;
    }
}
