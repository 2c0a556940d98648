package info.isaksson.erland.reacttoangular.parse;

/**
 * Malformed input. Raised by the parser before any rewrite pass runs; the pipeline writes no output
 * when it sees one.
 */
public class ParseError extends Exception {

    private final int line;
    private final int column;

    public ParseError(String message, int line, int column) {
        this(message, line, column, null);
    }

    public ParseError(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** {@code line:column: message}, or only the message when no location is known. */
    public String describe() {
        if (line <= 0) return getMessage();
        return line + ":" + column + ": " + getMessage();
    }
}
