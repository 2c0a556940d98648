package info.isaksson.erland.reacttoangular.rules;

import java.util.Objects;

/** A construct outside the supported pattern set; it is passed through untransformed. */
public final class UnsupportedConstructWarning {

    public static final String UNSUPPORTED_HOOK = "UNSUPPORTED_HOOK";
    public static final String UNSUPPORTED_STATEMENT = "UNSUPPORTED_STATEMENT";
    public static final String UNSUPPORTED_PATTERN = "UNSUPPORTED_PATTERN";
    public static final String UNSUPPORTED_ATTRIBUTE = "UNSUPPORTED_ATTRIBUTE";
    public static final String UNSUPPORTED_EFFECT = "UNSUPPORTED_EFFECT";
    /** A side-effect stylesheet import whose file could not be found next to the input. */
    public static final String MISSING_STYLESHEET = "MISSING_STYLESHEET";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** 1-based source line, 0 when unknown. */
    public final int line;
    public final int column;

    public UnsupportedConstructWarning(String code, String message, int line, int column) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    /** {@code line:column: [CODE] message}. */
    public String describe() {
        String where = line > 0 ? line + ":" + column + ": " : "";
        return where + "[" + code + "] " + message;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnsupportedConstructWarning)) return false;
        UnsupportedConstructWarning that = (UnsupportedConstructWarning) o;
        return line == that.line && column == that.column &&
                code.equals(that.code) && message.equals(that.message);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, line, column);
    }

    @Override public String toString() {
        return describe();
    }
}
