package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * Literal value. {@link #raw} is the exact source text (quotes included for strings), which is what
 * the printer emits so initializers survive the round trip unchanged. For strings {@link #value}
 * holds the decoded text (escapes resolved, and HTML entities for JSX attribute strings).
 */
public final class Literal extends Expression {

    public enum Kind { STRING, NUMBER, BOOLEAN, NULL, REGEX }

    public final Kind kind;
    public final String raw;
    public final String value;

    public Literal(SourceRange range, Kind kind, String raw) {
        this(range, kind, raw, null);
    }

    public Literal(SourceRange range, Kind kind, String raw, String value) {
        super(range);
        this.kind = kind;
        this.raw = raw;
        this.value = value;
    }

    /** Decoded string value for STRING literals, otherwise the raw text. */
    public String stringValue() {
        if (kind != Kind.STRING) return raw;
        if (value != null) return value;
        return raw.length() < 2 ? raw : raw.substring(1, raw.length() - 1);
    }

    @Override public String type() {
        return "Literal";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
