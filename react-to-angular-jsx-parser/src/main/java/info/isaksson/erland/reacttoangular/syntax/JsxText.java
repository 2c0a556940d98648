package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Raw text between JSX tags, whitespace preserved. */
public final class JsxText extends Expression {
    public final String value;

    public JsxText(SourceRange range, String value) {
        super(range);
        this.value = value;
    }

    public boolean isBlank() {
        return value.isBlank();
    }

    @Override public String type() {
        return "JSXText";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
