package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * {@code name="literal"}, {@code name={expression}} or a bare {@code name}. The value is a string
 * {@link Literal}, a {@link JsxExpressionContainer}, a JSX element, or null for the bare form.
 */
public final class JsxAttribute extends Node {
    public final String name;
    public final Expression value;

    public JsxAttribute(SourceRange range, String name, Expression value) {
        super(range);
        this.name = name;
        this.value = value;
    }

    /** The contained expression for {@code name={expr}}, otherwise null. */
    public Expression expression() {
        return value instanceof JsxExpressionContainer ? ((JsxExpressionContainer) value).expression : null;
    }

    @Override public String type() {
        return "JSXAttribute";
    }

    @Override public List<Node> children() {
        return nodes(value);
    }
}
