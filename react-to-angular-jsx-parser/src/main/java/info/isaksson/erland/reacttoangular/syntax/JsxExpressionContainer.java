package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** {@code {expression}} inside JSX; the expression is null for {@code {}} and comment-only containers. */
public final class JsxExpressionContainer extends Expression {
    public final Expression expression;

    public JsxExpressionContainer(SourceRange range, Expression expression) {
        super(range);
        this.expression = expression;
    }

    public boolean isEmpty() {
        return expression == null;
    }

    @Override public String type() {
        return "JSXExpressionContainer";
    }

    @Override public List<Node> children() {
        return nodes(expression);
    }
}
