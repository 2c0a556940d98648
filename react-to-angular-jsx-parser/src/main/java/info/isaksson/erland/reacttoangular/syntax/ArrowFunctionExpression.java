package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Arrow function; {@link #body} is a {@link BlockStatement} or an {@link Expression}. */
public final class ArrowFunctionExpression extends Expression {
    public final List<Expression> params;
    public final Node body;
    public final boolean async;

    public ArrowFunctionExpression(SourceRange range, List<Expression> params, Node body, boolean async) {
        super(range);
        this.params = List.copyOf(params);
        this.body = body;
        this.async = async;
    }

    public boolean hasExpressionBody() {
        return body instanceof Expression;
    }

    @Override public String type() {
        return "ArrowFunctionExpression";
    }

    @Override public List<Node> children() {
        return nodes(params, body);
    }
}
