package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class FunctionExpression extends Expression {
    /** Optional function name (null for anonymous functions). */
    public final String id;
    public final List<Expression> params;
    public final BlockStatement body;
    public final boolean async;

    public FunctionExpression(SourceRange range, String id, List<Expression> params, BlockStatement body, boolean async) {
        super(range);
        this.id = id;
        this.params = List.copyOf(params);
        this.body = body;
        this.async = async;
    }

    @Override public String type() {
        return "FunctionExpression";
    }

    @Override public List<Node> children() {
        return nodes(params, body);
    }
}
