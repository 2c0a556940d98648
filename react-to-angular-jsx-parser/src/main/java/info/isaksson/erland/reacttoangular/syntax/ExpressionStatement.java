package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class ExpressionStatement extends Statement {
    public final Expression expression;

    public ExpressionStatement(SourceRange range, Expression expression) {
        super(range);
        this.expression = expression;
    }

    @Override public String type() {
        return "ExpressionStatement";
    }

    @Override public List<Node> children() {
        return nodes(expression);
    }
}
