package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class UnaryExpression extends Expression {
    public final String operator;
    public final Expression argument;

    public UnaryExpression(SourceRange range, String operator, Expression argument) {
        super(range);
        this.operator = operator;
        this.argument = argument;
    }

    @Override public String type() {
        return "UnaryExpression";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
