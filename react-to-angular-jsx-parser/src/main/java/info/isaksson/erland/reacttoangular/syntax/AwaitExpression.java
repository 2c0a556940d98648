package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class AwaitExpression extends Expression {
    public final Expression argument;

    public AwaitExpression(SourceRange range, Expression argument) {
        super(range);
        this.argument = argument;
    }

    @Override public String type() {
        return "AwaitExpression";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
