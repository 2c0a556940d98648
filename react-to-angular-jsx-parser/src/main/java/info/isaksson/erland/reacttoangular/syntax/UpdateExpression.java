package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class UpdateExpression extends Expression {
    public final String operator;
    public final boolean prefix;
    public final Expression argument;

    public UpdateExpression(SourceRange range, String operator, boolean prefix, Expression argument) {
        super(range);
        this.operator = operator;
        this.prefix = prefix;
        this.argument = argument;
    }

    @Override public String type() {
        return "UpdateExpression";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
