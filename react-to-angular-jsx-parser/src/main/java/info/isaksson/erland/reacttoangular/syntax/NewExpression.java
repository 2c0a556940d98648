package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class NewExpression extends Expression {
    public final Expression callee;
    public final List<Expression> arguments;

    public NewExpression(SourceRange range, Expression callee, List<Expression> arguments) {
        super(range);
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
    }

    @Override public String type() {
        return "NewExpression";
    }

    @Override public List<Node> children() {
        return nodes(callee, arguments);
    }
}
