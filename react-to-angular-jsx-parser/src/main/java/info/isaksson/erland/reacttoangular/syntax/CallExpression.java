package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class CallExpression extends Expression {
    public final Expression callee;
    public final List<Expression> arguments;
    public final boolean optional;

    public CallExpression(SourceRange range, Expression callee, List<Expression> arguments, boolean optional) {
        super(range);
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
        this.optional = optional;
    }

    /** Callee name when the callee is a plain identifier, otherwise null. */
    public String calleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).name : null;
    }

    @Override public String type() {
        return "CallExpression";
    }

    @Override public List<Node> children() {
        return nodes(callee, arguments);
    }
}
