package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class SequenceExpression extends Expression {
    public final List<Expression> expressions;

    public SequenceExpression(SourceRange range, List<Expression> expressions) {
        super(range);
        this.expressions = List.copyOf(expressions);
    }

    @Override public String type() {
        return "SequenceExpression";
    }

    @Override public List<Node> children() {
        return nodes(expressions);
    }
}
