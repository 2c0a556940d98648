package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class AssignmentExpression extends Expression {
    public final String operator;
    public final Expression target;
    public final Expression value;

    public AssignmentExpression(SourceRange range, String operator, Expression target, Expression value) {
        super(range);
        this.operator = operator;
        this.target = target;
        this.value = value;
    }

    @Override public String type() {
        return "AssignmentExpression";
    }

    @Override public List<Node> children() {
        return nodes(target, value);
    }
}
