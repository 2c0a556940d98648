package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Binary and logical ({@code &&}, {@code ||}, {@code ??}) expressions. */
public final class BinaryExpression extends Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public BinaryExpression(SourceRange range, String operator, Expression left, Expression right) {
        super(range);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public boolean isLogical() {
        return "&&".equals(operator) || "||".equals(operator) || "??".equals(operator);
    }

    @Override public String type() {
        return isLogical() ? "LogicalExpression" : "BinaryExpression";
    }

    @Override public List<Node> children() {
        return nodes(left, right);
    }
}
