package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * Explicit parentheses from the source. Kept in the tree so printing reproduces the author's
 * grouping without a precedence table.
 */
public final class ParenthesizedExpression extends Expression {
    public final Expression expression;

    public ParenthesizedExpression(SourceRange range, Expression expression) {
        super(range);
        this.expression = expression;
    }

    /** Strips any number of enclosing parentheses. */
    public static Expression unwrap(Expression e) {
        Expression cur = e;
        while (cur instanceof ParenthesizedExpression) {
            cur = ((ParenthesizedExpression) cur).expression;
        }
        return cur;
    }

    @Override public String type() {
        return "ParenthesizedExpression";
    }

    @Override public List<Node> children() {
        return nodes(expression);
    }
}
