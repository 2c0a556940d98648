package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Binding with a default value, e.g. {@code title = "Untitled"}. */
public final class AssignmentPattern extends Expression {
    public final Expression left;
    public final Expression right;

    public AssignmentPattern(SourceRange range, Expression left, Expression right) {
        super(range);
        this.left = left;
        this.right = right;
    }

    @Override public String type() {
        return "AssignmentPattern";
    }

    @Override public List<Node> children() {
        return nodes(left, right);
    }
}
