package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** {@code for (left of right)} when {@link #of} is true, otherwise {@code for (left in right)}. */
public final class ForInOfStatement extends Statement {
    public final Node left;
    public final Expression right;
    public final Statement body;
    public final boolean of;

    public ForInOfStatement(SourceRange range, Node left, Expression right, Statement body, boolean of) {
        super(range);
        this.left = left;
        this.right = right;
        this.body = body;
        this.of = of;
    }

    @Override public String type() {
        return of ? "ForOfStatement" : "ForInStatement";
    }

    @Override public List<Node> children() {
        return nodes(left, right, body);
    }
}
