package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** {@code while} loop, or {@code do ... while} when {@link #doWhile} is set. */
public final class WhileStatement extends Statement {
    public final Expression test;
    public final Statement body;
    public final boolean doWhile;

    public WhileStatement(SourceRange range, Expression test, Statement body, boolean doWhile) {
        super(range);
        this.test = test;
        this.body = body;
        this.doWhile = doWhile;
    }

    @Override public String type() {
        return doWhile ? "DoWhileStatement" : "WhileStatement";
    }

    @Override public List<Node> children() {
        return nodes(test, body);
    }
}
