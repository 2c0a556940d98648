package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Classic {@code for (init; test; update)} loop; init is a declaration, an expression or null. */
public final class ForStatement extends Statement {
    public final Node init;
    public final Expression test;
    public final Expression update;
    public final Statement body;

    public ForStatement(SourceRange range, Node init, Expression test, Expression update, Statement body) {
        super(range);
        this.init = init;
        this.test = test;
        this.update = update;
        this.body = body;
    }

    @Override public String type() {
        return "ForStatement";
    }

    @Override public List<Node> children() {
        return nodes(init, test, update, body);
    }
}
