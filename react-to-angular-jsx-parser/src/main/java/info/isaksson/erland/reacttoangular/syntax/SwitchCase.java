package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** One {@code case test:} (or {@code default:} when test is null) with its statements. */
public final class SwitchCase extends Node {
    public final Expression test;
    public final List<Statement> consequent;

    public SwitchCase(SourceRange range, Expression test, List<Statement> consequent) {
        super(range);
        this.test = test;
        this.consequent = List.copyOf(consequent);
    }

    @Override public String type() {
        return "SwitchCase";
    }

    @Override public List<Node> children() {
        return nodes(test, consequent);
    }
}
