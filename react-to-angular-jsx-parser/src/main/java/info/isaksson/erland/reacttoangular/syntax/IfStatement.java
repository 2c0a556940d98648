package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class IfStatement extends Statement {
    public final Expression test;
    public final Statement consequent;
    public final Statement alternate;

    public IfStatement(SourceRange range, Expression test, Statement consequent, Statement alternate) {
        super(range);
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override public String type() {
        return "IfStatement";
    }

    @Override public List<Node> children() {
        return nodes(test, consequent, alternate);
    }
}
