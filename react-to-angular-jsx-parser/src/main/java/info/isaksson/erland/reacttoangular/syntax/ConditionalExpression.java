package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class ConditionalExpression extends Expression {
    public final Expression test;
    public final Expression consequent;
    public final Expression alternate;

    public ConditionalExpression(SourceRange range, Expression test, Expression consequent, Expression alternate) {
        super(range);
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override public String type() {
        return "ConditionalExpression";
    }

    @Override public List<Node> children() {
        return nodes(test, consequent, alternate);
    }
}
