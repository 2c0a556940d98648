package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class SpreadElement extends Expression {
    public final Expression argument;

    public SpreadElement(SourceRange range, Expression argument) {
        super(range);
        this.argument = argument;
    }

    @Override public String type() {
        return "SpreadElement";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
