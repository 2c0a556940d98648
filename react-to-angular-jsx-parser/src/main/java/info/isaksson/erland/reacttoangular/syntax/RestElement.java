package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class RestElement extends Expression {
    public final Expression argument;

    public RestElement(SourceRange range, Expression argument) {
        super(range);
        this.argument = argument;
    }

    @Override public String type() {
        return "RestElement";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
