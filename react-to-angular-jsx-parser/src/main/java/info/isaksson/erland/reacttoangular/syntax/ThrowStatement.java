package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class ThrowStatement extends Statement {
    public final Expression argument;

    public ThrowStatement(SourceRange range, Expression argument) {
        super(range);
        this.argument = argument;
    }

    @Override public String type() {
        return "ThrowStatement";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
