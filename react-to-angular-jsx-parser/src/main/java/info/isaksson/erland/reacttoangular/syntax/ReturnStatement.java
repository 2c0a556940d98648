package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class ReturnStatement extends Statement {
    public final Expression argument;

    public ReturnStatement(SourceRange range, Expression argument) {
        super(range);
        this.argument = argument;
    }

    @Override public String type() {
        return "ReturnStatement";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
