package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class JsxSpreadAttribute extends Node {
    public final Expression argument;

    public JsxSpreadAttribute(SourceRange range, Expression argument) {
        super(range);
        this.argument = argument;
    }

    @Override public String type() {
        return "JSXSpreadAttribute";
    }

    @Override public List<Node> children() {
        return nodes(argument);
    }
}
