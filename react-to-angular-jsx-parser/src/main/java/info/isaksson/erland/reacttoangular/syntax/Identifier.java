package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Identifier reference or binding; {@code this} is represented as an identifier named "this". */
public final class Identifier extends Expression {
    public final String name;

    public Identifier(SourceRange range, String name) {
        super(range);
        this.name = name;
    }

    public boolean isThis() {
        return "this".equals(name);
    }

    @Override public String type() {
        return isThis() ? "ThisExpression" : "Identifier";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
