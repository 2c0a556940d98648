package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Object literal; members are {@link Property} or {@link SpreadElement}. */
public final class ObjectExpression extends Expression {
    public final List<Node> properties;

    public ObjectExpression(SourceRange range, List<Node> properties) {
        super(range);
        this.properties = List.copyOf(properties);
    }

    @Override public String type() {
        return "ObjectExpression";
    }

    @Override public List<Node> children() {
        return properties;
    }
}
