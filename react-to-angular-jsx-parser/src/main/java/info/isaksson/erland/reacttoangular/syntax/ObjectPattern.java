package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Object destructuring target; members are {@link Property} (value is the sub-pattern) or {@link RestElement}. */
public final class ObjectPattern extends Expression {
    public final List<Node> properties;

    public ObjectPattern(SourceRange range, List<Node> properties) {
        super(range);
        this.properties = List.copyOf(properties);
    }

    @Override public String type() {
        return "ObjectPattern";
    }

    @Override public List<Node> children() {
        return properties;
    }
}
