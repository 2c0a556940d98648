package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * {@code object.property}, {@code object[property]} or the optional-chaining forms. For the
 * non-computed form the property is an {@link Identifier} that is never a variable reference.
 */
public final class MemberExpression extends Expression {
    public final Expression object;
    public final Expression property;
    public final boolean computed;
    public final boolean optional;

    public MemberExpression(SourceRange range, Expression object, Expression property, boolean computed, boolean optional) {
        super(range);
        this.object = object;
        this.property = property;
        this.computed = computed;
        this.optional = optional;
    }

    /** Property name for the non-computed form, otherwise null. */
    public String propertyName() {
        return !computed && property instanceof Identifier ? ((Identifier) property).name : null;
    }

    @Override public String type() {
        return "MemberExpression";
    }

    @Override public List<Node> children() {
        return nodes(object, property);
    }
}
