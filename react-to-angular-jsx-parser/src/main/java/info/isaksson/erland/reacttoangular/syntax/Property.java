package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * Object literal member. {@code kind} is "init", "get" or "set"; methods carry a
 * {@link FunctionExpression} value and {@code method == true}.
 */
public final class Property extends Node {
    public final Expression key;
    public final Expression value;
    public final boolean computed;
    public final boolean shorthand;
    public final boolean method;
    public final String kind;

    public Property(SourceRange range, Expression key, Expression value, boolean computed, boolean shorthand, boolean method, String kind) {
        super(range);
        this.key = key;
        this.value = value;
        this.computed = computed;
        this.shorthand = shorthand;
        this.method = method;
        this.kind = kind == null ? "init" : kind;
    }

    @Override public String type() {
        return "Property";
    }

    @Override public List<Node> children() {
        return nodes(key, value);
    }
}
