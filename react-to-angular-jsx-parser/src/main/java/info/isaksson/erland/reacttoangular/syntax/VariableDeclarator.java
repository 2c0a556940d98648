package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class VariableDeclarator extends Node {
    /** Binding pattern: {@link Identifier}, {@link ArrayPattern} or {@link ObjectPattern}. */
    public final Expression id;
    public final Expression init;

    public VariableDeclarator(SourceRange range, Expression id, Expression init) {
        super(range);
        this.id = id;
        this.init = init;
    }

    /** Declared name when the target is a plain identifier, otherwise null. */
    public String name() {
        return id instanceof Identifier ? ((Identifier) id).name : null;
    }

    @Override public String type() {
        return "VariableDeclarator";
    }

    @Override public List<Node> children() {
        return nodes(id, init);
    }
}
