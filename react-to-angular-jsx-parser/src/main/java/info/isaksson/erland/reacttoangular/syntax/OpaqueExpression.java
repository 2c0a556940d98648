package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * Expression kept only by its extent (class expressions, tagged templates, object methods). The
 * printer copies its text through {@link Program#textOf(Node)}.
 */
public final class OpaqueExpression extends Expression {

    public OpaqueExpression(SourceRange range) {
        super(range);
    }

    @Override public String type() {
        return "OpaqueExpression";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
