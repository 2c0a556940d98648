package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class VariableDeclaration extends Statement {
    /** {@code const}, {@code let} or {@code var}. */
    public final String kind;
    public final List<VariableDeclarator> declarations;

    public VariableDeclaration(SourceRange range, String kind, List<VariableDeclarator> declarations) {
        super(range);
        this.kind = kind;
        this.declarations = List.copyOf(declarations);
    }

    @Override public String type() {
        return "VariableDeclaration";
    }

    @Override public List<Node> children() {
        return nodes(declarations);
    }
}
