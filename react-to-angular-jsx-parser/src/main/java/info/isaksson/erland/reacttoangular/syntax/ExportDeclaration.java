package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * {@code export default <declaration|expression>} or {@code export <declaration>}. For
 * {@code export { a, b }} lists the declaration is null.
 */
public final class ExportDeclaration extends Statement {
    public final boolean isDefault;
    public final Node declaration;

    public ExportDeclaration(SourceRange range, boolean isDefault, Node declaration) {
        super(range);
        this.isDefault = isDefault;
        this.declaration = declaration;
    }

    @Override public String type() {
        return isDefault ? "ExportDefaultDeclaration" : "ExportNamedDeclaration";
    }

    @Override public List<Node> children() {
        return nodes(declaration);
    }
}
