package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/**
 * Statement the parser recognises only by its extent (e.g. a class declaration). The text is
 * available through {@link Program#textOf(Node)}.
 */
public final class OpaqueStatement extends Statement {
    public final String keyword;

    public OpaqueStatement(SourceRange range, String keyword) {
        super(range);
        this.keyword = keyword;
    }

    @Override public String type() {
        return "OpaqueStatement";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
