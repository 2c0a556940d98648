package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class EmptyStatement extends Statement {
    public EmptyStatement(SourceRange range) {
        super(range);
    }

    @Override public String type() {
        return "EmptyStatement";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
