package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class BlockStatement extends Statement {
    public final List<Statement> body;

    public BlockStatement(SourceRange range, List<Statement> body) {
        super(range);
        this.body = List.copyOf(body);
    }

    @Override public String type() {
        return "BlockStatement";
    }

    @Override public List<Node> children() {
        return nodes(body);
    }
}
