package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class FunctionDeclaration extends Statement {
    public final String id;
    public final List<Expression> params;
    public final BlockStatement body;
    public final boolean async;

    public FunctionDeclaration(SourceRange range, String id, List<Expression> params, BlockStatement body, boolean async) {
        super(range);
        this.id = id;
        this.params = List.copyOf(params);
        this.body = body;
        this.async = async;
    }

    @Override public String type() {
        return "FunctionDeclaration";
    }

    @Override public List<Node> children() {
        return nodes(params, body);
    }
}
