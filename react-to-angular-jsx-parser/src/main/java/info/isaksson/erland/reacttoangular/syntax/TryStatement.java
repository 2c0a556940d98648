package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class TryStatement extends Statement {
    public final BlockStatement block;
    /** Catch binding, null for {@code catch {}} or when there is no handler. */
    public final Expression param;
    public final BlockStatement handler;
    public final BlockStatement finalizer;

    public TryStatement(SourceRange range, BlockStatement block, Expression param, BlockStatement handler, BlockStatement finalizer) {
        super(range);
        this.block = block;
        this.param = param;
        this.handler = handler;
        this.finalizer = finalizer;
    }

    @Override public String type() {
        return "TryStatement";
    }

    @Override public List<Node> children() {
        return nodes(block, param, handler, finalizer);
    }
}
