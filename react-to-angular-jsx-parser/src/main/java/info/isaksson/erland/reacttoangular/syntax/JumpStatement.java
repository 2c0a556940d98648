package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** {@code break} or {@code continue}, with an optional label. */
public final class JumpStatement extends Statement {
    public final String keyword;
    public final String label;

    public JumpStatement(SourceRange range, String keyword, String label) {
        super(range);
        this.keyword = keyword;
        this.label = label;
    }

    @Override public String type() {
        return "break".equals(keyword) ? "BreakStatement" : "ContinueStatement";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
