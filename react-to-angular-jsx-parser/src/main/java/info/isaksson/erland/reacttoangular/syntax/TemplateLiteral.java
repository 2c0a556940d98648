package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Template literal: {@code quasis.size() == expressions.size() + 1}; quasis are raw text. */
public final class TemplateLiteral extends Expression {
    public final List<String> quasis;
    public final List<Expression> expressions;

    public TemplateLiteral(SourceRange range, List<String> quasis, List<Expression> expressions) {
        super(range);
        this.quasis = List.copyOf(quasis);
        this.expressions = List.copyOf(expressions);
    }

    @Override public String type() {
        return "TemplateLiteral";
    }

    @Override public List<Node> children() {
        return nodes(expressions);
    }
}
