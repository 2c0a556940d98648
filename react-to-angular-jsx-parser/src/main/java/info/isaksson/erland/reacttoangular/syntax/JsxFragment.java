package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

public final class JsxFragment extends Expression {
    public final List<Node> children;

    public JsxFragment(SourceRange range, List<Node> children) {
        super(range);
        this.children = List.copyOf(children);
    }

    @Override public String type() {
        return "JSXFragment";
    }

    @Override public List<Node> children() {
        return children;
    }
}
