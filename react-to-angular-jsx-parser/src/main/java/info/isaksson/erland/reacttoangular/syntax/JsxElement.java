package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** {@code <name attr...>children</name>} or the self-closing form. */
public final class JsxElement extends Expression {
    /** Element name as written, e.g. {@code div}, {@code TodoItem}, {@code Foo.Bar}. */
    public final String name;
    /** {@link JsxAttribute} or {@link JsxSpreadAttribute}. */
    public final List<Node> attributes;
    public final List<Node> children;
    public final boolean selfClosing;

    public JsxElement(SourceRange range, String name, List<Node> attributes, List<Node> children, boolean selfClosing) {
        super(range);
        this.name = name;
        this.attributes = List.copyOf(attributes);
        this.children = List.copyOf(children);
        this.selfClosing = selfClosing;
    }

    public JsxAttribute attribute(String attrName) {
        for (Node n : attributes) {
            if (n instanceof JsxAttribute && ((JsxAttribute) n).name.equals(attrName)) return (JsxAttribute) n;
        }
        return null;
    }

    @Override public String type() {
        return "JSXElement";
    }

    @Override public List<Node> children() {
        return nodes(attributes, children);
    }
}
