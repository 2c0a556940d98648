package info.isaksson.erland.reacttoangular.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Array destructuring target, e.g. {@code [count, setCount]}. Holes are null elements. */
public final class ArrayPattern extends Expression {
    public final List<Expression> elements;

    public ArrayPattern(SourceRange range, List<Expression> elements) {
        super(range);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override public String type() {
        return "ArrayPattern";
    }

    @Override public List<Node> children() {
        return nodes(elements);
    }
}
