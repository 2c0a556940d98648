package info.isaksson.erland.reacttoangular.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Array literal. Holes are kept as null elements. */
public final class ArrayExpression extends Expression {
    public final List<Expression> elements;

    public ArrayExpression(SourceRange range, List<Expression> elements) {
        super(range);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override public String type() {
        return "ArrayExpression";
    }

    @Override public List<Node> children() {
        return nodes(elements);
    }
}
