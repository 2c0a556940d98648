package info.isaksson.erland.reacttoangular.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class of the ESTree-shaped syntax tree produced by the parser.
 *
 * <p>Nodes are immutable. {@link #type()} returns the ESTree node type name so that diagnostics
 * read the same as for other JavaScript tooling.</p>
 */
public abstract class Node {

    public final SourceRange range;

    protected Node(SourceRange range) {
        this.range = range == null ? SourceRange.NONE : range;
    }

    public abstract String type();

    /** Direct child nodes in source order (null children are skipped). */
    public abstract List<Node> children();

    protected static List<Node> nodes(Object... parts) {
        List<Node> out = new ArrayList<>();
        for (Object p : parts) {
            if (p == null) continue;
            if (p instanceof Node) {
                out.add((Node) p);
            } else if (p instanceof List) {
                for (Object o : (List<?>) p) {
                    if (o instanceof Node) out.add((Node) o);
                }
            }
        }
        return out;
    }

    @Override public String toString() {
        return type() + "@" + range;
    }
}
