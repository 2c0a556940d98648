package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** Root of a parsed module. Keeps the source text so unsupported constructs can be copied verbatim. */
public final class Program extends Node {
    public final List<Statement> body;
    public final String source;

    public Program(SourceRange range, List<Statement> body, String source) {
        super(range);
        this.body = List.copyOf(body);
        this.source = source == null ? "" : source;
    }

    /** Exact source text covered by {@code node}. */
    public String textOf(Node node) {
        if (node == null || !node.range.isKnown()) return "";
        int start = Math.max(0, node.range.start);
        int end = Math.min(source.length(), node.range.end);
        return start >= end ? "" : source.substring(start, end);
    }

    @Override public String type() {
        return "Program";
    }

    @Override public List<Node> children() {
        return nodes(body);
    }
}
