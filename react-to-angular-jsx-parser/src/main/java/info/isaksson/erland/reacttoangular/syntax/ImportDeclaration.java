package info.isaksson.erland.reacttoangular.syntax;

import java.util.List;

/** {@code import ... from 'source'} or a side-effect import {@code import 'source'}. */
public final class ImportDeclaration extends Statement {
    /** Module specifier without quotes. */
    public final String source;
    /** Local names bound by the import (default, named and namespace). */
    public final List<String> localNames;

    public ImportDeclaration(SourceRange range, String source, List<String> localNames) {
        super(range);
        this.source = source;
        this.localNames = List.copyOf(localNames);
    }

    public boolean isSideEffectOnly() {
        return localNames.isEmpty();
    }

    @Override public String type() {
        return "ImportDeclaration";
    }

    @Override public List<Node> children() {
        return List.of();
    }
}
