package info.isaksson.erland.reacttoangular.syntax;

/** Expressions, binding patterns and JSX nodes. */
public abstract class Expression extends Node {
    protected Expression(SourceRange range) {
        super(range);
    }
}
