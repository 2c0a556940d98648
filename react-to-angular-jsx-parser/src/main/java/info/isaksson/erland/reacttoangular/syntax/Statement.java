package info.isaksson.erland.reacttoangular.syntax;

public abstract class Statement extends Node {
    protected Statement(SourceRange range) {
        super(range);
    }
}
