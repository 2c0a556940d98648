package info.isaksson.erland.reacttoangular.ir;

public enum IrTemplateNodeKind {
    ELEMENT,
    TEXT,
    INTERPOLATION,
    /** Grouping without its own element ({@code ng-container}). */
    CONTAINER
}
