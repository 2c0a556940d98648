package info.isaksson.erland.reacttoangular.ir;

/**
 * How an event handler was resolved.
 */
public enum IrEventKind {
    DIRECT_CALL,
    SETTER_CALL,
    INLINE_EXPRESSION
}
