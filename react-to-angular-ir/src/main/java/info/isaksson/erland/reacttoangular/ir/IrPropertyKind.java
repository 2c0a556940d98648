package info.isaksson.erland.reacttoangular.ir;

/**
 * Kinds of class properties that are not state bindings.
 */
public enum IrPropertyKind {
    /** Component input, rendered with {@code @Input()}. */
    INPUT,
    /** Mutable ref box from {@code useRef}, initialised to {@code { current: v }}. */
    REF,
    /** Local shared between an effect setup and its cleanup, hoisted to a field. */
    EFFECT_HANDLE
}
