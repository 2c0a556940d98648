package info.isaksson.erland.reacttoangular.ir;

public enum IrMethodKind {
    /** Local function or {@code useCallback} in the component body. */
    DECLARED,
    /** Derived value ({@code useMemo}, derived constants), rendered as a {@code get} accessor. */
    GETTER,
    /** Handler synthesised by the event pass. */
    GENERATED_HANDLER
}
