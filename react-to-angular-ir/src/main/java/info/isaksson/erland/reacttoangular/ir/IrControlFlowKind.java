package info.isaksson.erland.reacttoangular.ir;

public enum IrControlFlowKind {
    NONE,
    REPEAT,
    CONDITIONAL
}
