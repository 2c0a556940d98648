package info.isaksson.erland.reacttoangular.ir;

public enum IrAttributeKind {
    /** {@code name="literal"} */
    STATIC,
    /** {@code [name]="expr"} */
    PROPERTY,
    /** {@code name="text {{ expr }}"} */
    INTERPOLATED,
    /** {@code [(ngModel)]="state"} */
    TWO_WAY
}
