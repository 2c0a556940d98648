package info.isaksson.erland.reacttoangular.ir;

/**
 * Lifecycle mapping of an effect.
 */
public enum IrEffectClassification {
    /** Dependency array present and empty: runs once after creation. */
    ONE_TIME,
    /** Non-empty dependency array, or none at all: runs again when dependencies change. */
    RECURRING
}
