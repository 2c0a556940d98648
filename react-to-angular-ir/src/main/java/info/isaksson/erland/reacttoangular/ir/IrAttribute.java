package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Template attribute. For {@link IrAttributeKind#TWO_WAY} the value is the bound state name.
 */
@JsonPropertyOrder({"name","kind","value"})
public final class IrAttribute {
    public final String name;
    public final IrAttributeKind kind;
    /** Null only for boolean STATIC attributes such as {@code disabled}. */
    public final String value;

    @JsonCreator
    public IrAttribute(
            @JsonProperty("name") String name,
            @JsonProperty("kind") IrAttributeKind kind,
            @JsonProperty("value") String value
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("attribute name is required");
        this.name = name;
        this.kind = kind == null ? IrAttributeKind.STATIC : kind;
        if (this.kind != IrAttributeKind.STATIC && (value == null || value.isBlank())) {
            throw new IllegalArgumentException(this.kind + " attribute '" + name + "' needs a value");
        }
        this.value = value;
    }

    public static IrAttribute staticValue(String name, String value) {
        return new IrAttribute(name, IrAttributeKind.STATIC, value);
    }

    public static IrAttribute property(String name, String expression) {
        return new IrAttribute(name, IrAttributeKind.PROPERTY, expression);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrAttribute)) return false;
        IrAttribute that = (IrAttribute) o;
        return Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(name, kind, value);
    }
}
