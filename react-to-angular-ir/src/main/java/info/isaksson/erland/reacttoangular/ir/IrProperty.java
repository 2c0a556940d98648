package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","kind","type","initializer","source"})
public final class IrProperty {
    public final String name;
    public final IrPropertyKind kind;
    public final String type;
    /** Initializer text, or null when the property starts undefined. */
    public final String initializer;
    public final IrSourceRef source;

    @JsonCreator
    public IrProperty(
            @JsonProperty("name") String name,
            @JsonProperty("kind") IrPropertyKind kind,
            @JsonProperty("type") String type,
            @JsonProperty("initializer") String initializer,
            @JsonProperty("source") IrSourceRef source
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("property name is required");
        this.name = name;
        this.kind = kind == null ? IrPropertyKind.INPUT : kind;
        this.type = type == null || type.isBlank() ? "any" : type;
        this.initializer = initializer;
        this.source = source;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrProperty)) return false;
        IrProperty that = (IrProperty) o;
        return Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(type, that.type) &&
                Objects.equals(initializer, that.initializer) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(name, kind, type, initializer, source);
    }
}
