package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One {@code const [x, setX] = useState(init)} declaration.
 *
 * <p>An initializer that reads inputs ({@link #readsInputs}) cannot run as a field initializer,
 * because inputs are only bound after construction; it is assigned in {@code ngOnInit} instead.</p>
 */
@JsonPropertyOrder({"name","setter","type","initializer","readsInputs","twoWay","source"})
public final class IrStateBinding {
    public final String name;
    public final String setter;
    public final String type;
    public final String initializer;
    public final boolean readsInputs;
    public final boolean twoWay;
    public final IrSourceRef source;

    public IrStateBinding(String name, String setter, String type, String initializer, boolean twoWay, IrSourceRef source) {
        this(name, setter, type, initializer, false, twoWay, source);
    }

    @JsonCreator
    public IrStateBinding(
            @JsonProperty("name") String name,
            @JsonProperty("setter") String setter,
            @JsonProperty("type") String type,
            @JsonProperty("initializer") String initializer,
            @JsonProperty("readsInputs") boolean readsInputs,
            @JsonProperty("twoWay") boolean twoWay,
            @JsonProperty("source") IrSourceRef source
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("state name is required");
        this.name = name;
        this.setter = setter;
        this.type = type == null || type.isBlank() ? "any" : type;
        this.initializer = initializer == null || initializer.isBlank() ? "undefined" : initializer;
        this.readsInputs = readsInputs;
        this.twoWay = twoWay;
        this.source = source;
    }

    public IrStateBinding withTwoWay(boolean value) {
        return new IrStateBinding(name, setter, type, initializer, readsInputs, value, source);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrStateBinding)) return false;
        IrStateBinding that = (IrStateBinding) o;
        return twoWay == that.twoWay &&
                readsInputs == that.readsInputs &&
                Objects.equals(name, that.name) &&
                Objects.equals(setter, that.setter) &&
                Objects.equals(type, that.type) &&
                Objects.equals(initializer, that.initializer) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(name, setter, type, initializer, readsInputs, twoWay, source);
    }
}
