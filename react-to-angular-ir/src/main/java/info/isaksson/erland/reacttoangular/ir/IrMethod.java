package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"name","kind","params","async","body","source"})
public final class IrMethod {
    public final String name;
    public final IrMethodKind kind;
    /** Parameter list entries as printed, e.g. {@code "e"} or {@code "step = 1"}. */
    public final List<String> params;
    public final boolean async;
    public final List<IrLine> body;
    public final IrSourceRef source;

    @JsonCreator
    public IrMethod(
            @JsonProperty("name") String name,
            @JsonProperty("kind") IrMethodKind kind,
            @JsonProperty("params") List<String> params,
            @JsonProperty("async") boolean async,
            @JsonProperty("body") List<IrLine> body,
            @JsonProperty("source") IrSourceRef source
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("method name is required");
        this.name = name;
        this.kind = kind == null ? IrMethodKind.DECLARED : kind;
        this.params = params == null ? List.of() : List.copyOf(params);
        this.async = async;
        this.body = body == null ? List.of() : List.copyOf(body);
        this.source = source;
        if (this.kind == IrMethodKind.GETTER && !this.params.isEmpty()) {
            throw new IllegalArgumentException("getter '" + name + "' cannot take parameters");
        }
    }

    public IrMethod withBody(List<IrLine> newBody) {
        return new IrMethod(name, kind, params, async, newBody, source);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrMethod)) return false;
        IrMethod that = (IrMethod) o;
        return async == that.async &&
                Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(params, that.params) &&
                Objects.equals(body, that.body) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(name, kind, params, async, body, source);
    }
}
