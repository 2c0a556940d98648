package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * One {@code useEffect(setup, deps?)} call.
 *
 * <p>{@link #dependencies} hold the lowered dependency expressions; {@link #hasDependencyArray}
 * distinguishes {@code useEffect(fn)} from {@code useEffect(fn, [])}. {@link #hoisted} names the
 * locals that were promoted to {@link IrPropertyKind#EFFECT_HANDLE} fields so the cleanup can reach
 * them.</p>
 */
@JsonPropertyOrder({"index","hasDependencyArray","dependencies","setup","cleanup","hoisted","source"})
public final class IrEffect {
    public final int index;
    public final boolean hasDependencyArray;
    public final List<String> dependencies;
    public final List<IrLine> setup;
    public final List<IrLine> cleanup;
    public final List<String> hoisted;
    public final IrSourceRef source;

    @JsonCreator
    public IrEffect(
            @JsonProperty("index") int index,
            @JsonProperty("hasDependencyArray") boolean hasDependencyArray,
            @JsonProperty("dependencies") List<String> dependencies,
            @JsonProperty("setup") List<IrLine> setup,
            @JsonProperty("cleanup") List<IrLine> cleanup,
            @JsonProperty("hoisted") List<String> hoisted,
            @JsonProperty("source") IrSourceRef source
    ) {
        if (index < 0) throw new IllegalArgumentException("effect index must be >= 0");
        this.index = index;
        this.hasDependencyArray = hasDependencyArray;
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (!hasDependencyArray && !this.dependencies.isEmpty()) {
            throw new IllegalArgumentException("effect " + index + " lists dependencies without a dependency array");
        }
        this.setup = setup == null ? List.of() : List.copyOf(setup);
        this.cleanup = cleanup == null ? List.of() : List.copyOf(cleanup);
        this.hoisted = hoisted == null ? List.of() : List.copyOf(hoisted);
        this.source = source;
    }

    @JsonIgnore
    public IrEffectClassification classification() {
        return hasDependencyArray && dependencies.isEmpty()
                ? IrEffectClassification.ONE_TIME
                : IrEffectClassification.RECURRING;
    }

    @JsonIgnore
    public boolean hasCleanup() {
        return !cleanup.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrEffect)) return false;
        IrEffect that = (IrEffect) o;
        return index == that.index &&
                hasDependencyArray == that.hasDependencyArray &&
                Objects.equals(dependencies, that.dependencies) &&
                Objects.equals(setup, that.setup) &&
                Objects.equals(cleanup, that.cleanup) &&
                Objects.equals(hoisted, that.hoisted) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(index, hasDependencyArray, dependencies, setup, cleanup, hoisted, source);
    }
}
