package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structural directive attached to a template node.
 *
 * <p>REPEAT requires {@code source} and {@code item} ({@code index} is optional); CONDITIONAL
 * requires {@code guard}. Constructor arguments are checked against the kind.</p>
 */
@JsonPropertyOrder({"kind","source","item","index","guard"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrControlFlow {

    private static final IrControlFlow NONE = new IrControlFlow(IrControlFlowKind.NONE, null, null, null, null);

    public final IrControlFlowKind kind;
    public final String source;
    public final String item;
    public final String index;
    public final String guard;

    @JsonCreator
    public IrControlFlow(
            @JsonProperty("kind") IrControlFlowKind kind,
            @JsonProperty("source") String source,
            @JsonProperty("item") String item,
            @JsonProperty("index") String index,
            @JsonProperty("guard") String guard
    ) {
        this.kind = kind == null ? IrControlFlowKind.NONE : kind;
        switch (this.kind) {
            case REPEAT:
                if (isBlank(source) || isBlank(item)) {
                    throw new IllegalArgumentException("REPEAT needs a source and an item name");
                }
                break;
            case CONDITIONAL:
                if (isBlank(guard)) throw new IllegalArgumentException("CONDITIONAL needs a guard");
                break;
            default:
                break;
        }
        this.source = source;
        this.item = item;
        this.index = index;
        this.guard = guard;
    }

    public static IrControlFlow none() {
        return NONE;
    }

    public static IrControlFlow repeat(String source, String item, String index) {
        return new IrControlFlow(IrControlFlowKind.REPEAT, source, item, index, null);
    }

    public static IrControlFlow conditional(String guard) {
        return new IrControlFlow(IrControlFlowKind.CONDITIONAL, null, null, null, guard);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrControlFlow)) return false;
        IrControlFlow that = (IrControlFlow) o;
        return kind == that.kind &&
                Objects.equals(source, that.source) &&
                Objects.equals(item, that.item) &&
                Objects.equals(index, that.index) &&
                Objects.equals(guard, that.guard);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, source, item, index, guard);
    }
}
