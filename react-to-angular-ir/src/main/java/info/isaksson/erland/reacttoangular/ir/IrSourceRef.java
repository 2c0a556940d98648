package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Optional source reference for traceability back to the React input.
 */
@JsonPropertyOrder({"line","col"})
public final class IrSourceRef {
    public final Integer line;
    public final Integer col;

    @JsonCreator
    public IrSourceRef(
            @JsonProperty("line") Integer line,
            @JsonProperty("col") Integer col
    ) {
        this.line = line;
        this.col = col;
    }

    /** Line for ordering; unknown locations sort first. */
    public int lineOrZero() {
        return line == null ? 0 : line;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSourceRef)) return false;
        IrSourceRef that = (IrSourceRef) o;
        return Objects.equals(line, that.line) &&
                Objects.equals(col, that.col);
    }

    @Override public int hashCode() {
        return Objects.hash(line, col);
    }

    @Override public String toString() {
        return line + ":" + col;
    }
}
