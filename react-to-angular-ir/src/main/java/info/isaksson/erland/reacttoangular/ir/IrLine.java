package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One line of a lowered body. Depth is relative to the enclosing member; emitters apply indentation.
 */
@JsonPropertyOrder({"depth","text"})
public final class IrLine {
    public final int depth;
    public final String text;

    @JsonCreator
    public IrLine(
            @JsonProperty("depth") int depth,
            @JsonProperty("text") String text
    ) {
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        this.depth = depth;
        this.text = text == null ? "" : text;
    }

    public static IrLine of(String text) {
        return new IrLine(0, text);
    }

    public IrLine indented(int by) {
        return new IrLine(depth + by, text);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrLine)) return false;
        IrLine that = (IrLine) o;
        return depth == that.depth && Objects.equals(text, that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(depth, text);
    }

    @Override public String toString() {
        return depth + ":" + text;
    }
}
