package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Source text of a construct that no pass understood. Emitted verbatim inside a marked comment.
 */
@JsonPropertyOrder({"reason","text","source"})
public final class IrPassthrough {
    public final String reason;
    public final String text;
    public final IrSourceRef source;

    @JsonCreator
    public IrPassthrough(
            @JsonProperty("reason") String reason,
            @JsonProperty("text") String text,
            @JsonProperty("source") IrSourceRef source
    ) {
        this.reason = reason == null ? "" : reason;
        this.text = text == null ? "" : text;
        this.source = source;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPassthrough)) return false;
        IrPassthrough that = (IrPassthrough) o;
        return Objects.equals(reason, that.reason) &&
                Objects.equals(text, that.text) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(reason, text, source);
    }
}
