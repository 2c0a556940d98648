package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * {@code (event)="handler"} on the template element {@link #elementId}.
 */
@JsonPropertyOrder({"elementId","event","kind","handler","targetMethod","source"})
public final class IrEventBinding {
    public final String elementId;
    public final String event;
    public final IrEventKind kind;
    /** Template statement placed inside the event binding. */
    public final String handler;
    /** Method invoked by DIRECT_CALL and SETTER_CALL bindings. */
    public final String targetMethod;
    public final IrSourceRef source;

    @JsonCreator
    public IrEventBinding(
            @JsonProperty("elementId") String elementId,
            @JsonProperty("event") String event,
            @JsonProperty("kind") IrEventKind kind,
            @JsonProperty("handler") String handler,
            @JsonProperty("targetMethod") String targetMethod,
            @JsonProperty("source") IrSourceRef source
    ) {
        if (elementId == null || elementId.isBlank()) throw new IllegalArgumentException("elementId is required");
        if (event == null || event.isBlank()) throw new IllegalArgumentException("event name is required");
        if (kind == null) throw new IllegalArgumentException("event kind is required");
        if (handler == null || handler.isBlank()) throw new IllegalArgumentException("handler is required");
        if (kind != IrEventKind.INLINE_EXPRESSION && (targetMethod == null || targetMethod.isBlank())) {
            throw new IllegalArgumentException(kind + " binding for '" + event + "' needs a target method");
        }
        this.elementId = elementId;
        this.event = event;
        this.kind = kind;
        this.handler = handler;
        this.targetMethod = targetMethod;
        this.source = source;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrEventBinding)) return false;
        IrEventBinding that = (IrEventBinding) o;
        return Objects.equals(elementId, that.elementId) &&
                Objects.equals(event, that.event) &&
                kind == that.kind &&
                Objects.equals(handler, that.handler) &&
                Objects.equals(targetMethod, that.targetMethod) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(elementId, event, kind, handler, targetMethod, source);
    }
}
