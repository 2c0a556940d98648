package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Node of the rendered template tree.
 *
 * <p>ELEMENT nodes carry a tag; TEXT nodes carry literal text; INTERPOLATION nodes carry an
 * expression in {@link #text}. Only ELEMENT and CONTAINER nodes may have children.</p>
 */
@JsonPropertyOrder({"id","kind","tag","text","controlFlow","twoWayProperty","attributes","children"})
public final class IrTemplateNode {
    public final String id;
    public final IrTemplateNodeKind kind;
    public final String tag;
    public final String text;
    public final IrControlFlow controlFlow;
    public final String twoWayProperty;
    public final List<IrAttribute> attributes;
    public final List<IrTemplateNode> children;

    @JsonCreator
    public IrTemplateNode(
            @JsonProperty("id") String id,
            @JsonProperty("kind") IrTemplateNodeKind kind,
            @JsonProperty("tag") String tag,
            @JsonProperty("text") String text,
            @JsonProperty("controlFlow") IrControlFlow controlFlow,
            @JsonProperty("twoWayProperty") String twoWayProperty,
            @JsonProperty("attributes") List<IrAttribute> attributes,
            @JsonProperty("children") List<IrTemplateNode> children
    ) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("template node id is required");
        if (kind == null) throw new IllegalArgumentException("template node kind is required");
        this.id = id;
        this.kind = kind;
        this.tag = tag;
        this.text = text;
        this.controlFlow = controlFlow == null ? IrControlFlow.none() : controlFlow;
        this.twoWayProperty = twoWayProperty;
        this.attributes = attributes == null ? List.of() : List.copyOf(attributes);
        this.children = children == null ? List.of() : List.copyOf(children);

        switch (kind) {
            case ELEMENT:
                if (tag == null || tag.isBlank()) throw new IllegalArgumentException("element " + id + " needs a tag");
                break;
            case TEXT:
            case INTERPOLATION:
                if (text == null) throw new IllegalArgumentException(kind + " node " + id + " needs text");
                if (!this.children.isEmpty() || !this.attributes.isEmpty()) {
                    throw new IllegalArgumentException(kind + " node " + id + " cannot have children or attributes");
                }
                break;
            case CONTAINER:
                if (!this.attributes.isEmpty()) {
                    throw new IllegalArgumentException("container " + id + " cannot have attributes");
                }
                break;
            default:
                break;
        }
        if (twoWayProperty != null && kind != IrTemplateNodeKind.ELEMENT) {
            throw new IllegalArgumentException("only elements can be two-way bound (" + id + ")");
        }
    }

    public static IrTemplateNode element(String id, String tag, List<IrAttribute> attributes, List<IrTemplateNode> children) {
        return new IrTemplateNode(id, IrTemplateNodeKind.ELEMENT, tag, null, null, null, attributes, children);
    }

    public static IrTemplateNode text(String id, String text) {
        return new IrTemplateNode(id, IrTemplateNodeKind.TEXT, null, text, null, null, null, null);
    }

    public static IrTemplateNode interpolation(String id, String expression) {
        return new IrTemplateNode(id, IrTemplateNodeKind.INTERPOLATION, null, expression, null, null, null, null);
    }

    public static IrTemplateNode container(String id, List<IrTemplateNode> children) {
        return new IrTemplateNode(id, IrTemplateNodeKind.CONTAINER, "ng-container", null, null, null, null, children);
    }

    public IrTemplateNode withControlFlow(IrControlFlow flow) {
        return new IrTemplateNode(id, kind, tag, text, flow, twoWayProperty, attributes, children);
    }

    public IrTemplateNode withTwoWayProperty(String property) {
        return new IrTemplateNode(id, kind, tag, text, controlFlow, property, attributes, children);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTemplateNode)) return false;
        IrTemplateNode that = (IrTemplateNode) o;
        return Objects.equals(id, that.id) &&
                kind == that.kind &&
                Objects.equals(tag, that.tag) &&
                Objects.equals(text, that.text) &&
                Objects.equals(controlFlow, that.controlFlow) &&
                Objects.equals(twoWayProperty, that.twoWayProperty) &&
                Objects.equals(attributes, that.attributes) &&
                Objects.equals(children, that.children);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, tag, text, controlFlow, twoWayProperty, attributes, children);
    }
}
