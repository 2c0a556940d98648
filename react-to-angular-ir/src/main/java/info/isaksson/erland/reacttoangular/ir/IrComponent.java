package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Root of the intermediate model: one converted component.
 *
 * <p>Lists keep source order; emitters rely on it for stable output.</p>
 */
@JsonPropertyOrder({"schemaVersion","name","selector","inputs","states","properties","methods","effects",
        "events","template","passthroughs","styleImports","styles"})
public final class IrComponent {
    public static final String SCHEMA_VERSION = "1";

    public final String schemaVersion;
    public final String name;
    public final String selector;
    public final List<IrProperty> inputs;
    public final List<IrStateBinding> states;
    public final List<IrProperty> properties;
    public final List<IrMethod> methods;
    public final List<IrEffect> effects;
    public final List<IrEventBinding> events;
    /** Null when the component renders nothing. */
    public final IrTemplateNode template;
    public final List<IrPassthrough> passthroughs;
    public final List<String> styleImports;
    public final String styles;

    @JsonCreator
    public IrComponent(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("name") String name,
            @JsonProperty("selector") String selector,
            @JsonProperty("inputs") List<IrProperty> inputs,
            @JsonProperty("states") List<IrStateBinding> states,
            @JsonProperty("properties") List<IrProperty> properties,
            @JsonProperty("methods") List<IrMethod> methods,
            @JsonProperty("effects") List<IrEffect> effects,
            @JsonProperty("events") List<IrEventBinding> events,
            @JsonProperty("template") IrTemplateNode template,
            @JsonProperty("passthroughs") List<IrPassthrough> passthroughs,
            @JsonProperty("styleImports") List<String> styleImports,
            @JsonProperty("styles") String styles
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("component name is required");
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.name = name;
        this.selector = selector;
        this.inputs = inputs == null ? List.of() : List.copyOf(inputs);
        this.states = states == null ? List.of() : List.copyOf(states);
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.methods = methods == null ? List.of() : List.copyOf(methods);
        this.effects = effects == null ? List.of() : List.copyOf(effects);
        this.events = events == null ? List.of() : List.copyOf(events);
        this.template = template;
        this.passthroughs = passthroughs == null ? List.of() : List.copyOf(passthroughs);
        this.styleImports = styleImports == null ? List.of() : List.copyOf(styleImports);
        this.styles = styles == null ? "" : styles;
    }

    /** Copy with collected stylesheet text. */
    public IrComponent withStyles(String css) {
        return new IrComponent(schemaVersion, name, selector, inputs, states, properties, methods, effects,
                events, template, passthroughs, styleImports, css);
    }

    public IrStateBinding state(String stateName) {
        for (IrStateBinding s : states) {
            if (s.name.equals(stateName)) return s;
        }
        return null;
    }

    public IrMethod method(String methodName) {
        for (IrMethod m : methods) {
            if (m.name.equals(methodName)) return m;
        }
        return null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrComponent)) return false;
        IrComponent that = (IrComponent) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(name, that.name) &&
                Objects.equals(selector, that.selector) &&
                Objects.equals(inputs, that.inputs) &&
                Objects.equals(states, that.states) &&
                Objects.equals(properties, that.properties) &&
                Objects.equals(methods, that.methods) &&
                Objects.equals(effects, that.effects) &&
                Objects.equals(events, that.events) &&
                Objects.equals(template, that.template) &&
                Objects.equals(passthroughs, that.passthroughs) &&
                Objects.equals(styleImports, that.styleImports) &&
                Objects.equals(styles, that.styles);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, name, selector, inputs, states, properties, methods, effects, events,
                template, passthroughs, styleImports, styles);
    }
}
