package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrComponent;

/** Stylesheet text collected from the component's CSS imports, unchanged. */
public final class StyleEmitter {

    public String emit(IrComponent component, String name, EmitterOptions options) {
        if (component == null) throw new IllegalArgumentException("component must not be null");
        String css = component.styles;
        if (css.isBlank()) {
            return "/* No styles collected for " + ComponentNames.baseName(name == null ? component.name : name) + ". */\n";
        }
        return css;
    }
}
