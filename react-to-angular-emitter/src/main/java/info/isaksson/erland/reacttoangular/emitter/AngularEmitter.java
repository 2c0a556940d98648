package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Public API: turn a validated component model into the text of an Angular standalone component.
 *
 * <p>Nothing is written here; callers decide where the files go. The same model and options always
 * produce byte-identical text.</p>
 */
public final class AngularEmitter {

    /** One generated artifact: file name relative to the output directory plus its content. */
    public static final class Artifact {
        public final String fileName;
        public final String content;

        Artifact(String fileName, String content) {
            this.fileName = fileName;
            this.content = content;
        }

        @Override public String toString() {
            return "Artifact{" + fileName + ", " + content.length() + " chars}";
        }
    }

    /** All artifacts for one component, in behaviour, template, style, spec order. */
    public static final class EmittedComponent {
        public final String className;
        public final Artifact behavior;
        public final Artifact template;
        public final Artifact style;
        /** Null unless spec scaffolding was enabled. */
        public final Artifact spec;

        EmittedComponent(String className, Artifact behavior, Artifact template, Artifact style, Artifact spec) {
            this.className = className;
            this.behavior = behavior;
            this.template = template;
            this.style = style;
            this.spec = spec;
        }

        public List<Artifact> artifacts() {
            List<Artifact> all = new ArrayList<>(4);
            all.add(behavior);
            all.add(template);
            all.add(style);
            if (spec != null) all.add(spec);
            return Collections.unmodifiableList(all);
        }

        /** File name to content, in emission order. */
        public Map<String, String> asMap() {
            Map<String, String> m = new LinkedHashMap<>();
            for (Artifact a : artifacts()) m.put(a.fileName, a.content);
            return Collections.unmodifiableMap(m);
        }
    }

    private final BehaviorEmitter behaviorEmitter = new BehaviorEmitter();
    private final TemplateEmitter templateEmitter = new TemplateEmitter();
    private final StyleEmitter styleEmitter = new StyleEmitter();
    private final SpecEmitter specEmitter = new SpecEmitter();

    public EmittedComponent emit(IrComponent component, EmitterOptions options) {
        if (component == null) throw new IllegalArgumentException("component must not be null");
        if (options == null) options = EmitterOptions.defaults();
        String name = component.name;

        Artifact ts = new Artifact(ComponentNames.behaviorFile(name), behaviorEmitter.emit(component, name, options));
        Artifact html = new Artifact(ComponentNames.templateFile(name), templateEmitter.emit(component, name, options));
        Artifact css = new Artifact(ComponentNames.styleFile(name), styleEmitter.emit(component, name, options));
        Artifact spec = options.emitSpec
                ? new Artifact(ComponentNames.specFile(name), specEmitter.emit(component, name, options))
                : null;
        return new EmittedComponent(ComponentNames.className(name), ts, html, css, spec);
    }
}
