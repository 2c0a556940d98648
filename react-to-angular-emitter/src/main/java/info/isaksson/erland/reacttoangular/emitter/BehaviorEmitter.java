package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrAttributeKind;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrControlFlowKind;
import info.isaksson.erland.reacttoangular.ir.IrEffect;
import info.isaksson.erland.reacttoangular.ir.IrEffectClassification;
import info.isaksson.erland.reacttoangular.ir.IrLine;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrMethodKind;
import info.isaksson.erland.reacttoangular.ir.IrPassthrough;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.ir.IrStateBinding;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the TypeScript class of a standalone Angular component.
 *
 * <p>Member order: inputs, state properties, auxiliary properties, lifecycle hooks
 * ({@code ngOnInit}, {@code ngDoCheck}, {@code ngOnDestroy}), methods, getters, and finally the
 * passthrough block. One-time effects run in {@code ngOnInit}; recurring effects run in
 * {@code ngDoCheck} whenever one of their dependencies changed (or on every check when they have no
 * dependency array), after running the previous cleanup.</p>
 */
public final class BehaviorEmitter {

    static final String EFFECT_DEPS = "effectDeps";
    static final String EFFECT_CLEANUPS = "effectCleanups";

    public String emit(IrComponent component, String name, EmitterOptions options) {
        if (component == null) throw new IllegalArgumentException("component must not be null");
        if (options == null) options = EmitterOptions.defaults();
        String componentName = name == null || name.isBlank() ? component.name : name;

        List<IrEffect> oneTime = new ArrayList<>();
        List<IrEffect> recurring = new ArrayList<>();
        for (IrEffect e : component.effects) {
            if (e.classification() == IrEffectClassification.ONE_TIME) oneTime.add(e);
            else recurring.add(e);
        }
        List<IrStateBinding> inputStates = new ArrayList<>();
        for (IrStateBinding s : component.states) {
            if (s.readsInputs) inputStates.add(s);
        }
        boolean hasOnInit = !oneTime.isEmpty() || !inputStates.isEmpty();
        boolean hasDoCheck = !recurring.isEmpty();
        boolean recurringCleanup = recurring.stream().anyMatch(IrEffect::hasCleanup);
        boolean hasOnDestroy = oneTime.stream().anyMatch(IrEffect::hasCleanup) || recurringCleanup;
        boolean dependencyChecks = recurring.stream().anyMatch(e -> e.hasDependencyArray);

        CodeWriter w = new CodeWriter(options.indentWidth);
        imports(w, component, hasOnInit, hasDoCheck, hasOnDestroy);
        decorator(w, component, componentName);

        List<String> interfaces = new ArrayList<>();
        if (hasOnInit) interfaces.add("OnInit");
        if (hasDoCheck) interfaces.add("DoCheck");
        if (hasOnDestroy) interfaces.add("OnDestroy");
        w.line(0, "export class " + ComponentNames.className(componentName)
                + (interfaces.isEmpty() ? "" : " implements " + String.join(", ", interfaces)) + " {");

        for (IrProperty p : component.inputs) {
            w.line(1, "@Input() " + p.name + ": " + p.type + (p.initializer == null ? "" : " = " + p.initializer) + ";");
        }
        for (IrStateBinding s : component.states) {
            w.line(1, s.name + ": " + s.type + (s.readsInputs ? "" : " = " + s.initializer) + ";");
        }
        for (IrProperty p : component.properties) {
            w.line(1, p.name + ": " + p.type + (p.initializer == null ? "" : " = " + p.initializer) + ";");
        }
        if (dependencyChecks) {
            w.line(1, "private " + EFFECT_DEPS + ": unknown[][] = [];");
        }
        if (recurringCleanup) {
            w.line(1, "private " + EFFECT_CLEANUPS + ": Array<(() => void) | undefined> = [];");
        }

        if (hasOnInit) {
            w.blank();
            w.line(1, "ngOnInit(): void {");
            for (IrStateBinding s : inputStates) w.line(2, "this." + s.name + " = " + s.initializer + ";");
            for (IrEffect e : oneTime) effectSetup(w, 2, e, oneTime.size() > 1, false);
            w.line(1, "}");
        }
        if (hasDoCheck) {
            w.blank();
            w.line(1, "ngDoCheck(): void {");
            for (IrEffect e : recurring) recurringEffect(w, e);
            w.line(1, "}");
        }
        if (hasOnDestroy) {
            w.blank();
            w.line(1, "ngOnDestroy(): void {");
            for (IrEffect e : oneTime) {
                if (e.hasCleanup()) block(w, 2, e.cleanup, oneTime.size() > 1 && declaresLocals(e.cleanup));
            }
            for (IrEffect e : recurring) {
                if (e.hasCleanup()) w.line(2, "this.runCleanup(" + e.index + ");");
            }
            w.line(1, "}");
        }

        for (IrMethod m : component.methods) {
            if (m.kind == IrMethodKind.GETTER) continue;
            w.blank();
            w.line(1, (m.async ? "async " : "") + m.name + "(" + String.join(", ", m.params) + ") {");
            body(w, 2, m.body);
            w.line(1, "}");
        }
        for (IrMethod m : component.methods) {
            if (m.kind != IrMethodKind.GETTER) continue;
            w.blank();
            w.line(1, "get " + m.name + "() {");
            body(w, 2, m.body);
            w.line(1, "}");
        }

        if (dependencyChecks) {
            w.blank();
            w.line(1, "private depsChanged(slot: number, next: unknown[]): boolean {");
            w.line(2, "const prev = this." + EFFECT_DEPS + "[slot];");
            w.line(2, "this." + EFFECT_DEPS + "[slot] = next;");
            w.line(2, "return !prev || prev.length !== next.length || prev.some((value, i) => value !== next[i]);");
            w.line(1, "}");
        }
        if (recurringCleanup) {
            w.blank();
            w.line(1, "private runCleanup(slot: number): void {");
            w.line(2, "const cleanup = this." + EFFECT_CLEANUPS + "[slot];");
            w.line(2, "this." + EFFECT_CLEANUPS + "[slot] = undefined;");
            w.line(2, "if (cleanup) {");
            w.line(3, "cleanup();");
            w.line(2, "}");
            w.line(1, "}");
        }

        passthroughs(w, component.passthroughs);
        w.line(0, "}");
        return w.toString();
    }

    private static void imports(CodeWriter w, IrComponent c, boolean onInit, boolean doCheck, boolean onDestroy) {
        List<String> core = new ArrayList<>();
        core.add("Component");
        if (doCheck) core.add("DoCheck");
        if (!c.inputs.isEmpty()) core.add("Input");
        if (onDestroy) core.add("OnDestroy");
        if (onInit) core.add("OnInit");
        w.line(0, "import { " + String.join(", ", core) + " } from '@angular/core';");
        if (needsCommonModule(c.template)) w.line(0, "import { CommonModule } from '@angular/common';");
        if (needsFormsModule(c.template)) w.line(0, "import { FormsModule } from '@angular/forms';");
        w.blank();
    }

    private static void decorator(CodeWriter w, IrComponent c, String name) {
        List<String> modules = new ArrayList<>();
        if (needsCommonModule(c.template)) modules.add("CommonModule");
        if (needsFormsModule(c.template)) modules.add("FormsModule");
        w.line(0, "@Component({");
        w.line(1, "selector: '" + (c.selector == null ? "app-component" : c.selector) + "',");
        w.line(1, "standalone: true,");
        if (!modules.isEmpty()) w.line(1, "imports: [" + String.join(", ", modules) + "],");
        w.line(1, "templateUrl: './" + ComponentNames.templateFile(name) + "',");
        w.line(1, "styleUrls: ['./" + ComponentNames.styleFile(name) + "']");
        w.line(0, "})");
    }

    static boolean needsCommonModule(IrTemplateNode node) {
        if (node == null) return false;
        if (node.controlFlow.kind != IrControlFlowKind.NONE) return true;
        for (IrAttribute a : node.attributes) {
            if (a.kind == IrAttributeKind.PROPERTY && ("ngStyle".equals(a.name) || "ngClass".equals(a.name))) return true;
        }
        for (IrTemplateNode child : node.children) {
            if (needsCommonModule(child)) return true;
        }
        return false;
    }

    static boolean needsFormsModule(IrTemplateNode node) {
        if (node == null) return false;
        if (node.twoWayProperty != null) return true;
        for (IrTemplateNode child : node.children) {
            if (needsFormsModule(child)) return true;
        }
        return false;
    }

    private void recurringEffect(CodeWriter w, IrEffect e) {
        if (e.hasDependencyArray) {
            w.line(2, "if (this.depsChanged(" + e.index + ", [" + String.join(", ", e.dependencies) + "])) {");
        } else {
            w.line(2, "{");
        }
        if (e.hasCleanup()) w.line(3, "this.runCleanup(" + e.index + ");");
        effectSetup(w, 3, e, false, true);
        w.line(2, "}");
    }

    /**
     * Writes an effect's setup. A setup that returns early runs inside an arrow IIFE so the return
     * leaves only this effect; a setup declaring locals next to other effects gets its own block.
     */
    private void effectSetup(CodeWriter w, int depth, IrEffect e, boolean shared, boolean registerCleanup) {
        List<IrLine> lines = new ArrayList<>(e.setup);
        if (registerCleanup && e.hasCleanup()) {
            lines.add(new IrLine(0, "this." + EFFECT_CLEANUPS + "[" + e.index + "] = () => {"));
            for (IrLine l : e.cleanup) lines.add(l.indented(1));
            lines.add(new IrLine(0, "};"));
        }
        if (returnsEarly(e.setup)) {
            w.line(depth, "(() => {");
            body(w, depth + 1, lines);
            w.line(depth, "})();");
        } else {
            block(w, depth, lines, shared && declaresLocals(e.setup));
        }
    }

    private static void block(CodeWriter w, int depth, List<IrLine> lines, boolean braces) {
        if (braces) {
            w.line(depth, "{");
            body(w, depth + 1, lines);
            w.line(depth, "}");
        } else {
            body(w, depth, lines);
        }
    }

    private static void body(CodeWriter w, int depth, List<IrLine> lines) {
        for (IrLine l : lines) w.line(depth + l.depth, l.text);
    }

    static boolean returnsEarly(List<IrLine> lines) {
        for (IrLine l : lines) {
            if (l.text.equals("return;") || l.text.startsWith("return ")) return true;
        }
        return false;
    }

    private static boolean declaresLocals(List<IrLine> lines) {
        for (IrLine l : lines) {
            if (l.depth != 0) continue;
            if (l.text.startsWith("const ") || l.text.startsWith("let ") || l.text.startsWith("var ")
                    || l.text.startsWith("function ") || l.text.startsWith("async function ")) {
                return true;
            }
        }
        return false;
    }

    private static void passthroughs(CodeWriter w, List<IrPassthrough> fragments) {
        if (fragments.isEmpty()) return;
        w.blank();
        w.line(1, "/* BEGIN PASSTHROUGH: source not converted, kept verbatim");
        for (IrPassthrough p : fragments) {
            String where = p.source == null ? "" : "line " + p.source.lineOrZero() + ", ";
            w.line(1, " * [" + where + p.reason + "]");
            for (String raw : p.text.split("\r?\n", -1)) {
                String text = raw.replace("*/", "* /");
                w.line(1, text.isBlank() ? " *" : " * " + text);
            }
        }
        w.line(1, " * END PASSTHROUGH */");
    }
}
