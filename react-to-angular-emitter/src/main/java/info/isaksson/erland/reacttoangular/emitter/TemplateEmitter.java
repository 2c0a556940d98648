package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrComponent;
import info.isaksson.erland.reacttoangular.ir.IrControlFlow;
import info.isaksson.erland.reacttoangular.ir.IrEventBinding;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNode;
import info.isaksson.erland.reacttoangular.ir.IrTemplateNodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Emits the Angular template of a component.
 */
public final class TemplateEmitter {

    private static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "source", "track", "wbr");

    public String emit(IrComponent component, String name, EmitterOptions options) {
        if (component == null) throw new IllegalArgumentException("component must not be null");
        if (options == null) options = EmitterOptions.defaults();
        CodeWriter w = new CodeWriter(options.indentWidth);
        if (component.template == null) {
            w.line(0, "<!-- " + ComponentNames.baseName(name == null ? component.name : name) + " renders nothing -->");
            return w.toString();
        }
        Map<String, List<IrEventBinding>> events = new LinkedHashMap<>();
        for (IrEventBinding e : component.events) {
            events.computeIfAbsent(e.elementId, k -> new ArrayList<>()).add(e);
        }
        node(w, 0, component.template, events);
        return w.toString();
    }

    private void node(CodeWriter w, int depth, IrTemplateNode n, Map<String, List<IrEventBinding>> events) {
        switch (n.kind) {
            case TEXT:
                w.line(depth, escapeText(n.text));
                return;
            case INTERPOLATION:
                w.line(depth, interpolation(n.text));
                return;
            case CONTAINER:
                element(w, depth, "ng-container", n, events);
                return;
            default:
                element(w, depth, n.tag, n, events);
        }
    }

    private void element(CodeWriter w, int depth, String tag, IrTemplateNode n, Map<String, List<IrEventBinding>> events) {
        String open = "<" + tag + attributes(n, events.getOrDefault(n.id, List.of())) + ">";
        if (VOID_ELEMENTS.contains(tag) && n.children.isEmpty()) {
            w.line(depth, open);
            return;
        }
        String close = "</" + tag + ">";
        if (n.children.isEmpty()) {
            w.line(depth, open + close);
            return;
        }
        if (inline(n)) {
            StringBuilder sb = new StringBuilder(open);
            for (IrTemplateNode c : n.children) {
                sb.append(c.kind == IrTemplateNodeKind.TEXT ? escapeText(c.text) : interpolation(c.text));
            }
            w.line(depth, sb.append(close).toString());
            return;
        }
        w.line(depth, open);
        for (IrTemplateNode c : n.children) node(w, depth + 1, c, events);
        w.line(depth, close);
    }

    /** Only text and interpolations below: the element fits on one line. */
    private static boolean inline(IrTemplateNode n) {
        for (IrTemplateNode c : n.children) {
            if (c.kind != IrTemplateNodeKind.TEXT && c.kind != IrTemplateNodeKind.INTERPOLATION) return false;
        }
        return true;
    }

    private static String attributes(IrTemplateNode n, List<IrEventBinding> events) {
        StringBuilder sb = new StringBuilder();
        IrControlFlow flow = n.controlFlow;
        switch (flow.kind) {
            case REPEAT:
                sb.append(" *ngFor=\"let ").append(flow.item).append(" of ").append(escapeAttribute(flow.source));
                if (flow.index != null) sb.append("; let ").append(flow.index).append(" = index");
                sb.append('"');
                break;
            case CONDITIONAL:
                sb.append(" *ngIf=\"").append(escapeAttribute(flow.guard)).append('"');
                break;
            default:
                break;
        }
        for (IrAttribute a : n.attributes) {
            sb.append(' ');
            switch (a.kind) {
                case STATIC:
                    sb.append(a.name);
                    if (a.value != null) sb.append("=\"").append(escapeStatic(a.value)).append('"');
                    break;
                case PROPERTY:
                    sb.append('[').append(a.name).append("]=\"").append(escapeAttribute(a.value)).append('"');
                    break;
                case INTERPOLATED:
                    sb.append(a.name).append("=\"").append(escapeAttribute(a.value)).append('"');
                    break;
                case TWO_WAY:
                    sb.append("[(").append(a.name).append(")]=\"").append(escapeAttribute(a.value)).append('"');
                    break;
                default:
                    throw new IllegalStateException("unknown attribute kind " + a.kind);
            }
        }
        for (IrEventBinding e : events) {
            sb.append(" (").append(e.event).append(")=\"").append(escapeAttribute(e.handler)).append('"');
        }
        return sb.toString();
    }

    private static String interpolation(String expression) {
        return "{{ " + expression + " }}";
    }

    /** Markup characters become entities; braces become literal interpolations Angular will not parse. */
    static String escapeText(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '{': sb.append("{{ '{' }}"); break;
                case '}': sb.append("{{ '}' }}"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeStatic(String s) {
        return s.replace("&", "&amp;").replace("\"", "&quot;");
    }

    static String escapeAttribute(String s) {
        return s.replace("\"", "&quot;");
    }
}
