package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.Identifier;
import info.isaksson.erland.reacttoangular.syntax.JsxAttribute;
import info.isaksson.erland.reacttoangular.syntax.MemberExpression;
import info.isaksson.erland.reacttoangular.syntax.Node;
import info.isaksson.erland.reacttoangular.syntax.Property;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Identifier names read anywhere under a node, in source order. Property keys and non-computed
 * member names are not references and are skipped. Shadowing is ignored, so the result may
 * over-approximate.
 */
final class ReferencedNames {

    private ReferencedNames() {}

    static Set<String> of(Node root) {
        Set<String> out = new LinkedHashSet<>();
        collect(root, out);
        return out;
    }

    private static void collect(Node node, Set<String> out) {
        if (node == null) return;
        if (node instanceof Identifier) {
            out.add(((Identifier) node).name);
            return;
        }
        if (node instanceof MemberExpression) {
            MemberExpression m = (MemberExpression) node;
            collect(m.object, out);
            if (m.computed) collect(m.property, out);
            return;
        }
        if (node instanceof Property) {
            Property p = (Property) node;
            if (p.computed) collect(p.key, out);
            collect(p.value, out);
            return;
        }
        if (node instanceof JsxAttribute) {
            collect(((JsxAttribute) node).value, out);
            return;
        }
        for (Node child : node.children()) collect(child, out);
    }
}
