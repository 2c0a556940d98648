package info.isaksson.erland.reacttoangular.rules;

import info.isaksson.erland.reacttoangular.syntax.JsxElement;
import info.isaksson.erland.reacttoangular.syntax.JsxFragment;
import info.isaksson.erland.reacttoangular.syntax.Node;

import java.util.function.Consumer;

/** Pre-order traversal over syntax nodes. */
final class SyntaxWalk {

    private SyntaxWalk() {}

    static void preorder(Node node, Consumer<Node> visitor) {
        if (node == null) return;
        visitor.accept(node);
        for (Node child : node.children()) preorder(child, visitor);
    }

    static boolean containsJsx(Node node) {
        boolean[] found = new boolean[1];
        preorder(node, n -> {
            if (n instanceof JsxElement || n instanceof JsxFragment) found[0] = true;
        });
        return found[0];
    }
}
