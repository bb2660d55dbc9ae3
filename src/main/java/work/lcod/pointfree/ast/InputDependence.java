package work.lcod.pointfree.ast;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Classifies subtrees as dynamic (reference the input parameter) or static.
 */
public final class InputDependence {
    public static final String INPUT = "in";

    private InputDependence() {}

    public static boolean isInput(AstNode node) {
        return node instanceof AstNode.Variable variable && INPUT.equals(variable.name());
    }

    public static boolean dependsOnInput(AstNode root) {
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (isInput(node)) {
                return true;
            }
            if (node instanceof AstNode.Call call) {
                for (var child : call.children()) {
                    pending.push(child);
                }
            }
        }
        return false;
    }
}
