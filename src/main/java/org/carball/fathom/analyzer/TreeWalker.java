package org.carball.fathom.analyzer;

import org.carball.fathom.model.optree.OpNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order traversal of op trees. Every node is visited once, parents before
 * children, siblings left to right. The walk uses an explicit stack so the depth
 * of the tree is not bounded by the Java call stack.
 */
public class TreeWalker {

    @FunctionalInterface
    public interface NodeVisitor {
        void visit(OpNode node, int depth);
    }

    private record Frame(OpNode node, int depth) {
    }

    /**
     * Walks the main body first, then each subroutine body in the given order.
     *
     * @return number of nodes visited
     */
    public int walkAll(OpNode mainRoot, List<OpNode> subroutineRoots, NodeVisitor visitor) {
        int visited = walk(mainRoot, visitor);
        for (OpNode root : subroutineRoots) {
            visited += walk(root, visitor);
        }
        return visited;
    }

    public int walk(OpNode root, NodeVisitor visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));
        int visited = 0;

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            visitor.visit(frame.node(), frame.depth());
            visited++;

            List<OpNode> children = frame.node().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), frame.depth() + 1));
            }
        }
        return visited;
    }
}
