package org.carball.fathom.analyzer;

import org.carball.fathom.model.symbol.Namespace;
import org.carball.fathom.model.symbol.SymbolEntry;
import org.carball.fathom.model.symbol.SymbolTable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Visits every entry reachable from the root namespace exactly once. Each namespace
 * is entered once even when the namespace graph is cyclic; entries are visited
 * before the namespaces nested below them.
 */
public final class SymbolTableWalker {

    @FunctionalInterface
    public interface EntryVisitor {
        void visit(Namespace namespace, SymbolEntry entry);
    }

    private SymbolTableWalker() {
        // Utility class - prevent instantiation
    }

    public static int walk(SymbolTable table, EntryVisitor visitor) {
        Set<Namespace> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Namespace> pending = new ArrayDeque<>();
        pending.push(table.root());
        int visited = 0;

        while (!pending.isEmpty()) {
            Namespace namespace = pending.pop();
            if (!seen.add(namespace)) {
                continue;
            }
            for (SymbolEntry entry : namespace.getEntries()) {
                visitor.visit(namespace, entry);
                visited++;
            }
            // Reverse push keeps nested namespaces in declaration order.
            for (int i = namespace.getNamespaces().size() - 1; i >= 0; i--) {
                pending.push(namespace.getNamespaces().get(i));
            }
        }
        return visited;
    }
}
