package org.carball.fathom.model.symbol;

import java.util.Objects;

/**
 * The program's global symbol table, rooted at one namespace.
 */
public record SymbolTable(Namespace root) {

    public static final String DEFAULT_ROOT = "main";

    public SymbolTable {
        Objects.requireNonNull(root, "root namespace");
    }

    public static SymbolTable empty() {
        return new SymbolTable(new Namespace(DEFAULT_ROOT));
    }
}
