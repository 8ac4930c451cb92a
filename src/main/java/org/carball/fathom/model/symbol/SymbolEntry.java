package org.carball.fathom.model.symbol;

import java.util.Objects;

/**
 * A named slot of a namespace. An entry either denotes a code object, holds plain
 * data, or carries a code reference the front end could not resolve.
 */
public record SymbolEntry(String name, CodeObject code, String unresolvedReference) {

    public SymbolEntry {
        Objects.requireNonNull(name, "entry name");
    }

    public static SymbolEntry data(String name) {
        return new SymbolEntry(name, null, null);
    }

    public static SymbolEntry code(String name, CodeObject code) {
        return new SymbolEntry(name, Objects.requireNonNull(code, "code object"), null);
    }

    public static SymbolEntry unresolved(String name, String reference) {
        return new SymbolEntry(name, null, reference);
    }

    public boolean denotesCode() {
        return code != null;
    }

    public boolean isMalformed() {
        return code == null && unresolvedReference != null;
    }
}
