package org.carball.fathom.model.symbol;

/**
 * A fully qualified name together with the code object it resolves to.
 */
public record SymbolBinding(String qualifiedName, CodeObject code) {
}
