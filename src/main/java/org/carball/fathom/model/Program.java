package org.carball.fathom.model;

import org.carball.fathom.model.optree.OpNode;
import org.carball.fathom.model.symbol.SymbolTable;

import java.util.Objects;

/**
 * A parsed program as handed over by the front end: its main body and its symbol table.
 */
public record Program(String name, OpNode mainRoot, SymbolTable symbolTable) {

    public Program {
        Objects.requireNonNull(mainRoot, "main root");
        name = name != null ? name : "-";
        symbolTable = symbolTable != null ? symbolTable : SymbolTable.empty();
    }

    public static Program of(OpNode mainRoot) {
        return new Program(null, mainRoot, null);
    }
}
