package org.carball.fathom.model.symbol;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A namespace of the program's symbol table. Nested namespaces are held by reference
 * and may form cycles (a root namespace usually lists itself).
 */
@Getter
public class Namespace {

    public static final String SEPARATOR = "::";

    private final String name;
    private final List<SymbolEntry> entries = new ArrayList<>();
    private final List<Namespace> namespaces = new ArrayList<>();

    public Namespace(String name) {
        this.name = name;
    }

    public Namespace addEntry(SymbolEntry entry) {
        entries.add(entry);
        return this;
    }

    public Namespace addNamespace(Namespace namespace) {
        namespaces.add(namespace);
        return this;
    }

    public List<SymbolEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Namespace> getNamespaces() {
        return Collections.unmodifiableList(namespaces);
    }

    public String qualify(String entryName) {
        return name + SEPARATOR + entryName;
    }

    // Nested namespaces are left out: the graph may be cyclic.
    @Override
    public String toString() {
        return "Namespace{" + name + ", " + entries.size() + " entries, " + namespaces.size() + " namespaces}";
    }
}
