package org.carball.fathom.model.analysis;

import org.carball.fathom.model.symbol.CodeObject;

import java.util.List;

/**
 * Subroutine bodies queued for traversal, in collection order, and the sorted
 * names of the bindings skipped as re-exported.
 */
public record SubroutineWorklist(List<CodeObject> subroutines, List<String> skippedNames) {

    public SubroutineWorklist {
        subroutines = List.copyOf(subroutines);
        skippedNames = List.copyOf(skippedNames);
    }

    public int size() {
        return subroutines.size();
    }
}
