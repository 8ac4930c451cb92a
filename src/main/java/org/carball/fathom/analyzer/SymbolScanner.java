package org.carball.fathom.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.fathom.model.symbol.BindingMultiplicity;
import org.carball.fathom.model.symbol.SymbolBinding;
import org.carball.fathom.model.symbol.SymbolTable;

/**
 * First pass over the symbol table: counts how many names lead to each code object.
 */
@Slf4j
public class SymbolScanner {

    public BindingMultiplicity scan(SymbolTable table, AnalysisRun run) {
        BindingMultiplicity multiplicity = new BindingMultiplicity();

        int visited = SymbolTableWalker.walk(table, (namespace, entry) -> {
            if (entry.isMalformed()) {
                log.warn("Skipping unresolvable symbol {} (code reference '{}')",
                        namespace.qualify(entry.name()), entry.unresolvedReference());
                run.recordUnresolvedSymbol();
                return;
            }
            if (!entry.denotesCode()) {
                return;
            }
            multiplicity.record(new SymbolBinding(namespace.qualify(entry.name()), entry.code()));
        });

        log.debug("Scanned {} symbol entries, {} distinct code objects",
                visited, multiplicity.distinctCodeObjects());
        run.completeScan(multiplicity);
        return multiplicity;
    }
}
