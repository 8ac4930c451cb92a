package org.carball.fathom.analyzer;

import lombok.Getter;
import org.carball.fathom.model.Program;
import org.carball.fathom.model.analysis.Counters;
import org.carball.fathom.model.analysis.SubroutineWorklist;
import org.carball.fathom.model.symbol.BindingMultiplicity;

/**
 * State owned by a single analysis of one program. A new instance is created for
 * every run, so nothing carries over between programs.
 */
@Getter
public class AnalysisRun {

    private final Program program;
    private final Counters counters = new Counters();
    private BindingMultiplicity multiplicity;
    private SubroutineWorklist worklist;
    private int unresolvedSymbols;
    private int unclassifiedNodes;

    public AnalysisRun(Program program) {
        this.program = program;
    }

    void completeScan(BindingMultiplicity multiplicity) {
        this.multiplicity = multiplicity;
    }

    void completeCollection(SubroutineWorklist worklist) {
        this.worklist = worklist;
    }

    void recordUnresolvedSymbol() {
        unresolvedSymbols++;
    }

    void recordUnclassifiedNode() {
        unclassifiedNodes++;
    }
}
