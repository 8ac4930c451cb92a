package org.carball.fathom.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.fathom.model.analysis.SubroutineWorklist;
import org.carball.fathom.model.symbol.BindingMultiplicity;
import org.carball.fathom.model.symbol.CodeObject;
import org.carball.fathom.model.symbol.SymbolTable;
import org.carball.fathom.output.VerboseReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Second pass over the symbol table: queues the body of every code object reachable
 * under exactly one name. Objects reachable under several names are assumed to be
 * imported or re-exported and are left out.
 */
@Slf4j
public class SubroutineCollector {

    private final VerboseReporter reporter;

    public SubroutineCollector(VerboseReporter reporter) {
        this.reporter = reporter;
    }

    public SubroutineWorklist collect(SymbolTable table, AnalysisRun run) {
        BindingMultiplicity multiplicity = run.getMultiplicity();
        if (multiplicity == null) {
            throw new IllegalStateException("Symbol scan must complete before subroutines are collected");
        }

        List<CodeObject> queue = new ArrayList<>();
        TreeSet<String> skipped = new TreeSet<>();

        SymbolTableWalker.walk(table, (namespace, entry) -> {
            if (!entry.denotesCode()) {
                return;
            }
            CodeObject code = entry.code();
            String name = namespace.qualify(entry.name());

            int occurrences = multiplicity.occurrencesOf(code);
            if (occurrences != 1) {
                log.debug("Skipping {}: same code as {}, bound under {} names",
                        name, multiplicity.representativeName(code), occurrences);
                skipped.add(name);
                return;
            }
            if (!code.hasBody()) {
                log.debug("Subroutine {} has no body, nothing to traverse", name);
                return;
            }
            queue.add(code);
        });

        SubroutineWorklist worklist = new SubroutineWorklist(queue, new ArrayList<>(skipped));
        if (reporter.isEnabled(VerboseReporter.REPORT_SKIPPED)) {
            worklist.skippedNames().forEach(reporter::skippedReexport);
        }

        log.debug("Queued {} subroutine bodies, skipped {} re-exported names",
                worklist.size(), worklist.skippedNames().size());
        run.completeCollection(worklist);
        return worklist;
    }
}
