package org.carball.fathom.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.fathom.model.Program;
import org.carball.fathom.model.analysis.AnalysisResult;
import org.carball.fathom.model.analysis.ReadabilityScore;
import org.carball.fathom.model.analysis.SubroutineWorklist;
import org.carball.fathom.model.optree.OpCategory;
import org.carball.fathom.model.optree.OpNode;
import org.carball.fathom.model.symbol.CodeObject;
import org.carball.fathom.output.VerboseReporter;
import org.carball.fathom.parser.OpTreeDocumentReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class ReadabilityAnalyzer {

    private final VerboseReporter reporter;
    private final SymbolScanner symbolScanner;
    private final SubroutineCollector subroutineCollector;
    private final TreeWalker treeWalker;
    private final OpClassifier classifier;
    private final ReadabilityScorer scorer;

    public ReadabilityAnalyzer() {
        this(VerboseReporter.silent());
    }

    public ReadabilityAnalyzer(VerboseReporter reporter) {
        this.reporter = reporter;
        this.symbolScanner = new SymbolScanner();
        this.subroutineCollector = new SubroutineCollector(reporter);
        this.treeWalker = new TreeWalker();
        this.classifier = new OpClassifier();
        this.scorer = new ReadabilityScorer();

        log.debug("Initialized ReadabilityAnalyzer with verbosity {}", reporter.getVerbosity());
    }

    public AnalysisResult analyze(Path opTreeDocument) throws IOException {
        return analyze(OpTreeDocumentReader.read(opTreeDocument));
    }

    /**
     * Runs the full pipeline on one program.
     *
     * @throws DegenerateInputException if the program yields a zero counter
     */
    public AnalysisResult analyze(Program program) {
        log.info("Starting readability analysis of {}", program.name());
        AnalysisRun run = new AnalysisRun(program);

        // Step 1: Count bindings per code object (must finish before step 2)
        symbolScanner.scan(program.symbolTable(), run);

        // Step 2: Queue subroutines bound under exactly one name
        SubroutineWorklist worklist = subroutineCollector.collect(program.symbolTable(), run);

        // Step 3: Classify every op of the main body and of each queued subroutine
        List<OpNode> bodies = worklist.subroutines().stream()
                .map(CodeObject::getBody)
                .collect(Collectors.toList());
        int visited = treeWalker.walkAll(program.mainRoot(), bodies, (node, depth) -> {
            OpCategory category = classifier.tally(node, run);
            reporter.visitedNode(node, depth, category);
        });
        run.getCounters().countProgramBody();
        log.info("Visited {} ops in the main body and {} subroutines: {}",
                visited, worklist.size(), run.getCounters());

        // Step 4: Score
        ReadabilityScore score = scorer.score(run.getCounters());
        log.info("Readability of {} is {} ({})",
                program.name(), String.format("%.2f", score.getScore()), score.getLabel());

        return new AnalysisResult(
                program.name(),
                score,
                worklist.size(),
                worklist.skippedNames(),
                run.getUnresolvedSymbols(),
                run.getUnclassifiedNodes());
    }
}
