package org.carball.fathom.model.analysis;

import java.util.List;

public record AnalysisResult(
    String programName,
    ReadabilityScore score,
    int analyzedSubroutines,
    List<String> skippedReexports,
    int unresolvedSymbols,
    int unclassifiedNodes
) {}
