package org.carball.fathom.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.fathom.model.optree.OpCategory;
import org.carball.fathom.model.optree.OpNode;

/**
 * Adds the fixed increments of a node's category to the run's counters.
 * Every node gets a category; unknown shapes count as a single token.
 */
@Slf4j
public class OpClassifier {

    public OpCategory tally(OpNode node, AnalysisRun run) {
        OpCategory category = NodeTaxonomy.categorize(node);
        if (category == OpCategory.UNCLASSIFIED) {
            log.debug("Unclassified op {}, counting one token", node);
            run.recordUnclassifiedNode();
        }
        run.getCounters().apply(category);
        return category;
    }
}
