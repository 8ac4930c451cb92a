package org.carball.fathom.output;

import org.carball.fathom.model.optree.OpCategory;
import org.carball.fathom.model.optree.OpNode;

import java.io.OutputStream;
import java.io.PrintStream;

/**
 * User-facing diagnostics, gated by a verbosity level: 0 prints nothing, 1 lists
 * subroutines skipped as re-exported, 2 and above also traces every visited op.
 */
public class VerboseReporter {

    public static final int REPORT_SKIPPED = 1;
    public static final int REPORT_NODES = 2;

    private final PrintStream out;
    private final int verbosity;

    public VerboseReporter(PrintStream out, int verbosity) {
        if (verbosity < 0) {
            throw new IllegalArgumentException("Verbosity must not be negative: " + verbosity);
        }
        this.out = out;
        this.verbosity = verbosity;
    }

    public static VerboseReporter silent() {
        return new VerboseReporter(new PrintStream(OutputStream.nullOutputStream()), 0);
    }

    public boolean isEnabled(int level) {
        return verbosity >= level;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public void skippedReexport(String qualifiedName) {
        if (isEnabled(REPORT_SKIPPED)) {
            out.println("Skipping imported sub `" + qualifiedName + "'");
        }
    }

    public void visitedNode(OpNode node, int depth, OpCategory category) {
        if (isEnabled(REPORT_NODES)) {
            out.println("  ".repeat(depth) + node.name() + " [" + node.family() + "] "
                    + (category.contributesNothing() ? "-" : category.name()));
        }
    }
}
