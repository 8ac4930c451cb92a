package org.carball.fathom.analyzer;

import org.carball.fathom.model.optree.OpCategory;
import org.carball.fathom.model.optree.OpFamily;
import org.carball.fathom.model.optree.OpNode;

import java.util.List;
import java.util.Map;

/**
 * Maps an op to its structural category. Exact op names are checked first, then
 * the family chain in a fixed priority order.
 */
public final class NodeTaxonomy {

    private static final String SCOPE_EXIT_PREFIX = "leave";

    private static final Map<String, OpCategory> EXACT_NAMES = Map.ofEntries(
            Map.entry("null", OpCategory.IGNORABLE),
            Map.entry("enter", OpCategory.IGNORABLE),
            Map.entry("pushmark", OpCategory.IGNORABLE),
            Map.entry("unstack", OpCategory.IGNORABLE),
            Map.entry("lineseq", OpCategory.IGNORABLE),
            Map.entry("stub", OpCategory.IGNORABLE),
            Map.entry("nextstate", OpCategory.STATEMENT_BOUNDARY),
            Map.entry("dbstate", OpCategory.STATEMENT_BOUNDARY),
            Map.entry("leavesub", OpCategory.SUBROUTINE_EXIT),
            Map.entry("entertry", OpCategory.PROTECTED_BLOCK_ENTRY),
            Map.entry("anoncode", OpCategory.INLINE_CODE_BLOCK),
            Map.entry("scope", OpCategory.BARE_BLOCK_SCOPE),
            Map.entry("entersub", OpCategory.CALL_SITE)
    );

    // LOOP is a LISTOP, so it must be tested first.
    private static final List<Map.Entry<OpFamily, OpCategory>> FAMILY_ORDER = List.of(
            Map.entry(OpFamily.LOOP, OpCategory.LOOP),
            Map.entry(OpFamily.LISTOP, OpCategory.LIST_OPERATION),
            Map.entry(OpFamily.BINOP, OpCategory.BINARY_OPERATION),
            Map.entry(OpFamily.LOGOP, OpCategory.LOGICAL_OPERATION),
            Map.entry(OpFamily.CONDOP, OpCategory.CONDITIONAL),
            Map.entry(OpFamily.UNOP, OpCategory.UNARY_OPERATION)
    );

    private NodeTaxonomy() {
        // Utility class - prevent instantiation
    }

    public static OpCategory categorize(OpNode node) {
        OpCategory exact = EXACT_NAMES.get(node.name());
        if (exact != null) {
            return exact;
        }
        if (node.name().startsWith(SCOPE_EXIT_PREFIX)) {
            return OpCategory.SCOPE_EXIT_PAIRED;
        }
        for (Map.Entry<OpFamily, OpCategory> candidate : FAMILY_ORDER) {
            if (node.family().isA(candidate.getKey())) {
                return candidate.getValue();
            }
        }
        return OpCategory.UNCLASSIFIED;
    }
}
