package org.carball.fathom.analyzer;

import org.carball.fathom.model.optree.OpCategory;
import org.carball.fathom.model.optree.OpFamily;
import org.carball.fathom.model.optree.OpNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class NodeTaxonomyTest {

    private static OpCategory categorize(String name, OpFamily family) {
        return NodeTaxonomy.categorize(OpNode.leaf(name, family));
    }

    @Test
    void shouldIgnoreBookkeepingOps() {
        for (String name : new String[]{"null", "enter", "pushmark", "unstack", "lineseq", "stub"}) {
            assertThat(categorize(name, OpFamily.LISTOP)).as(name).isEqualTo(OpCategory.IGNORABLE);
        }
    }

    @Test
    void shouldRecognizeStatementBoundaries() {
        assertThat(categorize("nextstate", OpFamily.COP)).isEqualTo(OpCategory.STATEMENT_BOUNDARY);
        assertThat(categorize("dbstate", OpFamily.COP)).isEqualTo(OpCategory.STATEMENT_BOUNDARY);
    }

    @Test
    void shouldPreferExactNameOverFamily() {
        // leavesub is a UNOP but counts as a subroutine exit
        assertThat(categorize("leavesub", OpFamily.UNOP)).isEqualTo(OpCategory.SUBROUTINE_EXIT);
        assertThat(categorize("entertry", OpFamily.LOGOP)).isEqualTo(OpCategory.PROTECTED_BLOCK_ENTRY);
        assertThat(categorize("anoncode", OpFamily.SVOP)).isEqualTo(OpCategory.INLINE_CODE_BLOCK);
        assertThat(categorize("scope", OpFamily.LISTOP)).isEqualTo(OpCategory.BARE_BLOCK_SCOPE);
        assertThat(categorize("entersub", OpFamily.UNOP)).isEqualTo(OpCategory.CALL_SITE);
    }

    @Test
    void shouldTreatOtherLeaveOpsAsPairedScopeExits() {
        assertThat(categorize("leave", OpFamily.LISTOP)).isEqualTo(OpCategory.SCOPE_EXIT_PAIRED);
        assertThat(categorize("leaveloop", OpFamily.BINOP)).isEqualTo(OpCategory.SCOPE_EXIT_PAIRED);
        assertThat(categorize("leavetry", OpFamily.LISTOP)).isEqualTo(OpCategory.SCOPE_EXIT_PAIRED);
    }

    @Test
    void shouldCheckLoopBeforeListFamily() {
        assertThat(categorize("enteriter", OpFamily.LOOP)).isEqualTo(OpCategory.LOOP);
        assertThat(categorize("print", OpFamily.LISTOP)).isEqualTo(OpCategory.LIST_OPERATION);
        assertThat(categorize("match", OpFamily.PMOP)).isEqualTo(OpCategory.LIST_OPERATION);
    }

    @Test
    void shouldFallBackThroughRemainingFamilies() {
        assertThat(categorize("add", OpFamily.BINOP)).isEqualTo(OpCategory.BINARY_OPERATION);
        assertThat(categorize("and", OpFamily.LOGOP)).isEqualTo(OpCategory.LOGICAL_OPERATION);
        assertThat(categorize("cond_expr", OpFamily.CONDOP)).isEqualTo(OpCategory.CONDITIONAL);
        assertThat(categorize("not", OpFamily.UNOP)).isEqualTo(OpCategory.UNARY_OPERATION);
    }

    @Test
    void shouldCountUnknownShapesAsUnclassified() {
        assertThat(categorize("padsv", OpFamily.BASE)).isEqualTo(OpCategory.UNCLASSIFIED);
        assertThat(categorize("const", OpFamily.SVOP)).isEqualTo(OpCategory.UNCLASSIFIED);
        assertThat(categorize("somethingnew", OpFamily.PVOP)).isEqualTo(OpCategory.UNCLASSIFIED);
    }

    @Test
    void shouldCarryFixedIncrements() {
        assertThat(OpCategory.SUBROUTINE_EXIT.getTokens()).isEqualTo(4);
        assertThat(OpCategory.SUBROUTINE_EXIT.getSubroutines()).isEqualTo(1);
        assertThat(OpCategory.LOOP.getTokens()).isEqualTo(5);
        assertThat(OpCategory.LOOP.getExpressions()).isEqualTo(2);
        assertThat(OpCategory.CONDITIONAL.getExpressions()).isEqualTo(2);
        assertThat(OpCategory.UNCLASSIFIED.getTokens()).isEqualTo(1);
        assertThat(OpCategory.UNCLASSIFIED.getExpressions()).isZero();
        assertThat(OpCategory.SCOPE_EXIT_PAIRED.contributesNothing()).isTrue();
    }
}
