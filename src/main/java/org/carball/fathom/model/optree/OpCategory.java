package org.carball.fathom.model.optree;

import lombok.Getter;

/**
 * Structural category of an op together with the counter increments it contributes.
 * The increments approximate the surface tokens and independent sub-expressions
 * the construct stands for in the source text.
 */
@Getter
public enum OpCategory {
    IGNORABLE(0, 0, 0, 0),
    STATEMENT_BOUNDARY(1, 0, 1, 0),
    // sub name { ... }
    SUBROUTINE_EXIT(4, 1, 0, 1),
    // accounted for by the matching enter op
    SCOPE_EXIT_PAIRED(0, 0, 0, 0),
    // eval { ... }
    PROTECTED_BLOCK_ENTRY(3, 1, 0, 0),
    // sub { ... }
    INLINE_CODE_BLOCK(3, 1, 0, 0),
    // do { ... }
    BARE_BLOCK_SCOPE(3, 1, 0, 0),
    // name(...)
    CALL_SITE(3, 1, 0, 0),
    // for (...) { ... }
    LOOP(5, 2, 0, 0),
    // OP(...)
    LIST_OPERATION(3, 1, 0, 0),
    // x OP y
    BINARY_OPERATION(1, 1, 0, 0),
    LOGICAL_OPERATION(1, 1, 0, 0),
    // while (...) { ... }
    CONDITIONAL(5, 2, 0, 0),
    // OP x
    UNARY_OPERATION(1, 1, 0, 0),
    UNCLASSIFIED(1, 0, 0, 0);

    private final int tokens;
    private final int expressions;
    private final int statements;
    private final int subroutines;

    OpCategory(int tokens, int expressions, int statements, int subroutines) {
        this.tokens = tokens;
        this.expressions = expressions;
        this.statements = statements;
        this.subroutines = subroutines;
    }

    public boolean contributesNothing() {
        return tokens == 0 && expressions == 0 && statements == 0 && subroutines == 0;
    }
}
