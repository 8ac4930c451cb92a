package org.carball.fathom.model.analysis;

import lombok.Getter;
import org.carball.fathom.model.optree.OpCategory;

/**
 * Running structural counts of one analysis run. Counts only ever grow.
 */
@Getter
public class Counters {

    private int tokens;
    private int expressions;
    private int statements;
    private int subroutines;

    public Counters() {
    }

    public Counters(int tokens, int expressions, int statements, int subroutines) {
        if (tokens < 0 || expressions < 0 || statements < 0 || subroutines < 0) {
            throw new IllegalArgumentException("Counters must not be negative");
        }
        this.tokens = tokens;
        this.expressions = expressions;
        this.statements = statements;
        this.subroutines = subroutines;
    }

    public void apply(OpCategory category) {
        tokens += category.getTokens();
        expressions += category.getExpressions();
        statements += category.getStatements();
        subroutines += category.getSubroutines();
    }

    /**
     * The program body is the implicit subroutine of the whole program.
     */
    public void countProgramBody() {
        subroutines++;
    }

    public int get(Counter counter) {
        return switch (counter) {
            case TOKENS -> tokens;
            case EXPRESSIONS -> expressions;
            case STATEMENTS -> statements;
            case SUBROUTINES -> subroutines;
        };
    }

    @Override
    public String toString() {
        return String.format("Counters{tokens=%d, expressions=%d, statements=%d, subroutines=%d}",
                tokens, expressions, statements, subroutines);
    }
}
