package org.carball.fathom.model.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReadabilityScore {
    int tokens;
    int expressions;
    int statements;
    int subroutines;
    double tokenPerExpression;
    double expressionPerStatement;
    double statementPerSubroutine;
    double score;
    ReadabilityLevel level;

    public int count(Counter counter) {
        return switch (counter) {
            case TOKENS -> tokens;
            case EXPRESSIONS -> expressions;
            case STATEMENTS -> statements;
            case SUBROUTINES -> subroutines;
        };
    }

    public String getLabel() {
        return level.getLabel();
    }
}
