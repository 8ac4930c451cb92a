package org.carball.fathom.analyzer;

import org.carball.fathom.model.analysis.Counter;
import org.carball.fathom.model.analysis.Counters;
import org.carball.fathom.model.analysis.ReadabilityLevel;
import org.carball.fathom.model.analysis.ReadabilityScore;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

public class ReadabilityScorer {

    // Weights in hundredths, not normalized: 0.55, 0.28 and 0.08 sum to 0.91.
    private static final BigInteger TOKEN_PER_EXPRESSION_WEIGHT = BigInteger.valueOf(55);
    private static final BigInteger EXPRESSION_PER_STATEMENT_WEIGHT = BigInteger.valueOf(28);
    private static final BigInteger STATEMENT_PER_SUBROUTINE_WEIGHT = BigInteger.valueOf(8);
    private static final BigInteger WEIGHT_SCALE = BigInteger.valueOf(100);

    /**
     * Scores final counters.
     *
     * @throws DegenerateInputException if any counter is zero, checked in the
     *         order tokens, expressions, statements, subroutines
     */
    public ReadabilityScore score(Counters counters) {
        for (Counter counter : Counter.values()) {
            if (counters.get(counter) == 0) {
                throw new DegenerateInputException(counter);
            }
        }

        double tokenPerExpression = (double) counters.getTokens() / counters.getExpressions();
        double expressionPerStatement = (double) counters.getExpressions() / counters.getStatements();
        double statementPerSubroutine = (double) counters.getStatements() / counters.getSubroutines();

        // Exact score as one fraction over 100 * expressions * statements * subroutines
        BigInteger tokens = BigInteger.valueOf(counters.getTokens());
        BigInteger expressions = BigInteger.valueOf(counters.getExpressions());
        BigInteger statements = BigInteger.valueOf(counters.getStatements());
        BigInteger subroutines = BigInteger.valueOf(counters.getSubroutines());

        BigInteger numerator = TOKEN_PER_EXPRESSION_WEIGHT.multiply(tokens).multiply(statements).multiply(subroutines)
                .add(EXPRESSION_PER_STATEMENT_WEIGHT.multiply(expressions).multiply(expressions).multiply(subroutines))
                .add(STATEMENT_PER_SUBROUTINE_WEIGHT.multiply(statements).multiply(statements).multiply(expressions));
        BigInteger denominator = WEIGHT_SCALE.multiply(expressions).multiply(statements).multiply(subroutines);

        double score = new BigDecimal(numerator)
                .divide(new BigDecimal(denominator), MathContext.DECIMAL64)
                .doubleValue();

        return ReadabilityScore.builder()
                .tokens(counters.getTokens())
                .expressions(counters.getExpressions())
                .statements(counters.getStatements())
                .subroutines(counters.getSubroutines())
                .tokenPerExpression(tokenPerExpression)
                .expressionPerStatement(expressionPerStatement)
                .statementPerSubroutine(statementPerSubroutine)
                .score(score)
                .level(ReadabilityLevel.fromScore(numerator, denominator))
                .build();
    }
}
