package org.carball.fathom.analyzer;

import lombok.Getter;
import org.carball.fathom.model.analysis.Counter;

/**
 * Thrown when a counter is zero at scoring time, so no ratio can be formed.
 */
@Getter
public class DegenerateInputException extends RuntimeException {

    private final Counter counter;

    public DegenerateInputException(Counter counter) {
        super("No " + counter.getPlural() + "; score is meaningless.");
        this.counter = counter;
    }
}
