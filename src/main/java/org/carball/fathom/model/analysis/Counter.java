package org.carball.fathom.model.analysis;

import lombok.Getter;

/**
 * The four structural quantities, in the order the scorer validates them.
 */
@Getter
public enum Counter {
    TOKENS("token"),
    EXPRESSIONS("expression"),
    STATEMENTS("statement"),
    SUBROUTINES("subroutine");

    private final String singular;

    Counter(String singular) {
        this.singular = singular;
    }

    public String getPlural() {
        return singular + "s";
    }

    public String label(int count) {
        return count == 1 ? singular : getPlural();
    }
}
