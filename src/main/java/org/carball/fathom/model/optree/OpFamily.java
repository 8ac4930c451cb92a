package org.carball.fathom.model.optree;

import lombok.Getter;

/**
 * Structural family of an op. Families form a closed single-inheritance
 * hierarchy, so "is this node loop-like" is answered by walking the parent chain.
 */
@Getter
public enum OpFamily {
    BASE(null),
    COP(BASE),
    SVOP(BASE),
    PADOP(BASE),
    PVOP(BASE),
    UNOP(BASE),
    LOGOP(UNOP),
    CONDOP(UNOP),
    BINOP(UNOP),
    LISTOP(BINOP),
    PMOP(LISTOP),
    LOOP(LISTOP);

    private final OpFamily parent;

    OpFamily(OpFamily parent) {
        this.parent = parent;
    }

    public boolean isA(OpFamily other) {
        for (OpFamily family = this; family != null; family = family.parent) {
            if (family == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds a family by name (case-insensitive). Unknown or missing names map to {@link #BASE}.
     */
    public static OpFamily fromName(String name) {
        if (name == null) {
            return BASE;
        }
        for (OpFamily family : values()) {
            if (family.name().equalsIgnoreCase(name.trim())) {
                return family;
            }
        }
        return BASE;
    }
}
