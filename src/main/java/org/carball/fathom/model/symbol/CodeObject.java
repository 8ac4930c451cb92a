package org.carball.fathom.model.symbol;

import lombok.Getter;
import org.carball.fathom.model.optree.OpNode;

/**
 * The body of one subroutine. Code objects are compared by identity only: several
 * names may lead to the same instance, and two distinct instances are never equal.
 */
@Getter
public final class CodeObject {

    private final String id;

    /** Root op of the body; null for forward declarations and native routines. */
    private final OpNode body;

    public CodeObject(String id, OpNode body) {
        this.id = id;
        this.body = body;
    }

    public static CodeObject declaredOnly(String id) {
        return new CodeObject(id, null);
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return "CodeObject{" + id + (hasBody() ? "" : ", no body") + "}";
    }
}
