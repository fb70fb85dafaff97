package com.codegraph.core.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One root-to-leaf path of a call chain and why it ends there.
 *
 * @param entityIds entity ids along the path; null entries stand for external callees
 * @param names names along the path
 * @param truncation reason the path stops
 */
public record CallPath(
    List<String> entityIds,
    List<String> names,
    Truncation truncation
) {
    public CallPath {
        // List.copyOf rejects nulls, external callees have none
        entityIds = entityIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(entityIds));
        names = names == null ? List.of() : List.copyOf(names);
    }

    public int length() {
        return names.size();
    }

    /**
     * Why a call path ends.
     */
    public enum Truncation {
        /** Leaf: no further callees, or an external callee. */
        NONE,
        /** The depth limit was reached. */
        DEPTH,
        /** The node budget was exhausted. */
        NODE_LIMIT,
        /** The next callee is already on this path. */
        CYCLE,
        /** The next callee was expanded on another path. */
        REVISIT
    }
}
