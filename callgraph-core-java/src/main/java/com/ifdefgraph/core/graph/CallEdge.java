package com.ifdefgraph.core.graph;

import com.ifdefgraph.core.condition.ConditionRenderer;
import com.ifdefgraph.core.condition.PresenceCondition;

/**
 * One caller->callee relationship found at a call site.
 *
 * @param caller            enclosing function name, or {@link CallGraphExtractor#FILE_SCOPE}
 * @param callee            literal identifier, or the rendered call expression when {@code indirect}
 * @param indirect          the target is not a plain identifier (function pointer, member access, ...)
 * @param presenceCondition normalized condition under which the call site is compiled
 * @param alwaysFalse       the condition normalized to FALSE; the edge is kept for downstream filtering
 */
public record CallEdge(
    String project,
    String file,
    String caller,
    String callee,
    boolean indirect,
    PresenceCondition presenceCondition,
    boolean alwaysFalse
) {

    /** Canonical text of the presence condition, {@code "TRUE"} when unconditional. */
    public String presenceText() {
        return ConditionRenderer.render(presenceCondition);
    }
}
