package com.ifdefgraph.core.directive;

import com.ifdefgraph.core.condition.PresenceCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * One open {@code #if} group on the tracker's stack, describing the branch currently active.
 *
 * @param rawCondition     directive text as written ({@code FOO} for {@code #ifdef FOO}); null for {@code #else}
 * @param condition        normalized condition of the active branch, exclusions of earlier branches included
 * @param kind             directive that opened the active branch
 * @param branchConditions normalized own conditions of every branch seen so far in this group, in order
 */
public record DirectiveFrame(
    String rawCondition,
    PresenceCondition condition,
    BranchKind kind,
    List<PresenceCondition> branchConditions
) {

    public DirectiveFrame {
        branchConditions = List.copyOf(branchConditions);
    }

    static DirectiveFrame open(BranchKind kind, String raw, PresenceCondition condition) {
        return new DirectiveFrame(raw, condition, kind, List.of(condition));
    }

    DirectiveFrame nextBranch(BranchKind kind, String raw, PresenceCondition condition, PresenceCondition own) {
        List<PresenceCondition> branches = new ArrayList<>(branchConditions);
        if (own != null) {
            branches.add(own);
        }
        return new DirectiveFrame(raw, condition, kind, branches);
    }
}
