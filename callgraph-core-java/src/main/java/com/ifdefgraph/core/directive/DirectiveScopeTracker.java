package com.ifdefgraph.core.directive;

import com.ifdefgraph.core.condition.ConditionNormalizer;
import com.ifdefgraph.core.condition.ConditionParser;
import com.ifdefgraph.core.condition.PresenceCondition;
import com.ifdefgraph.core.condition.PresenceCondition.And;
import com.ifdefgraph.core.condition.PresenceCondition.Atom;
import com.ifdefgraph.core.condition.PresenceCondition.Constant;
import com.ifdefgraph.core.condition.PresenceCondition.Not;
import com.ifdefgraph.core.condition.PresenceCondition.Or;
import com.ifdefgraph.core.condition.PresenceCondition.Unknown;
import com.ifdefgraph.core.outcome.FileOutcomeAggregator;
import com.ifdefgraph.core.tree.Span;
import com.ifdefgraph.core.tree.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Stack machine over conditional directives, fed in document order.
 * {@link #current()} is the presence condition of the code at the position reached so far.
 *
 * Imbalances never abort. An {@code #elif}/{@code #else} with no open group opens one whose
 * condition is {@link Unknown#UNKNOWN}; a second {@code #else}, or an {@code #elif} after one, turns
 * the branch UNKNOWN. A stray {@code #endif} means an opening directive was lost, so every position
 * after it, up to the end of the file, carries an UNKNOWN conjunct. Each case is reported as a
 * DirectiveImbalance.
 */
public class DirectiveScopeTracker {

    private final ConditionNormalizer normalizer;
    private final ConditionParser parser;
    private final FileOutcomeAggregator outcome;

    // Top of the deque is the innermost group
    private final Deque<DirectiveFrame> stack = new ArrayDeque<>();
    private PresenceCondition active = Constant.TRUE;
    private boolean lostOpening;

    public DirectiveScopeTracker(ConditionNormalizer normalizer, ConditionParser parser, FileOutcomeAggregator outcome) {
        this.normalizer = normalizer;
        this.parser = parser;
        this.outcome = outcome;
    }

    /** Applies one directive node. Non-conditional directives are ignored. */
    public void onDirective(TreeNode node) {
        if (node.directiveKind() == null) return;
        String raw = node.conditionText();
        switch (node.directiveKind()) {
            case IF -> open(BranchKind.IF, raw, raw == null ? Unknown.UNKNOWN : parser.parse(raw));
            case IFDEF -> open(BranchKind.IFDEF, raw, raw == null ? Unknown.UNKNOWN : Atom.defined(raw));
            case IFNDEF -> open(BranchKind.IFNDEF, raw, raw == null ? Unknown.UNKNOWN : new Not(Atom.defined(raw)));
            case ELIF -> elif(raw, raw == null ? Unknown.UNKNOWN : parser.parse(raw), node.span());
            case ELSE -> orElse(node.span());
            case ENDIF -> endif(node.span());
            default -> {
                return;
            }
        }
        recompute();
    }

    /**
     * Presence condition at the current position, normalized. TRUE when no group is open and no
     * stray {@code #endif} has been seen.
     */
    public PresenceCondition current() {
        return active;
    }

    public int depth() {
        return stack.size();
    }

    /** Open frames, outermost first. */
    public List<DirectiveFrame> frames() {
        List<DirectiveFrame> frames = new ArrayList<>(stack);
        Collections.reverse(frames);
        return frames;
    }

    /**
     * Called at end of file. Any group still open is reported and discarded so the depth returns to 0.
     */
    public void finish() {
        if (stack.isEmpty()) return;
        DirectiveFrame innermost = stack.peek();
        outcome.directiveImbalance(Span.UNKNOWN, stack.size() + " conditional group(s) not closed by #endif at end of file"
                + " (innermost branch: " + describe(innermost) + ")");
        stack.clear();
        recompute();
    }

    // --- Transitions ---

    private void open(BranchKind kind, String raw, PresenceCondition condition) {
        stack.push(DirectiveFrame.open(kind, raw, normalizer.normalize(condition)));
    }

    private void elif(String raw, PresenceCondition own, Span span) {
        if (stack.isEmpty()) {
            outcome.directiveImbalance(span, "#elif without an open #if; branch condition is UNKNOWN");
            stack.push(DirectiveFrame.open(BranchKind.ELIF, raw, Unknown.UNKNOWN));
            return;
        }
        DirectiveFrame top = stack.pop();
        if (top.kind() == BranchKind.ELSE) {
            outcome.directiveImbalance(span, "#elif after #else; branch condition is UNKNOWN");
            stack.push(top.nextBranch(BranchKind.ELIF, raw, Unknown.UNKNOWN, null));
            return;
        }
        PresenceCondition normalizedOwn = normalizer.normalize(own);
        PresenceCondition condition = normalizer.normalize(
                new And(List.of(new Not(new Or(top.branchConditions())), normalizedOwn)));
        stack.push(top.nextBranch(BranchKind.ELIF, raw, condition, normalizedOwn));
    }

    private void orElse(Span span) {
        if (stack.isEmpty()) {
            outcome.directiveImbalance(span, "#else without an open #if; branch condition is UNKNOWN");
            stack.push(DirectiveFrame.open(BranchKind.ELSE, null, Unknown.UNKNOWN));
            return;
        }
        DirectiveFrame top = stack.pop();
        if (top.kind() == BranchKind.ELSE) {
            outcome.directiveImbalance(span, "duplicate #else in the same group; branch condition is UNKNOWN");
            stack.push(top.nextBranch(BranchKind.ELSE, null, Unknown.UNKNOWN, null));
            return;
        }
        PresenceCondition condition = normalizer.normalize(new Not(new Or(top.branchConditions())));
        stack.push(top.nextBranch(BranchKind.ELSE, null, condition, null));
    }

    private void endif(Span span) {
        if (stack.isEmpty()) {
            outcome.directiveImbalance(span, "#endif without a matching #if; rest of file is UNKNOWN");
            lostOpening = true;
            return;
        }
        stack.pop();
    }

    private void recompute() {
        if (stack.isEmpty() && !lostOpening) {
            active = Constant.TRUE;
            return;
        }
        List<PresenceCondition> conditions = new ArrayList<>(stack.size() + 1);
        if (lostOpening) {
            conditions.add(Unknown.UNKNOWN);
        }
        Iterator<DirectiveFrame> outermostFirst = stack.descendingIterator();
        while (outermostFirst.hasNext()) {
            conditions.add(outermostFirst.next().condition());
        }
        active = normalizer.normalize(new And(conditions));
    }

    private static String describe(DirectiveFrame frame) {
        String spelling = "#" + frame.kind().name().toLowerCase();
        return frame.rawCondition() == null ? spelling : spelling + " " + frame.rawCondition();
    }
}
