package com.ifdefgraph.core.condition;

import com.ifdefgraph.core.condition.PresenceCondition.And;
import com.ifdefgraph.core.condition.PresenceCondition.Atom;
import com.ifdefgraph.core.condition.PresenceCondition.Constant;
import com.ifdefgraph.core.condition.PresenceCondition.Not;
import com.ifdefgraph.core.condition.PresenceCondition.Or;
import com.ifdefgraph.core.condition.PresenceCondition.Unknown;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Syntactic canonicalization of presence conditions.
 *
 * <ol>
 *   <li>Negations are pushed down to atoms (De Morgan); double negations cancel.</li>
 *   <li>Nested AND/OR of the same operator are flattened.</li>
 *   <li>TRUE is dropped from conjunctions and FALSE from disjunctions; the absorbing constant wins.</li>
 *   <li>Duplicate operands are removed.</li>
 *   <li>A conjunction holding an atom and its negation is FALSE; a disjunction holding both is TRUE.
 *       {@link Unknown#UNKNOWN} is never cancelled: two lost scopes need not be the same one.</li>
 *   <li>Operands are sorted by {@link #OPERAND_ORDER}.</li>
 * </ol>
 *
 * This is not an equivalence decision procedure: two equivalent conditions may still render
 * differently (no absorption, no resolution).
 */
public class ConditionNormalizer {

    /**
     * Literals first, ordered by rendered atom text with the positive literal before the negative one;
     * then compound operands by their rendered text.
     */
    static final Comparator<PresenceCondition> OPERAND_ORDER = (a, b) -> {
        boolean aLiteral = a.isLiteral();
        boolean bLiteral = b.isLiteral();
        if (aLiteral != bLiteral) {
            return aLiteral ? -1 : 1;
        }
        if (aLiteral) {
            int byName = ConditionRenderer.render(baseOf(a)).compareTo(ConditionRenderer.render(baseOf(b)));
            if (byName != 0) return byName;
            return Boolean.compare(a instanceof Not, b instanceof Not);
        }
        return ConditionRenderer.render(a).compareTo(ConditionRenderer.render(b));
    };

    public PresenceCondition normalize(PresenceCondition condition) {
        return simplify(pushNegations(condition, false));
    }

    // --- Negation normal form ---

    private PresenceCondition pushNegations(PresenceCondition c, boolean negated) {
        if (c instanceof Constant) {
            return negated ? ((Constant) c).negate() : c;
        }
        if (c instanceof Atom || c instanceof Unknown) {
            return negated ? new Not(c) : c;
        }
        if (c instanceof Not) {
            return pushNegations(((Not) c).operand(), !negated);
        }
        if (c instanceof And) {
            List<PresenceCondition> ops = pushAll(((And) c).operands(), negated);
            return negated ? new Or(ops) : new And(ops);
        }
        if (c instanceof Or) {
            List<PresenceCondition> ops = pushAll(((Or) c).operands(), negated);
            return negated ? new And(ops) : new Or(ops);
        }
        throw new IllegalArgumentException("Unknown condition type: " + c.getClass().getName());
    }

    private List<PresenceCondition> pushAll(List<PresenceCondition> operands, boolean negated) {
        List<PresenceCondition> result = new ArrayList<>(operands.size());
        for (PresenceCondition op : operands) {
            result.add(pushNegations(op, negated));
        }
        return result;
    }

    // --- Simplification (input is in negation normal form) ---

    private PresenceCondition simplify(PresenceCondition c) {
        if (c instanceof And) {
            return junction(((And) c).operands(), true);
        }
        if (c instanceof Or) {
            return junction(((Or) c).operands(), false);
        }
        return c;
    }

    private PresenceCondition junction(List<PresenceCondition> operands, boolean conjunction) {
        Constant identity = conjunction ? Constant.TRUE : Constant.FALSE;
        Constant absorbing = identity.negate();

        Set<PresenceCondition> flat = new LinkedHashSet<>();
        for (PresenceCondition op : operands) {
            PresenceCondition s = simplify(op);
            if (conjunction && s instanceof And) {
                flat.addAll(((And) s).operands());
            } else if (!conjunction && s instanceof Or) {
                flat.addAll(((Or) s).operands());
            } else if (s == absorbing) {
                return absorbing;
            } else if (s != identity) {
                flat.add(s);
            }
        }

        for (PresenceCondition op : flat) {
            if (op instanceof Atom && flat.contains(new Not(op))) {
                return absorbing;
            }
        }

        if (flat.isEmpty()) return identity;
        if (flat.size() == 1) return flat.iterator().next();

        List<PresenceCondition> sorted = new ArrayList<>(flat);
        sorted.sort(OPERAND_ORDER);
        return conjunction ? new And(sorted) : new Or(sorted);
    }

    private static PresenceCondition baseOf(PresenceCondition literal) {
        return literal instanceof Not ? ((Not) literal).operand() : literal;
    }
}
