package com.ifdefgraph.core.condition;

import java.util.List;

/**
 * Boolean expression over macro atoms describing when a span of code is compiled.
 * All implementations are immutable values with structural equality.
 * Use {@link ConditionNormalizer} to obtain the canonical form and {@link ConditionRenderer} to print it.
 */
public interface PresenceCondition {

    /** True for an atom, the UNKNOWN marker, or the negation of either. */
    default boolean isLiteral() {
        PresenceCondition base = this instanceof Not ? ((Not) this).operand() : this;
        return base instanceof Atom || base instanceof Unknown;
    }

    static PresenceCondition and(PresenceCondition... operands) {
        return new And(List.of(operands));
    }

    static PresenceCondition or(PresenceCondition... operands) {
        return new Or(List.of(operands));
    }

    static PresenceCondition not(PresenceCondition operand) {
        return new Not(operand);
    }

    enum Constant implements PresenceCondition {
        TRUE,
        FALSE;

        public Constant negate() {
            return this == TRUE ? FALSE : TRUE;
        }
    }

    /**
     * Stands in for a scope whose real condition was lost to a directive imbalance or a missing
     * directive expression. Distinct from any macro, including one named {@code UNKNOWN}, and never
     * folded or cancelled by normalization.
     */
    enum Unknown implements PresenceCondition {
        UNKNOWN
    }

    /**
     * A condition the tool cannot decompose further: {@code defined(X)}, a bare macro name,
     * or an opaque comparison such as {@code VERSION > 2}.
     */
    record Atom(String name) implements PresenceCondition {

        public static Atom defined(String macro) {
            return new Atom("defined(" + macro + ")");
        }

        @Override
        public String toString() { return ConditionRenderer.render(this); }
    }

    record Not(PresenceCondition operand) implements PresenceCondition {
        @Override
        public String toString() { return ConditionRenderer.render(this); }
    }

    record And(List<PresenceCondition> operands) implements PresenceCondition {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public String toString() { return ConditionRenderer.render(this); }
    }

    record Or(List<PresenceCondition> operands) implements PresenceCondition {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public String toString() { return ConditionRenderer.render(this); }
    }
}
