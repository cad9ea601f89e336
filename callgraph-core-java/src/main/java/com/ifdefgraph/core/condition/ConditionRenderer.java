package com.ifdefgraph.core.condition;

import com.ifdefgraph.core.condition.PresenceCondition.And;
import com.ifdefgraph.core.condition.PresenceCondition.Atom;
import com.ifdefgraph.core.condition.PresenceCondition.Constant;
import com.ifdefgraph.core.condition.PresenceCondition.Not;
import com.ifdefgraph.core.condition.PresenceCondition.Or;
import com.ifdefgraph.core.condition.PresenceCondition.Unknown;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Textual rendering of a condition: {@code TRUE}, {@code FALSE}, {@code UNKNOWN}, atom text,
 * {@code not A}, operands joined by {@code and} / {@code or}. Negated or compound operands of a
 * junction are parenthesized, e.g. {@code (not X) and Y}.
 *
 * Atom text is printed bare only for a macro name or {@code defined(NAME)}; anything else, and a
 * macro spelled like a keyword of this notation, is bracketed: {@code not [X == 1]}, {@code [TRUE]}.
 *
 * The output is canonical only for conditions that went through {@link ConditionNormalizer}.
 */
public final class ConditionRenderer {

    private static final Pattern BARE_ATOM = Pattern.compile(
            "[A-Za-z_][A-Za-z0-9_]*|defined\\([A-Za-z_][A-Za-z0-9_]*\\)");
    private static final Set<String> RESERVED = Set.of("TRUE", "FALSE", "UNKNOWN", "not", "and", "or");

    private ConditionRenderer() {}

    public static String render(PresenceCondition condition) {
        StringBuilder sb = new StringBuilder();
        append(sb, condition);
        return sb.toString();
    }

    private static void append(StringBuilder sb, PresenceCondition c) {
        if (c instanceof Constant) {
            sb.append(((Constant) c).name());
        } else if (c instanceof Unknown) {
            sb.append("UNKNOWN");
        } else if (c instanceof Atom) {
            sb.append(atomText(((Atom) c).name()));
        } else if (c instanceof Not) {
            PresenceCondition operand = ((Not) c).operand();
            sb.append("not ");
            if (operand instanceof Atom || operand instanceof Constant || operand instanceof Unknown) {
                append(sb, operand);
            } else {
                sb.append('(');
                append(sb, operand);
                sb.append(')');
            }
        } else if (c instanceof And) {
            appendJunction(sb, ((And) c).operands(), " and ");
        } else if (c instanceof Or) {
            appendJunction(sb, ((Or) c).operands(), " or ");
        } else {
            throw new IllegalArgumentException("Unknown condition type: " + c.getClass().getName());
        }
    }

    private static void appendJunction(StringBuilder sb, List<PresenceCondition> operands, String joiner) {
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(joiner);
            PresenceCondition op = operands.get(i);
            boolean wrap = op instanceof Not || op instanceof And || op instanceof Or;
            if (wrap) sb.append('(');
            append(sb, op);
            if (wrap) sb.append(')');
        }
    }

    private static String atomText(String name) {
        if (BARE_ATOM.matcher(name).matches() && !RESERVED.contains(name)) {
            return name;
        }
        return "[" + name + "]";
    }
}
