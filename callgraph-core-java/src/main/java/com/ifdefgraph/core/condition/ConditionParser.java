package com.ifdefgraph.core.condition;

import com.ifdefgraph.core.condition.PresenceCondition.And;
import com.ifdefgraph.core.condition.PresenceCondition.Atom;
import com.ifdefgraph.core.condition.PresenceCondition.Constant;
import com.ifdefgraph.core.condition.PresenceCondition.Not;
import com.ifdefgraph.core.condition.PresenceCondition.Or;
import com.ifdefgraph.core.condition.PresenceCondition.Unknown;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the expression of an {@code #if} / {@code #elif} into a {@link PresenceCondition}.
 *
 * Only the propositional skeleton is modelled: {@code defined(X)}, {@code defined X}, {@code !},
 * {@code &&}, {@code ||} and parentheses. Every other sub-expression ({@code X > 2},
 * {@code VERSION(1, 2)}) becomes one opaque atom with whitespace-normalized text. Integer literals
 * are constants: zero is FALSE, anything else TRUE. Parsing never fails; text that does not fit
 * the grammar becomes a single atom.
 */
public class ConditionParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern INTEGER = Pattern.compile("(0[xX][0-9a-fA-F]+|[0-9]+)[uUlL]*");
    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("&&", "||", "==", "!=", "<=", ">=", "<<", ">>");

    /**
     * @param expression directive expression text, e.g. {@code defined(FOO) && !BAR}
     * @return the unnormalized condition, or {@link Unknown#UNKNOWN} for blank input
     */
    public PresenceCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Unknown.UNKNOWN;
        }
        List<String> tokens = tokenize(expression);
        Cursor cursor = new Cursor(tokens);
        PresenceCondition result = parseOr(cursor);
        if (!cursor.atEnd()) {
            // Trailing garbage such as an unbalanced ')': keep the whole expression as one atom
            return new Atom(join(tokens));
        }
        return result;
    }

    private PresenceCondition parseOr(Cursor c) {
        List<PresenceCondition> operands = new ArrayList<>();
        operands.add(parseAnd(c));
        while ("||".equals(c.peek())) {
            c.next();
            operands.add(parseAnd(c));
        }
        return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }

    private PresenceCondition parseAnd(Cursor c) {
        List<PresenceCondition> operands = new ArrayList<>();
        operands.add(parseUnary(c));
        while ("&&".equals(c.peek())) {
            c.next();
            operands.add(parseUnary(c));
        }
        return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    private PresenceCondition parseUnary(Cursor c) {
        if ("!".equals(c.peek())) {
            c.next();
            return new Not(parseUnary(c));
        }
        int start = c.pos;
        PresenceCondition primary = parsePrimary(c);
        if (primary != null && atOperandBoundary(c)) {
            return primary;
        }
        c.pos = start;
        return opaque(c);
    }

    /** Returns null when the tokens at the cursor are not a structured primary. */
    private PresenceCondition parsePrimary(Cursor c) {
        String t = c.peek();
        if (t == null) return null;

        if ("(".equals(t)) {
            c.next();
            PresenceCondition inner = parseOr(c);
            if (!")".equals(c.peek())) return null;
            c.next();
            return inner;
        }
        if ("defined".equals(t)) {
            c.next();
            if ("(".equals(c.peek())) {
                c.next();
                String macro = c.next();
                if (macro == null || !IDENTIFIER.matcher(macro).matches() || !")".equals(c.next())) return null;
                return Atom.defined(macro);
            }
            String macro = c.next();
            if (macro == null || !IDENTIFIER.matcher(macro).matches()) return null;
            return Atom.defined(macro);
        }
        if (INTEGER.matcher(t).matches()) {
            c.next();
            return isZero(t) ? Constant.FALSE : Constant.TRUE;
        }
        if (IDENTIFIER.matcher(t).matches()) {
            c.next();
            return new Atom(t);
        }
        return null;
    }

    /** Consumes tokens up to the next top-level {@code &&}, {@code ||} or unmatched {@code )}. */
    private PresenceCondition opaque(Cursor c) {
        List<String> taken = new ArrayList<>();
        int depth = 0;
        while (!c.atEnd()) {
            String t = c.peek();
            if (depth == 0 && ("&&".equals(t) || "||".equals(t) || ")".equals(t))) break;
            if ("(".equals(t)) depth++;
            if (")".equals(t)) depth--;
            taken.add(c.next());
        }
        if (taken.isEmpty()) {
            // Nothing usable here (e.g. "&& X"): take one token so parsing always advances
            String t = c.next();
            return t == null ? Unknown.UNKNOWN : new Atom(t);
        }
        return new Atom(join(taken));
    }

    private static boolean atOperandBoundary(Cursor c) {
        String t = c.peek();
        return t == null || "&&".equals(t) || "||".equals(t) || ")".equals(t);
    }

    private static boolean isZero(String literal) {
        String digits = literal.replaceAll("[uUlL]+$", "");
        if (digits.startsWith("0x") || digits.startsWith("0X")) digits = digits.substring(2);
        return digits.chars().allMatch(ch -> ch == '0');
    }

    // --- Tokens ---

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (Character.isLetterOrDigit(ch) || ch == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '.')) i++;
                tokens.add(text.substring(start, i));
            } else if (ch == '\'' || ch == '"') {
                int start = i++;
                while (i < n && text.charAt(i) != ch) {
                    if (text.charAt(i) == '\\') i++;
                    i++;
                }
                i = Math.min(i + 1, n);
                tokens.add(text.substring(start, i));
            } else if (i + 1 < n && TWO_CHAR_OPERATORS.contains(text.substring(i, i + 2))) {
                tokens.add(text.substring(i, i + 2));
                i += 2;
            } else {
                tokens.add(String.valueOf(ch));
                i++;
            }
        }
        return tokens;
    }

    /** Re-joins tokens with single spaces, tight around parentheses and commas. */
    static String join(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        String prev = null;
        for (String t : tokens) {
            if (prev != null && needsSpace(prev, t)) sb.append(' ');
            sb.append(t);
            prev = t;
        }
        return sb.toString();
    }

    private static boolean needsSpace(String prev, String next) {
        if ("(".equals(prev) || "!".equals(prev) || "~".equals(prev)) return false;
        if (")".equals(next) || ",".equals(next)) return false;
        return !("(".equals(next) && IDENTIFIER.matcher(prev).matches());
    }

    private static final class Cursor {
        final List<String> tokens;
        int pos;

        Cursor(List<String> tokens) {
            this.tokens = tokens;
        }

        String peek() {
            return pos < tokens.size() ? tokens.get(pos) : null;
        }

        String next() {
            return pos < tokens.size() ? tokens.get(pos++) : null;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }
    }
}
