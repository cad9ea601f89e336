package com.ifdefgraph.core.tree;

import com.ifdefgraph.core.outcome.FileOutcomeAggregator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flattens a converter tree into a pre-order sequence of {@link TreeNode}s, classifying each
 * element by srcML tag.
 *
 * Everything below a directive element is indexed as {@link NodeKind#OTHER}, so the
 * {@code defined(X)} inside {@code #if defined(X)} never counts as a call. Malformed nodes are
 * downgraded and reported to the file's {@link FileOutcomeAggregator}; indexing never aborts.
 */
public class TreeIndex {

    static final String ANONYMOUS_FUNCTION = "<anonymous>";
    static final String LAMBDA = "<lambda>";

    private static final Set<String> FUNCTION_TAGS = Set.of("function", "constructor", "destructor", "lambda");
    private static final Set<String> IGNORED_DIRECTIVE_PARTS = Set.of("cpp:directive", "comment");
    private static final Pattern LINE_CONTINUATION = Pattern.compile("\\\\\\r?\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<TreeNode> nodes;

    private TreeIndex(List<TreeNode> nodes) {
        this.nodes = Collections.unmodifiableList(nodes);
    }

    public List<TreeNode> nodes() { return nodes; }

    public int size() { return nodes.size(); }

    public TreeNode node(int index) { return nodes.get(index); }

    public TreeNode root() { return nodes.get(0); }

    /** Returns the parent node, or null for the root. */
    public TreeNode parent(TreeNode node) {
        return node.isRoot() ? null : nodes.get(node.parent());
    }

    public static TreeIndex build(TreeElement root, FileOutcomeAggregator outcome) {
        List<Pending> pending = new ArrayList<>();
        Deque<Visit> work = new ArrayDeque<>();
        work.push(new Visit(root, -1, false));

        // Explicit stack: srcML trees for generated sources can be deep enough to overflow recursion
        while (!work.isEmpty()) {
            Visit visit = work.pop();
            int index = pending.size();
            Pending p = classify(visit.element(), visit.insideDirective(), outcome);
            p.index = index;
            p.parent = visit.parent();
            pending.add(p);
            if (visit.parent() >= 0) {
                pending.get(visit.parent()).children.add(index);
            }

            boolean childInsideDirective = visit.insideDirective() || p.kind == NodeKind.DIRECTIVE;
            List<TreeElement> children = visit.element().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                work.push(new Visit(children.get(i), index, childInsideDirective));
            }
        }

        int[] last = new int[pending.size()];
        for (int i = pending.size() - 1; i >= 0; i--) {
            List<Integer> children = pending.get(i).children;
            last[i] = children.isEmpty() ? i : last[children.get(children.size() - 1)];
        }

        List<TreeNode> nodes = new ArrayList<>(pending.size());
        for (Pending p : pending) {
            nodes.add(new TreeNode(p.index, p.kind, p.tag, p.span, p.parent, p.children, last[p.index],
                    p.functionName, p.calleeText, p.indirectCallee, p.directiveKind, p.conditionText));
        }
        return new TreeIndex(nodes);
    }

    // --- Classification ---

    private static Pending classify(TreeElement element, boolean insideDirective, FileOutcomeAggregator outcome) {
        Pending p = new Pending(element.tag(), element.span());
        if (insideDirective) {
            return p;
        }
        if (p.tag.startsWith("cpp:")) {
            p.kind = NodeKind.DIRECTIVE;
            p.directiveKind = DirectiveKind.forTag(p.tag);
            p.conditionText = conditionText(element, p.directiveKind, outcome);
        } else if (FUNCTION_TAGS.contains(p.tag)) {
            p.kind = NodeKind.FUNCTION_DEFINITION;
            p.functionName = functionName(element, outcome);
        } else if ("call".equals(p.tag)) {
            classifyCall(element, p, outcome);
        }
        return p;
    }

    private static String functionName(TreeElement function, FileOutcomeAggregator outcome) {
        TreeElement name = firstChild(function, "name");
        String text = name != null ? collapse(name.text()) : "";
        if (!text.isEmpty()) {
            return text;
        }
        if ("lambda".equals(function.tag())) {
            return LAMBDA;
        }
        outcome.malformedNode(function.span(), "<" + function.tag() + "> has no name; calls attributed to "
                + ANONYMOUS_FUNCTION);
        return ANONYMOUS_FUNCTION;
    }

    private static void classifyCall(TreeElement call, Pending p, FileOutcomeAggregator outcome) {
        TreeElement name = firstChild(call, "name");
        if (name != null && isLiteralName(name)) {
            String text = collapse(name.text());
            if (!text.isEmpty()) {
                p.kind = NodeKind.CALL_EXPRESSION;
                p.calleeText = text;
                p.indirectCallee = false;
                return;
            }
        }
        String rendered = name != null ? collapse(name.text()) : calleeExpressionText(call);
        if (rendered.isEmpty()) {
            outcome.malformedNode(call.span(), "<call> has no callee expression; skipped");
            return;
        }
        p.kind = NodeKind.CALL_EXPRESSION;
        p.calleeText = rendered;
        p.indirectCallee = true;
    }

    /**
     * A plain identifier, or a qualified identifier such as {@code ns::f}.
     */
    private static boolean isLiteralName(TreeElement name) {
        for (TreeElement part : name.children()) {
            if ("name".equals(part.tag()) && part.children().isEmpty()) continue;
            if ("operator".equals(part.tag()) && "::".equals(part.text().trim())) continue;
            return false;
        }
        return true;
    }

    /** Text of the call expression with its trailing argument list removed. */
    private static String calleeExpressionText(TreeElement call) {
        String full = call.text();
        TreeElement args = null;
        for (TreeElement child : call.children()) {
            if ("argument_list".equals(child.tag())) args = child;
        }
        if (args != null) {
            int at = full.lastIndexOf(args.text());
            if (at >= 0) full = full.substring(0, at);
        }
        return collapse(full);
    }

    private static String conditionText(TreeElement directive, DirectiveKind kind, FileOutcomeAggregator outcome) {
        String wanted = switch (kind) {
            case IF, ELIF -> "expr";
            case IFDEF, IFNDEF -> "name";
            default -> null;
        };
        if (wanted == null) return null;

        TreeElement part = firstChild(directive, wanted);
        String text;
        if (part != null) {
            text = collapse(part.text());
        } else {
            StringBuilder sb = new StringBuilder();
            for (TreeElement child : directive.children()) {
                if (!IGNORED_DIRECTIVE_PARTS.contains(child.tag())) {
                    sb.append(child.text()).append(' ');
                }
            }
            text = collapse(sb.toString());
        }
        if (text.isEmpty()) {
            outcome.malformedNode(directive.span(), kind.spelling() + " has no condition");
            return null;
        }
        return text;
    }

    private static TreeElement firstChild(TreeElement element, String tag) {
        for (TreeElement child : element.children()) {
            if (tag.equals(child.tag())) return child;
        }
        return null;
    }

    static String collapse(String text) {
        String joined = LINE_CONTINUATION.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(joined).replaceAll(" ").trim();
    }

    private record Visit(TreeElement element, int parent, boolean insideDirective) {}

    private static final class Pending {
        final String tag;
        final Span span;
        final List<Integer> children = new ArrayList<>();
        int index;
        int parent;
        NodeKind kind = NodeKind.OTHER;
        String functionName;
        String calleeText;
        boolean indirectCallee;
        DirectiveKind directiveKind;
        String conditionText;

        Pending(String tag, Span span) {
            this.tag = tag;
            this.span = span;
        }
    }
}
