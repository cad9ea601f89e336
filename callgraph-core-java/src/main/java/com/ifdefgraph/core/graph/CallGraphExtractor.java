package com.ifdefgraph.core.graph;

import com.ifdefgraph.core.condition.PresenceCondition;
import com.ifdefgraph.core.condition.PresenceCondition.Constant;
import com.ifdefgraph.core.directive.DirectiveScopeTracker;
import com.ifdefgraph.core.tree.TreeIndex;
import com.ifdefgraph.core.tree.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks a {@link TreeIndex} in document order and emits one {@link CallEdge} per call expression.
 *
 * Directive nodes are forwarded to the {@link DirectiveScopeTracker} as they are reached, so the
 * condition read at a call site is the one in force at that position. Function definitions form a
 * stack: a nested definition gets its own call set and the enclosing one resumes after it ends.
 */
public class CallGraphExtractor {

    /** Caller recorded for calls outside any function (e.g. in a global initializer). */
    public static final String FILE_SCOPE = "<file>";

    private final String project;
    private final String file;
    private final DirectiveScopeTracker tracker;

    public CallGraphExtractor(String project, String file, DirectiveScopeTracker tracker) {
        this.project = project;
        this.file = file;
        this.tracker = tracker;
    }

    /**
     * Traverses the whole index. Closes the tracker at the end, so the result is final.
     *
     * @return edges in call-site encounter order
     */
    public List<CallEdge> extract(TreeIndex index) {
        List<CallEdge> edges = new ArrayList<>();
        Deque<FunctionScope> functions = new ArrayDeque<>();

        for (TreeNode node : index.nodes()) {
            while (!functions.isEmpty() && !functions.peek().covers(node.index())) {
                functions.pop();
            }
            switch (node.kind()) {
                case DIRECTIVE -> tracker.onDirective(node);
                case FUNCTION_DEFINITION -> functions.push(new FunctionScope(node.functionName(), node.index(), node.lastDescendant()));
                case CALL_EXPRESSION -> edges.add(edgeAt(node, functions));
                default -> { }
            }
        }
        tracker.finish();
        return edges;
    }

    private CallEdge edgeAt(TreeNode call, Deque<FunctionScope> functions) {
        String caller = functions.isEmpty() ? FILE_SCOPE : functions.peek().name();
        PresenceCondition condition = tracker.current();
        return new CallEdge(project, file, caller, call.calleeText(), call.indirectCallee(),
                condition, condition == Constant.FALSE);
    }

    private record FunctionScope(String name, int first, int last) {
        boolean covers(int index) {
            return index >= first && index <= last;
        }
    }
}
