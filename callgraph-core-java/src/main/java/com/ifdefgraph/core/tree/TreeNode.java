package com.ifdefgraph.core.tree;

import java.util.List;

/**
 * One indexed node. {@code index} is the pre-order position; {@code parent} is the parent's index
 * (-1 for the root); {@code lastDescendant} is the index of the last node in this node's subtree,
 * so {@code index..lastDescendant} is exactly the subtree.
 *
 * Kind-specific fields are null unless the kind matches:
 * <ul>
 *   <li>FUNCTION_DEFINITION: {@code functionName}</li>
 *   <li>CALL_EXPRESSION: {@code calleeText}, {@code indirectCallee}</li>
 *   <li>DIRECTIVE: {@code directiveKind}, {@code conditionText} (null when the directive carries none)</li>
 * </ul>
 */
public record TreeNode(
    int index,
    NodeKind kind,
    String tag,
    Span span,
    int parent,
    List<Integer> children,
    int lastDescendant,
    String functionName,
    String calleeText,
    boolean indirectCallee,
    DirectiveKind directiveKind,
    String conditionText
) {

    public TreeNode {
        children = List.copyOf(children);
    }

    public boolean isRoot() {
        return parent < 0;
    }

    public boolean contains(int otherIndex) {
        return otherIndex >= index && otherIndex <= lastDescendant;
    }
}
