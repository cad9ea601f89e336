package com.ifdefgraph.core.tree;

public enum NodeKind {
    FUNCTION_DEFINITION,
    CALL_EXPRESSION,
    DIRECTIVE,
    OTHER
}
