package com.ifdefgraph.core.directive;

public enum BranchKind {
    IF,
    IFDEF,
    IFNDEF,
    ELIF,
    ELSE
}
