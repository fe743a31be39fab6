package com.cyclomatic.model;

/**
 * Closed set of syntax node kinds the analysis distinguishes.
 * Frontend adapters map every native node onto exactly one of these; anything
 * the analysis has no use for becomes {@link #OTHER}.
 */
public enum NodeKind {
    TRANSLATION_UNIT,
    TYPE_DECLARATION,
    FUNCTION_DEFINITION,
    IF_STATEMENT,
    FOR_STATEMENT,
    WHILE_STATEMENT,
    DO_STATEMENT,
    SWITCH,
    CASE_BRANCH,
    DEFAULT_BRANCH,
    CONDITIONAL_EXPRESSION,
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    LAMBDA_EXPRESSION,
    CATCH_CLAUSE,
    OTHER
}
