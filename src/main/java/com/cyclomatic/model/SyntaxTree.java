package com.cyclomatic.model;

public record SyntaxTree(String unitName, SyntaxNode root) {
}
